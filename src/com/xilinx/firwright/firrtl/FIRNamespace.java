/*
 *
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of FIRWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.firwright.firrtl;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A set of names in use within some scope, able to hand out fresh names that
 * never collide with an existing or previously returned name.
 */
public class FIRNamespace {

    private final Set<String> used = new HashSet<>();

    /** Next suffix to try per hint */
    private final Map<String, Integer> nextIndex = new HashMap<>();

    public FIRNamespace() {

    }

    public FIRNamespace(Collection<String> names) {
        addAll(names);
    }

    /**
     * Reserves a name without checking whether it is already used.
     */
    public void add(String name) {
        used.add(name);
    }

    public void addAll(Collection<String> names) {
        used.addAll(names);
    }

    public boolean contains(String name) {
        return used.contains(name);
    }

    /**
     * Allocates a new name derived from the hint.  The hint itself is returned if
     * it is free, otherwise an {@code _N} suffix is appended with the smallest
     * counter value producing an unused name.  The returned name is reserved.
     * @param hint Preferred name
     * @return A name unique within this namespace
     */
    public String newName(String hint) {
        if (used.add(hint)) {
            return hint;
        }
        int i = nextIndex.getOrDefault(hint, 0);
        String candidate;
        do {
            candidate = hint + "_" + i++;
        } while (!used.add(candidate));
        nextIndex.put(hint, i);
        return candidate;
    }
}
