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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Reference to an inner symbol of a module: {@code Module::sym}.  Immutable.
 */
public final class FIRInnerRef {

    public static final String SEP = "::";

    private final String module;

    private final String name;

    public FIRInnerRef(@NotNull String module, @NotNull String name) {
        this.module = Objects.requireNonNull(module);
        this.name = Objects.requireNonNull(name);
    }

    public static FIRInnerRef parse(String s) {
        int idx = s.indexOf(SEP);
        if (idx <= 0 || idx + SEP.length() >= s.length()) {
            throw new IllegalArgumentException("ERROR: Malformed inner reference '" + s
                    + "', expected 'Module" + SEP + "sym'");
        }
        return new FIRInnerRef(s.substring(0, idx), s.substring(idx + SEP.length()));
    }

    public String getModule() {
        return module;
    }

    public String getName() {
        return name;
    }

    public FIRInnerRef withModule(String newModule) {
        return new FIRInnerRef(newModule, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FIRInnerRef that = (FIRInnerRef) o;
        return module.equals(that.module) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, name);
    }

    @Override
    public String toString() {
        return module + SEP + name;
    }
}
