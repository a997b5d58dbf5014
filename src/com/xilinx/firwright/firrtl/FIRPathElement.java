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

/**
 * One step of a {@link FIRHierPath}: either an inner reference
 * {@code Module::sym} (an instance, or a port/component when it is the leaf)
 * or a reference to a whole module.  Immutable.
 */
public final class FIRPathElement {

    private final String module;

    /** Inner symbol, null for a module reference */
    private final String name;

    private FIRPathElement(String module, String name) {
        this.module = Objects.requireNonNull(module);
        this.name = name;
    }

    public static FIRPathElement innerRef(String module, String name) {
        return new FIRPathElement(module, Objects.requireNonNull(name));
    }

    public static FIRPathElement innerRef(FIRInnerRef ref) {
        return innerRef(ref.getModule(), ref.getName());
    }

    public static FIRPathElement moduleRef(String module) {
        return new FIRPathElement(module, null);
    }

    /**
     * Parses {@code "Module::sym"} or {@code "Module"}.
     */
    public static FIRPathElement parse(String s) {
        if (s.contains(FIRInnerRef.SEP)) {
            return innerRef(FIRInnerRef.parse(s));
        }
        if (s.isEmpty()) {
            throw new IllegalArgumentException("ERROR: Empty hierarchical path element");
        }
        return moduleRef(s);
    }

    public String getModule() {
        return module;
    }

    public String getName() {
        return name;
    }

    public boolean isInnerRef() {
        return name != null;
    }

    public boolean isModuleRef() {
        return name == null;
    }

    public FIRInnerRef getInnerRef() {
        return name == null ? null : new FIRInnerRef(module, name);
    }

    /**
     * @return A copy of this element pointing into a different module, keeping the inner symbol.
     */
    public FIRPathElement withModule(String newModule) {
        return new FIRPathElement(newModule, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FIRPathElement that = (FIRPathElement) o;
        return module.equals(that.module) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, name);
    }

    @Override
    public String toString() {
        return name == null ? module : module + FIRInnerRef.SEP + name;
    }
}
