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
 * A value used by connects and node operands: a port of the enclosing module,
 * a result (port) of an instance, or a component.  Immutable.
 */
public final class FIRValue {

    public enum Kind {
        PORT,
        INSTANCE_RESULT,
        COMPONENT
    }

    private final Kind kind;

    private final FIRModule module;

    private final FIRInstance instance;

    private final FIRComponent component;

    private final int portIndex;

    private FIRValue(Kind kind, FIRModule module, FIRInstance instance, FIRComponent component,
                     int portIndex) {
        this.kind = kind;
        this.module = module;
        this.instance = instance;
        this.component = component;
        this.portIndex = portIndex;
    }

    /**
     * The i-th port of a module, as seen from inside the module body.
     */
    public static FIRValue ofPort(FIRModule module, int portIndex) {
        return new FIRValue(Kind.PORT, Objects.requireNonNull(module), null, null, portIndex);
    }

    /**
     * The i-th result of an instance, i.e. the i-th port of the instantiated module.
     */
    public static FIRValue ofResult(FIRInstance instance, int portIndex) {
        return new FIRValue(Kind.INSTANCE_RESULT, null, Objects.requireNonNull(instance), null,
                portIndex);
    }

    public static FIRValue ofComponent(FIRComponent component) {
        return new FIRValue(Kind.COMPONENT, null, null, Objects.requireNonNull(component), -1);
    }

    public Kind getKind() {
        return kind;
    }

    public FIRModule getModule() {
        return module;
    }

    public FIRInstance getInstance() {
        return instance;
    }

    public FIRComponent getComponent() {
        return component;
    }

    public int getPortIndex() {
        return portIndex;
    }

    /**
     * @return The port this value refers to, or null for components
     */
    public FIRPort getPort() {
        switch (kind) {
            case PORT:
                return module.getPort(portIndex);
            case INSTANCE_RESULT:
                FIRModule target = instance.getModule();
                return target == null ? null : target.getPort(portIndex);
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FIRValue that = (FIRValue) o;
        return kind == that.kind && portIndex == that.portIndex && module == that.module
                && instance == that.instance && component == that.component;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, portIndex, System.identityHashCode(module),
                System.identityHashCode(instance), System.identityHashCode(component));
    }

    @Override
    public String toString() {
        switch (kind) {
            case PORT:
                return module.getPort(portIndex).getName();
            case INSTANCE_RESULT:
                FIRPort p = getPort();
                return instance.getName() + "." + (p == null ? Integer.toString(portIndex) : p.getName());
            default:
                return component.getName();
        }
    }
}
