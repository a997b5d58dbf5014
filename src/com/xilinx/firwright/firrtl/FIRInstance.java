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

/**
 * An instantiation of a {@link FIRModule} inside the body of a parent module.
 * The instantiated module is referenced by name and resolved through the
 * parent's {@link FIRCircuit}, the same way the textual IR refers to it.
 */
public class FIRInstance extends FIRAnnotatedObject implements FIRStatement {

    private FIRModule parentModule;

    private String moduleName;

    private String innerSym;

    public FIRInstance(String name, String moduleName, String innerSym) {
        super(name);
        this.moduleName = moduleName;
        this.innerSym = innerSym;
    }

    public FIRInstance(String name, FIRModule module, String innerSym) {
        this(name, module.getName(), innerSym);
    }

    @Override
    public FIRModule getParentModule() {
        return parentModule;
    }

    @Override
    public void setParentModule(FIRModule parentModule) {
        this.parentModule = parentModule;
    }

    public String getModuleName() {
        return moduleName;
    }

    public void setModuleName(String moduleName) {
        this.moduleName = moduleName;
    }

    /**
     * Resolves the instantiated module through the circuit of the parent module.
     * @return The instantiated module or null if it cannot be resolved.
     */
    public FIRModule getModule() {
        if (parentModule == null || parentModule.getCircuit() == null) return null;
        return parentModule.getCircuit().getModule(moduleName);
    }

    @Override
    public String getInnerSym() {
        return innerSym;
    }

    public void setInnerSym(String innerSym) {
        this.innerSym = innerSym;
    }

    public FIRValue getResult(int portIndex) {
        return FIRValue.ofResult(this, portIndex);
    }

    /**
     * Gets the result connected to the named port of the instantiated module.
     * @param portName Name of the port on the instantiated module
     * @return The result value or null if no such port exists
     */
    public FIRValue getResult(String portName) {
        FIRModule m = getModule();
        if (m == null) return null;
        int idx = m.getPortIndex(portName);
        return idx < 0 ? null : getResult(idx);
    }

    @Override
    public String toString() {
        return "inst " + getName() + (innerSym == null ? "" : " sym @" + innerSym)
                + " of @" + moduleName;
    }
}
