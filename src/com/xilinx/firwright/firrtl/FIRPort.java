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
 * Represents a port on a {@link FIRModule}.
 */
public class FIRPort extends FIRAnnotatedObject {

    private FIRModule parentModule;

    private FIRDirection direction;

    /** Optional inner symbol making this port addressable by hierarchical paths */
    private String innerSym;

    public FIRPort(String name, FIRDirection direction) {
        super(name);
        this.direction = direction;
    }

    public FIRPort(String name, FIRDirection direction, String innerSym) {
        this(name, direction);
        this.innerSym = innerSym;
    }

    /**
     * Copy constructor, the copy has no parent module.
     * @param port Prototype port
     */
    public FIRPort(FIRPort port) {
        super(port);
        this.direction = port.direction;
        this.innerSym = port.innerSym;
    }

    public FIRDirection getDirection() {
        return direction;
    }

    public boolean isInput() {
        return direction == FIRDirection.IN;
    }

    public boolean isOutput() {
        return direction == FIRDirection.OUT;
    }

    public String getInnerSym() {
        return innerSym;
    }

    public void setInnerSym(String innerSym) {
        this.innerSym = innerSym;
    }

    public FIRModule getParentModule() {
        return parentModule;
    }

    protected void setParentModule(FIRModule parentModule) {
        this.parentModule = parentModule;
    }

    @Override
    public String toString() {
        return direction.name().toLowerCase() + " " + getName()
                + (innerSym == null ? "" : " sym @" + innerSym);
    }
}
