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
 * A read-write probe of a port or component of the module the probe lives in.
 * The target is an inner reference that names its owning module, so it must be
 * kept in sync with the module's name.
 */
public class FIRProbe extends FIRName implements FIRStatement {

    private FIRModule parentModule;

    private FIRInnerRef target;

    public FIRProbe(String name, FIRInnerRef target) {
        super(name);
        this.target = target;
    }

    public FIRInnerRef getTarget() {
        return target;
    }

    public void setTarget(FIRInnerRef target) {
        this.target = target;
    }

    @Override
    public FIRModule getParentModule() {
        return parentModule;
    }

    @Override
    public void setParentModule(FIRModule parentModule) {
        this.parentModule = parentModule;
    }

    @Override
    public String toString() {
        return "rwprobe " + getName() + " of " + target;
    }
}
