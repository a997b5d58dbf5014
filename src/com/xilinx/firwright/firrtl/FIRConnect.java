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
 * Connects (drives) a destination value from a source value.
 */
public class FIRConnect implements FIRStatement {

    private FIRModule parentModule;

    private final FIRValue dest;

    private final FIRValue src;

    public FIRConnect(FIRValue dest, FIRValue src) {
        this.dest = dest;
        this.src = src;
    }

    public FIRValue getDest() {
        return dest;
    }

    public FIRValue getSrc() {
        return src;
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
        return "connect " + dest + ", " + src;
    }
}
