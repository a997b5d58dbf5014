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
 * Instance graph facts about a circuit needed by transforms.  Currently this
 * locates the design-under-test (DUT): the module carrying the
 * {@link FIRTools#DUT_ANNO_CLASS} annotation.
 */
public class FIRInstanceInfo {

    private final FIRModule dut;

    public FIRInstanceInfo(FIRCircuit circuit) {
        FIRModule found = null;
        for (FIRModule m : circuit.getModules()) {
            if (m.hasAnnotation(FIRTools.DUT_ANNO_CLASS)) {
                found = m;
                break;
            }
        }
        dut = found;
    }

    /**
     * @return The DUT module, or null if the circuit has none
     */
    public FIRModule getDut() {
        return dut;
    }

    public boolean hasDut() {
        return dut != null;
    }

    public boolean isDut(FIRModule module) {
        return dut == module;
    }
}
