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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.firwright.support.FIRTestDesigns;

class TestFIRNamespace {

    @Test
    void testFreeHintIsReturned() {
        FIRNamespace ns = new FIRNamespace(Arrays.asList("Top", "DUT"));
        Assertions.assertEquals("Wrapper", ns.newName("Wrapper"));
        Assertions.assertTrue(ns.contains("Wrapper"));
    }

    @Test
    void testCollidingHintIsSuffixed() {
        FIRNamespace ns = new FIRNamespace(Arrays.asList("Top", "DUT", "DUT_0"));
        Assertions.assertEquals("DUT_1", ns.newName("DUT"));
        Assertions.assertEquals("DUT_2", ns.newName("DUT"));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 10, 100})
    void testNamesAreUnique(int count) {
        FIRNamespace ns = new FIRNamespace();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < count; i++) {
            Assertions.assertTrue(names.add(ns.newName("x")));
        }
        Assertions.assertTrue(names.contains("x"));
    }

    @Test
    void testCircuitNamespace() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRCircuitNamespace ns = new FIRCircuitNamespace(circuit);
        Assertions.assertTrue(ns.contains("DUT"));
        Assertions.assertTrue(ns.contains("nla_dut"));
        Assertions.assertEquals("DUT_0", ns.newName("DUT"));
        Assertions.assertEquals("nla_dut_0", ns.newName("nla_dut"));
    }

    @Test
    void testInnerSymbolNamespace() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRInnerSymbolNamespace ns = new FIRInnerSymbolNamespace(circuit.getModule("DUT"));
        Assertions.assertTrue(ns.contains("a"));
        Assertions.assertTrue(ns.contains("leaf"));
        Assertions.assertTrue(ns.contains("w"));
        Assertions.assertEquals("w_0", ns.newName("w"));
        Assertions.assertEquals("Wrapper", ns.newName("Wrapper"));
    }
}
