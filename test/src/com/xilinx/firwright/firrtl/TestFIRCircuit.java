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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.firwright.support.FIRTestDesigns;

class TestFIRCircuit {

    private static List<String> getModuleNames(FIRCircuit circuit) {
        List<String> names = new ArrayList<>();
        for (FIRModule m : circuit.getModules()) {
            names.add(m.getName());
        }
        return names;
    }

    @Test
    void testMainModule() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        Assertions.assertEquals("Top", circuit.getMainModule().getName());
        Assertions.assertSame(circuit, circuit.getModule("DUT").getCircuit());
    }

    @Test
    void testModuleSymbolCollision() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        Assertions.assertThrows(RuntimeException.class, () -> circuit.addModule(new FIRModule("DUT")));
        // Modules and paths share one symbol table
        Assertions.assertThrows(RuntimeException.class, () -> circuit.addModule(new FIRModule("nla_dut")));
        Assertions.assertThrows(RuntimeException.class,
                () -> circuit.addHierPath(FIRHierPath.parse("Leaf", "Top::dut", "DUT")));
    }

    @Test
    void testInsertModuleAfter() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        circuit.insertModuleAfter(circuit.getModule("DUT"), new FIRModule("Other"));
        Assertions.assertEquals(Arrays.asList("Top", "DUT", "Other", "Leaf"), getModuleNames(circuit));
        Assertions.assertThrows(RuntimeException.class,
                () -> circuit.insertModuleAfter(new FIRModule("Missing"), new FIRModule("Other2")));
    }

    @Test
    void testRenameModule() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRModule dut = circuit.getModule("DUT");
        circuit.renameModule(dut, "Renamed");
        Assertions.assertNull(circuit.getModule("DUT"));
        Assertions.assertSame(dut, circuit.getModule("Renamed"));
        Assertions.assertTrue(circuit.getSymbols().contains("Renamed"));
        // Instances refer to modules by name
        FIRInstance inst = circuit.getMainModule().getInstance("dut");
        Assertions.assertEquals("DUT", inst.getModuleName());
        Assertions.assertNull(inst.getModule());

        Assertions.assertThrows(RuntimeException.class, () -> circuit.renameModule(dut, "Leaf"));
    }

    @Test
    void testInsertHierPathBefore() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRHierPath anchor = circuit.getHierPath("nla_wire");
        FIRHierPath clone = circuit.insertHierPathBefore(anchor, new FIRHierPath("nla_wire_0", anchor));
        int idx = circuit.getHierPaths().indexOf(anchor);
        Assertions.assertSame(clone, circuit.getHierPaths().get(idx - 1));
        Assertions.assertSame(clone, circuit.getHierPath("nla_wire_0"));

        Assertions.assertSame(clone, circuit.removeHierPath(clone));
        Assertions.assertNull(circuit.getHierPath("nla_wire_0"));
        Assertions.assertFalse(circuit.getHierPaths().contains(clone));
    }

    @Test
    void testModulePorts() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRModule dut = circuit.getModule("DUT");
        Assertions.assertEquals(3, dut.getNumPorts());
        Assertions.assertEquals(2, dut.getPortIndex("y"));
        Assertions.assertEquals(-1, dut.getPortIndex("z"));
        Assertions.assertEquals(FIRDirection.OUT, dut.getPortDirection(2));
        Assertions.assertEquals("a", dut.getPortSymbol(0));
        Assertions.assertNull(dut.getPortSymbol(1));
        Assertions.assertThrows(RuntimeException.class, () -> dut.createPort("a", FIRDirection.IN));
    }

    @Test
    void testLookupInnerSym() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRModule dut = circuit.getModule("DUT");
        Assertions.assertTrue(dut.lookupInnerSym("a") instanceof FIRPort);
        Assertions.assertTrue(dut.lookupInnerSym("leaf") instanceof FIRInstance);
        Assertions.assertTrue(dut.lookupInnerSym("w") instanceof FIRComponent);
        Assertions.assertNull(dut.lookupInnerSym("nope"));
        Assertions.assertEquals(Arrays.asList("a", "y", "leaf", "w"), dut.getInnerSymbols());
    }

    @Test
    void testModuleShellCopy() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRModule dut = circuit.getModule("DUT");
        dut.setPrivate();
        FIRModule copy = new FIRModule("Copy", dut);
        Assertions.assertTrue(copy.isPublic());
        Assertions.assertTrue(copy.getBody().isEmpty());
        Assertions.assertEquals(dut.getNumPorts(), copy.getNumPorts());
        Assertions.assertNotSame(dut.getPort("a"), copy.getPort("a"));
        Assertions.assertEquals("a", copy.getPort("a").getInnerSym());
        Assertions.assertEquals(dut.getPort("a").getAnnotations(), copy.getPort("a").getAnnotations());
        Assertions.assertEquals(dut.getAnnotations(), copy.getAnnotations());

        copy.removePortAnnotations();
        Assertions.assertTrue(copy.getPort("a").getAnnotations().isEmpty());
        Assertions.assertFalse(dut.getPort("a").getAnnotations().isEmpty());
    }
}
