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

package com.xilinx.firwright.transforms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.firwright.firrtl.FIRCircuit;
import com.xilinx.firwright.firrtl.FIRCircuitNamespace;
import com.xilinx.firwright.firrtl.FIRConnect;
import com.xilinx.firwright.firrtl.FIRInstance;
import com.xilinx.firwright.firrtl.FIRModule;
import com.xilinx.firwright.firrtl.FIRTools;
import com.xilinx.firwright.firrtl.FIRVisibility;
import com.xilinx.firwright.support.FIREvaluator;
import com.xilinx.firwright.support.FIRTestDesigns;

class TestDUTModuleSplitter {

    private static DUTSplit split(FIRCircuit circuit, String wrapperName, boolean moveDut) {
        return DUTModuleSplitter.split(circuit, new FIRCircuitNamespace(circuit),
                circuit.getModule(FIRTestDesigns.DUT), wrapperName, moveDut);
    }

    @Test
    void testSplit() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRModule origDut = circuit.getModule("DUT");
        int bodySize = origDut.getBody().size();
        DUTSplit s = split(circuit, "Wrapper", false);

        Assertions.assertSame(origDut, s.getWrapper());
        Assertions.assertEquals("Wrapper", s.getWrapper().getName());
        Assertions.assertEquals("DUT", s.getShell().getName());
        Assertions.assertEquals("DUT", s.getDutName());
        Assertions.assertSame(s.getShell(), circuit.getModule("DUT"));
        Assertions.assertSame(s.getWrapper(), circuit.getModule("Wrapper"));
        Assertions.assertEquals(bodySize, s.getWrapper().getBody().size());

        List<String> names = new ArrayList<>();
        for (FIRModule m : circuit.getModules()) {
            names.add(m.getName());
        }
        Assertions.assertEquals(Arrays.asList("Top", "Wrapper", "DUT", "Leaf"), names);

        // Existing instantiations now reach the shell
        Assertions.assertSame(s.getShell(), circuit.getMainModule().getInstance("dut").getModule());
    }

    @Test
    void testShellBody() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        DUTSplit s = split(circuit, "Wrapper", false);
        FIRModule shell = s.getShell();

        Assertions.assertEquals(4, shell.getBody().size());
        FIRInstance inst = s.getWrapperInstance();
        Assertions.assertSame(inst, shell.getBody().get(0));
        Assertions.assertEquals("Wrapper", inst.getName());
        Assertions.assertEquals("Wrapper", inst.getInnerSym());
        Assertions.assertSame(s.getWrapper(), inst.getModule());

        List<FIRConnect> connects = shell.getConnects();
        Assertions.assertEquals(3, connects.size());
        Assertions.assertEquals(inst.getResult("a"), connects.get(0).getDest());
        Assertions.assertEquals(shell.getArgument("a"), connects.get(0).getSrc());
        Assertions.assertEquals(inst.getResult("b"), connects.get(1).getDest());
        Assertions.assertEquals(shell.getArgument("y"), connects.get(2).getDest());
        Assertions.assertEquals(inst.getResult("y"), connects.get(2).getSrc());
    }

    @Test
    void testInterfaceAndAnnotations() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        DUTSplit s = split(circuit, "Wrapper", false);
        FIRModule shell = s.getShell();
        FIRModule wrapper = s.getWrapper();

        Assertions.assertEquals(FIRVisibility.PUBLIC, shell.getVisibility());
        Assertions.assertEquals(FIRVisibility.PRIVATE, wrapper.getVisibility());
        Assertions.assertEquals(wrapper.getNumPorts(), shell.getNumPorts());
        for (int i = 0; i < shell.getNumPorts(); i++) {
            Assertions.assertEquals(wrapper.getPort(i).getName(), shell.getPort(i).getName());
            Assertions.assertEquals(wrapper.getPortDirection(i), shell.getPortDirection(i));
            Assertions.assertEquals(wrapper.getPortSymbol(i), shell.getPortSymbol(i));
        }

        Assertions.assertTrue(shell.hasAnnotation(FIRTools.DUT_ANNO_CLASS));
        Assertions.assertTrue(shell.hasAnnotation(FIRTestDesigns.DUT_TRACKER_ANNO_CLASS));
        Assertions.assertTrue(shell.getPort("a").hasAnnotation(FIRTestDesigns.PORT_TRACKER_ANNO_CLASS));
        Assertions.assertTrue(wrapper.getAnnotations().isEmpty());
        Assertions.assertTrue(wrapper.getPort("a").getAnnotations().isEmpty());
        // Body annotations travel with the body
        Assertions.assertTrue(wrapper.getComponent("w").hasAnnotation(FIRTestDesigns.WIRE_TRACKER_ANNO_CLASS));
    }

    @Test
    void testMoveDut() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        DUTSplit s = split(circuit, "Wrapper", true);
        Assertions.assertEquals(FIRVisibility.PRIVATE, s.getShell().getVisibility());
        Assertions.assertEquals(FIRVisibility.PUBLIC, s.getWrapper().getVisibility());
        Assertions.assertFalse(s.getShell().hasAnnotation(FIRTools.DUT_ANNO_CLASS));
        Assertions.assertTrue(s.getShell().hasAnnotation(FIRTestDesigns.DUT_TRACKER_ANNO_CLASS));
        Assertions.assertTrue(s.getWrapper().hasAnnotation(FIRTools.DUT_ANNO_CLASS));
        Assertions.assertFalse(s.getWrapper().hasAnnotation(FIRTestDesigns.DUT_TRACKER_ANNO_CLASS));
    }

    @Test
    void testPrivateDutStaysPrivate() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        circuit.getModule("DUT").setPrivate();
        DUTSplit s = split(circuit, "Wrapper", false);
        Assertions.assertFalse(s.getShell().isPublic());
        Assertions.assertFalse(s.getWrapper().isPublic());
    }

    @Test
    void testWrapperNameCollision() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        DUTSplit s = split(circuit, "Leaf", false);
        Assertions.assertEquals("Leaf_0", s.getWrapper().getName());
        Assertions.assertSame(circuit.getModule("Leaf"), s.getWrapper().getInstance("leaf").getModule());

        FIRCircuit circuit2 = FIRTestDesigns.createSampleCircuit();
        Assertions.assertEquals("DUT_0", split(circuit2, "DUT", false).getWrapper().getName());
    }

    @Test
    void testInstanceSymbolCollision() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        // Shell inherits port symbols, the instance symbol must avoid them
        DUTSplit s = split(circuit, "y", false);
        Assertions.assertEquals("y", s.getWrapper().getName());
        Assertions.assertEquals("y_0", s.getWrapperInstance().getInnerSym());
    }

    @Test
    void testFunctionPreserved() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        Map<Integer, Map<String, Long>> top = new FIREvaluator(circuit).truthTable("Top");
        Map<Integer, Map<String, Long>> dut = new FIREvaluator(circuit).truthTable("DUT");
        DUTSplit s = split(circuit, "Wrapper", false);
        Assertions.assertEquals(top, new FIREvaluator(circuit).truthTable("Top"));
        Assertions.assertEquals(dut, new FIREvaluator(circuit).truthTable("DUT"));
        Assertions.assertEquals(dut, new FIREvaluator(circuit).truthTable(s.getWrapper().getName()));
    }
}
