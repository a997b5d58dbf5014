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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.firwright.firrtl.FIRCircuit;
import com.xilinx.firwright.firrtl.FIRCircuitNamespace;
import com.xilinx.firwright.firrtl.FIRHierPath;
import com.xilinx.firwright.firrtl.FIRHierPathTable;
import com.xilinx.firwright.firrtl.FIRPort;
import com.xilinx.firwright.firrtl.FIRTools;
import com.xilinx.firwright.support.FIRTestDesigns;
import com.xilinx.firwright.transforms.HierPathRewriter.PathCase;

class TestHierPathRewriter {

    private FIRHierPathTable table;

    private HierPathRewriter createRewriter(FIRCircuit circuit) {
        table = new FIRHierPathTable(circuit);
        FIRCircuitNamespace ns = new FIRCircuitNamespace(circuit);
        DUTSplit s = DUTModuleSplitter.split(circuit, ns, circuit.getModule(FIRTestDesigns.DUT),
                FIRTestDesigns.WRAPPER, false);
        Set<String> dutPaths = FIRHierPathTable.getReferencedPaths(s.getShell(), true);
        Set<String> portSyms = new LinkedHashSet<>();
        for (FIRPort p : s.getShell().getPorts()) {
            if (p.getInnerSym() != null) portSyms.add(p.getInnerSym());
        }
        return new HierPathRewriter(circuit, ns, table, s, dutPaths, portSyms);
    }

    private static List<String> path(FIRCircuit circuit, String sym) {
        return FIRTestDesigns.getNamepath(circuit.getHierPath(sym));
    }

    @Test
    void testClassify() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        HierPathRewriter rewriter = createRewriter(circuit);
        Assertions.assertEquals(PathCase.LEAF_MODULE_SHARED, rewriter.classify(circuit.getHierPath("nla_dut")));
        Assertions.assertEquals(PathCase.EXTEND, rewriter.classify(circuit.getHierPath("nla_mod")));
        Assertions.assertEquals(PathCase.LEAF_PORT, rewriter.classify(circuit.getHierPath("nla_port")));
        Assertions.assertEquals(PathCase.EXTEND, rewriter.classify(circuit.getHierPath("nla_wire")));
        Assertions.assertEquals(PathCase.EXTEND, rewriter.classify(circuit.getHierPath("nla_leaf")));
        Assertions.assertEquals(PathCase.ROOT, rewriter.classify(circuit.getHierPath("nla_root")));
    }

    @Test
    void testRewriteAll() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        HierPathRewriter rewriter = createRewriter(circuit);
        FIRHierPath origDutPath = circuit.getHierPath("nla_dut");
        Map<String, FIRHierPath> renames = rewriter.rewriteAll();

        Assertions.assertEquals(1, renames.size());
        FIRHierPath clone = renames.get("nla_dut");
        Assertions.assertEquals("nla_dut_0", clone.getSymName());
        Assertions.assertSame(clone, circuit.getHierPath("nla_dut_0"));
        Assertions.assertSame(origDutPath, circuit.getHierPath("nla_dut"));
        Assertions.assertSame(renames, rewriter.getDutRenames());

        Assertions.assertEquals(Arrays.asList("Top::dut", "DUT"), path(circuit, "nla_dut_0"));
        Assertions.assertEquals(Arrays.asList("Top::dut", "DUT::Wrapper", "Wrapper"), path(circuit, "nla_dut"));
        Assertions.assertEquals(Arrays.asList("Top::dut", "DUT::Wrapper", "Wrapper"), path(circuit, "nla_mod"));
        Assertions.assertEquals(Arrays.asList("Top::dut", "DUT::a"), path(circuit, "nla_port"));
        Assertions.assertEquals(Arrays.asList("Top::dut", "DUT::Wrapper", "Wrapper::w"), path(circuit, "nla_wire"));
        Assertions.assertEquals(Arrays.asList("Top::dut", "DUT::Wrapper", "Wrapper::leaf", "Leaf"),
                path(circuit, "nla_leaf"));
        Assertions.assertEquals(Arrays.asList("Wrapper::leaf", "Leaf::y"), path(circuit, "nla_root"));

        // Clones sit right before their original
        List<String> order = new ArrayList<>();
        for (FIRHierPath p : circuit.getHierPaths()) {
            order.add(p.getSymName());
        }
        Assertions.assertEquals(Arrays.asList("nla_dut_0", "nla_dut", "nla_mod", "nla_port", "nla_wire",
                "nla_leaf", "nla_root"), order);

        for (FIRHierPath p : circuit.getHierPaths()) {
            Assertions.assertNull(FIRTools.checkHierPath(circuit, p));
        }
    }

    @Test
    void testTableKeptCurrent() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        HierPathRewriter rewriter = createRewriter(circuit);
        rewriter.rewriteAll();
        Assertions.assertEquals(5, table.lookup(FIRTestDesigns.WRAPPER).size());
        Assertions.assertFalse(table.lookup("DUT").contains(circuit.getHierPath("nla_root")));
        Assertions.assertTrue(table.lookup("DUT").contains(circuit.getHierPath("nla_dut_0")));
        Assertions.assertSame(circuit.getHierPath("nla_dut_0"), table.getPath("nla_dut_0"));
    }

    @Test
    void testUnusedModulePathIsNotCloned() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        circuit.getModule("DUT").removeAnnotations(FIRTestDesigns.DUT_TRACKER_ANNO_CLASS);
        HierPathRewriter rewriter = createRewriter(circuit);
        Assertions.assertTrue(rewriter.rewriteAll().isEmpty());
        Assertions.assertEquals(Arrays.asList("Top::dut", "DUT::Wrapper", "Wrapper"), path(circuit, "nla_dut"));
        Assertions.assertEquals(6, circuit.getHierPaths().size());
    }

    @Test
    void testSingleElementDutPath() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRHierPath solo = circuit.addHierPath(FIRHierPath.parse("solo", "DUT"));
        FIRHierPath soloWire = circuit.addHierPath(FIRHierPath.parse("solo_wire", "DUT::w"));
        FIRHierPath soloPort = circuit.addHierPath(FIRHierPath.parse("solo_port", "DUT::a"));
        HierPathRewriter rewriter = createRewriter(circuit);
        Assertions.assertEquals(PathCase.EXTEND, rewriter.classify(solo));
        Assertions.assertEquals(PathCase.EXTEND, rewriter.classify(soloWire));
        Assertions.assertEquals(PathCase.LEAF_PORT, rewriter.classify(soloPort));

        rewriter.rewriteAll();
        Assertions.assertEquals(Arrays.asList("DUT::Wrapper", "Wrapper"), path(circuit, "solo"));
        Assertions.assertEquals(Arrays.asList("DUT::Wrapper", "Wrapper::w"), path(circuit, "solo_wire"));
        Assertions.assertEquals(Arrays.asList("DUT::a"), path(circuit, "solo_port"));
        Assertions.assertNull(FIRTools.checkHierPath(circuit, solo));
        Assertions.assertNull(FIRTools.checkHierPath(circuit, soloWire));
        Assertions.assertNull(FIRTools.checkHierPath(circuit, soloPort));
    }

    @Test
    void testPathsNotTouchingDutAreIgnored() {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit();
        FIRHierPath other = circuit.addHierPath(FIRHierPath.parse("other", "Leaf::y"));
        HierPathRewriter rewriter = createRewriter(circuit);
        rewriter.rewriteAll();
        Assertions.assertEquals(Arrays.asList("Leaf::y"), FIRTestDesigns.getNamepath(other));
    }
}
