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

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.firwright.support.FIREvaluator;
import com.xilinx.firwright.support.FIRTestDesigns;
import com.xilinx.firwright.util.FileTools;

class TestFIRJson {

    @Test
    void testReadSample() {
        FIRCircuit circuit = FIRJsonReader.readCircuit(FIRTestDesigns.getPath("sample.json"));
        Assertions.assertEquals("Top", circuit.getName());
        Assertions.assertEquals(3, circuit.getModules().size());
        Assertions.assertEquals(6, circuit.getHierPaths().size());
        Assertions.assertTrue(circuit.hasAnnotation(FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS));

        FIRModule dut = circuit.getModule("DUT");
        Assertions.assertTrue(dut.hasAnnotation(FIRTools.DUT_ANNO_CLASS));
        Assertions.assertEquals("nla_dut", dut.getAnnotation(FIRTestDesigns.DUT_TRACKER_ANNO_CLASS).getNonLocal());
        Assertions.assertEquals("nla_port",
                dut.getPort("a").getAnnotation(FIRTestDesigns.PORT_TRACKER_ANNO_CLASS).getNonLocal());
        Assertions.assertEquals(FIRVisibility.PRIVATE, circuit.getModule("Leaf").getVisibility());

        FIRInstance leaf = dut.getInstance("leaf");
        Assertions.assertSame(circuit.getModule("Leaf"), leaf.getModule());
        Assertions.assertEquals("leaf", leaf.getInnerSym());
        FIRComponent x = dut.getComponent("x");
        Assertions.assertTrue(x.isNode());
        Assertions.assertEquals(FIRPrimOp.XOR, x.getOp());
        Assertions.assertEquals(FIRValue.ofComponent(dut.getComponent("w")), x.getOperands().get(0));
        Assertions.assertEquals(dut.getArgument("a"), x.getOperands().get(1));
        FIRProbe p = dut.getProbes().get(0);
        Assertions.assertEquals(new FIRInnerRef("DUT", "w"), p.getTarget());

        Assertions.assertTrue(FIRTools.verifyCircuit(circuit).isEmpty());
    }

    @Test
    void testSampleMatchesProgrammaticDesign() {
        FIRCircuit fromFile = FIRJsonReader.readCircuit(FIRTestDesigns.getPath("sample.json"));
        FIRCircuit built = FIRTestDesigns.createSampleCircuit(FIRTestDesigns.WRAPPER, false);
        Assertions.assertTrue(FIRJsonWriter.toJSON(built).similar(FIRJsonWriter.toJSON(fromFile)));
        Assertions.assertEquals(new FIREvaluator(built).truthTable("Top"),
                new FIREvaluator(fromFile).truthTable("Top"));
    }

    @Test
    void testWriteAndReadBack(@TempDir Path tempDir) {
        FIRCircuit circuit = FIRTestDesigns.createSampleCircuit(FIRTestDesigns.WRAPPER, true);
        Path out = tempDir.resolve("out").resolve("sample.json");
        FIRJsonWriter.writeCircuit(circuit, out);
        FIRCircuit readBack = FIRJsonReader.readCircuit(out);
        Assertions.assertTrue(FIRJsonWriter.toJSON(circuit).similar(FIRJsonWriter.toJSON(readBack)));
        Assertions.assertEquals(Boolean.TRUE, readBack.getAnnotation(FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS)
                .getBoolean("moveDut"));
    }

    @Test
    void testSymbolReferences() {
        List<FIRAnnotation> annos = FIRJsonReader.parseAnnotations(
                "[{\"target\": \"@nla\", \"class\": \"x\", \"plain\": \"text\", \"flag\": false, \"count\": 3}]");
        Assertions.assertEquals(1, annos.size());
        FIRAnnotation a = annos.get(0);
        Assertions.assertEquals("x", a.getClassName());
        Assertions.assertEquals("nla", a.getSymbolRef("target"));
        Assertions.assertEquals(FIRValueType.SYMBOL_REF, a.getMember("target").getType());
        Assertions.assertEquals("text", a.getString("plain"));
        Assertions.assertEquals(Boolean.FALSE, a.getBoolean("flag"));
        Assertions.assertEquals(Long.valueOf(3), a.getMember("count").getIntValue());
        // Class first, then the remaining members by name
        Assertions.assertEquals("[class, count, flag, plain, target]", a.getMembers().keySet().toString());

        JSONObject jo = FIRJsonWriter.toJSON(a);
        Assertions.assertEquals("@nla", jo.getString("target"));
        Assertions.assertFalse(jo.getBoolean("flag"));
    }

    @Test
    void testMalformedCircuit() {
        Assertions.assertThrows(FIRParseException.class,
                () -> FIRJsonReader.readCircuit(FIRTestDesigns.getPath("malformed.json")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"circuit\": \"Top\", \"modules\": [{\"name\": \"Top\", \"body\": [{\"op\": \"register\"}]}]}",
        "{\"circuit\": \"Top\", \"modules\": [{\"name\": \"Top\", \"ports\": [{\"name\": \"a\", \"direction\": \"sideways\"}]}]}",
        "{\"circuit\": \"Top\", \"modules\": [{\"name\": \"Top\", \"body\": [{\"op\": \"connect\", \"dest\": \"q\", \"src\": \"r\"}]}]}",
        "{\"circuit\": \"Top\", \"hierpaths\": [{\"sym\": \"nla\", \"namepath\": [\"Top\", \"Leaf\"]}]}",
        "{\"circuit\": \"Top\", \"modules\": [{\"name\": \"Top\", \"body\": [{\"op\": \"rwprobe\", \"name\": \"p\", \"target\": \"w\"}]}]}",
        "{\"circuit\": \"Top\", \"modules\": [{\"name\": \"Top\"}, {\"name\": \"Top\"}]}",
        "{\"circuit\": \"Top\", \"modules\": [{\"name\": \"Top\", \"ports\": [{\"name\": \"a\", \"direction\": \"in\"}, {\"name\": \"a\", \"direction\": \"out\"}]}]}",
        "{\"circuit\": \"Top\", \"modules\": [{\"name\": \"Top\"}], \"hierpaths\": [{\"sym\": \"Top\", \"namepath\": [\"Top\"]}]}",
    })
    void testInvalidCircuit(String json) {
        Assertions.assertThrows(FIRParseException.class, () -> FIRJsonReader.parseCircuit(json));
    }

    @Test
    void testMissingFile(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("missing.json");
        Assertions.assertThrows(UncheckedIOException.class, () -> FIRJsonReader.readCircuit(missing));
        Assertions.assertFalse(FileTools.errorIfFileDoesNotExist(missing.toString()));
    }
}
