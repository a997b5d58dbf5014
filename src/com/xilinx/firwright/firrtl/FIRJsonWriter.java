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

import java.nio.file.Path;
import java.util.List;
import java.util.Map.Entry;

import org.json.JSONArray;
import org.json.JSONObject;

import com.xilinx.firwright.util.FileTools;

/**
 * Writes circuits to JSON.  The format is:
 * <pre>
 * { "circuit": "Top",
 *   "annotations": [ {"class": "...", ...} ],
 *   "modules": [ { "name": "M", "visibility": "public", "convention": "internal",
 *                  "annotations": [...],
 *                  "ports": [ {"name": "a", "direction": "in", "sym": "a", "annotations": [...]} ],
 *                  "body": [ {"op": "instance", "name": "i", "sym": "i", "module": "Leaf"},
 *                            {"op": "wire", "name": "w"},
 *                            {"op": "node", "name": "n", "prim": "and", "operands": ["a", "i.y"]},
 *                            {"op": "connect", "dest": "b", "src": "n"},
 *                            {"op": "rwprobe", "name": "p", "target": "M::w"} ] } ],
 *   "hierpaths": [ {"sym": "nla", "namepath": ["Top::dut", "M"]} ] }
 * </pre>
 * Symbol reference annotation members are written with a leading '@'.
 */
public class FIRJsonWriter {

    public static final int INDENT = 2;

    public static void writeCircuit(FIRCircuit circuit, Path path) {
        FileTools.writeStringToFile(toJSON(circuit).toString(INDENT) + System.lineSeparator(), path);
    }

    public static void writeCircuit(FIRCircuit circuit, String fileName) {
        writeCircuit(circuit, Path.of(fileName));
    }

    public static String toJSONString(FIRCircuit circuit) {
        return toJSON(circuit).toString(INDENT);
    }

    public static JSONObject toJSON(FIRCircuit circuit) {
        JSONObject root = new JSONObject();
        root.put("circuit", circuit.getName());
        root.put("annotations", toJSON(circuit.getAnnotations()));
        JSONArray modules = new JSONArray();
        for (FIRModule m : circuit.getModules()) {
            modules.put(toJSON(m));
        }
        root.put("modules", modules);
        JSONArray paths = new JSONArray();
        for (FIRHierPath p : circuit.getHierPaths()) {
            JSONObject jp = new JSONObject();
            jp.put("sym", p.getSymName());
            JSONArray np = new JSONArray();
            for (FIRPathElement e : p.getNamepath()) {
                np.put(e.toString());
            }
            jp.put("namepath", np);
            paths.put(jp);
        }
        root.put("hierpaths", paths);
        return root;
    }

    private static JSONObject toJSON(FIRModule m) {
        JSONObject jm = new JSONObject();
        jm.put("name", m.getName());
        jm.put("visibility", m.getVisibility().name().toLowerCase());
        jm.put("convention", m.getConvention().name().toLowerCase());
        jm.put("annotations", toJSON(m.getAnnotations()));
        JSONArray ports = new JSONArray();
        for (FIRPort p : m.getPorts()) {
            JSONObject jp = new JSONObject();
            jp.put("name", p.getName());
            jp.put("direction", p.getDirection().name().toLowerCase());
            if (p.getInnerSym() != null) jp.put("sym", p.getInnerSym());
            jp.put("annotations", toJSON(p.getAnnotations()));
            ports.put(jp);
        }
        jm.put("ports", ports);
        JSONArray body = new JSONArray();
        for (FIRStatement s : m.getBody()) {
            body.put(toJSON(s));
        }
        jm.put("body", body);
        return jm;
    }

    private static JSONObject toJSON(FIRStatement s) {
        JSONObject js = new JSONObject();
        if (s.getInnerSym() != null) js.put("sym", s.getInnerSym());
        if (s instanceof FIRInstance) {
            FIRInstance inst = (FIRInstance) s;
            js.put("op", "instance");
            js.put("name", inst.getName());
            js.put("module", inst.getModuleName());
            js.put("annotations", toJSON(inst.getAnnotations()));
        } else if (s instanceof FIRComponent) {
            FIRComponent c = (FIRComponent) s;
            js.put("op", c.getKind().name().toLowerCase());
            js.put("name", c.getName());
            if (c.isNode()) {
                js.put("prim", c.getOp().name().toLowerCase());
                JSONArray operands = new JSONArray();
                for (FIRValue v : c.getOperands()) {
                    operands.put(v.toString());
                }
                js.put("operands", operands);
            }
            js.put("annotations", toJSON(c.getAnnotations()));
        } else if (s instanceof FIRConnect) {
            FIRConnect c = (FIRConnect) s;
            js.put("op", "connect");
            js.put("dest", c.getDest().toString());
            js.put("src", c.getSrc().toString());
        } else if (s instanceof FIRProbe) {
            FIRProbe p = (FIRProbe) s;
            js.put("op", "rwprobe");
            js.put("name", p.getName());
            js.put("target", p.getTarget().toString());
        } else {
            throw new RuntimeException("ERROR: Unsupported statement type " + s.getClass().getSimpleName());
        }
        return js;
    }

    public static JSONArray toJSON(List<FIRAnnotation> annotations) {
        JSONArray array = new JSONArray();
        for (FIRAnnotation a : annotations) {
            array.put(toJSON(a));
        }
        return array;
    }

    public static JSONObject toJSON(FIRAnnotation a) {
        JSONObject jo = new JSONObject();
        for (Entry<String, FIRAnnotationValue> e : a.getMembers().entrySet()) {
            FIRAnnotationValue v = e.getValue();
            switch (v.getType()) {
                case BOOLEAN:
                    jo.put(e.getKey(), v.getBooleanValue().booleanValue());
                    break;
                case INTEGER:
                    jo.put(e.getKey(), v.getIntValue().longValue());
                    break;
                case SYMBOL_REF:
                    jo.put(e.getKey(), FIRJsonReader.SYMBOL_REF_PREFIX + v.getValue());
                    break;
                default:
                    jo.put(e.getKey(), v.getValue());
            }
        }
        return jo;
    }
}
