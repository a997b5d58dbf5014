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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.xilinx.firwright.util.FileTools;

/**
 * Reads circuits and annotation files from their JSON representation.  See
 * {@link FIRJsonWriter} for the format.
 */
public class FIRJsonReader {

    public static final String SYMBOL_REF_PREFIX = "@";

    public static FIRCircuit readCircuit(Path path) {
        return parseCircuit(FileTools.readFileAsString(path));
    }

    public static FIRCircuit readCircuit(String fileName) {
        return readCircuit(Path.of(fileName));
    }

    /**
     * Reads an annotation file: a JSON array of annotation objects.
     */
    public static List<FIRAnnotation> readAnnotations(Path path) {
        return parseAnnotations(FileTools.readFileAsString(path));
    }

    public static List<FIRAnnotation> parseAnnotations(String json) {
        try {
            return parseAnnotationArray(new JSONArray(json));
        } catch (JSONException e) {
            throw new FIRParseException("ERROR: Malformed annotation file: " + e.getMessage(), e);
        }
    }

    public static FIRCircuit parseCircuit(String json) {
        try {
            return parseCircuit(new JSONObject(json));
        } catch (FIRParseException e) {
            throw e;
        } catch (JSONException e) {
            throw new FIRParseException("ERROR: Malformed circuit: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Unknown enum values, malformed references and symbol collisions
            throw new FIRParseException("ERROR: Invalid circuit: " + e.getMessage(), e);
        }
    }

    public static FIRCircuit parseCircuit(JSONObject root) {
        FIRCircuit circuit = new FIRCircuit(root.getString("circuit"));
        for (FIRAnnotation a : parseAnnotationArray(root.optJSONArray("annotations"))) {
            circuit.addAnnotation(a);
        }

        JSONArray modules = root.optJSONArray("modules");
        List<JSONObject> bodies = new ArrayList<>();
        if (modules != null) {
            // Declare all modules and ports first, instances may refer forward
            for (int i = 0; i < modules.length(); i++) {
                JSONObject jm = modules.getJSONObject(i);
                FIRModule m = new FIRModule(jm.getString("name"),
                        FIRVisibility.getEnum(jm.optString("visibility", "public")),
                        FIRConvention.getEnum(jm.optString("convention", "internal")));
                for (FIRAnnotation a : parseAnnotationArray(jm.optJSONArray("annotations"))) {
                    m.addAnnotation(a);
                }
                JSONArray ports = jm.optJSONArray("ports");
                if (ports != null) {
                    for (int j = 0; j < ports.length(); j++) {
                        JSONObject jp = ports.getJSONObject(j);
                        FIRPort p = m.createPort(jp.getString("name"),
                                FIRDirection.getEnum(jp.getString("direction")),
                                jp.optString("sym", null));
                        for (FIRAnnotation a : parseAnnotationArray(jp.optJSONArray("annotations"))) {
                            p.addAnnotation(a);
                        }
                    }
                }
                circuit.addModule(m);
                bodies.add(jm);
            }
            for (JSONObject jm : bodies) {
                parseBody(circuit.getModule(jm.getString("name")), jm.optJSONArray("body"));
            }
        }

        JSONArray paths = root.optJSONArray("hierpaths");
        if (paths != null) {
            for (int i = 0; i < paths.length(); i++) {
                JSONObject jp = paths.getJSONObject(i);
                JSONArray np = jp.getJSONArray("namepath");
                List<FIRPathElement> namepath = new ArrayList<>(np.length());
                for (int j = 0; j < np.length(); j++) {
                    namepath.add(FIRPathElement.parse(np.getString(j)));
                }
                try {
                    circuit.addHierPath(new FIRHierPath(jp.getString("sym"), namepath));
                } catch (IllegalArgumentException e) {
                    throw new FIRParseException(e.getMessage(), e);
                }
            }
        }
        return circuit;
    }

    private static void parseBody(FIRModule m, JSONArray body) {
        if (body == null) return;
        Map<String, FIRInstance> insts = new HashMap<>();
        Map<String, FIRComponent> comps = new HashMap<>();
        // Declarations are visible to the whole body
        for (int i = 0; i < body.length(); i++) {
            JSONObject js = body.getJSONObject(i);
            String op = js.getString("op");
            if (op.equals("instance")) {
                FIRInstance inst = new FIRInstance(js.getString("name"), js.getString("module"),
                        js.optString("sym", null));
                for (FIRAnnotation a : parseAnnotationArray(js.optJSONArray("annotations"))) {
                    inst.addAnnotation(a);
                }
                insts.put(inst.getName(), inst);
            } else if (op.equals("wire") || op.equals("node")) {
                FIRComponent c = new FIRComponent(js.getString("name"), FIRComponentKind.getEnum(op),
                        js.optString("sym", null));
                for (FIRAnnotation a : parseAnnotationArray(js.optJSONArray("annotations"))) {
                    c.addAnnotation(a);
                }
                comps.put(c.getName(), c);
            }
        }
        for (int i = 0; i < body.length(); i++) {
            JSONObject js = body.getJSONObject(i);
            String op = js.getString("op");
            switch (op) {
                case "instance":
                    m.addStatement(insts.get(js.getString("name")));
                    break;
                case "wire":
                    m.addStatement(comps.get(js.getString("name")));
                    break;
                case "node":
                    FIRComponent node = m.addStatement(comps.get(js.getString("name")));
                    JSONArray ops = js.getJSONArray("operands");
                    FIRValue[] operands = new FIRValue[ops.length()];
                    for (int j = 0; j < ops.length(); j++) {
                        operands[j] = parseValue(m, insts, comps, ops.getString(j));
                    }
                    try {
                        node.setOperation(FIRPrimOp.getEnum(js.getString("prim")), operands);
                    } catch (IllegalArgumentException e) {
                        throw new FIRParseException(e.getMessage(), e);
                    }
                    break;
                case "connect":
                    m.createConnect(parseValue(m, insts, comps, js.getString("dest")),
                            parseValue(m, insts, comps, js.getString("src")));
                    break;
                case "rwprobe":
                    m.addStatement(new FIRProbe(js.getString("name"),
                            FIRInnerRef.parse(js.getString("target"))));
                    break;
                default:
                    throw new FIRParseException("ERROR: Unknown operation '" + op + "' in module "
                            + m.getName());
            }
        }
    }

    private static FIRValue parseValue(FIRModule m, Map<String, FIRInstance> insts,
                                       Map<String, FIRComponent> comps, String ref) {
        int dot = ref.indexOf('.');
        if (dot > 0) {
            FIRInstance inst = insts.get(ref.substring(0, dot));
            if (inst == null) {
                throw new FIRParseException("ERROR: Unknown instance in value '" + ref
                        + "' in module " + m.getName());
            }
            FIRModule target = m.getCircuit().getModule(inst.getModuleName());
            int idx = target == null ? -1 : target.getPortIndex(ref.substring(dot + 1));
            if (idx < 0) {
                throw new FIRParseException("ERROR: Unknown instance port in value '" + ref
                        + "' in module " + m.getName());
            }
            return FIRValue.ofResult(inst, idx);
        }
        int idx = m.getPortIndex(ref);
        if (idx >= 0) {
            return m.getArgument(idx);
        }
        FIRComponent c = comps.get(ref);
        if (c == null) {
            throw new FIRParseException("ERROR: Unknown value '" + ref + "' in module " + m.getName());
        }
        return FIRValue.ofComponent(c);
    }

    private static List<FIRAnnotation> parseAnnotationArray(JSONArray array) {
        List<FIRAnnotation> annos = new ArrayList<>();
        if (array == null) return annos;
        for (int i = 0; i < array.length(); i++) {
            annos.add(parseAnnotation(array.getJSONObject(i)));
        }
        return annos;
    }

    /**
     * Converts one JSON object into an annotation.  The class member comes first,
     * the others follow in name order.  Strings starting with
     * {@link #SYMBOL_REF_PREFIX} become symbol references.
     */
    public static FIRAnnotation parseAnnotation(JSONObject jo) {
        FIRAnnotation anno = new FIRAnnotation();
        if (jo.has(FIRAnnotation.CLASS_KEY)) {
            anno.setMember(FIRAnnotation.CLASS_KEY, parseAnnotationValue(jo.get(FIRAnnotation.CLASS_KEY)));
        }
        for (String key : new TreeSet<>(jo.keySet())) {
            if (key.equals(FIRAnnotation.CLASS_KEY)) continue;
            anno.setMember(key, parseAnnotationValue(jo.get(key)));
        }
        return anno;
    }

    private static FIRAnnotationValue parseAnnotationValue(Object o) {
        if (o instanceof Boolean) {
            return FIRAnnotationValue.ofBoolean((Boolean) o);
        }
        if (o instanceof Integer || o instanceof Long) {
            return FIRAnnotationValue.ofInteger(((Number) o).longValue());
        }
        if (o instanceof String) {
            String s = (String) o;
            if (s.startsWith(SYMBOL_REF_PREFIX) && s.length() > 1) {
                return FIRAnnotationValue.ofSymbolRef(s.substring(SYMBOL_REF_PREFIX.length()));
            }
            return FIRAnnotationValue.ofString(s);
        }
        return FIRAnnotationValue.ofString(String.valueOf(o));
    }
}
