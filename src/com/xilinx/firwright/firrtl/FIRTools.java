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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A collection of utility methods and constants for working with FIRRTL
 * circuits.
 */
public class FIRTools {

    /** Marks the design-under-test */
    public static final String DUT_ANNO_CLASS = "sifive.enterprise.firrtl.MarkDUTAnnotation";

    /** Requests a level of hierarchy to be injected below the DUT */
    public static final String INJECT_DUT_HIERARCHY_ANNO_CLASS =
            "sifive.enterprise.firrtl.InjectDUTHierarchyAnnotation";

    /**
     * Connects dest from src at the end of the module body.
     * @param module Module to add the connect to
     * @param dest The driven value
     * @param src The driving value
     * @return The new connect
     */
    public static FIRConnect emitConnect(FIRModule module, FIRValue dest, FIRValue src) {
        return module.createConnect(dest, src);
    }

    /**
     * Finds every instantiation of a module anywhere in the circuit.
     * @param circuit The circuit to search
     * @param moduleName Name of the instantiated module
     * @return The instances in module and document order
     */
    public static List<FIRInstance> getInstancesOf(FIRCircuit circuit, String moduleName) {
        List<FIRInstance> insts = new ArrayList<>();
        for (FIRModule m : circuit.getModules()) {
            for (FIRInstance i : m.getInstances()) {
                if (i.getModuleName().equals(moduleName)) insts.add(i);
            }
        }
        return insts;
    }

    /**
     * Finds the connect driving a value in a module.
     * @return The driving connect or null if the value is undriven
     */
    public static FIRConnect getDriver(FIRModule module, FIRValue dest) {
        for (FIRConnect c : module.getConnects()) {
            if (c.getDest().equals(dest)) return c;
        }
        return null;
    }

    /**
     * Checks the structural invariants of a circuit: unique module names, unique
     * inner symbols per module, resolvable instances, hierarchical paths that
     * describe an actual instantiation route, annotations that reference existing
     * paths and probes that target their own module.
     * @param circuit The circuit to check
     * @return A list of human readable violations, empty if the circuit is sound
     */
    public static List<String> verifyCircuit(FIRCircuit circuit) {
        List<String> errors = new ArrayList<>();
        Set<String> moduleNames = new HashSet<>();
        for (FIRModule m : circuit.getModules()) {
            if (!moduleNames.add(m.getName())) {
                errors.add("Duplicate module name @" + m.getName());
            }
            Set<String> syms = new HashSet<>();
            for (String sym : m.getInnerSymbols()) {
                if (!syms.add(sym)) {
                    errors.add("Duplicate inner symbol @" + sym + " in module @" + m.getName());
                }
            }
            for (FIRInstance i : m.getInstances()) {
                if (i.getModule() == null) {
                    errors.add("Instance " + i.getName() + " in module @" + m.getName()
                            + " refers to unknown module @" + i.getModuleName());
                }
            }
            for (FIRProbe p : m.getProbes()) {
                FIRInnerRef t = p.getTarget();
                if (!t.getModule().equals(m.getName()) || m.lookupInnerSym(t.getName()) == null) {
                    errors.add("Probe " + p.getName() + " in module @" + m.getName()
                            + " has unresolvable target " + t);
                }
            }
            checkAnnotations(circuit, m, errors);
            for (FIRPort p : m.getPorts()) {
                checkAnnotations(circuit, p, errors);
            }
            for (FIRStatement s : m.getBody()) {
                if (s instanceof FIRAnnotatedObject) {
                    checkAnnotations(circuit, (FIRAnnotatedObject) s, errors);
                }
            }
        }
        for (FIRHierPath path : circuit.getHierPaths()) {
            String problem = checkHierPath(circuit, path);
            if (problem != null) errors.add(problem);
        }
        return errors;
    }

    private static void checkAnnotations(FIRCircuit circuit, FIRAnnotatedObject obj, List<String> errors) {
        for (FIRAnnotation a : obj.getAnnotations()) {
            String sym = a.getNonLocal();
            if (sym != null && circuit.getHierPath(sym) == null) {
                errors.add("Annotation " + a + " on " + obj + " references unknown path @" + sym);
            }
        }
    }

    /**
     * Checks that a path describes one instantiation route through the circuit.
     * @return A description of the first problem found, or null if the path is routable
     */
    public static String checkHierPath(FIRCircuit circuit, FIRHierPath path) {
        List<FIRPathElement> namepath = path.getNamepath();
        for (int i = 0; i < namepath.size(); i++) {
            FIRPathElement e = namepath.get(i);
            FIRModule m = circuit.getModule(e.getModule());
            if (m == null) {
                return path + ": element " + e + " names unknown module";
            }
            if (e.isModuleRef()) continue;
            Object target = m.lookupInnerSym(e.getName());
            if (target == null) {
                return path + ": element " + e + " does not resolve";
            }
            if (i == namepath.size() - 1) continue;
            if (!(target instanceof FIRInstance)) {
                return path + ": element " + e + " is not an instance";
            }
            String next = namepath.get(i + 1).getModule();
            if (!((FIRInstance) target).getModuleName().equals(next)) {
                return path + ": element " + e + " instantiates @"
                        + ((FIRInstance) target).getModuleName() + " but the next element is in @" + next;
            }
        }
        return null;
    }
}
