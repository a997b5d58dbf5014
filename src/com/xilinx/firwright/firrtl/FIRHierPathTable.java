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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reverse index from a module name to every {@link FIRHierPath} that names the
 * module in any of its elements (root, interior or leaf).  Built once over a
 * circuit and kept up to date incrementally by whoever edits paths.
 */
public class FIRHierPathTable {

    private final Map<String, Set<FIRHierPath>> modToPaths = new HashMap<>();

    /** Modules each indexed path was registered under, used to un-index */
    private final Map<FIRHierPath, Set<String>> pathToMods = new HashMap<>();

    private final Map<String, FIRHierPath> symToPath = new HashMap<>();

    public FIRHierPathTable(FIRCircuit circuit) {
        for (FIRHierPath p : circuit.getHierPaths()) {
            addPath(p);
        }
    }

    /**
     * Indexes a path under every module it names.
     */
    public void addPath(FIRHierPath path) {
        Set<String> mods = new LinkedHashSet<>();
        for (FIRPathElement e : path.getNamepath()) {
            mods.add(e.getModule());
        }
        for (String m : mods) {
            modToPaths.computeIfAbsent(m, k -> new LinkedHashSet<>()).add(path);
        }
        pathToMods.put(path, mods);
        symToPath.put(path.getSymName(), path);
    }

    /**
     * Removes a path from the index.
     * @return True if the path was indexed
     */
    public boolean erasePath(FIRHierPath path) {
        Set<String> mods = pathToMods.remove(path);
        if (mods == null) return false;
        for (String m : mods) {
            Set<FIRHierPath> paths = modToPaths.get(m);
            if (paths == null) continue;
            paths.remove(path);
            if (paths.isEmpty()) modToPaths.remove(m);
        }
        symToPath.remove(path.getSymName());
        return true;
    }

    /**
     * Re-indexes a path after its namepath was changed.
     */
    public void updatePath(FIRHierPath path) {
        erasePath(path);
        addPath(path);
    }

    /**
     * @param moduleName Name of a module
     * @return All paths passing through the module, in insertion order.  The
     * returned set is a live view; copy it before editing paths.
     */
    public Set<FIRHierPath> lookup(String moduleName) {
        Set<FIRHierPath> paths = modToPaths.get(moduleName);
        return paths == null ? Collections.emptySet() : Collections.unmodifiableSet(paths);
    }

    public Set<FIRHierPath> lookup(FIRModule module) {
        return lookup(module.getName());
    }

    public FIRHierPath getPath(String sym) {
        return symToPath.get(sym);
    }

    /**
     * Collects the symbols of all paths referenced by annotations on a module and,
     * optionally, on its ports.
     * @param module The module to scan
     * @param includePorts If true, port annotations are scanned as well
     * @return Referenced path symbols in order of first appearance
     */
    public static Set<String> getReferencedPaths(FIRModule module, boolean includePorts) {
        Set<String> syms = new LinkedHashSet<>();
        addReferencedPaths(module, syms);
        if (includePorts) {
            for (FIRPort p : module.getPorts()) {
                addReferencedPaths(p, syms);
            }
        }
        return syms;
    }

    private static void addReferencedPaths(FIRAnnotatedObject obj, Set<String> syms) {
        for (FIRAnnotation a : obj.getAnnotations()) {
            String sym = a.getNonLocal();
            if (sym != null) syms.add(sym);
        }
    }
}
