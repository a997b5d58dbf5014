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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.firwright.firrtl.FIRCircuit;
import com.xilinx.firwright.firrtl.FIRHierPath;
import com.xilinx.firwright.firrtl.FIRHierPathTable;
import com.xilinx.firwright.firrtl.FIRNamespace;
import com.xilinx.firwright.firrtl.FIRPathElement;
import com.xilinx.firwright.util.MessageGenerator;

/**
 * Updates the hierarchical paths that involve the DUT after it has been split
 * into a shell and a wrapper (see {@link DUTModuleSplitter}).
 *
 * The shell carries the DUT's name, so paths still name it, while everything
 * that used to be inside the DUT now lives in the wrapper.  There are three
 * cases:
 * <ol>
 *   <li>The DUT is the root of the path.  The root is moved to the wrapper.</li>
 *   <li>The path ends at the DUT.
 *     <ul>
 *       <li>Reference to a DUT port: ports stay on the shell, nothing to do.</li>
 *       <li>Module path used by annotations on the shell or its ports: clone
 *           the path so those annotations keep resolving for the shell, then
 *           extend the original into the wrapper.</li>
 *       <li>Anything else (module path, reference to a component): extend
 *           into the wrapper.</li>
 *     </ul></li>
 *   <li>The path passes through the DUT.  Extend into the wrapper.</li>
 * </ol>
 */
public class HierPathRewriter {

    public enum PathCase {
        ROOT,
        LEAF_PORT,
        LEAF_MODULE_SHARED,
        EXTEND;
    }

    private final FIRCircuit circuit;

    private final FIRNamespace circuitNS;

    private final FIRHierPathTable pathTable;

    private final DUTSplit split;

    /** Paths referenced by annotations on the shell or its ports */
    private final Set<String> dutPaths;

    /** Inner symbols of the shell's ports */
    private final Set<String> dutPortSyms;

    /** Original path symbol to its clone */
    private final Map<String, FIRHierPath> dutRenames = new LinkedHashMap<>();

    private boolean verbose;

    public HierPathRewriter(FIRCircuit circuit, FIRNamespace circuitNS, FIRHierPathTable pathTable,
                            DUTSplit split, Set<String> dutPaths, Set<String> dutPortSyms) {
        this.circuit = circuit;
        this.circuitNS = circuitNS;
        this.pathTable = pathTable;
        this.split = split;
        this.dutPaths = dutPaths;
        this.dutPortSyms = dutPortSyms;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Decides how a path touching the DUT has to be updated.  Only paths with
     * more than one element can take the root case, a single element path at
     * the DUT is routed through the wrapper instance like any other leaf.
     * @param path A path naming the DUT in at least one element
     * @return The case that applies to the path
     */
    public PathCase classify(FIRHierPath path) {
        String dutName = split.getDutName();
        if (path.size() > 1 && path.root().equals(dutName)) {
            return PathCase.ROOT;
        }
        if (path.leafMod().equals(dutName)) {
            if (path.isComponent() && dutPortSyms.contains(path.ref()))
                return PathCase.LEAF_PORT;
            if (path.isModule() && dutPaths.contains(path.getSymName()))
                return PathCase.LEAF_MODULE_SHARED;
        }
        return PathCase.EXTEND;
    }

    /**
     * Rewrites every path the table associates with the DUT.
     * @return Original path symbol to clone, for paths that were cloned
     */
    public Map<String, FIRHierPath> rewriteAll() {
        if (verbose) MessageGenerator.briefMessage("Processing hierarchical paths:");
        // Snapshot, cloning and extending paths edits the table
        List<FIRHierPath> paths = new ArrayList<>(pathTable.lookup(split.getDutName()));
        for (FIRHierPath path : paths) {
            if (verbose) MessageGenerator.briefMessage("  - " + path);
            rewrite(path);
        }
        return dutRenames;
    }

    /**
     * Applies the update for one path.
     * @return The case that was applied
     */
    public PathCase rewrite(FIRHierPath path) {
        PathCase c = classify(path);
        switch (c) {
            case ROOT:
                moveRootToWrapper(path);
                break;
            case LEAF_PORT:
                break;
            case LEAF_MODULE_SHARED:
                FIRHierPath clone = new FIRHierPath(circuitNS.newName(path.getSymName()), path);
                circuit.insertHierPathBefore(path, clone);
                pathTable.addPath(clone);
                dutRenames.put(path.getSymName(), clone);
                addHierarchy(path);
                break;
            case EXTEND:
                addHierarchy(path);
                break;
        }
        return c;
    }

    private void moveRootToWrapper(FIRHierPath path) {
        List<FIRPathElement> namepath = path.getNamepath();
        List<FIRPathElement> newNamepath = new ArrayList<>(namepath);
        newNamepath.set(0, namepath.get(0).withModule(split.getWrapper().getName()));
        path.setNamepath(newNamepath);
        pathTable.updatePath(path);
    }

    /**
     * Adds the wrapper instance after the DUT element of a path.  E.g.:
     * <pre>
     *   [Top::dut, DUT]  ->  [Top::dut, DUT::wrapper, Wrapper]
     * </pre>
     * The DUT element itself is moved into the wrapper, keeping its inner symbol.
     */
    void addHierarchy(FIRHierPath path) {
        String dutName = split.getDutName();
        List<FIRPathElement> namepath = path.getNamepath();

        int idx = 0;
        List<FIRPathElement> newNamepath = new ArrayList<>(namepath.size() + 1);
        while (!path.modPart(idx).equals(dutName))
            newNamepath.add(namepath.get(idx++));
        newNamepath.add(FIRPathElement.innerRef(dutName, split.getWrapperInstance().getInnerSym()));

        newNamepath.add(namepath.get(idx).withModule(split.getWrapper().getName()));

        newNamepath.addAll(namepath.subList(idx + 1, namepath.size()));
        path.setNamepath(newNamepath);
        pathTable.updatePath(path);
    }

    public Map<String, FIRHierPath> getDutRenames() {
        return dutRenames;
    }
}
