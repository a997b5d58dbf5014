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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top level container of a FIRRTL design.  Owns the ordered list of modules
 * and hierarchical paths, which share a single symbol table, and carries the
 * circuit-level annotations.  The circuit name is the name of its main module.
 */
public class FIRCircuit extends FIRAnnotatedObject {

    private final List<FIRModule> modules = new ArrayList<>();

    private final Map<String, FIRModule> moduleMap = new HashMap<>();

    private final List<FIRHierPath> hierPaths = new ArrayList<>();

    private final Map<String, FIRHierPath> hierPathMap = new HashMap<>();

    public FIRCircuit(String name) {
        super(name);
    }

    private void checkSymbolCollision(String sym, String what) {
        if (moduleMap.containsKey(sym) || hierPathMap.containsKey(sym)) {
            throw new RuntimeException("ERROR: Symbol collision inside FIRCircuit " + getName()
                    + ", trying to add " + what + " @" + sym
                    + " which already exists inside this circuit.");
        }
    }

    /**
     * Adds the module at the end of the circuit.  Checks for a symbol collision.
     * @param module The module to add
     * @return The module added to the circuit
     */
    public FIRModule addModule(FIRModule module) {
        return insertModule(modules.size(), module);
    }

    /**
     * Adds the module immediately after another module of this circuit.
     * @param anchor Existing module of this circuit
     * @param module The module to add
     * @return The module added to the circuit
     */
    public FIRModule insertModuleAfter(FIRModule anchor, FIRModule module) {
        int idx = indexOf(anchor);
        if (idx < 0) {
            throw new RuntimeException("ERROR: Module " + anchor.getName()
                    + " is not part of circuit " + getName());
        }
        return insertModule(idx + 1, module);
    }

    private FIRModule insertModule(int index, FIRModule module) {
        checkSymbolCollision(module.getName(), "module");
        module.setCircuit(this);
        modules.add(index, module);
        moduleMap.put(module.getName(), module);
        return module;
    }

    private int indexOf(FIRModule module) {
        for (int i = 0; i < modules.size(); i++) {
            if (modules.get(i) == module) return i;
        }
        return -1;
    }

    public FIRModule getModule(String name) {
        return moduleMap.get(name);
    }

    public List<FIRModule> getModules() {
        return Collections.unmodifiableList(modules);
    }

    /**
     * @return The module with the same name as the circuit, or null
     */
    public FIRModule getMainModule() {
        return getModule(getName());
    }

    /**
     * Renames a module of this circuit.  Instances and hierarchical paths refer
     * to modules by name and are not updated.
     * @param module Module of this circuit
     * @param newName New, unused name (see {@link FIRCircuitNamespace})
     */
    public void renameModule(FIRModule module, String newName) {
        if (moduleMap.get(module.getName()) != module) {
            throw new RuntimeException("ERROR: Couldn't find module " + module.getName()
                    + " in circuit " + getName() + " when trying to rename to " + newName);
        }
        checkSymbolCollision(newName, "module");
        moduleMap.remove(module.getName());
        module.setName(newName);
        moduleMap.put(newName, module);
    }

    public FIRHierPath addHierPath(FIRHierPath path) {
        checkSymbolCollision(path.getSymName(), "hierpath");
        hierPaths.add(path);
        hierPathMap.put(path.getSymName(), path);
        return path;
    }

    /**
     * Adds a path immediately before an existing path, keeping clones next to their originals.
     */
    public FIRHierPath insertHierPathBefore(FIRHierPath anchor, FIRHierPath path) {
        int idx = hierPaths.indexOf(anchor);
        if (idx < 0) {
            throw new RuntimeException("ERROR: Hierarchical path @" + anchor.getSymName()
                    + " is not part of circuit " + getName());
        }
        checkSymbolCollision(path.getSymName(), "hierpath");
        hierPaths.add(idx, path);
        hierPathMap.put(path.getSymName(), path);
        return path;
    }

    public FIRHierPath removeHierPath(FIRHierPath path) {
        FIRHierPath removed = hierPathMap.remove(path.getSymName());
        if (removed != null) hierPaths.remove(removed);
        return removed;
    }

    public FIRHierPath getHierPath(String sym) {
        return hierPathMap.get(sym);
    }

    public List<FIRHierPath> getHierPaths() {
        return Collections.unmodifiableList(hierPaths);
    }

    /**
     * @return Every top-level symbol currently defined in this circuit (modules and paths).
     */
    public Set<String> getSymbols() {
        Set<String> syms = new LinkedHashSet<>(moduleMap.keySet());
        syms.addAll(hierPathMap.keySet());
        return syms;
    }

    @Override
    public String toString() {
        return "circuit " + getName();
    }
}
