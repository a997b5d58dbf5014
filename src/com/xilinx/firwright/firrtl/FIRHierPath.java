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
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * A named hierarchical path (non-local anchor): an ordered route of
 * {@link FIRPathElement}s through instance edges from a root module down to a
 * leaf module, port or component.  Annotations refer to a path by its symbol
 * through the {@link FIRAnnotation#NONLOCAL_KEY} member to restrict themselves
 * to the one instantiation context the path describes.
 *
 * Every element except the last must be an inner reference naming an instance.
 * The last element is either a module reference (the path scopes a whole
 * module) or an inner reference to a port or component (the path scopes one
 * target).
 */
public class FIRHierPath {

    @NotNull
    private final String symName;

    private List<FIRPathElement> namepath;

    public FIRHierPath(@NotNull String symName, @NotNull List<FIRPathElement> namepath) {
        this.symName = Objects.requireNonNull(symName);
        setNamepath(namepath);
    }

    /**
     * Copy constructor, creates a clone of the path under a new symbol.
     * @param symName Symbol of the clone
     * @param orig The path to clone
     */
    public FIRHierPath(String symName, FIRHierPath orig) {
        this(symName, orig.namepath);
    }

    public static FIRHierPath parse(String symName, String... elements) {
        List<FIRPathElement> namepath = new ArrayList<>(elements.length);
        for (String e : elements) {
            namepath.add(FIRPathElement.parse(e));
        }
        return new FIRHierPath(symName, namepath);
    }

    public String getSymName() {
        return symName;
    }

    public List<FIRPathElement> getNamepath() {
        return namepath;
    }

    /**
     * Replaces the route of this path.  Callers that maintain a
     * {@link FIRHierPathTable} must update it afterwards.
     * @param namepath The new route
     */
    public void setNamepath(List<FIRPathElement> namepath) {
        if (namepath == null || namepath.isEmpty()) {
            throw new IllegalArgumentException("ERROR: Hierarchical path @" + symName
                    + " must have at least one element");
        }
        for (int i = 0; i < namepath.size() - 1; i++) {
            if (!namepath.get(i).isInnerRef()) {
                throw new IllegalArgumentException("ERROR: Hierarchical path @" + symName
                        + " has a module reference '" + namepath.get(i)
                        + "' before its leaf, only instance references are allowed there");
            }
        }
        this.namepath = Collections.unmodifiableList(new ArrayList<>(namepath));
    }

    public int size() {
        return namepath.size();
    }

    /**
     * @param i Index of the element
     * @return The name of the module owning the i-th element
     */
    public String modPart(int i) {
        return namepath.get(i).getModule();
    }

    public String root() {
        return modPart(0);
    }

    public FIRPathElement getLeaf() {
        return namepath.get(namepath.size() - 1);
    }

    public String leafMod() {
        return getLeaf().getModule();
    }

    /**
     * @return True if this path scopes a whole module (leaf is a module reference)
     */
    public boolean isModule() {
        return getLeaf().isModuleRef();
    }

    /**
     * @return True if this path scopes a port or component (leaf is an inner reference)
     */
    public boolean isComponent() {
        return getLeaf().isInnerRef();
    }

    /**
     * @return The inner symbol the leaf refers to, or null for a module path
     */
    public String ref() {
        return getLeaf().getName();
    }

    /**
     * @param moduleName Name of a module
     * @return True if any element of this path is owned by the module
     */
    public boolean hasModule(String moduleName) {
        for (FIRPathElement e : namepath) {
            if (e.getModule().equals(moduleName)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("hierpath @").append(symName).append(" [");
        for (int i = 0; i < namepath.size(); i++) {
            if (i > 0) sb.append(", ");
            FIRPathElement e = namepath.get(i);
            sb.append('@').append(e.getModule());
            if (e.isInnerRef()) {
                sb.append("::@").append(e.getName());
            }
        }
        return sb.append("]").toString();
    }
}
