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
import java.util.List;

import com.xilinx.firwright.firrtl.FIRAnnotation;
import com.xilinx.firwright.firrtl.FIRCircuit;
import com.xilinx.firwright.firrtl.FIRTools;
import com.xilinx.firwright.transforms.InjectDUTHierarchyException.ErrorKind;
import com.xilinx.firwright.util.MessageGenerator;

/**
 * Parameters of {@link InjectDUTHierarchy}, read from the
 * {@link FIRTools#INJECT_DUT_HIERARCHY_ANNO_CLASS} directive on the circuit.
 * The directive stays on the circuit after it is read.
 */
public class InjectDUTHierarchyConfig {

    public static final String NAME_KEY = "name";

    public static final String MOVE_DUT_KEY = "moveDut";

    /** Hint for the name of the module that receives the DUT's body */
    private final String wrapperName;

    /**
     * If true, the wrapper keeps the DUT marker and the new shell becomes
     * private.  This breaks the interface of the DUT unless the caller
     * compensates for it, e.g. with module prefixing.
     */
    private final boolean moveDut;

    public InjectDUTHierarchyConfig(String wrapperName, boolean moveDut) {
        this.wrapperName = wrapperName;
        this.moveDut = moveDut;
    }

    public String getWrapperName() {
        return wrapperName;
    }

    public boolean isMoveDut() {
        return moveDut;
    }

    /**
     * Builds the directive annotation describing this configuration.
     */
    public FIRAnnotation toAnnotation() {
        FIRAnnotation anno = new FIRAnnotation(FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS);
        anno.addMember(NAME_KEY, wrapperName);
        if (moveDut) anno.addMember(MOVE_DUT_KEY, true);
        return anno;
    }

    /**
     * Reads the directive from the circuit annotations.  Every malformed or
     * duplicate directive is reported before failing.
     * @param circuit The circuit to read from
     * @return The configuration, or null if the circuit carries no directive
     * @throws InjectDUTHierarchyException if a directive is malformed or repeated
     */
    public static InjectDUTHierarchyConfig fromCircuit(FIRCircuit circuit) {
        String wrapperName = null;
        boolean moveDut = false;
        List<InjectDUTHierarchyException> errors = new ArrayList<>();

        for (FIRAnnotation anno : circuit.getAnnotations()) {
            if (!anno.isClass(FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS))
                continue;

            String name = anno.getString(NAME_KEY);
            if (name == null) {
                errors.add(report(ErrorKind.MALFORMED_DIRECTIVE, circuit,
                        "contained a malformed '" + FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS
                        + "' annotation that did not contain a '" + NAME_KEY + "' field"));
                continue;
            }

            if (wrapperName != null) {
                errors.add(report(ErrorKind.DUPLICATE_DIRECTIVE, circuit,
                        "contained multiple '" + FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS
                        + "' annotations when at most one is allowed"));
                continue;
            }

            wrapperName = name;
            Boolean move = anno.getBoolean(MOVE_DUT_KEY);
            if (move != null)
                moveDut = move;
        }

        if (!errors.isEmpty()) {
            InjectDUTHierarchyException first = errors.get(0);
            for (int i = 1; i < errors.size(); i++) {
                first.addSuppressed(errors.get(i));
            }
            throw first;
        }

        return wrapperName == null ? null : new InjectDUTHierarchyConfig(wrapperName, moveDut);
    }

    static InjectDUTHierarchyException report(ErrorKind kind, FIRCircuit circuit, String what) {
        String msg = "ERROR: circuit '" + circuit.getName() + "' " + what;
        MessageGenerator.briefError(msg);
        return new InjectDUTHierarchyException(kind, circuit.getName(), msg);
    }

    @Override
    public String toString() {
        return "InjectDUTHierarchyConfig{" + NAME_KEY + "=" + wrapperName + ", "
                + MOVE_DUT_KEY + "=" + moveDut + "}";
    }
}
