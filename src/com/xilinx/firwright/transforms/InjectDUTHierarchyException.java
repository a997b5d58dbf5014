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

/**
 * Signals that {@link InjectDUTHierarchy} could not run on a circuit.  When
 * several problems are found, the first is thrown and the others are attached
 * as suppressed exceptions.
 */
public class InjectDUTHierarchyException extends RuntimeException {

    private static final long serialVersionUID = -2964001584785830122L;

    public enum ErrorKind {
        /** A directive is missing its required 'name' member */
        MALFORMED_DIRECTIVE,
        /** More than one directive is present */
        DUPLICATE_DIRECTIVE,
        /** A directive is present but no module is marked as the DUT */
        MISSING_DUT;
    }

    private final ErrorKind kind;

    private final String circuitName;

    public InjectDUTHierarchyException(ErrorKind kind, String circuitName, String message) {
        super(message);
        this.kind = kind;
        this.circuitName = circuitName;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
