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

/**
 * Thrown when a serialized design or annotation file cannot be turned into a
 * circuit.
 */
public class FIRParseException extends RuntimeException {

    private static final long serialVersionUID = 4318829302917710436L;

    public FIRParseException(String message) {
        super(message);
    }

    public FIRParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
