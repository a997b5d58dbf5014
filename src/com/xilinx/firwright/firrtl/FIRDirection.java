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
 * Provides the directional options for module ports.
 */
public enum FIRDirection {
    IN,
    OUT;

    public static FIRDirection getEnum(String s) {
        s = s.toUpperCase();
        if (s.equals("INPUT")) return IN;
        if (s.equals("OUTPUT")) return OUT;
        return valueOf(s);
    }

    public FIRDirection flip() {
        return this == IN ? OUT : IN;
    }
}
