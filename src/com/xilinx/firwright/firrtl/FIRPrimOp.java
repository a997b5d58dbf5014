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
 * Bitwise primitive operations available to {@link FIRComponentKind#NODE}
 * components.
 */
public enum FIRPrimOp {
    AND(2),
    OR(2),
    XOR(2),
    NOT(1);

    private final int arity;

    FIRPrimOp(int arity) {
        this.arity = arity;
    }

    public int getArity() {
        return arity;
    }

    public long apply(long[] args) {
        if (args.length != arity) {
            throw new IllegalArgumentException("ERROR: " + this + " expects " + arity
                    + " operand(s), got " + args.length);
        }
        switch (this) {
            case AND:
                return args[0] & args[1];
            case OR:
                return args[0] | args[1];
            case XOR:
                return args[0] ^ args[1];
            case NOT:
                return ~args[0];
            default:
                throw new IllegalStateException("Unhandled primitive " + this);
        }
    }

    public static FIRPrimOp getEnum(String s) {
        return valueOf(s.toUpperCase());
    }
}
