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

/**
 * A declaration inside a module body that can be addressed by an inner
 * symbol: a wire or a primitive node.
 */
public class FIRComponent extends FIRAnnotatedObject implements FIRStatement {

    private FIRModule parentModule;

    private final FIRComponentKind kind;

    private String innerSym;

    private FIRPrimOp op;

    private List<FIRValue> operands;

    public FIRComponent(String name, FIRComponentKind kind, String innerSym) {
        super(name);
        this.kind = kind;
        this.innerSym = innerSym;
    }

    public static FIRComponent createWire(String name, String innerSym) {
        return new FIRComponent(name, FIRComponentKind.WIRE, innerSym);
    }

    public static FIRComponent createNode(String name, String innerSym, FIRPrimOp op, FIRValue... operands) {
        FIRComponent c = new FIRComponent(name, FIRComponentKind.NODE, innerSym);
        c.setOperation(op, operands);
        return c;
    }

    public FIRComponentKind getKind() {
        return kind;
    }

    public boolean isWire() {
        return kind == FIRComponentKind.WIRE;
    }

    public boolean isNode() {
        return kind == FIRComponentKind.NODE;
    }

    @Override
    public FIRModule getParentModule() {
        return parentModule;
    }

    @Override
    public void setParentModule(FIRModule parentModule) {
        this.parentModule = parentModule;
    }

    @Override
    public String getInnerSym() {
        return innerSym;
    }

    public void setInnerSym(String innerSym) {
        this.innerSym = innerSym;
    }

    public FIRPrimOp getOp() {
        return op;
    }

    public List<FIRValue> getOperands() {
        return operands == null ? Collections.emptyList() : operands;
    }

    public void setOperation(FIRPrimOp op, FIRValue... operands) {
        if (kind != FIRComponentKind.NODE) {
            throw new RuntimeException("ERROR: Only nodes carry an operation, " + getName()
                    + " is a " + kind);
        }
        if (operands.length != op.getArity()) {
            throw new IllegalArgumentException("ERROR: " + op + " expects " + op.getArity()
                    + " operand(s), node " + getName() + " was given " + operands.length);
        }
        this.op = op;
        this.operands = new ArrayList<>(operands.length);
        Collections.addAll(this.operands, operands);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase()).append(' ').append(getName());
        if (innerSym != null) sb.append(" sym @").append(innerSym);
        if (op != null) sb.append(" = ").append(op.name().toLowerCase()).append(getOperands());
        return sb.toString();
    }
}
