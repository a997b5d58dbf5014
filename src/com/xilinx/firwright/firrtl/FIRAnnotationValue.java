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

import java.util.Objects;

/**
 * A typed annotation member value.  Currently supports: string, boolean,
 * integer and flat symbol references.
 */
public class FIRAnnotationValue {

    private final FIRValueType type;

    private final String value;

    public FIRAnnotationValue(String value, FIRValueType type) {
        this.value = Objects.requireNonNull(value);
        this.type = Objects.requireNonNull(type);
    }

    public static FIRAnnotationValue ofString(String value) {
        return new FIRAnnotationValue(value, FIRValueType.STRING);
    }

    public static FIRAnnotationValue ofBoolean(boolean value) {
        return new FIRAnnotationValue(value ? "true" : "false", FIRValueType.BOOLEAN);
    }

    public static FIRAnnotationValue ofInteger(long value) {
        return new FIRAnnotationValue(Long.toString(value), FIRValueType.INTEGER);
    }

    public static FIRAnnotationValue ofSymbolRef(String symbol) {
        return new FIRAnnotationValue(symbol, FIRValueType.SYMBOL_REF);
    }

    /**
     * @return the type
     */
    public FIRValueType getType() {
        return type;
    }

    /**
     * @return the raw value
     */
    public String getValue() {
        return value;
    }

    /**
     * @return The boolean value, or null if this is not a boolean.
     */
    public Boolean getBooleanValue() {
        if (type != FIRValueType.BOOLEAN) {
            return null;
        }
        return Boolean.parseBoolean(value);
    }

    /**
     * @return The integer value, or null if this is not an integer.
     */
    public Long getIntValue() {
        if (type != FIRValueType.INTEGER) {
            return null;
        }
        return Long.parseLong(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FIRAnnotationValue that = (FIRAnnotationValue) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING:
                return "\"" + value + "\"";
            case SYMBOL_REF:
                return "@" + value;
            default:
                return value;
        }
    }
}
