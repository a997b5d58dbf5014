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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;

/**
 * A single annotation: an ordered map of named, typed members.  The
 * {@link #CLASS_KEY} member identifies the kind of annotation and the optional
 * {@link #NONLOCAL_KEY} member scopes the annotation to the instantiation
 * context described by a {@link FIRHierPath}.
 */
public class FIRAnnotation {

    public static final String CLASS_KEY = "class";

    public static final String NONLOCAL_KEY = "circt.nonlocal";

    private final Map<String, FIRAnnotationValue> members;

    public FIRAnnotation() {
        members = new LinkedHashMap<>();
    }

    public FIRAnnotation(String className) {
        this();
        setMember(CLASS_KEY, FIRAnnotationValue.ofString(className));
    }

    /**
     * Copy constructor
     * @param anno Prototype annotation
     */
    public FIRAnnotation(FIRAnnotation anno) {
        members = new LinkedHashMap<>(anno.members);
    }

    public String getClassName() {
        FIRAnnotationValue v = members.get(CLASS_KEY);
        return v == null ? null : v.getValue();
    }

    public boolean isClass(String className) {
        return Objects.equals(getClassName(), className);
    }

    public FIRAnnotationValue getMember(String key) {
        return members.get(key);
    }

    /**
     * Gets a member only if it is present with the requested type.
     * @param key Name of the member
     * @param type Expected type
     * @return The value or null if missing or of another type
     */
    public FIRAnnotationValue getMember(String key, FIRValueType type) {
        FIRAnnotationValue v = members.get(key);
        if (v == null || v.getType() != type) return null;
        return v;
    }

    public String getString(String key) {
        FIRAnnotationValue v = getMember(key, FIRValueType.STRING);
        return v == null ? null : v.getValue();
    }

    public Boolean getBoolean(String key) {
        FIRAnnotationValue v = getMember(key, FIRValueType.BOOLEAN);
        return v == null ? null : v.getBooleanValue();
    }

    public String getSymbolRef(String key) {
        FIRAnnotationValue v = getMember(key, FIRValueType.SYMBOL_REF);
        return v == null ? null : v.getValue();
    }

    /**
     * Convenience accessor for the hierarchical path this annotation is scoped to.
     * @return The path symbol or null if the annotation is local.
     */
    public String getNonLocal() {
        return getSymbolRef(NONLOCAL_KEY);
    }

    public FIRAnnotationValue setMember(String key, FIRAnnotationValue value) {
        return members.put(key, value);
    }

    public FIRAnnotation addMember(String key, String value) {
        setMember(key, FIRAnnotationValue.ofString(value));
        return this;
    }

    public FIRAnnotation addMember(String key, boolean value) {
        setMember(key, FIRAnnotationValue.ofBoolean(value));
        return this;
    }

    public FIRAnnotation addSymbolRef(String key, String symbol) {
        setMember(key, FIRAnnotationValue.ofSymbolRef(symbol));
        return this;
    }

    public FIRAnnotationValue removeMember(String key) {
        return members.remove(key);
    }

    public Map<String, FIRAnnotationValue> getMembers() {
        return Collections.unmodifiableMap(members);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return members.equals(((FIRAnnotation) o).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Entry<String, FIRAnnotationValue> e : members.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.append("}").toString();
    }
}
