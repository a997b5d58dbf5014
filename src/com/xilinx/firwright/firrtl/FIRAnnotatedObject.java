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
import java.util.function.Predicate;

/**
 * All circuit objects that can carry annotations inherit from this class.
 */
public class FIRAnnotatedObject extends FIRName {

    private List<FIRAnnotation> annotations;

    public FIRAnnotatedObject(String name) {
        super(name);
    }

    /**
     * Copy constructor, annotations are duplicated.
     * @param obj Prototype object
     */
    public FIRAnnotatedObject(FIRAnnotatedObject obj) {
        super(obj);
        annotations = obj.createDuplicateAnnotations();
    }

    protected FIRAnnotatedObject() {

    }

    public void addAnnotation(FIRAnnotation anno) {
        if (annotations == null) annotations = new ArrayList<>(2);
        annotations.add(anno);
    }

    /**
     * Get all annotations on this object in order.
     */
    public List<FIRAnnotation> getAnnotations() {
        if (annotations == null) {
            return Collections.emptyList();
        }
        return annotations;
    }

    /**
     * Replaces all annotations
     * @param annotations the annotations to set
     */
    public void setAnnotations(List<FIRAnnotation> annotations) {
        this.annotations = annotations == null ? null : new ArrayList<>(annotations);
    }

    /**
     * Removes all annotations matching the provided predicate.
     * @param predicate Returns true for annotations that should be removed
     * @return True if any annotation was removed
     */
    public boolean removeAnnotations(Predicate<FIRAnnotation> predicate) {
        if (annotations == null) return false;
        return annotations.removeIf(predicate);
    }

    public boolean removeAnnotations(String className) {
        return removeAnnotations(a -> a.isClass(className));
    }

    public boolean hasAnnotation(String className) {
        return getAnnotation(className) != null;
    }

    /**
     * @param className Annotation class to look for
     * @return The first annotation of the provided class or null if none exists
     */
    public FIRAnnotation getAnnotation(String className) {
        for (FIRAnnotation a : getAnnotations()) {
            if (a.isClass(className)) return a;
        }
        return null;
    }

    public List<FIRAnnotation> createDuplicateAnnotations() {
        if (annotations == null) return null;
        List<FIRAnnotation> copy = new ArrayList<>(annotations.size());
        for (FIRAnnotation a : annotations) {
            copy.add(new FIRAnnotation(a));
        }
        return copy;
    }
}
