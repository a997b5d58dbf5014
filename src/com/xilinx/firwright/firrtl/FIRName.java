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
 * Common ancestor for all named FIRRTL circuit objects (modules, ports,
 * instances, components).
 */
public class FIRName implements Comparable<FIRName> {
    /** Name of the object */
    private String name;

    protected FIRName() {

    }

    public FIRName(String name) {
        this.name = name;
    }

    /**
     * Copy constructor
     * @param firName
     */
    public FIRName(FIRName firName) {
        this.name = firName.name;
    }

    public String getName() {
        return name;
    }

    protected void setName(String name) {
        this.name = name;
    }

    /* (non-Javadoc)
     * @see java.lang.Object#hashCode()
     */
    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    /* (non-Javadoc)
     * @see java.lang.Object#equals(java.lang.Object)
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        FIRName other = (FIRName) obj;
        return Objects.equals(name, other.name);
    }

    public String toString() {
        return name;
    }

    public int compareTo(FIRName o) {
        return this.getName().compareTo(o.getName());
    }
}
