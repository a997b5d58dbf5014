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

import java.util.Map;

import com.xilinx.firwright.firrtl.FIRAnnotatedObject;
import com.xilinx.firwright.firrtl.FIRAnnotation;
import com.xilinx.firwright.firrtl.FIRAnnotationValue;
import com.xilinx.firwright.firrtl.FIRHierPath;
import com.xilinx.firwright.firrtl.FIRModule;
import com.xilinx.firwright.firrtl.FIRPort;
import com.xilinx.firwright.firrtl.FIRProbe;

/**
 * Fixes up references that the DUT split and path rewriting leave stale:
 * annotations on the shell scoped to a path that was cloned, and read-write
 * probes inside the wrapper whose target still names the old DUT.
 */
public class DUTAnnotationRetargeter {

    /**
     * Points annotations on the module and its ports at the clones of the paths
     * they reference.  Annotations whose path was not cloned are left untouched.
     * @param shell The shell module
     * @param dutRenames Original path symbol to clone
     * @return Number of annotations updated
     */
    public static int retargetAnnotations(FIRModule shell, Map<String, FIRHierPath> dutRenames) {
        if (dutRenames.isEmpty()) return 0;
        int count = retargetAnnotations((FIRAnnotatedObject) shell, dutRenames);
        for (FIRPort p : shell.getPorts()) {
            count += retargetAnnotations(p, dutRenames);
        }
        return count;
    }

    private static int retargetAnnotations(FIRAnnotatedObject obj, Map<String, FIRHierPath> dutRenames) {
        int count = 0;
        for (FIRAnnotation anno : obj.getAnnotations()) {
            String sym = anno.getNonLocal();
            if (sym == null)
                continue;
            FIRHierPath clone = dutRenames.get(sym);
            if (clone == null)
                continue;
            anno.setMember(FIRAnnotation.NONLOCAL_KEY, FIRAnnotationValue.ofSymbolRef(clone.getSymName()));
            count++;
        }
        return count;
    }

    /**
     * Probes are local to their module, so their target is renamed with it.
     * @param wrapper The wrapper module
     * @return Number of probes updated
     */
    public static int relocateProbes(FIRModule wrapper) {
        int count = 0;
        for (FIRProbe probe : wrapper.getProbes()) {
            probe.setTarget(probe.getTarget().withModule(wrapper.getName()));
            count++;
        }
        return count;
    }
}
