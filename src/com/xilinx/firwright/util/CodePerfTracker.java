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

package com.xilinx.firwright.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple tool for measuring the runtime of the phases of a tool and reporting
 * them.
 */
public class CodePerfTracker {

    private String name;

    private final List<Long> runtimes = new ArrayList<>();

    private final List<String> segmentNames = new ArrayList<>();

    private int maxRuntimeSize = 9;
    private int maxSegmentNameSize = 24;
    private boolean printProgress = true;

    public static final CodePerfTracker SILENT;

    static {
        SILENT = new CodePerfTracker("", false);
        SILENT.setVerbose(false);
    }

    private boolean verbose = true;

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean printProgress) {
        this.name = name;
        this.printProgress = printProgress;
        if (this.printProgress && isVerbose() && name != null) {
            MessageGenerator.printHeader(name);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    public CodePerfTracker start(String segmentName) {
        if (this == SILENT) return this;
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        return this;
    }

    public CodePerfTracker stop() {
        if (this == SILENT) return this;
        long end = System.nanoTime();
        int idx = runtimes.size() - 1;
        if (idx < 0) return this;
        runtimes.set(idx, end - runtimes.get(idx));
        if (printProgress && isVerbose()) {
            print(idx);
        }
        return this;
    }

    private void print(String segmentName, long runtime) {
        System.out.printf("%" + maxSegmentNameSize + "s: %" + maxRuntimeSize + ".3fs%n",
                segmentName, runtime / 1000000000.0);
    }

    private void print(int idx) {
        print(segmentNames.get(idx), runtimes.get(idx));
    }

    public void printSummary() {
        if (this == SILENT || !isVerbose()) return;
        if (!printProgress) {
            MessageGenerator.printHeader(name);
            for (int i = 0; i < runtimes.size(); i++) {
                print(i);
            }
        }
        long total = 0L;
        for (long r : runtimes) {
            total += r;
        }
        System.out.println("------------------------------------------------------------------------------");
        print("*Total*", total);
    }
}
