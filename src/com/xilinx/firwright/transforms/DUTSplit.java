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

import org.jetbrains.annotations.NotNull;

import com.xilinx.firwright.firrtl.FIRInstance;
import com.xilinx.firwright.firrtl.FIRModule;

/**
 * Result of {@link DUTModuleSplitter#split}: the shell that took over the
 * DUT's name and interface, the wrapper holding the original body, and the
 * instance of the wrapper inside the shell.
 */
public class DUTSplit {

    private final FIRModule shell;

    private final FIRModule wrapper;

    private final FIRInstance wrapperInstance;

    /** Name the DUT had before the split, now the name of the shell */
    private final String dutName;

    public DUTSplit(@NotNull FIRModule shell, @NotNull FIRModule wrapper,
                    @NotNull FIRInstance wrapperInstance, @NotNull String dutName) {
        this.shell = shell;
        this.wrapper = wrapper;
        this.wrapperInstance = wrapperInstance;
        this.dutName = dutName;
    }

    public FIRModule getShell() {
        return shell;
    }

    public FIRModule getWrapper() {
        return wrapper;
    }

    public FIRInstance getWrapperInstance() {
        return wrapperInstance;
    }

    public String getDutName() {
        return dutName;
    }

    @Override
    public String toString() {
        return "DUTSplit{shell=@" + shell.getName() + ", wrapper=@" + wrapper.getName()
                + ", instance=" + wrapperInstance.getName() + "}";
    }
}
