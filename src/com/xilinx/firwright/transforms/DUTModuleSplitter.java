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

import com.xilinx.firwright.firrtl.FIRCircuit;
import com.xilinx.firwright.firrtl.FIRDirection;
import com.xilinx.firwright.firrtl.FIRInnerSymbolNamespace;
import com.xilinx.firwright.firrtl.FIRInstance;
import com.xilinx.firwright.firrtl.FIRModule;
import com.xilinx.firwright.firrtl.FIRNamespace;
import com.xilinx.firwright.firrtl.FIRTools;
import com.xilinx.firwright.firrtl.FIRValue;

/**
 * Splits the DUT into an empty shell that keeps the DUT's name and interface
 * and a wrapper module holding the original body, instantiated by the shell
 * with pass-through connections.
 *
 * The logical operation is "move the body of the DUT into a new wrapper".
 * Mechanically the original DUT module is renamed to become the wrapper and a
 * fresh module takes its place, which avoids copying the body.
 */
public class DUTModuleSplitter {

    /**
     * Performs the split.
     * @param circuit Circuit containing the DUT
     * @param circuitNS Namespace of the circuit's top-level symbols
     * @param dut The DUT module
     * @param wrapperNameHint Preferred name of the wrapper
     * @param moveDut If true the wrapper keeps the DUT marker and the shell is made
     * private, otherwise the shell takes over the DUT's visibility and marker
     * @return The shell, wrapper and wrapper instance
     */
    public static DUTSplit split(FIRCircuit circuit, FIRNamespace circuitNS, FIRModule dut,
                                 String wrapperNameHint, boolean moveDut) {
        String dutName = dut.getName();
        FIRModule wrapper;
        FIRModule shell;
        {
            FIRModule newDUT = new FIRModule(dutName, dut);

            // Only existing public modules stay public.  In moveDut mode the
            // wrapper is the new DUT and keeps the original's visibility.
            if (moveDut) {
                newDUT.setPrivate();
            } else {
                newDUT.setVisibility(dut.getVisibility());
                dut.setPrivate();
            }
            circuit.renameModule(dut, circuitNS.newName(wrapperNameHint));
            circuit.insertModuleAfter(dut, newDUT);

            wrapper = dut;
            shell = newDUT;

            wrapper.removePortAnnotations();
            wrapper.removeAnnotations(anno -> {
                if (anno.isClass(FIRTools.DUT_ANNO_CLASS))
                    return !moveDut;
                return true;
            });

            if (moveDut)
                shell.removeAnnotations(FIRTools.DUT_ANNO_CLASS);
        }

        FIRInnerSymbolNamespace shellNS = new FIRInnerSymbolNamespace(shell);
        FIRInstance wrapperInst = shell.insertStatement(0,
                new FIRInstance(wrapper.getName(), wrapper, shellNS.newName(wrapper.getName())));
        for (int i = 0; i < shell.getNumPorts(); i++) {
            FIRValue lhs = shell.getArgument(i);
            FIRValue rhs = wrapperInst.getResult(i);
            if (shell.getPortDirection(i) == FIRDirection.IN) {
                FIRValue tmp = lhs;
                lhs = rhs;
                rhs = tmp;
            }
            FIRTools.emitConnect(shell, lhs, rhs);
        }

        return new DUTSplit(shell, wrapper, wrapperInst, dutName);
    }
}
