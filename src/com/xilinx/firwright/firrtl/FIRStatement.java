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
 * An operation in the body of a {@link FIRModule}.  Statements are kept in
 * document order by their parent module.
 */
public interface FIRStatement {

    FIRModule getParentModule();

    void setParentModule(FIRModule parentModule);

    /**
     * @return The inner symbol declared by this statement, or null if it declares none.
     */
    default String getInnerSym() {
        return null;
    }
}
