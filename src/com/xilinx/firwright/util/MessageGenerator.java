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

/**
 * Console message helpers shared by the tools in this project.  Regular
 * messages go to standard out, errors to standard error.
 */
public class MessageGenerator {

    public static final int HEADER_WIDTH = 80;

    public static String makeWhiteSpace(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }

    /**
     * Prints a banner with the provided title centered between '=' rules.
     * @param title Title of the banner
     */
    public static void printHeader(String title) {
        StringBuilder rule = new StringBuilder(HEADER_WIDTH);
        for (int i = 0; i < HEADER_WIDTH; i++) {
            rule.append('=');
        }
        int pad = Math.max(0, (HEADER_WIDTH - title.length()) / 2);
        System.out.println(rule);
        System.out.println(makeWhiteSpace(pad) + title);
        System.out.println(rule);
    }

    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    public static void briefError(String msg) {
        System.err.println(msg);
    }
}
