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

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * A collection of methods to help read and write design files.
 */
public class FileTools {

    /**
     * Reads a whole text file into a String.  The user is cautioned not to open
     * extremely large files with this method.
     * @param path The file to read
     * @return The contents of the file
     */
    public static String readFileAsString(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        }
        catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + path, e);
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + path, e);
        }
    }

    /**
     * Writes a String to a file, replacing any previous contents.  Parent
     * directories are created as needed.
     * @param text The text to write
     * @param path The file to write to
     */
    public static void writeStringToFile(String text, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter bw = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                bw.write(text);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " +
                path + File.separator + e.getMessage(), e);
        }
    }

    /**
     * Convenience check that a file exists
     * @param fileName Name of the file to check
     * @return True if the file exists, false otherwise (an error is printed)
     */
    public static boolean errorIfFileDoesNotExist(String fileName) {
        File f = new File(fileName);
        if (!f.exists()) {
            MessageGenerator.briefError("ERROR: Couldn't find file '" + fileName +
                    "'. Did it get mispelled or deleted?");
            return false;
        }
        return true;
    }
}
