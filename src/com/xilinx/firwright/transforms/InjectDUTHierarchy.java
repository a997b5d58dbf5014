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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;

import com.xilinx.firwright.firrtl.FIRAnnotation;
import com.xilinx.firwright.firrtl.FIRCircuit;
import com.xilinx.firwright.firrtl.FIRCircuitNamespace;
import com.xilinx.firwright.firrtl.FIRHierPath;
import com.xilinx.firwright.firrtl.FIRHierPathTable;
import com.xilinx.firwright.firrtl.FIRInstanceInfo;
import com.xilinx.firwright.firrtl.FIRJsonReader;
import com.xilinx.firwright.firrtl.FIRJsonWriter;
import com.xilinx.firwright.firrtl.FIRModule;
import com.xilinx.firwright.firrtl.FIRParseException;
import com.xilinx.firwright.firrtl.FIRPort;
import com.xilinx.firwright.firrtl.FIRTools;
import com.xilinx.firwright.transforms.InjectDUTHierarchyException.ErrorKind;
import com.xilinx.firwright.util.CodePerfTracker;
import com.xilinx.firwright.util.FileTools;
import com.xilinx.firwright.util.MessageGenerator;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Moves all the logic inside the DUT into a new module named by the
 * {@link FIRTools#INJECT_DUT_HIERARCHY_ANNO_CLASS} directive, instantiated by
 * the DUT.  The DUT keeps its name, ports and annotations, hierarchical paths
 * and annotations are updated so they keep pointing at the same hardware.
 *
 * Can be used from the command line on JSON designs, see {@link #printHelp()}.
 */
public class InjectDUTHierarchy {

    private static final List<String> INPUT_OPTS = Arrays.asList("i", "input");
    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> ANNOTATIONS_OPTS = Arrays.asList("a", "annotations");
    private static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    public static final String OUTPUT_SUFFIX = "_injected";

    private boolean verbose;

    private DUTSplit split;

    public InjectDUTHierarchy() {

    }

    public InjectDUTHierarchy(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * @return The shell/wrapper split produced by the last run that changed a
     * circuit, or null
     */
    public DUTSplit getSplit() {
        return split;
    }

    /**
     * Runs the transform on a circuit.  The directive and the DUT are checked
     * before the circuit is touched.
     * @param circuit The circuit to transform
     * @return {@link FIRPassResult#PRESERVED_ALL} if there is no directive,
     * {@link FIRPassResult#CHANGED} otherwise
     * @throws InjectDUTHierarchyException if the directive is malformed or
     * repeated, or if there is no DUT
     */
    public FIRPassResult run(FIRCircuit circuit) {
        split = null;
        InjectDUTHierarchyConfig config = InjectDUTHierarchyConfig.fromCircuit(circuit);

        // The prerequisites for the transform were not met, nothing to do
        if (config == null)
            return FIRPassResult.PRESERVED_ALL;

        FIRInstanceInfo instanceInfo = new FIRInstanceInfo(circuit);
        if (!instanceInfo.hasDut()) {
            throw InjectDUTHierarchyConfig.report(ErrorKind.MISSING_DUT, circuit,
                    "contained a '" + FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS + "', but no '"
                    + FIRTools.DUT_ANNO_CLASS + "' was provided");
        }

        FIRHierPathTable pathTable = new FIRHierPathTable(circuit);
        FIRCircuitNamespace circuitNS = new FIRCircuitNamespace(circuit);

        DUTSplit s = DUTModuleSplitter.split(circuit, circuitNS, instanceInfo.getDut(),
                config.getWrapperName(), config.isMoveDut());
        FIRModule dut = s.getShell();
        FIRModule wrapper = s.getWrapper();

        // Paths used by annotations on the DUT or its ports must keep resolving for the DUT
        Set<String> dutPaths = FIRHierPathTable.getReferencedPaths(dut, true);
        Set<String> dutPortSyms = new LinkedHashSet<>();
        for (FIRPort p : dut.getPorts()) {
            if (p.getInnerSym() != null)
                dutPortSyms.add(p.getInnerSym());
        }

        if (verbose) {
            MessageGenerator.briefMessage("DUT Symbol Users:");
            for (String path : dutPaths)
                MessageGenerator.briefMessage("  - @" + path);
            MessageGenerator.briefMessage("Port Symbols:");
            for (String sym : dutPortSyms)
                MessageGenerator.briefMessage("  - @" + sym);
        }

        HierPathRewriter rewriter = new HierPathRewriter(circuit, circuitNS, pathTable, s,
                dutPaths, dutPortSyms);
        rewriter.setVerbose(verbose);
        Map<String, FIRHierPath> dutRenames = rewriter.rewriteAll();

        int annos = DUTAnnotationRetargeter.retargetAnnotations(dut, dutRenames);
        int probes = DUTAnnotationRetargeter.relocateProbes(wrapper);

        if (verbose) {
            MessageGenerator.briefMessage("Injected @" + wrapper.getName() + " below @" + dut.getName()
                    + ": " + dutRenames.size() + " path(s) cloned, " + annos
                    + " annotation(s) retargeted, " + probes + " probe(s) relocated");
        }
        split = s;
        return FIRPassResult.CHANGED;
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(INPUT_OPTS, "Input design (*.json)").withRequiredArg();
                acceptsAll(OUTPUT_OPTS, "Output design (default is '<input>" + OUTPUT_SUFFIX + ".json')")
                        .withRequiredArg();
                acceptsAll(ANNOTATIONS_OPTS, "Annotation file (*.json) added to the circuit annotations")
                        .withRequiredArg();
                acceptsAll(VERBOSE_OPTS, "Print the paths and symbols processed");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
            }
        };
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("InjectDUTHierarchy");
        System.out.println("Moves the body of the DUT into a new module instantiated by the DUT.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String getDefaultOutputName(String inputName) {
        return FilenameUtils.removeExtension(inputName) + OUTPUT_SUFFIX + "."
                + FilenameUtils.getExtension(inputName);
    }

    /**
     * Command line entry point without exiting the JVM.
     * @param args Command line arguments
     * @return The exit status, 0 on success
     */
    public static int runTool(String[] args) {
        OptionSet options;
        try {
            options = createOptionParser().parse(args);
        } catch (OptionException e) {
            MessageGenerator.briefError("ERROR: " + e.getMessage());
            printHelp();
            return 1;
        }
        if (options.has(HELP_OPTS.get(0))) {
            printHelp();
            return 0;
        }
        if (!options.has(INPUT_OPTS.get(0))) {
            MessageGenerator.briefError("ERROR: No input design found. "
                    + "Please specify an input design (*.json) using options " + INPUT_OPTS);
            return 1;
        }
        String input = (String) options.valueOf(INPUT_OPTS.get(0));
        String output = options.has(OUTPUT_OPTS.get(0)) ? (String) options.valueOf(OUTPUT_OPTS.get(0))
                : getDefaultOutputName(input);
        String annotations = options.has(ANNOTATIONS_OPTS.get(0))
                ? (String) options.valueOf(ANNOTATIONS_OPTS.get(0)) : null;
        if (!FileTools.errorIfFileDoesNotExist(input)
                || (annotations != null && !FileTools.errorIfFileDoesNotExist(annotations))) {
            return 1;
        }
        boolean verbose = options.has(VERBOSE_OPTS.get(0));

        CodePerfTracker t = verbose ? new CodePerfTracker("InjectDUTHierarchy") : CodePerfTracker.SILENT;
        FIRCircuit circuit;
        try {
            t.start("Read Design");
            circuit = FIRJsonReader.readCircuit(Paths.get(input));
            if (annotations != null) {
                for (FIRAnnotation a : FIRJsonReader.readAnnotations(Paths.get(annotations))) {
                    circuit.addAnnotation(a);
                }
            }
            t.stop();
        } catch (FIRParseException | UncheckedIOException e) {
            MessageGenerator.briefError(e.getMessage());
            return 1;
        }

        FIRPassResult result;
        try {
            t.start("Inject DUT Hierarchy");
            result = new InjectDUTHierarchy(verbose).run(circuit);
            t.stop();
        } catch (InjectDUTHierarchyException e) {
            // Already reported
            return 1;
        } catch (RuntimeException e) {
            MessageGenerator.briefError("ERROR: Failed to inject DUT hierarchy into " + input + ": "
                    + e.getMessage());
            return 1;
        }

        try {
            t.start("Write Design");
            FIRJsonWriter.writeCircuit(circuit, Paths.get(output));
            t.stop();
        } catch (UncheckedIOException e) {
            MessageGenerator.briefError(e.getMessage());
            return 1;
        }
        t.printSummary();

        if (result == FIRPassResult.PRESERVED_ALL) {
            MessageGenerator.briefMessage("No '" + FIRTools.INJECT_DUT_HIERARCHY_ANNO_CLASS
                    + "' found, design written unchanged to " + output);
        } else {
            MessageGenerator.briefMessage("Wrote " + output);
        }
        return 0;
    }

    public static void main(String[] args) {
        int status = runTool(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}
