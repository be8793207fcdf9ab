/*
 * Copyright (c) 2025, PinWright Contributors.
 * All rights reserved.
 *
 * This file is part of PinWright.
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

package com.pinwright.symbol.merge;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FilenameUtils;

import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpParser;
import com.pinwright.sexp.SexpWriter;
import com.pinwright.symbol.SymbolLibraries;
import com.pinwright.util.MessageGenerator;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Command-line entry point that merges two or more symbol libraries into one.
 * Libraries are merged left to right, so with overwriting enabled a symbol of
 * a later library replaces one of the same name from an earlier library.
 * Unless overwriting is enabled an existing output file is left untouched.
 */
public class MergeSymbolLibs {

    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> OVERWRITE_OPTS = Arrays.asList("w", "overwrite");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    /** Added to the first input's base name to form the default output name. */
    public static final String MERGED_SUFFIX = "_merged";

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(OUTPUT_OPTS, "Output library (default is the first input library's name with "
                        + MERGED_SUFFIX + " appended)").withRequiredArg();
                acceptsAll(OVERWRITE_OPTS, "Let symbols of later libraries replace symbols of the same name"
                        + " and replace an existing output library");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
                nonOptions("Two or more symbol libraries (*.kicad_sym)");
            }
        };
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("MergeSymbolLibs");
        System.out.println("Merges two or more symbol libraries into a single library.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }

    /**
     * Reads and merges the given libraries in order.
     * @param inputs The library files, at least two.
     * @param allowOverwrite True to let later symbols replace earlier ones.
     * @return The merged library.
     */
    public static SexpList mergeFiles(List<Path> inputs, boolean allowOverwrite) {
        if (inputs.size() < 2) {
            throw new IllegalArgumentException("At least two symbol libraries are needed for a merge");
        }
        SexpList merged = null;
        for (Path input : inputs) {
            SexpList lib = SexpParser.readFile(input);
            if (!SymbolLibraries.isLibrary(lib)) {
                throw new IllegalArgumentException(input + " is not a symbol library");
            }
            merged = merged == null ? lib : SymbolLibMerger.merge(merged, lib, allowOverwrite);
        }
        return merged;
    }

    /**
     * @param firstInput The first library of a merge.
     * @return The library written when no output is given, e.g.
     * {@code power_merged.kicad_sym} for {@code power.kicad_sym}.
     */
    public static Path getDefaultOutput(Path firstInput) {
        String name = firstInput.toString();
        return Paths.get(FilenameUtils.removeExtension(name) + MERGED_SUFFIX
                + FilenameUtils.EXTENSION_SEPARATOR + FilenameUtils.getExtension(name));
    }

    /**
     * Merges the given libraries and writes the result.
     * @param inputs The library files, at least two.
     * @param output The library to write, or null for
     * {@link #getDefaultOutput(Path)} of the first input.
     * @param allowOverwrite True to let later symbols replace earlier ones and
     * to replace an existing output file.
     * @return The library file written.
     * @throws IllegalStateException if the output exists and overwriting is
     * not allowed.
     */
    public static Path mergeToFile(List<Path> inputs, Path output, boolean allowOverwrite) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("At least two symbol libraries are needed for a merge");
        }
        if (output == null) {
            output = getDefaultOutput(inputs.get(0));
        }
        if (Files.exists(output) && !allowOverwrite) {
            throw new IllegalStateException("Output file " + output
                    + " already exists and overwriting has not been enabled.");
        }
        SexpList merged = mergeFiles(inputs, allowOverwrite);
        SexpWriter.writeFile(output, merged);
        return output;
    }

    public static void main(String[] args) {
        OptionSet options = createOptionParser().parse(args);
        if (options.has(HELP_OPTS.get(0)) || options.nonOptionArguments().size() < 2) {
            printHelp();
            return;
        }
        List<Path> inputs = new ArrayList<>();
        for (Object arg : options.nonOptionArguments()) {
            inputs.add(Paths.get(arg.toString()));
        }
        Path output = options.has(OUTPUT_OPTS.get(0))
                ? Paths.get((String) options.valueOf(OUTPUT_OPTS.get(0)))
                : null;
        try {
            output = mergeToFile(inputs, output, options.has(OVERWRITE_OPTS.get(0)));
            MessageGenerator.info("Merged " + inputs.size() + " libraries into " + output);
        } catch (RuntimeException e) {
            MessageGenerator.error(e.getMessage());
            System.exit(1);
        }
    }
}
