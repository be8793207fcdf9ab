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

package com.pinwright.tools;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.io.FilenameUtils;

import com.pinwright.rows.CsvRowReader;
import com.pinwright.rows.SymbolRowsParser;
import com.pinwright.rows.UnsupportedFileExtensionException;
import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpParser;
import com.pinwright.sexp.SexpWriter;
import com.pinwright.symbol.PartDefinition;
import com.pinwright.symbol.SymbolLibraries;
import com.pinwright.symbol.SymbolOptions;
import com.pinwright.symbol.merge.SymbolLibMerger;
import com.pinwright.util.Diagnostics;
import com.pinwright.util.MessageGenerator;

/**
 * Converts row files into symbol libraries. Each row file becomes a library
 * of the same name unless an output library is given, in which case the
 * symbols of all row files accumulate in that library.
 */
public class SymbolLibGenerator {

    public static final String LIB_EXTENSION = ".kicad_sym";

    private final SymbolLibGeneratorConfig config;

    private final Diagnostics diagnostics;

    public SymbolLibGenerator(SymbolLibGeneratorConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public SymbolLibGenerator(SymbolLibGeneratorConfig config) {
        this(config, new Diagnostics());
    }

    public SymbolLibGeneratorConfig getConfig() {
        return config;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Builds a library from the rows of a row file.
     * @param rows All rows of the file.
     * @param options Symbol options.
     * @param oneSymbol True to read the rows as a single part.
     * @param diagnostics Receives the warnings found while reading rows.
     * @return The library.
     * @throws IllegalArgumentException if no symbol could be built.
     */
    public static SexpList rowsToLibrary(List<List<String>> rows, SymbolOptions options, boolean oneSymbol,
            Diagnostics diagnostics) {
        SymbolRowsParser parser = new SymbolRowsParser(options, diagnostics);
        List<PartDefinition> parts = parser.parseParts(rows, oneSymbol);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("No valid symbols were generated from the input data");
        }
        return SymbolLibraries.buildLibrary(parts, options);
    }

    /**
     * Converts one row file into a library file.
     * @param rowFile The row file.
     * @param libFile The library to write, or null for the row file's name
     * with the library extension.
     * @param overwrite True to allow replacing an existing library.
     * @param merge True to add the new symbols to an existing library,
     * replacing existing symbols of the same name.
     * @return The library file written.
     * @throws UnsupportedFileExtensionException if the library file does not
     * have the library extension.
     * @throws IllegalStateException if the library exists and overwriting is
     * not allowed.
     */
    public Path convert(Path rowFile, Path libFile, boolean overwrite, boolean merge) {
        if (libFile == null) {
            libFile = Paths.get(FilenameUtils.removeExtension(rowFile.toString()) + LIB_EXTENSION);
        } else if (!libFile.toString().endsWith(LIB_EXTENSION)) {
            throw new UnsupportedFileExtensionException(FilenameUtils.getExtension(libFile.toString()),
                    "Output file " + libFile + " must have a " + LIB_EXTENSION + " extension");
        }
        boolean exists = Files.exists(libFile);
        if (exists && !overwrite) {
            throw new IllegalStateException("Output file " + libFile
                    + " already exists and overwriting has not been enabled.");
        }

        List<List<String>> rows = CsvRowReader.readFile(rowFile);
        SexpList lib = rowsToLibrary(rows, config.getSymbolOptions(), config.isOneSymbol(), diagnostics);

        if (exists && merge) {
            SexpList existing = SexpParser.readFile(libFile);
            lib = SymbolLibMerger.merge(existing, lib, true);
        }
        SexpWriter.writeFile(libFile, lib);
        if (exists && merge) {
            MessageGenerator.briefMessage("Merged symbols from " + rowFile + " into existing symbol library "
                    + libFile);
        } else {
            MessageGenerator.briefMessage("Created symbol library " + libFile + " from " + rowFile);
        }
        return libFile;
    }

    /**
     * Converts every input file of the configuration. A file that fails is
     * reported and the run continues with the next one.
     * @return The number of files that failed.
     */
    public int run() {
        boolean overwrite = config.isOverwrite();
        boolean merge = config.isMerge();
        int errors = 0;
        for (Path rowFile : config.getInputFiles()) {
            try {
                convert(rowFile, config.getOutput(), overwrite, merge);
                // Later files add their symbols to the same output library
                if (config.getOutput() != null) {
                    overwrite = true;
                    merge = true;
                }
            } catch (RuntimeException e) {
                MessageGenerator.error("Failed while processing file '" + rowFile + "': " + e.getMessage());
                errors++;
            }
            if (diagnostics.hasWarnings()) {
                diagnostics.print(System.err);
                MessageGenerator.info(rowFile + ": " + diagnostics.summary());
            }
            diagnostics.clear();
        }
        return errors;
    }

    public static void main(String[] args) {
        if (args.length == 0 || SymbolLibGeneratorConfig.hasHelpArg(args)) {
            SymbolLibGeneratorConfig.printHelp();
            return;
        }
        SymbolLibGeneratorConfig config;
        try {
            config = new SymbolLibGeneratorConfig(args);
        } catch (RuntimeException e) {
            MessageGenerator.briefErrorAndExit(MessageGenerator.ERROR_PREFIX + e.getMessage());
            return;
        }
        int errors = new SymbolLibGenerator(config).run();
        if (errors > 0) {
            MessageGenerator.error("A total of " + errors
                    + " errors occurred during processing. Please check the output above.");
            System.exit(1);
        }
    }
}
