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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FilenameUtils;

import com.pinwright.rows.CsvRowReader;
import com.pinwright.rows.CsvRowWriter;
import com.pinwright.rows.LibraryRowsExtractor;
import com.pinwright.rows.UnsupportedFileExtensionException;
import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpParser;
import com.pinwright.util.MessageGenerator;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Converts symbol libraries into row files, the reverse of
 * {@link SymbolLibGenerator}.
 */
public class SymbolLibToCSV {

    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> OVERWRITE_OPTS = Arrays.asList("w", "overwrite");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(OUTPUT_OPTS, "Output row file (*.csv), only with a single input library")
                        .withRequiredArg();
                acceptsAll(OVERWRITE_OPTS, "Allow overwriting of an existing row file");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
                nonOptions("Symbol libraries (*.kicad_sym)");
            }
        };
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("SymbolLibToCSV");
        System.out.println("Converts symbol libraries into row files.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }

    /**
     * Converts a library file into a row file.
     * @param libFile The library.
     * @param csvFile The row file to write, or null for the library's name
     * with the .csv extension.
     * @param overwrite True to allow replacing an existing row file.
     * @return The row file written.
     */
    public static Path convert(Path libFile, Path csvFile, boolean overwrite) {
        if (!Files.exists(libFile)) {
            throw new UncheckedIOException(new NoSuchFileException("Input file " + libFile + " does not exist"));
        }
        String ext = FilenameUtils.getExtension(libFile.toString());
        if (!("." + ext).equalsIgnoreCase(SymbolLibGenerator.LIB_EXTENSION)) {
            throw new UnsupportedFileExtensionException(ext, "Input file must be a "
                    + SymbolLibGenerator.LIB_EXTENSION + " file, got ." + ext);
        }
        if (csvFile == null) {
            csvFile = Paths.get(FilenameUtils.removeExtension(libFile.toString()) + "."
                    + CsvRowReader.CSV_EXTENSION);
        }
        if (Files.exists(csvFile) && !overwrite) {
            throw new IllegalStateException("Output file " + csvFile
                    + " already exists. Use --overwrite to allow overwriting.");
        }
        SexpList lib = SexpParser.readFile(libFile);
        CsvRowWriter.writeFile(csvFile, LibraryRowsExtractor.libraryToRows(lib));
        return csvFile;
    }

    public static void main(String[] args) {
        OptionSet options = createOptionParser().parse(args);
        if (options.has(HELP_OPTS.get(0)) || options.nonOptionArguments().isEmpty()) {
            printHelp();
            return;
        }
        List<Path> inputs = new ArrayList<>();
        for (Object arg : options.nonOptionArguments()) {
            inputs.add(Paths.get(arg.toString()));
        }
        Path output = null;
        if (options.has(OUTPUT_OPTS.get(0))) {
            if (inputs.size() > 1) {
                MessageGenerator.briefErrorAndExit(MessageGenerator.ERROR_PREFIX
                        + "--output can only be used with a single input file");
            }
            output = Paths.get((String) options.valueOf(OUTPUT_OPTS.get(0)));
        }
        boolean overwrite = options.has(OVERWRITE_OPTS.get(0));
        boolean failed = false;
        for (Path input : inputs) {
            try {
                Path csv = convert(input, output, overwrite);
                MessageGenerator.briefMessage("Generated " + csv + " successfully from " + input);
            } catch (RuntimeException e) {
                MessageGenerator.error("Failed to process " + input + ": " + e.getMessage());
                failed = true;
            }
        }
        if (failed) {
            System.exit(1);
        }
    }
}
