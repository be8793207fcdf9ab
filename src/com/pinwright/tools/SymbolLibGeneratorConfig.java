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
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FilenameUtils;

import com.pinwright.pin.BundleStyle;
import com.pinwright.pin.PinElectricalType;
import com.pinwright.pin.PinGraphicStyle;
import com.pinwright.pin.PinSide;
import com.pinwright.pin.PinSortOrder;
import com.pinwright.symbol.SymbolOptions;
import com.pinwright.util.MessageGenerator;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

/**
 * A collection of customizable parameters for a {@link SymbolLibGenerator}
 * run. Modifications of default parameter values can be done by adding
 * corresponding options with values to the arguments or by calling the
 * applicable setter method.
 */
public class SymbolLibGeneratorConfig {

    private List<Path> inputFiles;

    private Path output;

    private boolean overwrite;

    private boolean merge;

    private boolean oneSymbol;

    private SymbolOptions symbolOptions;

    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> OVERWRITE_OPTS = Arrays.asList("w", "overwrite");
    private static final List<String> MERGE_OPTS = Arrays.asList("m", "merge", "append");
    private static final List<String> ONE_SYMBOL_OPTS = Arrays.asList("1", "one-symbol");
    private static final List<String> SORT_OPTS = Arrays.asList("s", "sort");
    private static final List<String> REVERSE_OPTS = Arrays.asList("r", "reverse");
    private static final List<String> CCW_OPTS = Collections.singletonList("ccw");
    private static final List<String> SCRUNCH_OPTS = Collections.singletonList("scrunch");
    private static final List<String> SIDE_OPTS = Collections.singletonList("side");
    private static final List<String> TYPE_OPTS = Collections.singletonList("type");
    private static final List<String> STYLE_OPTS = Collections.singletonList("style");
    private static final List<String> PUSH_OPTS = Collections.singletonList("push");
    private static final List<String> ALT_DELIMITER_OPTS = Arrays.asList("a", "alt-delimiter");
    private static final List<String> BUNDLE_OPTS = Arrays.asList("b", "bundle");
    private static final List<String> BUNDLE_STYLE_OPTS = Collections.singletonList("bundle-style");
    private static final List<String> HIDE_PIN_NUM_OPTS = Collections.singletonList("hide-pin-num");
    private static final List<String> JUSTIFY_OPTS = Arrays.asList("j", "justify");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    private SymbolLibGeneratorConfig() {
        inputFiles = new ArrayList<>();
        overwrite = false;
        merge = false;
        oneSymbol = false;
        symbolOptions = new SymbolOptions();
    }

    public SymbolLibGeneratorConfig(List<Path> inputFiles) {
        this();
        setInputFiles(inputFiles);
    }

    public SymbolLibGeneratorConfig(String[] arguments) {
        this();
        parseArguments(arguments);
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(OUTPUT_OPTS, "Output symbol library (*.kicad_sym)").withRequiredArg();
                acceptsAll(OVERWRITE_OPTS, "Allow overwriting of an existing symbol library");
                acceptsAll(MERGE_OPTS, "Merge symbols into an existing library rather than overwriting it");
                acceptsAll(ONE_SYMBOL_OPTS, "Ignore blank rows rather than starting a new symbol");
                acceptsAll(SORT_OPTS, "Sort pins by row, num or name (default is row)").withRequiredArg();
                acceptsAll(REVERSE_OPTS, "Sort pins in reverse order");
                acceptsAll(CCW_OPTS, "Arrange pins counter-clockwise around the symbol");
                acceptsAll(SCRUNCH_OPTS, "Compress left/right pins underneath the top/bottom pins");
                acceptsAll(SIDE_OPTS, "Default side for pins without one: left, right, top or bottom")
                        .withRequiredArg();
                acceptsAll(TYPE_OPTS, "Default type for pins without one (default is passive)").withRequiredArg();
                acceptsAll(STYLE_OPTS, "Default style for pins without one (default is line)").withRequiredArg();
                acceptsAll(PUSH_OPTS, "Position of pin groups on each side (0.0=start, 0.5=centered, 1.0=end)")
                        .withRequiredArg();
                acceptsAll(ALT_DELIMITER_OPTS, "Delimiter for splitting pin names into alternatives")
                        .withRequiredArg();
                acceptsAll(BUNDLE_OPTS, "Bundle same-named power pins, repeat to also bundle no-connect pins");
                acceptsAll(BUNDLE_STYLE_OPTS, "Suffix added to bundled pin names: none, count or range")
                        .withRequiredArg();
                acceptsAll(HIDE_PIN_NUM_OPTS, "Hide pin numbers");
                acceptsAll(JUSTIFY_OPTS, "Justification of visible properties: left, center or right")
                        .withRequiredArg();
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
                nonOptions("Row files (*.csv)");
            }
        };
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("SymbolLibGenerator");
        System.out.println("Converts row files describing part pins into a symbol library.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }

    public static boolean hasHelpArg(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);
        return options.has(HELP_OPTS.get(0));
    }

    private static String stringValue(OptionSet options, List<String> opts) {
        return (String) options.valueOf(opts.get(0));
    }

    private void parseArguments(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);

        List<Path> inputs = new ArrayList<>();
        for (Object arg : options.nonOptionArguments()) {
            inputs.add(Paths.get(arg.toString()));
        }
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("No input files specified");
        }
        setInputFiles(inputs);

        setOverwrite(options.has(OVERWRITE_OPTS.get(0)));
        setMerge(options.has(MERGE_OPTS.get(0)));
        setOneSymbol(options.has(ONE_SYMBOL_OPTS.get(0)));
        if (options.has(OUTPUT_OPTS.get(0))) {
            setOutput(Paths.get(stringValue(options, OUTPUT_OPTS)));
        }

        SymbolOptions s = getSymbolOptions();
        s.setReverse(options.has(REVERSE_OPTS.get(0)));
        if (options.has(SORT_OPTS.get(0))) {
            s.setSortOrder(PinSortOrder.fromString(stringValue(options, SORT_OPTS)));
        }
        if (options.has(SIDE_OPTS.get(0))) {
            s.setDefaultSide(PinSide.fromString(stringValue(options, SIDE_OPTS)));
        }
        if (options.has(TYPE_OPTS.get(0))) {
            s.setDefaultType(PinElectricalType.fromString(stringValue(options, TYPE_OPTS)));
        }
        if (options.has(STYLE_OPTS.get(0))) {
            s.setDefaultStyle(PinGraphicStyle.fromString(stringValue(options, STYLE_OPTS)));
        }
        if (options.has(BUNDLE_STYLE_OPTS.get(0))) {
            s.setBundleStyle(BundleStyle.fromString(stringValue(options, BUNDLE_STYLE_OPTS)));
        }
        if (options.has(JUSTIFY_OPTS.get(0))) {
            s.setJustify(stringValue(options, JUSTIFY_OPTS));
        }
        // Each -b raises the bundle level by one
        int bundleLevel = 0;
        for (OptionSpec<?> spec : options.specs()) {
            if (spec.options().contains(BUNDLE_OPTS.get(1))) {
                bundleLevel++;
            }
        }
        s.setBundleLevel(bundleLevel);

        s.getLayout().setCcw(options.has(CCW_OPTS.get(0)));
        s.getLayout().setScrunch(options.has(SCRUNCH_OPTS.get(0)));
        s.getLayout().setHidePinNumbers(options.has(HIDE_PIN_NUM_OPTS.get(0)));
        if (options.has(ALT_DELIMITER_OPTS.get(0))) {
            s.getLayout().setAltPinDelimiter(stringValue(options, ALT_DELIMITER_OPTS));
        }
        if (options.has(PUSH_OPTS.get(0))) {
            String push = stringValue(options, PUSH_OPTS);
            try {
                s.getLayout().setPush(Double.parseDouble(push));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid push value: " + push, e);
            }
        }

        // Merging implies overwriting so that symbols can be added to the library
        if (isMerge()) {
            setOverwrite(true);
            if (getOutput() == null) {
                String first = getInputFiles().get(0).toString();
                setOutput(Paths.get(FilenameUtils.removeExtension(first) + SymbolLibGenerator.LIB_EXTENSION));
            }
        }
    }

    public List<Path> getInputFiles() {
        return inputFiles;
    }

    public void setInputFiles(List<Path> inputFiles) {
        this.inputFiles = new ArrayList<>(inputFiles);
    }

    /**
     * @return The library all inputs are written to, or null to write each
     * input to a library named after it.
     */
    public Path getOutput() {
        return output;
    }

    public void setOutput(Path output) {
        this.output = output;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public void setOverwrite(boolean overwrite) {
        this.overwrite = overwrite;
    }

    public boolean isMerge() {
        return merge;
    }

    public void setMerge(boolean merge) {
        this.merge = merge;
    }

    public boolean isOneSymbol() {
        return oneSymbol;
    }

    public void setOneSymbol(boolean oneSymbol) {
        this.oneSymbol = oneSymbol;
    }

    public SymbolOptions getSymbolOptions() {
        return symbolOptions;
    }

    public void setSymbolOptions(SymbolOptions symbolOptions) {
        this.symbolOptions = symbolOptions;
    }
}
