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

package com.pinwright.symbol.compare;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Paths;

import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpParser;
import com.pinwright.util.PerfTracker;

/**
 * Command-line entry point that compares two symbol library files and prints
 * a report of their differences. Exits with status 1 if they differ.
 */
public class CompareSymbolLibs {

    public static void main(String[] args) {
        if (args.length != 2 && args.length != 3) {
            System.out.println(
                    "USAGE: <golden .kicad_sym library> <test .kicad_sym library> [diff report filename]");
            return;
        }
        PerfTracker t = new PerfTracker("Compare Symbol Libraries");
        t.start("Load Gold");
        SexpList gold = SexpParser.readFile(Paths.get(args[0]));
        t.stop().start("Load Test");
        SexpList test = SexpParser.readFile(Paths.get(args[1]));
        t.stop().start("Compare");
        SymbolComparator comparator = new SymbolComparator();
        int diffs = comparator.compareLibraries(gold, test);
        t.stop();
        if (args.length == 3) {
            try (PrintStream ps = new PrintStream(args[2])) {
                comparator.printDiffReport(ps);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        } else {
            comparator.printDiffReport(System.out);
        }
        t.printSummary();

        System.exit(diffs > 0 ? 1 : 0);
    }
}
