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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.pinwright.sexp.SexpAtom;
import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpNode;
import com.pinwright.sexp.SexpParser;
import com.pinwright.support.RandomParts;
import com.pinwright.support.SampleParts;
import com.pinwright.symbol.SymbolLibraries;
import com.pinwright.symbol.SymbolOptions;
import com.pinwright.symbol.SymbolTags;
import com.pinwright.tools.SymbolLibGenerator;
import com.pinwright.util.Diagnostics;

public class TestSymbolComparator {

    private static SexpList gold() {
        return SampleParts.symbol(SampleParts.MCU_CSV, new SymbolOptions().setBundleLevel(1));
    }

    private static SexpList firstUnit(SexpList symbol) {
        return symbol.findChild(SymbolTags.SYMBOL);
    }

    private static SexpList pin(SexpList symbol, String number) {
        for (SexpList p : firstUnit(symbol).findChildren(SymbolTags.PIN)) {
            if (number.equals(p.findChild(SymbolTags.NUMBER).getAtomValue(1))) {
                return p;
            }
        }
        throw new AssertionError("No pin " + number);
    }

    private static SexpList property(SexpList symbol, String name) {
        return symbol.findByKey(SymbolTags.PROPERTY, 1, name);
    }

    /**
     * Rebuilds a list with its leading atoms in place and its child lists in
     * random order. Nested symbols are shuffled too, down to the given depth.
     */
    private static SexpList shuffleLists(SexpList list, Random rng, int depth) {
        SexpList shuffled = new SexpList();
        List<SexpList> lists = new ArrayList<>();
        for (SexpNode n : list.getElements()) {
            if (n.isAtom()) {
                shuffled.add(n.copy());
            } else if (depth > 0 && n.asList().hasTag(SymbolTags.SYMBOL)) {
                lists.add(shuffleLists(n.asList(), rng, depth - 1));
            } else {
                lists.add(n.asList().copy());
            }
        }
        Collections.shuffle(lists, rng);
        for (SexpList l : lists) {
            shuffled.add(l);
        }
        return shuffled;
    }

    private static SymbolComparator checkDiffTypes(SexpList gold, Consumer<SexpList> mutation,
                                                   SymbolDiffType... expectedTypes) {
        SexpList test = gold.copy();
        mutation.accept(test);
        SymbolComparator comparator = new SymbolComparator();
        int diffs = comparator.compareSymbols(gold, test);
        Map<SymbolDiffType, List<SymbolDiff>> diffMap = comparator.getDiffMap();
        Assertions.assertEquals(expectedTypes.length, diffs, "Diffs found: " + diffMap);
        Assertions.assertEquals(expectedTypes.length, diffMap.size());
        for (SymbolDiffType expectedType : expectedTypes) {
            Assertions.assertEquals(1, comparator.getDiffs(expectedType).size(), "Diffs found: " + diffMap);
        }
        Assertions.assertFalse(SymbolComparator.symbolsEqual(gold, test));
        return comparator;
    }

    private static SymbolComparator checkSingleDiffType(SexpList gold, Consumer<SexpList> mutation,
                                                        SymbolDiffType expectedType) {
        return checkDiffTypes(gold, mutation, expectedType);
    }

    private static void checkStillEqual(SexpList gold, Consumer<SexpList> mutation) {
        SexpList test = gold.copy();
        mutation.accept(test);
        SymbolComparator comparator = new SymbolComparator();
        Assertions.assertEquals(0, comparator.compareSymbols(gold, test), "Diffs found: " + comparator.getDiffMap());
    }

    @Test
    public void testIdenticalSymbols() {
        Assertions.assertTrue(SymbolComparator.symbolsEqual(gold(), gold()));
        Assertions.assertTrue(SymbolComparator.areEqual(gold(), gold()));
        SexpList lib = SampleParts.library(SampleParts.BOTH_CSV);
        Assertions.assertTrue(SymbolComparator.librariesEqual(lib, lib.copy()));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 4, 5, 6, 7, 8})
    public void testOrderIndependence(long seed) {
        Random rng = new Random(seed);
        SexpList lib = SampleParts.library(SampleParts.BOTH_CSV, new SymbolOptions().setBundleLevel(1));
        SexpList shuffled = shuffleLists(lib, rng, 2);
        Assertions.assertTrue(SymbolComparator.areEqual(lib, shuffled));

        SexpList randomLib = SymbolLibGenerator.rowsToLibrary(new RandomParts(seed).randomFileRows(3, 60),
                new SymbolOptions(), false, new Diagnostics(false));
        Assertions.assertTrue(SymbolComparator.areEqual(randomLib, shuffleLists(randomLib, rng, 2)));
    }

    @Test
    public void testBundlePermutation() {
        String header = "MULTI\npin,name,type,side\n";
        String a = header + "1,VCC,pwr,left\n2,GND,pwr,left\n10,VCC,pwr,left\nA4,GND,pwr,left\n5,IO,io,right\n";
        String b = header + "10,VCC,pwr,left\nA4,GND,pwr,left\n1,VCC,pwr,left\n2,GND,pwr,left\n5,IO,io,right\n";
        SymbolOptions options = new SymbolOptions().setBundleLevel(1);
        Assertions.assertTrue(SymbolComparator.symbolsEqual(SampleParts.symbol(a, options),
                SampleParts.symbol(b, options)));
        // Without bundling the row order decides where each pin goes
        Assertions.assertFalse(SymbolComparator.symbolsEqual(SampleParts.symbol(a), SampleParts.symbol(b)));
    }

    @Test
    public void testPropertyDiffs() {
        checkSingleDiffType(gold(), s -> property(s, "Value").set(2, SexpAtom.quoted("MCU64")),
                SymbolDiffType.PROPERTY_VALUE);
        checkSingleDiffType(gold(), s -> property(s, "Reference").findPath(SymbolTags.EFFECTS, SymbolTags.JUSTIFY)
                .set(1, new SexpAtom("left")), SymbolDiffType.PROPERTY_EFFECTS);
        checkSingleDiffType(gold(), s -> property(s, "Footprint").findPath(SymbolTags.EFFECTS, SymbolTags.HIDE)
                .set(1, new SexpAtom(SymbolTags.NO)), SymbolDiffType.PROPERTY_EFFECTS);
        checkDiffTypes(gold(), s -> s.remove(property(s, "Datasheet")), SymbolDiffType.PROPERTY_COUNT,
                SymbolDiffType.PROPERTY_MISSING);
        checkDiffTypes(gold(), s -> s.add(SexpParser.parseList("(property \"Extra\" \"1\" (at 0 0 0))")),
                SymbolDiffType.PROPERTY_COUNT, SymbolDiffType.PROPERTY_EXTRA);
    }

    @Test
    public void testPropertyPositionIgnored() {
        checkStillEqual(gold(), s -> property(s, "Value").findChild(SymbolTags.AT).set(1, new SexpAtom("99")));
    }

    @Test
    public void testPinDiffs() {
        checkSingleDiffType(gold(), s -> pin(s, "5").set(1, new SexpAtom("output")), SymbolDiffType.PIN_TYPE);
        checkSingleDiffType(gold(), s -> pin(s, "5").set(2, new SexpAtom("line")), SymbolDiffType.PIN_STYLE);
        checkSingleDiffType(gold(), s -> pin(s, "5").findChild(SymbolTags.NAME).set(1, SexpAtom.quoted("CLK2")),
                SymbolDiffType.PIN_NAME);
        checkSingleDiffType(gold(), s -> pin(s, "5").findChild(SymbolTags.AT).set(3, new SexpAtom("90")),
                SymbolDiffType.PIN_POSITION);
        checkSingleDiffType(gold(), s -> pin(s, "5").findChild(SymbolTags.LENGTH).set(1, new SexpAtom("5.08")),
                SymbolDiffType.PIN_LENGTH);
        checkSingleDiffType(gold(), s -> pin(s, "5").add(SexpParser.parseList("(hide yes)")),
                SymbolDiffType.PIN_HIDE);
        checkSingleDiffType(gold(), s -> pin(s, "5").add(SexpParser.parseList("(alternate \"X\" input line)")),
                SymbolDiffType.PIN_ALTERNATES);
        checkDiffTypes(gold(), s -> firstUnit(s).remove(pin(s, "6")), SymbolDiffType.PIN_COUNT,
                SymbolDiffType.PIN_MISSING);
        checkDiffTypes(gold(), s -> {
            SexpList extra = pin(s, "6").copy();
            extra.findChild(SymbolTags.NUMBER).set(1, SexpAtom.quoted("66"));
            firstUnit(s).add(extra);
        }, SymbolDiffType.PIN_COUNT, SymbolDiffType.PIN_EXTRA);
    }

    @Test
    public void testPinHideComparesPresence() {
        // (hide no) is still a hide item, so it differs from a pin without one
        SymbolComparator c = checkSingleDiffType(gold(), s -> pin(s, "5").add(SexpParser.parseList("(hide no)")),
                SymbolDiffType.PIN_HIDE);
        Assertions.assertEquals("Mismatch found (pin 5), expected false, but found true"
                + " in unit MCU32_1_1 of symbol MCU32", c.getDiffs(SymbolDiffType.PIN_HIDE).get(0).toString());
        checkSingleDiffType(gold(), s -> {
            SexpList p = pin(s, "7");
            p.remove(p.findChild(SymbolTags.HIDE));
        }, SymbolDiffType.PIN_HIDE);
        checkStillEqual(gold(), s -> pin(s, "7").findChild(SymbolTags.HIDE).set(1, new SexpAtom(SymbolTags.NO)));
    }

    @Test
    public void testEquivalentPinForms() {
        // A bare hide atom means the same as (hide yes)
        checkStillEqual(gold(), s -> {
            SexpList p = pin(s, "7");
            p.remove(p.findChild(SymbolTags.HIDE));
            p.add(new SexpAtom(SymbolTags.HIDE));
        });
        checkStillEqual(gold(), s -> pin(s, "5").findChild(SymbolTags.AT).set(1, new SexpAtom("-0.000")));
        checkStillEqual(gold(), s -> pin(s, "1").findChild(SymbolTags.NAME).findPath(SymbolTags.EFFECTS,
                SymbolTags.FONT, SymbolTags.SIZE).set(1, new SexpAtom("2")));
    }

    @Test
    public void testUnitDiffs() {
        checkSingleDiffType(gold(), s -> firstUnit(s).findPath(SymbolTags.RECTANGLE, SymbolTags.END)
                .set(1, new SexpAtom("100")), SymbolDiffType.UNIT_GEOMETRY);
        checkSingleDiffType(gold(), s -> firstUnit(s).add(SexpParser.parseList("(circle (center 0 0) (radius 1))")),
                SymbolDiffType.UNIT_GEOMETRY);
        checkDiffTypes(gold(), s -> s.remove(firstUnit(s)), SymbolDiffType.UNIT_COUNT, SymbolDiffType.UNIT_MISSING);
        checkDiffTypes(gold(), s -> s.add(SexpParser.parseList("(symbol \"MCU32_2_1\")")),
                SymbolDiffType.UNIT_COUNT, SymbolDiffType.UNIT_EXTRA);
        // Text items are annotations and do not count as graphics
        checkStillEqual(gold(), s -> firstUnit(s).add(SexpParser.parseList("(text \"note\" (at 0 0 0))")));
    }

    @Test
    public void testDuplicateKeys() {
        SymbolComparator c = checkDiffTypes(gold(), s -> s.add(property(s, "Reference").copy()),
                SymbolDiffType.PROPERTY_COUNT, SymbolDiffType.PROPERTY_DUPLICATE);
        Assertions.assertEquals("Duplicate property Reference (test) in symbol MCU32",
                c.getDiffs(SymbolDiffType.PROPERTY_DUPLICATE).get(0).toString());
        checkDiffTypes(gold(), s -> s.add(firstUnit(s).copy()), SymbolDiffType.UNIT_COUNT,
                SymbolDiffType.UNIT_DUPLICATE);
        checkDiffTypes(gold(), s -> firstUnit(s).add(pin(s, "6").copy()), SymbolDiffType.PIN_COUNT,
                SymbolDiffType.PIN_DUPLICATE);
        // Same pin count, but pin 5 now occurs twice and pin 6 is gone
        checkDiffTypes(gold(), s -> {
            firstUnit(s).remove(pin(s, "6"));
            firstUnit(s).add(pin(s, "5").copy());
        }, SymbolDiffType.PIN_DUPLICATE, SymbolDiffType.PIN_MISSING);
    }

    @Test
    public void testDuplicatesOnBothSides() {
        SexpList gold = SexpParser.parseList("(symbol \"P\" (property \"Reference\" \"U\") (symbol \"P_1_1\"))");
        SexpList doubled = SexpParser.parseList(
                "(symbol \"P\" (property \"Reference\" \"U\") (property \"Reference\" \"U\") (symbol \"P_1_1\"))");
        Assertions.assertFalse(SymbolComparator.symbolsEqual(gold, doubled));
        Assertions.assertFalse(SymbolComparator.symbolsEqual(doubled, gold));
        SexpList twoUnits = SexpParser.parseList(
                "(symbol \"P\" (property \"Reference\" \"U\") (symbol \"P_1_1\") (symbol \"P_1_1\"))");
        Assertions.assertFalse(SymbolComparator.symbolsEqual(gold, twoUnits));

        // A repeated key is reported on each side even when the counts agree
        SymbolComparator comparator = new SymbolComparator();
        Assertions.assertEquals(2, comparator.compareSymbols(doubled, doubled.copy()));
        List<SymbolDiff> diffs = comparator.getDiffs(SymbolDiffType.PROPERTY_DUPLICATE);
        Assertions.assertEquals(2, diffs.size());
        Assertions.assertEquals("Duplicate property Reference (test) in symbol P", diffs.get(0).toString());
        Assertions.assertEquals("Duplicate property Reference (gold) in symbol P", diffs.get(1).toString());
    }

    @Test
    public void testTagsMatchExactly() {
        checkSingleDiffType(gold(), s -> s.add(SexpParser.parseList("(IN_BOM yes)")),
                SymbolDiffType.SYMBOL_ATTRIBUTE_EXTRA);
        checkDiffTypes(gold(), s -> s.findChild(SymbolTags.IN_BOM).set(0, new SexpAtom("IN_BOM")),
                SymbolDiffType.SYMBOL_ATTRIBUTE_MISSING, SymbolDiffType.SYMBOL_ATTRIBUTE_EXTRA);
        // An upper case property is just another attribute
        checkDiffTypes(gold(), s -> property(s, "Datasheet").set(0, new SexpAtom("PROPERTY")),
                SymbolDiffType.SYMBOL_ATTRIBUTE_EXTRA, SymbolDiffType.PROPERTY_COUNT,
                SymbolDiffType.PROPERTY_MISSING);
    }

    @Test
    public void testSymbolAttributeDiffs() {
        checkSingleDiffType(gold(), s -> s.findChild(SymbolTags.IN_BOM).set(1, new SexpAtom(SymbolTags.NO)),
                SymbolDiffType.SYMBOL_ATTRIBUTE);
        checkSingleDiffType(gold(), s -> s.remove(s.findChild(SymbolTags.EXCLUDE_FROM_SIM)),
                SymbolDiffType.SYMBOL_ATTRIBUTE_MISSING);
        checkSingleDiffType(gold(), s -> s.add(SexpParser.parseList("(pin_names (offset 0))")),
                SymbolDiffType.SYMBOL_ATTRIBUTE_EXTRA);
        checkSingleDiffType(gold(), s -> s.add(SexpParser.parseList("(in_bom yes)")),
                SymbolDiffType.SYMBOL_ATTRIBUTE);
        SymbolComparator c = checkSingleDiffType(gold(), s -> s.set(1, SexpAtom.quoted("MCU33")),
                SymbolDiffType.SYMBOL_NAME);
        Assertions.assertEquals("Mismatch found (name), expected MCU32, but found MCU33 in symbol MCU32",
                c.getDiffs(SymbolDiffType.SYMBOL_NAME).get(0).toString());
    }

    @Test
    public void testLibraryDiffs() {
        SexpList gold = SampleParts.library(SampleParts.BOTH_CSV);

        SexpList test = gold.copy();
        test.findChild(SymbolTags.VERSION).set(1, new SexpAtom("20211014"));
        SymbolComparator comparator = new SymbolComparator();
        Assertions.assertEquals(1, comparator.compareLibraries(gold, test));
        Assertions.assertEquals(1, comparator.getDiffs(SymbolDiffType.LIBRARY_VERSION).size());

        test = gold.copy();
        test.remove(SymbolLibraries.getSymbol(test, "MCU32"));
        Assertions.assertEquals(2, comparator.compareLibraries(gold, test));
        Assertions.assertEquals(1, comparator.getDiffs(SymbolDiffType.LIBRARY_SYMBOL_COUNT).size());
        SymbolDiff missing = comparator.getDiffs(SymbolDiffType.SYMBOL_MISSING).get(0);
        Assertions.assertEquals("Missing symbol MCU32", missing.toString());

        Assertions.assertEquals(2, comparator.compareLibraries(test, gold));
        Assertions.assertEquals("Extra symbol MCU32",
                comparator.getDiffs(SymbolDiffType.SYMBOL_EXTRA).get(0).toString());

        test = gold.copy();
        test.add(SymbolLibraries.getSymbol(test, "MCU32").copy());
        Assertions.assertEquals(2, comparator.compareLibraries(gold, test));
        Assertions.assertEquals(1, comparator.getDiffs(SymbolDiffType.LIBRARY_SYMBOL_COUNT).size());
        Assertions.assertEquals("Duplicate symbol MCU32 (test)",
                comparator.getDiffs(SymbolDiffType.SYMBOL_DUPLICATE).get(0).toString());
        Assertions.assertFalse(SymbolComparator.librariesEqual(gold, test));

        SexpList symbol = SymbolLibraries.getSymbol(gold, "MCU32");
        Assertions.assertEquals(1, comparator.compareLibraries(gold, symbol));
        Assertions.assertEquals(1, comparator.getDiffs(SymbolDiffType.LIBRARY_FORMAT).size());
        Assertions.assertFalse(SymbolComparator.areEqual(gold, symbol));
    }

    @Test
    public void testComparatorIsReusable() {
        SymbolComparator comparator = new SymbolComparator();
        SexpList test = gold();
        test.set(1, SexpAtom.quoted("OTHER"));
        Assertions.assertEquals(1, comparator.compareSymbols(gold(), test));
        Assertions.assertEquals(0, comparator.compareSymbols(gold(), gold()));
        Assertions.assertEquals(0, comparator.getDiffCount());
        Assertions.assertTrue(comparator.getDiffMap().isEmpty());
    }

    @Test
    public void testAreEqualOnPlainTrees() {
        Assertions.assertTrue(SymbolComparator.areEqual(SexpParser.parse("(a 1.0 (b x))"), SexpParser.parse("(a 1 (b x))")));
        Assertions.assertFalse(SymbolComparator.areEqual(SexpParser.parse("(a (b x) (c y))"),
                SexpParser.parse("(a (c y) (b x))")));
    }

    @Test
    public void testDiffReport() {
        SexpList test = gold();
        pin(test, "5").set(1, new SexpAtom("output"));
        SymbolComparator comparator = new SymbolComparator();
        comparator.compareSymbols(gold(), test);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PrintStream ps = new PrintStream(out, true, StandardCharsets.UTF_8)) {
            comparator.printDiffReport(ps);
        }
        String report = new String(out.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(report.contains("= Symbol Library Diff Summary"));
        Assertions.assertTrue(report.contains("        1 PIN_TYPE Diffs"));
        Assertions.assertTrue(report.contains("        1 Total Diffs"));
        Assertions.assertTrue(report.contains(" *** PIN_TYPE: 1 diffs"));
        Assertions.assertTrue(report.contains("Mismatch found (pin 5), expected input, but found output"
                + " in unit MCU32_1_1 of symbol MCU32"));
    }
}
