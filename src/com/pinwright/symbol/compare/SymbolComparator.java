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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

import com.pinwright.sexp.SexpAtom;
import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpNode;
import com.pinwright.symbol.SymbolLibraries;
import com.pinwright.symbol.SymbolTags;

/**
 * Compares two symbols or two symbol libraries for structural equivalence.
 * Two trees are equivalent when they describe the same part even if their
 * properties, units, pins, graphics or alternate pin functions appear in a
 * different order. Every difference found is recorded so that a report can be
 * printed; the comparison itself never throws on well-formed trees.
 * <p>
 * Symbols are matched by name, properties by property name, units by unit
 * symbol name and pins by pin number. A side whose element counts differ or
 * that repeats one of these keys is never equivalent. Property positions are
 * not compared; only their value and their text effects (font size,
 * justification and visibility) are.
 * <p>
 * Tags are matched exactly here, unlike the case-insensitive lookups of
 * {@link SexpList}, so {@code (IN_BOM yes)} and {@code (in_bom yes)} differ.
 */
public class SymbolComparator {

    private Map<SymbolDiffType, List<SymbolDiff>> diffMap;

    private int diffCount;

    public SymbolComparator() {
        diffMap = new LinkedHashMap<>();
        diffCount = 0;
    }

    /**
     * Checks two trees for equivalence. Libraries and symbols are compared
     * structurally, anything else must be equal node for node.
     * @param gold The expected tree.
     * @param test The tree to check.
     * @return True if the trees are equivalent.
     */
    public static boolean areEqual(SexpNode gold, SexpNode test) {
        if (gold.isList() && test.isList()) {
            SexpList g = gold.asList();
            SexpList t = test.asList();
            if (isTagged(g, SymbolTags.KICAD_SYMBOL_LIB) && isTagged(t, SymbolTags.KICAD_SYMBOL_LIB)) {
                return librariesEqual(g, t);
            }
            if (isTagged(g, SymbolTags.SYMBOL) && isTagged(t, SymbolTags.SYMBOL)) {
                return symbolsEqual(g, t);
            }
        }
        return gold.equals(test);
    }

    public static boolean librariesEqual(SexpList gold, SexpList test) {
        return new SymbolComparator().compareLibraries(gold, test) == 0;
    }

    public static boolean symbolsEqual(SexpList gold, SexpList test) {
        return new SymbolComparator().compareSymbols(gold, test) == 0;
    }

    public int getDiffCount() {
        return diffCount;
    }

    public Map<SymbolDiffType, List<SymbolDiff>> getDiffMap() {
        return Collections.unmodifiableMap(diffMap);
    }

    public List<SymbolDiff> getDiffs(SymbolDiffType type) {
        return diffMap.getOrDefault(type, Collections.emptyList());
    }

    private void reset() {
        diffMap = new LinkedHashMap<>();
        diffCount = 0;
    }

    private void checkDiff(Object checkGold, Object checkTest, SymbolDiffType type, String what,
            String symbolName, String unitName) {
        if (!Objects.equals(checkGold, checkTest)) {
            addDiff(type, checkGold, checkTest, symbolName, unitName, what);
        }
    }

    private void addDiff(SymbolDiffType type, Object gold, Object test, String symbolName, String unitName,
            String notEqualString) {
        List<SymbolDiff> diffs = diffMap.computeIfAbsent(type, l -> new ArrayList<>());
        diffs.add(new SymbolDiff(type, gold, test, symbolName, unitName, notEqualString));
        diffCount++;
    }

    private static boolean isTagged(SexpList list, String tag) {
        return tag.equals(list.getTag());
    }

    private static List<SexpList> children(SexpList parent, String tag) {
        List<SexpList> matches = new ArrayList<>();
        for (SexpList child : parent.getChildLists()) {
            if (isTagged(child, tag)) {
                matches.add(child);
            }
        }
        return matches;
    }

    private static SexpList child(SexpList parent, String tag) {
        for (SexpList child : parent.getChildLists()) {
            if (isTagged(child, tag)) {
                return child;
            }
        }
        return null;
    }

    private static Integer getVersion(SexpList lib) {
        SexpList v = child(lib, SymbolTags.VERSION);
        SexpAtom value = v == null ? null : v.getAtom(1);
        return value == null ? null : value.getIntValue();
    }

    /**
     * Compares two libraries.
     * @param gold The expected library.
     * @param test The library to check.
     * @return The number of differences found.
     */
    public int compareLibraries(SexpList gold, SexpList test) {
        reset();
        if (!isTagged(gold, SymbolTags.KICAD_SYMBOL_LIB) || !isTagged(test, SymbolTags.KICAD_SYMBOL_LIB)) {
            addDiff(SymbolDiffType.LIBRARY_FORMAT, gold.getTag(), test.getTag(), null, null, "tag");
            return diffCount;
        }
        checkDiff(getVersion(gold), getVersion(test), SymbolDiffType.LIBRARY_VERSION, "version", null, null);

        List<SexpList> goldSymbols = children(gold, SymbolTags.SYMBOL);
        List<SexpList> testSymbols = children(test, SymbolTags.SYMBOL);
        checkDiff(goldSymbols.size(), testSymbols.size(), SymbolDiffType.LIBRARY_SYMBOL_COUNT, "symbol count",
                null, null);

        Map<String, SexpList> testMap = index(testSymbols, SymbolLibraries::getSymbolName,
                SymbolDiffType.SYMBOL_DUPLICATE, false, null, null);
        Map<String, SexpList> goldMap = index(goldSymbols, SymbolLibraries::getSymbolName,
                SymbolDiffType.SYMBOL_DUPLICATE, true, null, null);
        for (Entry<String, SexpList> e : goldMap.entrySet()) {
            SexpList testSymbol = testMap.remove(e.getKey());
            if (testSymbol == null) {
                addDiff(SymbolDiffType.SYMBOL_MISSING, e.getKey(), null, null, null, "");
                continue;
            }
            compareSymbol(e.getValue(), testSymbol);
        }
        for (String name : testMap.keySet()) {
            addDiff(SymbolDiffType.SYMBOL_EXTRA, null, name, null, null, "");
        }
        return diffCount;
    }

    /**
     * Compares two symbols.
     * @param gold The expected symbol.
     * @param test The symbol to check.
     * @return The number of differences found.
     */
    public int compareSymbols(SexpList gold, SexpList test) {
        reset();
        compareSymbol(gold, test);
        return diffCount;
    }

    private void compareSymbol(SexpList gold, SexpList test) {
        String name = SymbolLibraries.getSymbolName(gold);
        checkDiff(name, SymbolLibraries.getSymbolName(test), SymbolDiffType.SYMBOL_NAME, "name", name, null);
        compareAttributes(gold, test, name);
        compareProperties(gold, test, name);
        compareUnits(gold, test, name);
    }

    /**
     * Groups the child lists of a symbol that are neither properties nor
     * units by their tag.
     */
    private static Map<String, List<String>> getAttributes(SexpList symbol) {
        Map<String, List<String>> attrs = new TreeMap<>();
        for (SexpList child : symbol.getChildLists()) {
            if (isTagged(child, SymbolTags.PROPERTY) || isTagged(child, SymbolTags.SYMBOL)) continue;
            String tag = String.valueOf(child.getTag());
            attrs.computeIfAbsent(tag, t -> new ArrayList<>()).add(child.toCanonicalString());
        }
        for (List<String> values : attrs.values()) {
            Collections.sort(values);
        }
        return attrs;
    }

    private void compareAttributes(SexpList gold, SexpList test, String symbolName) {
        Map<String, List<String>> testAttrs = getAttributes(test);
        for (Entry<String, List<String>> e : getAttributes(gold).entrySet()) {
            List<String> testValues = testAttrs.remove(e.getKey());
            if (testValues == null) {
                addDiff(SymbolDiffType.SYMBOL_ATTRIBUTE_MISSING, e.getKey(), null, symbolName, null, "");
                continue;
            }
            checkDiff(e.getValue(), testValues, SymbolDiffType.SYMBOL_ATTRIBUTE, e.getKey(), symbolName, null);
        }
        for (String tag : testAttrs.keySet()) {
            addDiff(SymbolDiffType.SYMBOL_ATTRIBUTE_EXTRA, null, tag, symbolName, null, "");
        }
    }

    private void compareProperties(SexpList gold, SexpList test, String symbolName) {
        List<SexpList> goldList = children(gold, SymbolTags.PROPERTY);
        List<SexpList> testList = children(test, SymbolTags.PROPERTY);
        checkDiff(goldList.size(), testList.size(), SymbolDiffType.PROPERTY_COUNT, "property count", symbolName,
                null);
        Map<String, SexpList> testProps = index(testList, p -> p.getAtomValue(1), SymbolDiffType.PROPERTY_DUPLICATE,
                false, symbolName, null);
        Map<String, SexpList> goldProps = index(goldList, p -> p.getAtomValue(1), SymbolDiffType.PROPERTY_DUPLICATE,
                true, symbolName, null);
        for (Entry<String, SexpList> e : goldProps.entrySet()) {
            SexpList testProp = testProps.remove(e.getKey());
            if (testProp == null) {
                addDiff(SymbolDiffType.PROPERTY_MISSING, e.getKey(), null, symbolName, null, "");
                continue;
            }
            SexpList goldProp = e.getValue();
            String what = "property " + e.getKey();
            checkDiff(goldProp.getAtomValue(2), testProp.getAtomValue(2), SymbolDiffType.PROPERTY_VALUE, what,
                    symbolName, null);
            checkDiff(getEffects(goldProp), getEffects(testProp), SymbolDiffType.PROPERTY_EFFECTS, what,
                    symbolName, null);
        }
        for (String name : testProps.keySet()) {
            addDiff(SymbolDiffType.PROPERTY_EXTRA, null, name, symbolName, null, "");
        }
    }

    /**
     * Reduces the {@code (effects ...)} of a text item to the fields that
     * matter for equivalence: font size, justification and visibility.
     */
    private static Map<String, Object> getEffects(SexpList item) {
        Map<String, Object> effects = new LinkedHashMap<>();
        SexpList e = child(item, SymbolTags.EFFECTS);
        if (e == null) return effects;
        SexpList font = child(e, SymbolTags.FONT);
        SexpList size = font == null ? null : child(font, SymbolTags.SIZE);
        effects.put(SymbolTags.SIZE, size == null ? null : size.getChildren());
        Set<String> justify = new HashSet<>();
        SexpList j = child(e, SymbolTags.JUSTIFY);
        if (j != null) {
            for (SexpNode n : j.getChildren()) {
                justify.add(n.toCanonicalString());
            }
        }
        effects.put(SymbolTags.JUSTIFY, justify);
        effects.put(SymbolTags.HIDE, SymbolLibraries.isHidden(e));
        return effects;
    }

    private void compareUnits(SexpList gold, SexpList test, String symbolName) {
        List<SexpList> goldList = children(gold, SymbolTags.SYMBOL);
        List<SexpList> testList = children(test, SymbolTags.SYMBOL);
        checkDiff(goldList.size(), testList.size(), SymbolDiffType.UNIT_COUNT, "unit count", symbolName, null);
        Map<String, SexpList> testUnits = index(testList, SymbolLibraries::getSymbolName,
                SymbolDiffType.UNIT_DUPLICATE, false, symbolName, null);
        Map<String, SexpList> goldUnits = index(goldList, SymbolLibraries::getSymbolName,
                SymbolDiffType.UNIT_DUPLICATE, true, symbolName, null);
        for (Entry<String, SexpList> e : goldUnits.entrySet()) {
            SexpList testUnit = testUnits.remove(e.getKey());
            if (testUnit == null) {
                addDiff(SymbolDiffType.UNIT_MISSING, e.getKey(), null, symbolName, null, "");
                continue;
            }
            compareUnit(e.getValue(), testUnit, symbolName, e.getKey());
        }
        for (String name : testUnits.keySet()) {
            addDiff(SymbolDiffType.UNIT_EXTRA, null, name, symbolName, null, "");
        }
    }

    private static List<String> getGeometry(SexpList unit) {
        List<String> shapes = new ArrayList<>();
        for (SexpList child : unit.getChildLists()) {
            if (isTagged(child, SymbolTags.PIN) || isTagged(child, SymbolTags.TEXT)) continue;
            shapes.add(child.toCanonicalString());
        }
        Collections.sort(shapes);
        return shapes;
    }

    private static String getPinNumber(SexpList pin) {
        SexpList number = child(pin, SymbolTags.NUMBER);
        return number == null ? "" : String.valueOf(number.getAtomValue(1));
    }

    private void compareUnit(SexpList gold, SexpList test, String symbolName, String unitName) {
        checkDiff(getGeometry(gold), getGeometry(test), SymbolDiffType.UNIT_GEOMETRY, "graphics", symbolName,
                unitName);
        List<SexpList> goldList = children(gold, SymbolTags.PIN);
        List<SexpList> testList = children(test, SymbolTags.PIN);
        checkDiff(goldList.size(), testList.size(), SymbolDiffType.PIN_COUNT, "pin count", symbolName, unitName);
        Map<String, SexpList> testPins = index(testList, SymbolComparator::getPinNumber,
                SymbolDiffType.PIN_DUPLICATE, false, symbolName, unitName);
        Map<String, SexpList> goldPins = index(goldList, SymbolComparator::getPinNumber,
                SymbolDiffType.PIN_DUPLICATE, true, symbolName, unitName);
        for (Entry<String, SexpList> e : goldPins.entrySet()) {
            SexpList testPin = testPins.remove(e.getKey());
            if (testPin == null) {
                addDiff(SymbolDiffType.PIN_MISSING, e.getKey(), null, symbolName, unitName, "");
                continue;
            }
            comparePin(e.getValue(), testPin, symbolName, unitName, "pin " + e.getKey());
        }
        for (String number : testPins.keySet()) {
            addDiff(SymbolDiffType.PIN_EXTRA, null, number, symbolName, unitName, "");
        }
    }

    private static List<SexpNode> childValues(SexpList parent, String tag) {
        SexpList child = child(parent, tag);
        return child == null ? null : child.getChildren();
    }

    private static Set<String> getAlternates(SexpList pin) {
        Set<String> alternates = new HashSet<>();
        for (SexpList alt : children(pin, SymbolTags.ALTERNATE)) {
            List<String> fields = new ArrayList<>();
            for (SexpNode n : alt.getChildren()) {
                fields.add(n.toCanonicalString());
            }
            alternates.add(String.join(" ", fields));
        }
        return alternates;
    }

    /**
     * A pin carries a hide flag when it has a {@code (hide ...)} item or a
     * bare {@code hide} atom, whatever value the item holds.
     */
    private static boolean hasHideFlag(SexpList pin) {
        for (SexpNode n : pin.getChildren()) {
            if (n.isAtom() && SymbolTags.HIDE.equals(n.asAtom().getValue())) {
                return true;
            }
        }
        return child(pin, SymbolTags.HIDE) != null;
    }

    private void comparePin(SexpList gold, SexpList test, String symbolName, String unitName, String what) {
        checkDiff(gold.getAtomValue(1), test.getAtomValue(1), SymbolDiffType.PIN_TYPE, what, symbolName, unitName);
        checkDiff(gold.getAtomValue(2), test.getAtomValue(2), SymbolDiffType.PIN_STYLE, what, symbolName, unitName);
        SexpList goldName = child(gold, SymbolTags.NAME);
        SexpList testName = child(test, SymbolTags.NAME);
        checkDiff(goldName == null ? null : goldName.getAtomValue(1), testName == null ? null : testName.getAtomValue(1),
                SymbolDiffType.PIN_NAME, what, symbolName, unitName);
        // x, y and, when present in either, the orientation
        checkDiff(childValues(gold, SymbolTags.AT), childValues(test, SymbolTags.AT), SymbolDiffType.PIN_POSITION,
                what, symbolName, unitName);
        checkDiff(childValues(gold, SymbolTags.LENGTH), childValues(test, SymbolTags.LENGTH),
                SymbolDiffType.PIN_LENGTH, what, symbolName, unitName);
        checkDiff(hasHideFlag(gold), hasHideFlag(test), SymbolDiffType.PIN_HIDE, what, symbolName, unitName);
        checkDiff(getAlternates(gold), getAlternates(test), SymbolDiffType.PIN_ALTERNATES, what, symbolName,
                unitName);
    }

    /**
     * Maps lists by key, keeping the first list for each key. Every later
     * list with an already seen key is reported as a duplicate on its side.
     */
    private Map<String, SexpList> index(List<SexpList> lists, Function<SexpList, String> keyOf,
            SymbolDiffType duplicateType, boolean goldSide, String symbolName, String unitName) {
        Map<String, SexpList> map = new LinkedHashMap<>();
        for (SexpList l : lists) {
            String key = String.valueOf(keyOf.apply(l));
            if (map.putIfAbsent(key, l) != null) {
                addDiff(duplicateType, goldSide ? key : null, goldSide ? null : key, symbolName, unitName, "");
            }
        }
        return map;
    }

    public void printDiffReportSummary(PrintStream ps) {
        ps.println("=============================================================================");
        ps.println("= Symbol Library Diff Summary");
        ps.println("=============================================================================");
        for (SymbolDiffType type : SymbolDiffType.values()) {
            int typeDiffCount = diffMap.getOrDefault(type, Collections.emptyList()).size();
            ps.printf("%9d %s Diffs\n", typeDiffCount, type.name());
        }
        ps.println("-----------------------------------------------------------------------------");
        ps.printf("%9d Total Diffs\n\n", diffCount);
    }

    public void printDiffReport(PrintStream ps) {
        printDiffReportSummary(ps);

        for (Entry<SymbolDiffType, List<SymbolDiff>> e : diffMap.entrySet()) {
            ps.println(" *** " + e.getKey() + ": " + e.getValue().size() + " diffs");
            for (SymbolDiff diff : e.getValue()) {
                ps.println("  " + diff.toString());
            }
        }
    }
}
