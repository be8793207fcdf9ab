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

package com.pinwright.rows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.pinwright.pin.PinSide;
import com.pinwright.sexp.SexpAtom;
import com.pinwright.sexp.SexpList;
import com.pinwright.symbol.SymbolBuilder;
import com.pinwright.symbol.SymbolLibraries;
import com.pinwright.symbol.SymbolTags;
import com.pinwright.util.StringTools;

/**
 * Converts symbols back into the rows of a row file, so that an existing
 * library can be edited as a spreadsheet and regenerated.
 */
public class LibraryRowsExtractor {

    public static final List<String> PIN_HEADER = Arrays.asList(SymbolRowsParser.PIN_COLUMN,
            SymbolRowsParser.NAME_COLUMN, SymbolRowsParser.TYPE_COLUMN, SymbolRowsParser.SIDE_COLUMN,
            SymbolRowsParser.UNIT_COLUMN, SymbolRowsParser.STYLE_COLUMN, SymbolRowsParser.HIDDEN_COLUMN);

    /**
     * Converts every symbol of a library. Symbols are written in name order
     * with a blank row between two symbols.
     * @param lib The library.
     * @return The rows.
     */
    public static List<List<String>> libraryToRows(SexpList lib) {
        List<SexpList> symbols = new ArrayList<>(SymbolLibraries.getSymbols(lib));
        symbols.sort(Comparator.comparing(s -> String.valueOf(SymbolLibraries.getSymbolName(s))));
        List<List<String>> rows = new ArrayList<>();
        for (SexpList symbol : symbols) {
            if (!rows.isEmpty()) {
                rows.add(new ArrayList<>());
            }
            rows.addAll(symbolToRows(symbol));
        }
        return rows;
    }

    /**
     * Converts one symbol: a name row, a row per property, the pin column
     * header and a row per pin of every unit.
     * @param symbol The symbol.
     * @return The rows.
     */
    public static List<List<String>> symbolToRows(SexpList symbol) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(Arrays.asList(SymbolLibraries.getSymbolName(symbol), ""));
        for (SexpList prop : symbol.findChildren(SymbolTags.PROPERTY)) {
            String label = valueOrEmpty(prop.getAtomValue(1));
            // A hidden custom property is marked so it stays hidden when regenerated
            if (SymbolBuilder.canonicalPropertyName(label) == null && isTextHidden(prop)) {
                label += "*";
            }
            rows.add(Arrays.asList(label + ":", valueOrEmpty(prop.getAtomValue(2))));
        }
        rows.add(new ArrayList<>(PIN_HEADER));

        int ordinal = 1;
        for (SexpList unit : symbol.findChildren(SymbolTags.SYMBOL)) {
            String unitName = unit.getChildValue(SymbolTags.UNIT_NAME);
            String unitId = unitName == null ? Integer.toString(ordinal) : unitName;
            for (SexpList pin : unit.findChildren(SymbolTags.PIN)) {
                rows.add(pinToRow(pin, unitId));
            }
            ordinal++;
        }
        return rows;
    }

    private static List<String> pinToRow(SexpList pin, String unitId) {
        SexpList name = pin.findChild(SymbolTags.NAME);
        SexpList number = pin.findChild(SymbolTags.NUMBER);
        boolean hidden = SymbolLibraries.isHidden(pin)
                || (isTextHidden(name) && isTextHidden(number));
        return Arrays.asList(
                number == null ? "" : valueOrEmpty(number.getAtomValue(1)),
                name == null ? "" : valueOrEmpty(name.getAtomValue(1)),
                valueOrEmpty(pin.getAtomValue(1)),
                sideOf(pin).toString(),
                unitId,
                valueOrEmpty(pin.getAtomValue(2)),
                StringTools.toYesNo(hidden));
    }

    private static boolean isTextHidden(SexpList text) {
        if (text == null) return false;
        SexpList effects = text.findChild(SymbolTags.EFFECTS);
        return effects != null && SymbolLibraries.isHidden(effects);
    }

    private static PinSide sideOf(SexpList pin) {
        SexpList at = pin.findChild(SymbolTags.AT);
        SexpAtom angle = at == null ? null : at.getAtom(3);
        Integer orientation = angle == null ? null : angle.getIntValue();
        return PinSide.fromOrientation(orientation == null ? 0 : orientation);
    }

    private static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }
}
