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

package com.pinwright.symbol;

import java.util.List;

import com.pinwright.sexp.SexpAtom;
import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpNode;
import com.pinwright.util.MessageGenerator;
import com.pinwright.util.Params;

/**
 * Helpers to create, inspect and fill {@code (kicad_symbol_lib ...)} trees.
 */
public class SymbolLibraries {

    /**
     * Creates a library holding no symbols. Its header comes from
     * {@link Params#PW_LIB_VERSION}, {@link Params#PW_GENERATOR} and
     * {@link Params#PW_GENERATOR_VERSION}.
     * @return The new library.
     */
    public static SexpList createEmptyLibrary() {
        return SexpList.of(SymbolTags.KICAD_SYMBOL_LIB,
                SexpList.of(SymbolTags.VERSION, Params.PW_LIB_VERSION),
                SexpList.of(SymbolTags.GENERATOR, SexpAtom.quoted(Params.PW_GENERATOR)),
                SexpList.of(SymbolTags.GENERATOR_VERSION, SexpAtom.quoted(Params.PW_GENERATOR_VERSION)));
    }

    public static boolean isLibrary(SexpList tree) {
        return tree != null && tree.hasTag(SymbolTags.KICAD_SYMBOL_LIB);
    }

    /**
     * @param lib A library tree.
     * @return The top-level symbols of the library, in file order.
     */
    public static List<SexpList> getSymbols(SexpList lib) {
        return lib.findChildren(SymbolTags.SYMBOL);
    }

    /**
     * @param symbol A {@code (symbol NAME ...)} list.
     * @return The name of the symbol, or null if it has none.
     */
    public static String getSymbolName(SexpList symbol) {
        return symbol.getAtomValue(1);
    }

    /**
     * Finds a top-level symbol by name.
     * @param lib The library.
     * @param name Name of the symbol.
     * @return The symbol, or null if the library has no symbol of that name.
     */
    public static SexpList getSymbol(SexpList lib, String name) {
        return lib.findByKey(SymbolTags.SYMBOL, 1, name);
    }

    /**
     * @param lib The library.
     * @return The format version, or null if it is missing or not a number.
     */
    public static Integer getVersion(SexpList lib) {
        SexpList v = lib.findChild(SymbolTags.VERSION);
        if (v == null || v.getAtom(1) == null) return null;
        return v.getAtom(1).getIntValue();
    }

    /**
     * Checks an item for a {@code hide} flag, given either as a bare atom or
     * as {@code (hide)} or {@code (hide yes)}.
     * @param item A pin, an effects list or another list that can be hidden.
     * @return True if the item is hidden.
     */
    public static boolean isHidden(SexpList item) {
        for (SexpNode n : item.getChildren()) {
            if (n.isAtom() && SymbolTags.HIDE.equals(n.asAtom().getValue())) {
                return true;
            }
        }
        SexpList hide = item.findChild(SymbolTags.HIDE);
        if (hide == null) return false;
        String value = hide.getAtomValue(1);
        return value == null || SymbolTags.YES.equalsIgnoreCase(value);
    }

    /**
     * Builds a symbol for every part and collects them in a new library. A
     * part that cannot be built is reported and skipped so that one bad part
     * does not sink the rest of the file.
     * @param parts The parts to convert.
     * @param options Options for the symbol builder.
     * @return The library.
     * @throws IllegalArgumentException if no part produced a symbol.
     */
    public static SexpList buildLibrary(List<PartDefinition> parts, SymbolOptions options) {
        SymbolBuilder builder = new SymbolBuilder(options);
        SexpList lib = createEmptyLibrary();
        int count = 0;
        for (PartDefinition part : parts) {
            try {
                lib.add(builder.buildSymbol(part));
                count++;
            } catch (RuntimeException e) {
                MessageGenerator.error("Failed to build symbol '" + part.getName() + "': "
                        + e.getMessage());
            }
        }
        if (count == 0) {
            throw new IllegalArgumentException("No valid symbols were generated from the input data");
        }
        return lib;
    }
}
