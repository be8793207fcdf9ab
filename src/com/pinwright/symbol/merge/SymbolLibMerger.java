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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpNode;
import com.pinwright.symbol.SymbolLibraries;
import com.pinwright.symbol.SymbolTags;

/**
 * Combines the symbols of two libraries into a new one.
 */
public class SymbolLibMerger {

    /**
     * Merges two libraries. The result takes its header (version, generator
     * and anything else that is not a symbol) from the first library. Its
     * symbols are those of the first library followed by those of the second.
     * When overwriting is allowed a symbol of the second library replaces the
     * one of the same name in the first. Neither input is modified.
     * @param libA The base library.
     * @param libB The library merged into the base.
     * @param allowOverwrite True to let symbols of libB replace those of libA.
     * @return The merged library.
     * @throws DuplicateSymbolException if both libraries hold a symbol of the
     * same name and overwriting is not allowed.
     */
    public static SexpList merge(SexpList libA, SexpList libB, boolean allowOverwrite) {
        Map<String, SexpList> symbolsA = symbolMap(libA);
        Map<String, SexpList> symbolsB = symbolMap(libB);

        if (!allowOverwrite) {
            Set<String> duplicates = new TreeSet<>(symbolsA.keySet());
            duplicates.retainAll(symbolsB.keySet());
            if (!duplicates.isEmpty()) {
                throw new DuplicateSymbolException(duplicates);
            }
        }

        SexpList merged = new SexpList();
        for (SexpNode n : libA.getElements()) {
            if (n.isList() && n.asList().hasTag(SymbolTags.SYMBOL)) continue;
            merged.add(n.copy());
        }
        for (Map.Entry<String, SexpList> e : symbolsA.entrySet()) {
            if (symbolsB.containsKey(e.getKey())) continue;
            merged.add(e.getValue().copy());
        }
        for (SexpList symbol : symbolsB.values()) {
            merged.add(symbol.copy());
        }
        return merged;
    }

    private static Map<String, SexpList> symbolMap(SexpList lib) {
        Map<String, SexpList> symbols = new LinkedHashMap<>();
        for (SexpList symbol : SymbolLibraries.getSymbols(lib)) {
            symbols.put(SymbolLibraries.getSymbolName(symbol), symbol);
        }
        return symbols;
    }
}
