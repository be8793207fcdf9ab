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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.pinwright.pin.PinRecord;
import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpParser;
import com.pinwright.support.SampleParts;
import com.pinwright.util.Params;

public class TestSymbolLibraries {

    @Test
    public void testEmptyLibrary() {
        SexpList lib = SymbolLibraries.createEmptyLibrary();
        Assertions.assertTrue(SymbolLibraries.isLibrary(lib));
        Assertions.assertEquals(Integer.valueOf(Params.PW_LIB_VERSION), SymbolLibraries.getVersion(lib));
        Assertions.assertEquals(Params.PW_GENERATOR, lib.getChildValue(SymbolTags.GENERATOR));
        Assertions.assertEquals(Params.PW_GENERATOR_VERSION, lib.getChildValue(SymbolTags.GENERATOR_VERSION));
        Assertions.assertTrue(SymbolLibraries.getSymbols(lib).isEmpty());
        Assertions.assertFalse(SymbolLibraries.isLibrary(SexpList.of(SymbolTags.SYMBOL, "X")));
        Assertions.assertFalse(SymbolLibraries.isLibrary(null));
    }

    @Test
    public void testLookupByName() {
        SexpList lib = SampleParts.library(SampleParts.BOTH_CSV);
        Assertions.assertEquals(2, SymbolLibraries.getSymbols(lib).size());
        Assertions.assertEquals("DUAL_OPAMP", SymbolLibraries.getSymbolName(SymbolLibraries.getSymbol(lib, "DUAL_OPAMP")));
        Assertions.assertNull(SymbolLibraries.getSymbol(lib, "MCU32_1_1"));
        Assertions.assertNull(SymbolLibraries.getSymbol(lib, "missing"));
    }

    @Test
    public void testBuildSkipsBadParts() {
        PinRecord pin = PinRecord.builder().number("1").name("A").build();
        List<PartDefinition> parts = Arrays.asList(
                new PartDefinition("", Collections.singletonList(pin)),
                new PartDefinition("GOOD", Collections.singletonList(pin)));
        SexpList lib = SymbolLibraries.buildLibrary(parts, new SymbolOptions());
        Assertions.assertEquals(1, SymbolLibraries.getSymbols(lib).size());
        Assertions.assertNotNull(SymbolLibraries.getSymbol(lib, "GOOD"));

        List<PartDefinition> bad = Collections.singletonList(new PartDefinition("", Collections.singletonList(pin)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SymbolLibraries.buildLibrary(bad, new SymbolOptions()));
    }

    @ParameterizedTest
    @CsvSource({
            "(pin input line hide), true",
            "(pin input line (hide)), true",
            "(pin input line (hide yes)), true",
            "(pin input line (hide no)), false",
            "(pin input line (at 0 0 0)), false",
            "(effects (font (size 1.27 1.27)) hide), true",
    })
    public void testHiddenForms(String text, boolean expected) {
        Assertions.assertEquals(expected, SymbolLibraries.isHidden(SexpParser.parseList(text)));
    }

    @Test
    public void testVersion() {
        Assertions.assertEquals(Integer.valueOf(20211014),
                SymbolLibraries.getVersion(SexpParser.parseList("(kicad_symbol_lib (version 20211014))")));
        Assertions.assertNull(SymbolLibraries.getVersion(SexpParser.parseList("(kicad_symbol_lib)")));
        Assertions.assertNull(SymbolLibraries.getVersion(SexpParser.parseList("(kicad_symbol_lib (version x))")));
    }
}
