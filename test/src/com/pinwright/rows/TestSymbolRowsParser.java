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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.pinwright.pin.PinElectricalType;
import com.pinwright.pin.PinGraphicStyle;
import com.pinwright.pin.PinRecord;
import com.pinwright.pin.PinSide;
import com.pinwright.support.SampleParts;
import com.pinwright.symbol.PartDefinition;
import com.pinwright.symbol.SymbolOptions;
import com.pinwright.util.Diagnostics;

public class TestSymbolRowsParser {

    private static SymbolRowsParser parser(Diagnostics diagnostics) {
        return new SymbolRowsParser(new SymbolOptions(), diagnostics);
    }

    private static PartDefinition parse(String csv, Diagnostics diagnostics) {
        return parser(diagnostics).parsePart(SampleParts.rows(csv));
    }

    @Test
    public void testSplitParts() {
        List<List<String>> rows = SampleParts.rows("A\npin,name\n1,X\n,,\n\n\nB\npin,name\n1,Y\n");
        List<List<List<String>>> parts = SymbolRowsParser.splitParts(rows, false);
        Assertions.assertEquals(2, parts.size());
        Assertions.assertEquals("A", parts.get(0).get(0).get(0));
        Assertions.assertEquals(3, parts.get(0).size());
        Assertions.assertEquals("B", parts.get(1).get(0).get(0));

        List<List<List<String>>> one = SymbolRowsParser.splitParts(rows, true);
        Assertions.assertEquals(1, one.size());
        Assertions.assertEquals(6, one.get(0).size());

        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> SymbolRowsParser.splitParts(SampleParts.rows("\n,\n , \n"), false));
        Assertions.assertEquals("No valid symbols found in input file", e.getMessage());
    }

    @ParameterizedTest
    @CsvSource({
            "'Reference:,U', true",
            "' Datasheet: ,http://x', true",
            "'Reference:', false",
            "'pin,name', false",
            "'1,A:', false",
    })
    public void testPropertyRows(String line, boolean expected) {
        Assertions.assertEquals(expected, SymbolRowsParser.isPropertyRow(SampleParts.rows(line).get(0)));
    }

    @Test
    public void testParseSamplePart() {
        Diagnostics diagnostics = new Diagnostics(false);
        PartDefinition part = parse(SampleParts.MCU_CSV, diagnostics);
        Assertions.assertFalse(diagnostics.hasWarnings(), diagnostics.getWarnings().toString());
        Assertions.assertEquals("MCU32", part.getName());
        Assertions.assertEquals(Arrays.asList("Reference", "Datasheet", "Manufacturer", "Internal*"),
                Arrays.asList(part.getProperties().keySet().toArray()));
        Assertions.assertEquals("Acme", part.getProperties().get("Manufacturer"));
        Assertions.assertEquals(9, part.getPins().size());

        PinRecord clk = part.getPins().get(4);
        Assertions.assertEquals("5", clk.getNumber());
        Assertions.assertEquals(PinElectricalType.INPUT, clk.getType());
        Assertions.assertEquals(PinGraphicStyle.CLOCK, clk.getStyle());
        Assertions.assertEquals(PinSide.TOP, clk.getSide());
        Assertions.assertEquals(4, clk.getRowIndex());
        Assertions.assertTrue(part.getPins().get(6).isHidden());
        Assertions.assertEquals("*4", part.getPins().get(3).getNumber());
    }

    @Test
    public void testColumnOrderAndDefaults() {
        SymbolOptions options = new SymbolOptions()
                .setDefaultSide(PinSide.RIGHT)
                .setDefaultType(PinElectricalType.INPUT)
                .setDefaultStyle(PinGraphicStyle.INVERTED);
        SymbolRowsParser parser = new SymbolRowsParser(options, new Diagnostics(false));
        PartDefinition part = parser.parsePart(SampleParts.rows(
                "U1\nName, Unit ,PIN\nA,,1\nB,2,2\n"));
        PinRecord a = part.getPins().get(0);
        Assertions.assertEquals("1", a.getNumber());
        Assertions.assertEquals("A", a.getName());
        Assertions.assertEquals(PinRecord.DEFAULT_UNIT_ID, a.getUnit());
        Assertions.assertEquals(PinSide.RIGHT, a.getSide());
        Assertions.assertEquals(PinElectricalType.INPUT, a.getType());
        Assertions.assertEquals(PinGraphicStyle.INVERTED, a.getStyle());
        Assertions.assertFalse(a.isHidden());
        Assertions.assertEquals("2", part.getPins().get(1).getUnit());
        Assertions.assertTrue(part.getProperties().isEmpty());
    }

    @Test
    public void testUnknownTokensFallBack() {
        Diagnostics diagnostics = new Diagnostics(false);
        PartDefinition part = parse("U1\npin,name,type,side,style,hidden,color\n"
                + "1,A,sorta_input,middle,wavy,maybe,red\n"
                + "2,B,sorta_input,left,,no,blue\n", diagnostics);
        PinRecord a = part.getPins().get(0);
        Assertions.assertEquals(PinRecord.DEFAULT_TYPE, a.getType());
        Assertions.assertEquals(PinRecord.DEFAULT_SIDE, a.getSide());
        Assertions.assertEquals(PinRecord.DEFAULT_STYLE, a.getStyle());
        Assertions.assertFalse(a.isHidden());

        // color column, type, side, style and hidden; the repeated type is reported once
        Assertions.assertEquals(5, diagnostics.getWarnings().size(), diagnostics.getWarnings().toString());
        Assertions.assertEquals(1, diagnostics.getSuppressedCount());
        Assertions.assertTrue(diagnostics.getWarnings().get(0).contains("color"));
        Assertions.assertTrue(diagnostics.summary().startsWith("5 warnings"));
    }

    @Test
    public void testWarningsAsErrors() {
        Diagnostics diagnostics = new Diagnostics(true);
        MalformedRowException e = Assertions.assertThrows(MalformedRowException.class,
                () -> parse("U1\npin,name,type\n1,A,sorta_input\n", diagnostics));
        Assertions.assertTrue(e.getMessage().contains("sorta_input"));
        Assertions.assertThrows(MalformedRowException.class, () -> parse("U1\npin,name,color\n1,A,red\n",
                diagnostics));
    }

    @Test
    public void testRowsWithoutNumbers() {
        Diagnostics diagnostics = new Diagnostics(false);
        PartDefinition part = parse("U1\npin,name,side\n1,A,left\n,B,left\n3\n", diagnostics);
        Assertions.assertEquals(2, part.getPins().size());
        Assertions.assertEquals("3", part.getPins().get(1).getNumber());
        Assertions.assertEquals("", part.getPins().get(1).getName());
        Assertions.assertEquals(1, part.getPins().get(1).getRowIndex());
        Assertions.assertEquals(2, diagnostics.getWarnings().size(), diagnostics.getWarnings().toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "U1\nnumber,name\n1,A\n",
            "U1\npin,label\n1,A\n",
            "U1\nRef:,U\n",
    })
    public void testMalformedHeader(String csv) {
        Assertions.assertThrows(MalformedRowException.class, () -> parse(csv, new Diagnostics(false)));
    }

    @Test
    public void testParsePartsSkipsBadPart() {
        SymbolRowsParser parser = parser(new Diagnostics(false));
        List<PartDefinition> parts = parser.parseParts(SampleParts.rows(
                "BAD\nnumber,name\n1,A\n\nGOOD\npin,name\n1,A\n"), false);
        Assertions.assertEquals(1, parts.size());
        Assertions.assertEquals("GOOD", parts.get(0).getName());

        Assertions.assertEquals(2, parser.parseParts(SampleParts.rows(SampleParts.BOTH_CSV), false).size());
    }
}
