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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.pinwright.pin.PinElectricalType;
import com.pinwright.pin.PinGraphicStyle;
import com.pinwright.pin.PinRecord;
import com.pinwright.pin.PinSide;
import com.pinwright.symbol.PartDefinition;
import com.pinwright.symbol.SymbolOptions;
import com.pinwright.util.Diagnostics;
import com.pinwright.util.MessageGenerator;
import com.pinwright.util.StringTools;

/**
 * Turns the rows of a row file into part definitions.
 * <p>
 * A file holds one or more parts separated by blank rows. The first row of a
 * part holds its name in the first cell. It is followed by any number of
 * property rows of the form {@code Label:,value}, then a header row naming the
 * pin columns, then one row per pin. The header must contain the {@code pin}
 * and {@code name} columns and may contain {@code unit}, {@code side},
 * {@code type}, {@code style} and {@code hidden} in any order. A missing
 * optional column or an empty cell takes the default from the
 * {@link SymbolOptions}.
 * <p>
 * Problems that still leave a usable part (an unknown column, an unknown
 * token in a cell, a pin row without a number) are reported through a
 * {@link Diagnostics} collector. When the collector treats warnings as errors
 * they raise a {@link MalformedRowException} instead.
 */
public class SymbolRowsParser {

    public static final String PIN_COLUMN = "pin";
    public static final String NAME_COLUMN = "name";
    public static final String UNIT_COLUMN = "unit";
    public static final String SIDE_COLUMN = "side";
    public static final String TYPE_COLUMN = "type";
    public static final String STYLE_COLUMN = "style";
    public static final String HIDDEN_COLUMN = "hidden";

    public static final List<String> REQUIRED_COLUMNS = Arrays.asList(PIN_COLUMN, NAME_COLUMN);

    public static final List<String> OPTIONAL_COLUMNS = Arrays.asList(UNIT_COLUMN, SIDE_COLUMN, TYPE_COLUMN,
            STYLE_COLUMN, HIDDEN_COLUMN);

    private static final Function<String, MalformedRowException> AS_ERROR = MalformedRowException::new;

    private final SymbolOptions options;

    private final Diagnostics diagnostics;

    public SymbolRowsParser(SymbolOptions options, Diagnostics diagnostics) {
        this.options = options;
        this.diagnostics = diagnostics;
    }

    public SymbolRowsParser() {
        this(new SymbolOptions(), new Diagnostics());
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Splits the rows of a file into the rows of each part. Blank rows end a
     * part unless the whole file describes a single part, in which case blank
     * rows are dropped.
     * @param rows All rows of the file.
     * @param oneSymbol True to read the whole file as one part.
     * @return The rows of each part, without blank rows.
     * @throws IllegalArgumentException if the file holds no part at all.
     */
    public static List<List<List<String>>> splitParts(List<List<String>> rows, boolean oneSymbol) {
        List<List<List<String>>> parts = new ArrayList<>();
        List<List<String>> current = new ArrayList<>();
        for (List<String> row : rows) {
            if (StringTools.isBlankRow(row)) {
                if (!oneSymbol && !current.isEmpty()) {
                    parts.add(current);
                    current = new ArrayList<>();
                }
            } else {
                current.add(row);
            }
        }
        if (!current.isEmpty()) {
            parts.add(current);
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("No valid symbols found in input file");
        }
        return parts;
    }

    /**
     * @param row A row of a part.
     * @return True if the row is a {@code Label:,value} property row.
     */
    public static boolean isPropertyRow(List<String> row) {
        return row.size() >= 2 && row.get(0).trim().endsWith(":");
    }

    /**
     * Reads every part of a file. A part that cannot be read is reported and
     * skipped.
     * @param rows All rows of the file.
     * @param oneSymbol True to read the whole file as one part.
     * @return The parts that could be read.
     */
    public List<PartDefinition> parseParts(List<List<String>> rows, boolean oneSymbol) {
        List<PartDefinition> parts = new ArrayList<>();
        for (List<List<String>> partRows : splitParts(rows, oneSymbol)) {
            try {
                parts.add(parsePart(partRows));
            } catch (RuntimeException e) {
                String name = partRows.get(0).isEmpty() ? "Unknown" : partRows.get(0).get(0);
                MessageGenerator.error("Error processing symbol '" + name + "': " + e.getMessage());
            }
        }
        return parts;
    }

    /**
     * Reads the rows of a single part.
     * @param partRows Rows of the part, starting with the name row.
     * @return The part.
     * @throws MalformedRowException if the header row is missing or lacks a
     * required column.
     */
    public PartDefinition parsePart(List<List<String>> partRows) {
        String partName = partRows.get(0).isEmpty() ? "" : partRows.get(0).get(0).trim();

        Map<String, String> properties = new LinkedHashMap<>();
        int rowIdx = 1;
        while (rowIdx < partRows.size() && isPropertyRow(partRows.get(rowIdx))) {
            List<String> row = partRows.get(rowIdx);
            String label = row.get(0).trim();
            properties.put(label.substring(0, label.length() - 1), row.get(1).trim());
            rowIdx++;
        }
        if (rowIdx >= partRows.size()) {
            throw new MalformedRowException("No pin column header found for part " + partName);
        }

        Map<String, Integer> columns = mapColumns(partRows.get(rowIdx), partName);
        int width = partRows.get(rowIdx).size();
        rowIdx++;

        List<PinRecord> pins = new ArrayList<>();
        int pinIndex = 0;
        for (int i = rowIdx; i < partRows.size(); i++) {
            List<String> row = partRows.get(i);
            if (row.size() < width) {
                diagnostics.warn("short-row:" + partName, "Row " + (i + 1) + " of part " + partName
                        + " has fewer cells than its header; missing cells are left empty", AS_ERROR);
            }
            String number = cell(row, columns.get(PIN_COLUMN));
            if (number.isEmpty()) {
                diagnostics.warn("no-number:" + partName, "Pin row " + (i + 1) + " of part " + partName
                        + " has no pin number and is skipped", AS_ERROR);
                continue;
            }
            pins.add(PinRecord.builder()
                    .number(number)
                    .name(cell(row, columns.get(NAME_COLUMN)))
                    .unit(orDefault(cell(row, columns.get(UNIT_COLUMN)), PinRecord.DEFAULT_UNIT_ID))
                    .side(parseToken(row, columns.get(SIDE_COLUMN), PinSide::fromString,
                            options.getDefaultSide(), SIDE_COLUMN, partName))
                    .type(parseToken(row, columns.get(TYPE_COLUMN), PinElectricalType::fromString,
                            options.getDefaultType(), TYPE_COLUMN, partName))
                    .style(parseToken(row, columns.get(STYLE_COLUMN), PinGraphicStyle::fromString,
                            options.getDefaultStyle(), STYLE_COLUMN, partName))
                    .hidden(parseToken(row, columns.get(HIDDEN_COLUMN), StringTools::parseYesNo,
                            Boolean.FALSE, HIDDEN_COLUMN, partName))
                    .rowIndex(pinIndex++)
                    .build());
        }
        return new PartDefinition(partName, properties, pins);
    }

    private Map<String, Integer> mapColumns(List<String> header, String partName) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String col = header.get(i).trim().toLowerCase();
            if (col.isEmpty()) continue;
            if (REQUIRED_COLUMNS.contains(col) || OPTIONAL_COLUMNS.contains(col)) {
                columns.putIfAbsent(col, i);
            } else {
                diagnostics.warn("column:" + col, "Unrecognized column '" + col + "' in header for part "
                        + partName + " is ignored", AS_ERROR);
            }
        }
        for (String col : REQUIRED_COLUMNS) {
            if (!columns.containsKey(col)) {
                throw new MalformedRowException("Required column '" + col + "' not found in header for part "
                        + partName);
            }
        }
        return columns;
    }

    private static String cell(List<String> row, Integer column) {
        if (column == null || column >= row.size()) return "";
        return row.get(column).trim();
    }

    private static String orDefault(String value, String defaultValue) {
        return value.isEmpty() ? defaultValue : value;
    }

    private <T> T parseToken(List<String> row, Integer column, Function<String, T> parser, T defaultValue,
            String columnName, String partName) {
        String value = cell(row, column);
        if (value.isEmpty()) return defaultValue;
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            diagnostics.warn(columnName + ":" + value.toLowerCase(), "Unknown " + columnName + " '" + value
                    + "' in part " + partName + ", using " + defaultValue, AS_ERROR);
            return defaultValue;
        }
    }
}
