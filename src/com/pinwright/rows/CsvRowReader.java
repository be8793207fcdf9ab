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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FilenameUtils;

/**
 * Reads comma separated rows. A cell may be enclosed in double quotes, in
 * which case it can hold commas, line breaks and doubled quotes standing for
 * one quote. Line ends may be LF or CRLF.
 */
public class CsvRowReader {

    public static final String CSV_EXTENSION = "csv";

    private static final char SEPARATOR = ',';

    private static final char QUOTE = '"';

    /**
     * Reads all rows of a CSV file.
     * @param fileName The file to read, must end in .csv.
     * @return The rows, each a list of cells.
     * @throws UnsupportedFileExtensionException if the file is not a .csv file.
     */
    public static List<List<String>> readFile(Path fileName) {
        String ext = FilenameUtils.getExtension(fileName.toString());
        if (!CSV_EXTENSION.equalsIgnoreCase(ext)) {
            throw new UnsupportedFileExtensionException(ext, "Unsupported file extension: ." + ext
                    + ". Only .csv row files are supported");
        }
        try (BufferedReader br = Files.newBufferedReader(fileName, StandardCharsets.UTF_8)) {
            return read(br);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't read file: " + fileName, e);
        }
    }

    public static List<List<String>> readString(String text) {
        try {
            return read(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads all rows from a character stream. A line with no characters
     * becomes an empty row.
     * @param in The stream, left open.
     * @return The rows.
     * @throws IOException if reading fails.
     */
    public static List<List<String>> read(Reader in) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuotes = false;
        boolean lineHasContent = false;
        int c = in.read();
        if (c == '\uFEFF') {
            c = in.read();
        }
        while (c != -1) {
            char ch = (char) c;
            if (inQuotes) {
                if (ch == QUOTE) {
                    int next = in.read();
                    if (next == QUOTE) {
                        cell.append(QUOTE);
                    } else {
                        inQuotes = false;
                        c = next;
                        continue;
                    }
                } else {
                    cell.append(ch);
                }
            } else if (ch == QUOTE) {
                inQuotes = true;
                lineHasContent = true;
            } else if (ch == SEPARATOR) {
                row.add(cell.toString());
                cell.setLength(0);
                lineHasContent = true;
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r') {
                    int next = in.read();
                    if (next != '\n') {
                        endRow(rows, row, cell, lineHasContent);
                        row = new ArrayList<>();
                        lineHasContent = false;
                        c = next;
                        continue;
                    }
                }
                endRow(rows, row, cell, lineHasContent);
                row = new ArrayList<>();
                lineHasContent = false;
            } else {
                cell.append(ch);
                lineHasContent = true;
            }
            c = in.read();
        }
        if (lineHasContent) {
            endRow(rows, row, cell, true);
        }
        return rows;
    }

    private static void endRow(List<List<String>> rows, List<String> row, StringBuilder cell,
            boolean lineHasContent) {
        if (lineHasContent) {
            row.add(cell.toString());
        }
        cell.setLength(0);
        rows.add(row);
    }
}
