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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rows as comma separated values. Cells holding a comma, a quote, a
 * line break or leading or trailing blanks are quoted.
 */
public class CsvRowWriter {

    public static String quoteCell(String cell) {
        boolean quote = cell.indexOf(',') >= 0 || cell.indexOf('"') >= 0 || cell.indexOf('\n') >= 0
                || cell.indexOf('\r') >= 0 || (!cell.isEmpty() && !cell.equals(cell.trim()));
        if (!quote) return cell;
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    public static void write(Writer out, List<List<String>> rows) throws IOException {
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) out.write(',');
                out.write(quoteCell(row.get(i)));
            }
            out.write("\r\n");
        }
    }

    public static String toString(List<List<String>> rows) {
        StringWriter sw = new StringWriter();
        try {
            write(sw, rows);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sw.toString();
    }

    public static void writeFile(Path fileName, List<List<String>> rows) {
        try (BufferedWriter bw = Files.newBufferedWriter(fileName, StandardCharsets.UTF_8)) {
            write(bw, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't write file: " + fileName, e);
        }
    }
}
