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

package com.pinwright.tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pinwright.rows.CsvRowReader;
import com.pinwright.rows.LibraryRowsExtractor;
import com.pinwright.rows.UnsupportedFileExtensionException;
import com.pinwright.sexp.SexpList;
import com.pinwright.sexp.SexpWriter;
import com.pinwright.support.SampleParts;

public class TestSymbolLibToCSV {

    private static Path writeLibrary(Path dir, String name) {
        Path lib = dir.resolve(name);
        SexpWriter.writeFile(lib, SampleParts.library(SampleParts.BOTH_CSV));
        return lib;
    }

    @Test
    public void testConvert(@TempDir Path tmpDir) {
        Path lib = writeLibrary(tmpDir, "parts.kicad_sym");
        Path csv = SymbolLibToCSV.convert(lib, null, false);
        Assertions.assertEquals(tmpDir.resolve("parts.csv"), csv);
        SexpList expected = SampleParts.library(SampleParts.BOTH_CSV);
        Assertions.assertEquals(LibraryRowsExtractor.libraryToRows(expected), CsvRowReader.readFile(csv));
    }

    @Test
    public void testExistingOutputNeedsOverwrite(@TempDir Path tmpDir) throws IOException {
        Path lib = writeLibrary(tmpDir, "parts.kicad_sym");
        Path csv = tmpDir.resolve("out.csv");
        Files.write(csv, new byte[0]);
        Assertions.assertThrows(IllegalStateException.class, () -> SymbolLibToCSV.convert(lib, csv, false));
        Assertions.assertEquals(csv, SymbolLibToCSV.convert(lib, csv, true));
        Assertions.assertFalse(CsvRowReader.readFile(csv).isEmpty());
    }

    @Test
    public void testMissingInput(@TempDir Path tmpDir) {
        Assertions.assertThrows(UncheckedIOException.class,
                () -> SymbolLibToCSV.convert(tmpDir.resolve("none.kicad_sym"), null, false));
    }

    @Test
    public void testWrongInputExtension(@TempDir Path tmpDir) {
        Path lib = writeLibrary(tmpDir, "parts.lib");
        UnsupportedFileExtensionException e = Assertions.assertThrows(UnsupportedFileExtensionException.class,
                () -> SymbolLibToCSV.convert(lib, null, false));
        Assertions.assertEquals("lib", e.getExtension());
    }
}
