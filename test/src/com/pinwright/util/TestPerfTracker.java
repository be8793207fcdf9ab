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

package com.pinwright.util;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestPerfTracker {

    @Test
    public void testSegments() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PerfTracker t = new PerfTracker("Convert", false);
        t.setOutput(new PrintStream(baos, true));
        t.start("Read rows").stop();
        t.start("Build symbols").stop();

        Assertions.assertTrue(t.getRuntime("Read rows") >= 0);
        Assertions.assertTrue(t.getRuntime("Build symbols") >= 0);
        Assertions.assertNull(t.getRuntime("Write library"));
        // Nothing is printed until the summary when progress is off
        Assertions.assertEquals(0, baos.size());

        t.printSummary();
        String out = new String(baos.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(out.contains("Read rows:"));
        Assertions.assertTrue(out.contains("Build symbols:"));
        Assertions.assertTrue(out.contains("*Total*:"));
    }

    @Test
    public void testProgress() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PerfTracker t = new PerfTracker(null, true);
        t.setOutput(new PrintStream(baos, true));
        t.start("Merge").stop();
        String out = new String(baos.toByteArray(), StandardCharsets.UTF_8);
        Assertions.assertTrue(out.trim().startsWith("Merge:"));
        Assertions.assertTrue(out.trim().endsWith("s"));
    }

    @Test
    public void testSilent() {
        PerfTracker.SILENT.start("x").stop();
        Assertions.assertNull(PerfTracker.SILENT.getRuntime("x"));
    }
}
