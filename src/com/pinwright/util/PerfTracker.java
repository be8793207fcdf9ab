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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Measures the runtime of the named steps of a command-line run and prints a
 * small table of them.
 */
public class PerfTracker {

    private final String name;

    private final List<String> segmentNames = new ArrayList<>();

    private final List<Long> runtimes = new ArrayList<>();

    private final boolean printProgress;

    private PrintStream out = System.out;

    private static final int MAX_SEGMENT_NAME_SIZE = 24;

    private static final int MAX_RUNTIME_SIZE = 9;

    public static final PerfTracker SILENT = new PerfTracker(null, false);

    public PerfTracker(String name) {
        this(name, true);
    }

    public PerfTracker(String name, boolean printProgress) {
        this.name = name;
        this.printProgress = printProgress;
        if (printProgress && name != null) {
            MessageGenerator.printHeader(name);
        }
    }

    public void setOutput(PrintStream out) {
        this.out = out;
    }

    public PerfTracker start(String segmentName) {
        if (this == SILENT) return this;
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        return this;
    }

    public PerfTracker stop() {
        if (this == SILENT) return this;
        int idx = runtimes.size() - 1;
        if (idx < 0) return this;
        runtimes.set(idx, System.nanoTime() - runtimes.get(idx));
        if (printProgress) {
            print(segmentNames.get(idx), runtimes.get(idx));
        }
        return this;
    }

    /**
     * @param segmentName Name given to {@link #start(String)}.
     * @return Runtime of the segment in nanoseconds, or null if unknown.
     */
    public Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    private void print(String segmentName, long runtime) {
        out.printf("%" + MAX_SEGMENT_NAME_SIZE + "s: %" + MAX_RUNTIME_SIZE + ".3fs%n", segmentName,
                runtime / 1000000000.0);
    }

    public void printSummary() {
        if (this == SILENT) return;
        if (!printProgress) {
            MessageGenerator.printHeader(out, name);
            for (int i = 0; i < runtimes.size(); i++) {
                print(segmentNames.get(i), runtimes.get(i));
            }
        }
        long total = 0L;
        for (long r : runtimes) {
            total += r;
        }
        out.println("------------------------------------------------------------------------------");
        print("*Total*", total);
    }
}
