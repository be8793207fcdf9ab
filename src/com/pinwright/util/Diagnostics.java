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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Collects the warnings of one conversion run. A warning with the same key is
 * only recorded once, so a problem repeated on many rows is reported a single
 * time. When errors are requested a warning is thrown instead of recorded.
 */
public class Diagnostics {

    private final List<String> lines = new ArrayList<>();

    private final Set<String> keys = new HashSet<>();

    private int suppressed;

    private boolean warningsAsErrors;

    public Diagnostics(boolean warningsAsErrors) {
        this.warningsAsErrors = warningsAsErrors;
    }

    public Diagnostics() {
        this(Params.PW_WARNINGS_AS_ERRORS);
    }

    public boolean isWarningsAsErrors() {
        return warningsAsErrors;
    }

    public void setWarningsAsErrors(boolean warningsAsErrors) {
        this.warningsAsErrors = warningsAsErrors;
    }

    /**
     * Records a warning unless one with the same key was already recorded.
     * @param key Identifies the problem, e.g. the unknown token.
     * @param message Text shown to the user.
     * @param asError Creates the exception thrown if warnings are errors.
     * @return True if the warning was new.
     */
    public <E extends RuntimeException> boolean warn(String key, String message, Function<String, E> asError) {
        if (warningsAsErrors) {
            throw asError.apply(message);
        }
        if (!keys.add(key)) {
            suppressed++;
            return false;
        }
        lines.add(message);
        return true;
    }

    /**
     * Records a warning keyed by its own text.
     * @param message Text shown to the user.
     * @return True if the warning was new.
     */
    public boolean warn(String message) {
        return warn(message, message, IllegalStateException::new);
    }

    public boolean hasWarnings() {
        return !lines.isEmpty();
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * @return How many repeated warnings were dropped.
     */
    public int getSuppressedCount() {
        return suppressed;
    }

    public void clear() {
        lines.clear();
        keys.clear();
        suppressed = 0;
    }

    public String summary() {
        int n = lines.size();
        if (n == 0) return "";
        String s = n == 1 ? "1 warning" : n + " warnings";
        if (suppressed > 0) {
            s += " (" + suppressed + " repeats not shown)";
        }
        return s;
    }

    public void print(PrintStream ps) {
        for (String line : lines) {
            ps.println(MessageGenerator.WARNING_PREFIX + line);
        }
    }
}
