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

package com.pinwright.layout;

import java.util.regex.Pattern;

/**
 * Estimates the space labels take. Characters are assumed to be 90% of the
 * font size wide.
 */
public class TextMetrics {

    public static final double FONT_SIZE = 1.27;

    public static final double CHAR_WIDTH_FRACTION = 0.9;

    /**
     * @param text The label.
     * @param altDelimiter If not null or empty, the label is a list of
     * alternative names separated by this string and the widest one counts.
     * @param fontSize Font size in millimeters.
     * @return Width of the label in millimeters.
     */
    public static double textWidth(String text, String altDelimiter, double fontSize) {
        return longestAlternate(text, altDelimiter) * fontSize * CHAR_WIDTH_FRACTION;
    }

    public static double textWidth(String text, String altDelimiter) {
        return textWidth(text, altDelimiter, FONT_SIZE);
    }

    public static double textWidth(String text) {
        return textWidth(text, null, FONT_SIZE);
    }

    /**
     * @param text The label.
     * @return Height of the label in millimeters.
     */
    public static double textHeight(String text) {
        return FONT_SIZE;
    }

    static int longestAlternate(String text, String altDelimiter) {
        if (altDelimiter == null || altDelimiter.isEmpty()) {
            return text.length();
        }
        int longest = 0;
        for (String alt : splitAlternates(text, altDelimiter)) {
            longest = Math.max(longest, alt.length());
        }
        return longest;
    }

    /**
     * Splits a pin name into its primary name and alternates.
     * @param text The full pin name.
     * @param altDelimiter Separator, or null/empty to not split.
     * @return The names, primary first. Empty parts are kept.
     */
    public static String[] splitAlternates(String text, String altDelimiter) {
        if (altDelimiter == null || altDelimiter.isEmpty()) {
            return new String[] {text};
        }
        return text.split(Pattern.quote(altDelimiter), -1);
    }
}
