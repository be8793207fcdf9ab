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
import java.util.Comparator;
import java.util.List;

import jline.TerminalFactory;

/**
 * A set of String utility methods.
 */
public class StringTools {

    /**
     * Interprets a yes/no style flag: yes, y, true, t and 1 are true; no, n,
     * false, f and 0 are false. Case and surrounding whitespace are ignored.
     * @param value The text to interpret.
     * @return The flag value.
     * @throws IllegalArgumentException for anything else.
     */
    public static boolean parseYesNo(String value) {
        switch (value.trim().toLowerCase()) {
            case "yes":
            case "y":
            case "true":
            case "t":
            case "1":
                return true;
            case "no":
            case "n":
            case "false":
            case "f":
            case "0":
                return false;
            default:
                throw new IllegalArgumentException("Invalid value for YES-NO-TRUE-FALSE string: " + value);
        }
    }

    public static String toYesNo(boolean value) {
        return value ? "yes" : "no";
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    /**
     * @param cells A row of cells.
     * @return True if the row is empty or every cell is blank.
     */
    public static boolean isBlankRow(List<String> cells) {
        for (String cell : cells) {
            if (!isBlank(cell)) return false;
        }
        return true;
    }

    /**
     * Counts how many times a character repeats at the start of a string.
     * @param s The string.
     * @param c The character.
     * @return Length of the leading run of c.
     */
    public static int countLeading(String s, char c) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == c) i++;
        return i;
    }

    /**
     * Spacing between columns used in {@link #printListInColumns(List, PrintStream, int)}
     */
    public static final int COLUMN_SPACING = 2;

    /**
     * Prints a list of Strings in columns, based upon the terminal width.
     *
     * @param items      The list of Strings to print
     * @param ps         The stream to send the printed Strings to.
     * @param maxColumns A maximum limit to the number columns to print
     */
    public static void printListInColumns(List<String> items, PrintStream ps, int maxColumns) {
        if (items.isEmpty()) return;
        int maxLength = items.stream().max(Comparator.comparingInt(String::length)).get().length();

        int termWidth = TerminalFactory.get().getWidth();

        int colWidth = maxLength + COLUMN_SPACING;
        int numCols = Math.max(1, Integer.min(termWidth / colWidth, maxColumns));
        int colHeight = (items.size() + numCols - 1) / numCols;
        String fmt = MessageGenerator.makeWhiteSpace(COLUMN_SPACING) + "%-" + maxLength + "s";
        for (int i = 0; i < colHeight; i++) {
            for (int col = 0; col < numCols; col++) {
                int idx = col * colHeight + i;
                if (idx < items.size())
                    ps.printf(fmt, items.get(idx));
            }
            ps.println();
        }
    }
}
