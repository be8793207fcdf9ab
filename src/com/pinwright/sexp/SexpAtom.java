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

package com.pinwright.sexp;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A leaf of a symbolic tree. The value is kept as text; numeric atoms are
 * interpreted on demand so that values like "5.08" and "5.080" compare equal.
 * Whether the atom was (or must be) written in double quotes is tracked
 * separately from its value.
 */
public class SexpAtom extends SexpNode {

    private final String value;

    private final boolean quoted;

    private BigDecimal numberValue;

    private boolean numberParsed;

    public SexpAtom(String value, boolean quoted) {
        this.value = Objects.requireNonNull(value);
        this.quoted = quoted;
    }

    public SexpAtom(String value) {
        this(value, false);
    }

    /**
     * Creates an atom that is always written inside double quotes.
     * @param value The string value.
     * @return The new atom.
     */
    public static SexpAtom quoted(String value) {
        return new SexpAtom(value, true);
    }

    public static SexpAtom of(int value) {
        return new SexpAtom(Integer.toString(value));
    }

    public static SexpAtom of(BigDecimal value) {
        return new SexpAtom(formatNumber(value));
    }

    /**
     * Formats a number without exponent and without trailing zeros, e.g. 5.080
     * becomes "5.08" and 0.00 becomes "0".
     * @param value The number to format.
     * @return The plain string form.
     */
    public static String formatNumber(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    public String getValue() {
        return value;
    }

    public boolean isQuoted() {
        return quoted;
    }

    /**
     * Checks if the value of this atom parses as a decimal number. Quoted atoms
     * are strings and are never treated as numbers.
     * @return True if the atom is an unquoted number.
     */
    public boolean isNumber() {
        return getNumberValue() != null;
    }

    /**
     * Gets the numeric interpretation of this atom.
     * @return The number, or null if this atom is quoted or not numeric.
     */
    public BigDecimal getNumberValue() {
        if (!numberParsed) {
            numberParsed = true;
            if (!quoted && looksNumeric(value)) {
                try {
                    numberValue = new BigDecimal(value);
                } catch (NumberFormatException e) {
                    numberValue = null;
                }
            }
        }
        return numberValue;
    }

    /**
     * Gets the integer interpretation of this atom.
     * @return The integer value, or null if the atom is not an integral number.
     */
    public Integer getIntValue() {
        BigDecimal n = getNumberValue();
        if (n == null) {
            n = parseQuotedNumber();
        }
        if (n == null) return null;
        try {
            return n.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private BigDecimal parseQuotedNumber() {
        if (!looksNumeric(value)) return null;
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean looksNumeric(String s) {
        if (s.isEmpty()) return false;
        char c = s.charAt(0);
        return Character.isDigit(c) || ((c == '-' || c == '+' || c == '.') && s.length() > 1);
    }

    @Override
    public boolean isAtom() {
        return true;
    }

    @Override
    public SexpAtom copy() {
        return new SexpAtom(value, quoted);
    }

    @Override
    protected void appendCanonical(StringBuilder sb) {
        BigDecimal n = getNumberValue();
        sb.append(n == null ? value : formatNumber(n));
    }

    /**
     * Atoms are equal when their values are equal. Two numbers compare by
     * magnitude, two non-numbers by exact text (quoting is ignored), and a
     * number never equals a non-number.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SexpAtom other = (SexpAtom) o;
        BigDecimal n = getNumberValue();
        BigDecimal otherN = other.getNumberValue();
        if (n != null && otherN != null) {
            return n.compareTo(otherN) == 0;
        }
        if (n != null || otherN != null) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        BigDecimal n = getNumberValue();
        if (n != null) {
            return 31 * formatNumber(n).hashCode() + 1;
        }
        return value.hashCode();
    }
}
