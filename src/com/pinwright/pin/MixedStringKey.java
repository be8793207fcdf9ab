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

package com.pinwright.pin;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sort key for pin numbers and names that orders embedded numbers by value,
 * e.g. "A2" before "A10". A string is split into alternating runs of
 * non-digits and digits; a string that starts with a digit gets an empty
 * leading text run so that it sorts before any string starting with a letter.
 * The wildcard "*" sorts after everything else.
 */
public final class MixedStringKey implements Comparable<MixedStringKey> {

    public static final String WILDCARD = "*";

    private static final MixedStringKey LAST = new MixedStringKey(Collections.emptyList(), true);

    /** Text runs are Strings, digit runs are BigIntegers, alternating from a text run. */
    private final List<Object> components;

    private final boolean last;

    private MixedStringKey(List<Object> components, boolean last) {
        this.components = components;
        this.last = last;
    }

    /**
     * Builds the key for a string.
     * @param s The pin number or name.
     * @return The key.
     */
    public static MixedStringKey of(String s) {
        if (WILDCARD.equals(s)) {
            return LAST;
        }
        List<Object> parts = new ArrayList<>();
        if (s.isEmpty()) {
            parts.add(s);
            return new MixedStringKey(parts, false);
        }
        if (Character.isDigit(s.charAt(0))) {
            // Keeps text runs at even positions
            parts.add("");
        }
        int start = 0;
        boolean numeric = Character.isDigit(s.charAt(0));
        for (int i = 1; i <= s.length(); i++) {
            if (i == s.length() || Character.isDigit(s.charAt(i)) != numeric) {
                String run = s.substring(start, i);
                if (numeric) {
                    try {
                        parts.add(new BigInteger(run));
                    } catch (NumberFormatException e) {
                        return wholeToken(s);
                    }
                } else {
                    parts.add(run);
                }
                start = i;
                numeric = !numeric;
            }
        }
        return new MixedStringKey(parts, false);
    }

    private static MixedStringKey wholeToken(String s) {
        List<Object> parts = new ArrayList<>();
        parts.add(s);
        return new MixedStringKey(parts, false);
    }

    public boolean isWildcard() {
        return last;
    }

    List<Object> getComponents() {
        return Collections.unmodifiableList(components);
    }

    @Override
    public int compareTo(MixedStringKey o) {
        if (last || o.last) {
            return Boolean.compare(last, o.last);
        }
        int n = Math.min(components.size(), o.components.size());
        for (int i = 0; i < n; i++) {
            Object a = components.get(i);
            Object b = o.components.get(i);
            int c;
            if (a instanceof BigInteger && b instanceof BigInteger) {
                c = ((BigInteger) a).compareTo((BigInteger) b);
            } else if (a instanceof String && b instanceof String) {
                c = ((String) a).compareTo((String) b);
            } else {
                // Only reachable through the whole-token fallback; text sorts first
                c = a instanceof String ? -1 : 1;
            }
            if (c != 0) return c;
        }
        return Integer.compare(components.size(), o.components.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MixedStringKey k = (MixedStringKey) o;
        return last == k.last && components.equals(k.components);
    }

    @Override
    public int hashCode() {
        return 31 * components.hashCode() + (last ? 1 : 0);
    }

    @Override
    public String toString() {
        return last ? "(*)" : components.toString();
    }
}
