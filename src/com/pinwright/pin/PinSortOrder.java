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

import java.util.Comparator;

/**
 * The orders pins can be arranged in along a side.
 */
public enum PinSortOrder {
    /** Order of the rows in the input. */
    ROW("row"),
    /** Natural order of pin numbers; spacers go last. */
    NUM("num"),
    /** Natural order of pin names. */
    NAME("name");

    private final String token;

    private PinSortOrder(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * @param reverse Reverse the order. Pins that compare equal keep their
     * relative order either way.
     * @return A comparator implementing this order.
     */
    public Comparator<PinRecord> comparator(boolean reverse) {
        Comparator<PinRecord> c;
        switch (this) {
            case NUM:
                c = Comparator.comparing(p -> MixedStringKey.of(p.getNumber()));
                break;
            case NAME:
                c = Comparator.comparing(p -> MixedStringKey.of(p.getName()));
                break;
            case ROW:
            default:
                c = Comparator.comparingInt(PinRecord::getRowIndex);
        }
        return reverse ? c.reversed() : c;
    }

    public static PinSortOrder fromString(String value) {
        String v = value.trim().toLowerCase();
        for (PinSortOrder o : values()) {
            if (o.token.equals(v)) {
                return o;
            }
        }
        throw new IllegalArgumentException("Invalid sort order: " + value + ", use row, num or name");
    }

    @Override
    public String toString() {
        return token;
    }
}
