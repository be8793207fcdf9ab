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

import java.util.HashMap;
import java.util.Map;

/**
 * Graphic style of a pin line, with the spellings accepted in row files.
 */
public enum PinGraphicStyle {
    LINE("line", ""),
    INVERTED("inverted", "inv", "~", "#"),
    CLOCK("clock", "clk", "rising_clk"),
    INVERTED_CLOCK("inverted_clock", "inv_clk", "clk_b", "clk_n", "~clk", "#clk"),
    INPUT_LOW("input_low", "inp_low", "in_lw", "in_b", "in_n", "~in", "#in"),
    CLOCK_LOW("clock_low", "clk_low", "clk_lw"),
    OUTPUT_LOW("output_low", "outp_low", "out_lw", "out_b", "out_n", "~out", "#out"),
    EDGE_CLOCK_HIGH("edge_clock_high"),
    NON_LOGIC("non_logic", "nl", "analog");

    private final String token;

    private final String[] aliases;

    private static final Map<String, PinGraphicStyle> lookup;

    static {
        lookup = new HashMap<>();
        for (PinGraphicStyle s : values()) {
            lookup.put(s.token, s);
            for (String alias : s.aliases) {
                lookup.putIfAbsent(alias, s);
            }
        }
    }

    private PinGraphicStyle(String token, String... aliases) {
        this.token = token;
        this.aliases = aliases;
    }

    public String getToken() {
        return token;
    }

    /**
     * Looks up a style by name or alias, ignoring case and surrounding
     * whitespace. An empty string means {@link #LINE}.
     * @param value The text to interpret.
     * @return The matching style.
     * @throws IllegalArgumentException if nothing matches.
     */
    public static PinGraphicStyle fromString(String value) {
        PinGraphicStyle s = lookup.get(value.trim().toLowerCase());
        if (s == null) {
            throw new IllegalArgumentException("Invalid value for style: " + value);
        }
        return s;
    }

    @Override
    public String toString() {
        return token;
    }
}
