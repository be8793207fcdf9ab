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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Electrical type of a pin as written in symbol files, together with the
 * spellings accepted in row files.
 */
public enum PinElectricalType {
    INPUT("input", "inp", "in", "clk"),
    OUTPUT("output", "out", "outp"),
    BIDIRECTIONAL("bidirectional", "bidir", "bi", "inout", "io", "iop"),
    TRI_STATE("tri_state", "tri-state", "tri", "tristate"),
    PASSIVE("passive", "pass"),
    FREE("free"),
    UNSPECIFIED("unspecified", "un", "analog"),
    POWER_IN("power_in", "pwr_in", "pwrin", "power", "pwr", "ground", "gnd"),
    POWER_OUT("power_out", "pwr_out", "pwrout", "pwr_o"),
    OPEN_COLLECTOR("open_collector", "opencollector", "open_coll", "opencoll", "oc"),
    OPEN_EMITTER("open_emitter", "openemitter", "open_emit", "openemit", "oe"),
    NO_CONNECT("no_connect", "noconnect", "no_conn", "noconn", "nc");

    private final String token;

    private final List<String> aliases;

    private static final Map<String, PinElectricalType> lookup;

    static {
        lookup = new HashMap<>();
        for (PinElectricalType t : values()) {
            lookup.put(t.token, t);
            for (String alias : t.aliases) {
                lookup.put(alias, t);
            }
        }
    }

    private PinElectricalType(String token, String... aliases) {
        this.token = token;
        this.aliases = Collections.unmodifiableList(Arrays.asList(aliases));
    }

    /**
     * @return The name of this type in symbol files, e.g. "power_in".
     */
    public String getToken() {
        return token;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public boolean isPower() {
        return this == POWER_IN || this == POWER_OUT;
    }

    /**
     * Checks if pins of this type may be collapsed into one pin at the given
     * bundle level. Level 1 bundles power pins, level 2 and above also bundles
     * no-connect pins.
     * @param level The bundle level, 0 disables bundling.
     * @return True if the type is eligible.
     */
    public boolean isBundleable(int level) {
        if (level <= 0) return false;
        return isPower() || (level > 1 && this == NO_CONNECT);
    }

    /**
     * Looks up a type by its name or one of its aliases, ignoring case and
     * surrounding whitespace.
     * @param value The text to interpret.
     * @return The matching type.
     * @throws IllegalArgumentException if nothing matches.
     */
    public static PinElectricalType fromString(String value) {
        PinElectricalType t = lookup.get(value.trim().toLowerCase());
        if (t == null) {
            throw new IllegalArgumentException("Invalid value for type: " + value);
        }
        return t;
    }

    @Override
    public String toString() {
        return token;
    }
}
