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

package com.pinwright.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.pinwright.pin.PinRecord;

/**
 * Everything read about one part: its name, the property rows given for it
 * and its pins in row order.
 */
public class PartDefinition {

    private final String name;

    private final Map<String, String> properties;

    private final List<PinRecord> pins;

    /**
     * @param name The part name.
     * @param properties Property labels as written in the input (e.g. "ref",
     * "Footprint" or "MPN*") mapped to their values, in input order.
     * @param pins The pins in row order.
     */
    public PartDefinition(String name, Map<String, String> properties, List<PinRecord> pins) {
        this.name = name;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.pins = Collections.unmodifiableList(new ArrayList<>(pins));
    }

    public PartDefinition(String name, List<PinRecord> pins) {
        this(name, Collections.emptyMap(), pins);
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public List<PinRecord> getPins() {
        return pins;
    }

    @Override
    public String toString() {
        return name + " (" + pins.size() + " pins)";
    }
}
