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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The pins of one unit of a part, kept as one ordered list per side.
 */
public class UnitPins {

    private final String unitId;

    private final Map<PinSide, List<PinRecord>> sides;

    public UnitPins(String unitId) {
        this.unitId = unitId;
        this.sides = new EnumMap<>(PinSide.class);
        for (PinSide side : PinSide.values()) {
            sides.put(side, new ArrayList<>());
        }
    }

    public String getUnitId() {
        return unitId;
    }

    public void add(PinRecord pin) {
        sides.get(pin.getSide()).add(pin);
    }

    /**
     * @param side The side.
     * @return The pins on the side in placement order. Never null.
     */
    public List<PinRecord> getPins(PinSide side) {
        return Collections.unmodifiableList(sides.get(side));
    }

    public void setPins(PinSide side, List<PinRecord> pins) {
        sides.put(side, new ArrayList<>(pins));
    }

    /**
     * @return Number of slots used on all sides, spacers included.
     */
    public int getSlotCount() {
        int count = 0;
        for (List<PinRecord> pins : sides.values()) {
            count += pins.size();
        }
        return count;
    }

    /**
     * @return All pins of the unit, spacers excluded, side by side.
     */
    public List<PinRecord> getRealPins() {
        List<PinRecord> pins = new ArrayList<>();
        for (List<PinRecord> sidePins : sides.values()) {
            for (PinRecord p : sidePins) {
                if (!p.isSpacer()) pins.add(p);
            }
        }
        return pins;
    }

    @Override
    public String toString() {
        return "unit " + unitId + " " + sides;
    }
}
