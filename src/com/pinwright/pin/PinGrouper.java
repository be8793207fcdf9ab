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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pinwright.util.StringTools;

/**
 * Turns the pin rows of one part into per-unit, per-side pin sequences ready
 * for placement. For every side of every unit the pins go through spacer
 * expansion, optional bundling and sorting, in that order.
 */
public class PinGrouper {

    private PinSortOrder sortOrder = PinSortOrder.ROW;

    private boolean reverse;

    private int bundleLevel;

    private BundleStyle bundleStyle = BundleStyle.COUNT;

    public PinGrouper() {
    }

    public PinGrouper(PinSortOrder sortOrder, boolean reverse, int bundleLevel, BundleStyle bundleStyle) {
        this.sortOrder = sortOrder;
        this.reverse = reverse;
        this.bundleLevel = bundleLevel;
        this.bundleStyle = bundleStyle;
    }

    public PinSortOrder getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(PinSortOrder sortOrder) {
        this.sortOrder = sortOrder;
    }

    public boolean isReverse() {
        return reverse;
    }

    public void setReverse(boolean reverse) {
        this.reverse = reverse;
    }

    public int getBundleLevel() {
        return bundleLevel;
    }

    public void setBundleLevel(int bundleLevel) {
        this.bundleLevel = bundleLevel;
    }

    public BundleStyle getBundleStyle() {
        return bundleStyle;
    }

    public void setBundleStyle(BundleStyle bundleStyle) {
        this.bundleStyle = bundleStyle;
    }

    /**
     * Groups the pins of a part by unit and side and arranges each side.
     * @param pins Pins of one part in row order.
     * @return Units in order of first appearance.
     */
    public Map<String, UnitPins> arrange(List<PinRecord> pins) {
        Map<String, UnitPins> units = groupByUnit(pins);
        for (UnitPins unit : units.values()) {
            for (PinSide side : PinSide.values()) {
                List<PinRecord> sidePins = insertSpacers(unit.getPins(side));
                sidePins = bundle(sidePins, bundleLevel, bundleStyle);
                sidePins.sort(sortOrder.comparator(reverse));
                unit.setPins(side, sidePins);
            }
        }
        return units;
    }

    /**
     * Splits pins into units, keeping the input order within every side.
     * @param pins The pins of a part.
     * @return Units keyed by id, in order of first appearance.
     */
    public static Map<String, UnitPins> groupByUnit(List<PinRecord> pins) {
        Map<String, UnitPins> units = new LinkedHashMap<>();
        for (PinRecord pin : pins) {
            units.computeIfAbsent(pin.getUnit(), UnitPins::new).add(pin);
        }
        return units;
    }

    /**
     * Expands leading spacer markers in pin numbers. A number such as "**1"
     * becomes two spacers followed by pin "1", and "***" becomes three spacers
     * and no pin. Row indexes of the result count up from zero.
     * @param pins The pins of one side of one unit.
     * @return The expanded pins.
     */
    public static List<PinRecord> insertSpacers(List<PinRecord> pins) {
        List<PinRecord> expanded = new ArrayList<>();
        int rowIndex = 0;
        for (PinRecord pin : pins) {
            if (pin.isSpacer()) {
                expanded.add(pin.toBuilder().rowIndex(rowIndex++).build());
                continue;
            }
            String number = pin.getNumber();
            int stars = StringTools.countLeading(number, PinRecord.SPACER_MARKER.charAt(0));
            for (int i = 0; i < stars; i++) {
                expanded.add(PinRecord.spacer(pin.getSide(), pin.getUnit(), rowIndex++));
            }
            if (stars < number.length()) {
                List<String> numbers = new ArrayList<>(pin.getNumbers());
                numbers.set(0, number.substring(stars));
                expanded.add(pin.toBuilder().numbers(numbers).rowIndex(rowIndex++).build());
            }
        }
        return expanded;
    }

    /**
     * Collapses same-named pins into one pin carrying all their numbers. A
     * group of pins sharing a name is collapsed only when all its members
     * have the same electrical type and that type is eligible at the given
     * level (see {@link PinElectricalType#isBundleable(int)}). The bundled pin
     * takes the place and row index of the group's first member; its numbers
     * are in natural order so the visible number does not depend on row order.
     * Spacers are never bundled.
     * @param pins The pins of one side of one unit.
     * @param level Bundle level, 0 for none.
     * @param style How the bundle size is added to the name.
     * @return The pins after bundling.
     */
    public static List<PinRecord> bundle(List<PinRecord> pins, int level, BundleStyle style) {
        if (level <= 0) {
            return new ArrayList<>(pins);
        }
        Map<String, List<PinRecord>> byName = new LinkedHashMap<>();
        for (PinRecord pin : pins) {
            if (!pin.isSpacer()) {
                byName.computeIfAbsent(pin.getName(), k -> new ArrayList<>()).add(pin);
            }
        }
        Set<String> emitted = new HashSet<>();
        List<PinRecord> result = new ArrayList<>();
        for (PinRecord pin : pins) {
            if (pin.isSpacer()) {
                result.add(pin);
                continue;
            }
            List<PinRecord> group = byName.get(pin.getName());
            if (!isBundleable(group, level)) {
                result.add(pin);
            } else if (emitted.add(pin.getName())) {
                result.add(makeBundle(group, style));
            }
        }
        return result;
    }

    private static boolean isBundleable(List<PinRecord> group, int level) {
        PinElectricalType type = group.get(0).getType();
        if (!type.isBundleable(level)) {
            return false;
        }
        for (PinRecord p : group) {
            if (p.getType() != type) {
                return false;
            }
        }
        return true;
    }

    private static PinRecord makeBundle(List<PinRecord> group, BundleStyle style) {
        PinRecord first = group.get(0);
        if (group.size() == 1) {
            return first;
        }
        List<String> numbers = new ArrayList<>();
        for (PinRecord p : group) {
            numbers.addAll(p.getNumbers());
        }
        numbers.sort((a, b) -> MixedStringKey.of(a).compareTo(MixedStringKey.of(b)));
        return first.toBuilder()
                .numbers(numbers)
                .name(style.apply(first.getName(), numbers.size()))
                .build();
    }
}
