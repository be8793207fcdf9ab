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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.pinwright.pin.PinRecord;
import com.pinwright.pin.PinSide;
import com.pinwright.pin.UnitPins;

/**
 * Sizes the body of a symbol unit and places its pins on the grid.
 *
 * Each side is first treated as a vertical column of pins: its width is the
 * widest pin name plus the name offset and its height is one pin height per
 * slot. The top and bottom columns are then turned on their sides. In the
 * normal arrangement the left and right columns stand beside the top and
 * bottom rows; with scrunch the columns are tucked underneath the rows, which
 * makes the body narrower and taller.
 */
public class SymbolLayoutEngine {

    private final LayoutOptions options;

    public SymbolLayoutEngine(LayoutOptions options) {
        this.options = options;
    }

    public SymbolLayoutEngine() {
        this(new LayoutOptions());
    }

    public LayoutOptions getOptions() {
        return options;
    }

    /**
     * Computes the pin length shared by all units of a part: the width of the
     * longest pin number plus two characters, at least
     * {@link Grid#MIN_PIN_LENGTH}, rounded up to the grid. With hidden pin
     * numbers the minimum length is used.
     * @param pins All pins of the part.
     * @return Pin length in grid units.
     */
    public int computePinLength(Collection<PinRecord> pins) {
        if (options.isHidePinNumbers()) {
            return Grid.MIN_PIN_LENGTH;
        }
        double longest = 0;
        for (PinRecord pin : pins) {
            if (pin.isSpacer()) continue;
            for (String number : pin.getNumbers()) {
                longest = Math.max(longest, TextMetrics.textWidth(number + "  "));
            }
        }
        double units = Math.max(Grid.mmToUnits(longest), Grid.MIN_PIN_LENGTH);
        return Grid.gridify(units, Grid.Rounding.UP);
    }

    private double columnWidth(List<PinRecord> pins) {
        double width = 0;
        for (PinRecord pin : pins) {
            if (pin.isSpacer()) continue;
            double w = TextMetrics.textWidth(pin.getName(), options.getAltPinDelimiter()) + Grid.PIN_NAME_OFFSET_MM;
            width = Math.max(width, Grid.mmToUnits(w));
        }
        return width;
    }

    /**
     * Lays out one unit.
     * @param unit The arranged pins of the unit.
     * @param ordinal Position of the unit within its part, starting at 1.
     * @param pinLength Pin length in grid units.
     * @return The unit geometry.
     */
    public UnitLayout layoutUnit(UnitPins unit, int ordinal, int pinLength) {
        Map<PinSide, Double> nameSpan = new EnumMap<>(PinSide.class);
        Map<PinSide, Integer> slotSpan = new EnumMap<>(PinSide.class);
        for (PinSide side : PinSide.values()) {
            List<PinRecord> pins = unit.getPins(side);
            nameSpan.put(side, columnWidth(pins));
            slotSpan.put(side, pins.size() * Grid.PIN_HEIGHT);
        }

        int lrHeight = Grid.gridify(Math.max(slotSpan.get(PinSide.LEFT), slotSpan.get(PinSide.RIGHT)),
                Grid.Rounding.UP);
        int lrWidth = Grid.gridify(max(nameSpan.get(PinSide.LEFT), nameSpan.get(PinSide.RIGHT),
                Grid.SIDE_CLEARANCE), Grid.Rounding.UP);
        int tbHeight = Grid.gridify(max(nameSpan.get(PinSide.TOP), nameSpan.get(PinSide.BOTTOM),
                Grid.SIDE_CLEARANCE), Grid.Rounding.UP);
        int tbWidth = Grid.gridify(Math.max(slotSpan.get(PinSide.TOP), slotSpan.get(PinSide.BOTTOM)),
                Grid.Rounding.UP);

        int width;
        int height;
        if (options.isScrunch()) {
            width = Math.max(Math.max(tbWidth + 2 * Grid.SIDE_CLEARANCE, Grid.LR_SEPARATION), 2 * lrWidth);
            height = 2 * tbHeight + lrHeight + 2 * Grid.SIDE_CLEARANCE;
        } else {
            width = 2 * Math.max(lrWidth, Grid.SIDE_CLEARANCE) + Math.max(tbWidth, Grid.LR_SEPARATION);
            height = 2 * Math.max(tbHeight, Grid.SIDE_CLEARANCE) + Math.max(lrHeight, Grid.TB_SEPARATION);
        }

        List<PlacedPin> placed = new ArrayList<>();
        UnitLayout frame = new UnitLayout(unit.getUnitId(), ordinal, width, height, lrWidth, lrHeight,
                tbWidth, tbHeight, pinLength, placed);
        for (PinSide side : PinSide.values()) {
            placeSide(frame, side, unit.getPins(side), placed);
        }
        return frame;
    }

    private static double max(double a, double b, double c) {
        return Math.max(a, Math.max(b, c));
    }

    private int offset(int span, int count) {
        return Grid.gridify(options.getPush() * (span - count * Grid.PIN_HEIGHT));
    }

    private void placeSide(UnitLayout u, PinSide side, List<PinRecord> pins, List<PlacedPin> placed) {
        int count = pins.size();
        int halfPin = Grid.PIN_HEIGHT / 2;
        boolean scrunch = options.isScrunch();
        int x;
        int y;
        int dx = 0;
        int dy = 0;
        switch (side) {
            case LEFT:
                x = u.getX0() - u.getPinLength();
                y = u.getY0() + u.getTbHeight() + u.getLrHeight() - offset(u.getLrHeight(), count) - halfPin;
                dy = -Grid.PIN_SPACING;
                break;
            case RIGHT:
                x = u.getX1() + u.getPinLength();
                if (options.isCcw()) {
                    y = u.getY0() + u.getTbHeight() + offset(u.getLrHeight(), count) + halfPin;
                    dy = Grid.PIN_SPACING;
                } else {
                    y = u.getY0() + u.getTbHeight() + u.getLrHeight() - offset(u.getLrHeight(), count) - halfPin;
                    dy = -Grid.PIN_SPACING;
                }
                break;
            case TOP:
                if (options.isCcw()) {
                    if (scrunch) {
                        x = u.getX0() + u.getWidth() - offset(u.getWidth(), count) - halfPin;
                    } else {
                        x = u.getX0() + u.getLrWidth() + u.getTbWidth() - offset(u.getTbWidth(), count) - halfPin;
                    }
                    dx = -Grid.PIN_SPACING;
                } else {
                    if (scrunch) {
                        x = u.getX0() + offset(u.getWidth(), count) + halfPin;
                    } else {
                        x = u.getX0() + u.getLrWidth() + offset(u.getTbWidth(), count) + halfPin;
                    }
                    dx = Grid.PIN_SPACING;
                }
                y = u.getY1() + u.getPinLength();
                break;
            case BOTTOM:
            default:
                if (scrunch) {
                    x = u.getX0() + offset(u.getWidth(), count) + halfPin;
                } else {
                    x = u.getX0() + u.getLrWidth() + offset(u.getTbWidth(), count) + halfPin;
                }
                y = -u.getY1() - u.getPinLength();
                dx = Grid.PIN_SPACING;
                break;
        }
        for (PinRecord pin : pins) {
            if (!pin.isSpacer()) {
                placed.add(new PlacedPin(pin, x, y, side));
            }
            x += dx;
            y += dy;
        }
    }
}
