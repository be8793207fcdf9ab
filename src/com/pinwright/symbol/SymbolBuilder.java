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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.pinwright.layout.Grid;
import com.pinwright.layout.PlacedPin;
import com.pinwright.layout.SymbolLayoutEngine;
import com.pinwright.layout.TextMetrics;
import com.pinwright.layout.UnitLayout;
import com.pinwright.pin.PinRecord;
import com.pinwright.pin.UnitPins;
import com.pinwright.sexp.SexpAtom;
import com.pinwright.sexp.SexpList;

/**
 * Builds the symbol tree of a part. Pins are grouped and ordered by a
 * {@link com.pinwright.pin.PinGrouper}, every unit is laid out by a
 * {@link SymbolLayoutEngine}, and the result is assembled into a
 * {@code (symbol ...)} list holding the part's properties and one child symbol
 * per unit.
 */
public class SymbolBuilder {

    public static final String DEFAULT_REFERENCE = "U";

    public static final BigDecimal FONT_SIZE = new BigDecimal("1.27");

    public static final BigDecimal STROKE_WIDTH = new BigDecimal("0.254");

    private static final BigDecimal HALF_FONT = FONT_SIZE.divide(BigDecimal.valueOf(2));

    /** Property labels accepted in row files, lower case, mapped to their names in symbols. */
    private static final Map<String, String> PROPERTY_ALIASES;

    static {
        PROPERTY_ALIASES = new HashMap<>();
        PROPERTY_ALIASES.put("reference", "Reference");
        PROPERTY_ALIASES.put("ref", "Reference");
        PROPERTY_ALIASES.put("value", "Value");
        PROPERTY_ALIASES.put("val", "Value");
        PROPERTY_ALIASES.put("footprint", "Footprint");
        PROPERTY_ALIASES.put("fp", "Footprint");
        PROPERTY_ALIASES.put("datasheet", "Datasheet");
        PROPERTY_ALIASES.put("description", "Description");
        PROPERTY_ALIASES.put("desc", "Description");
        PROPERTY_ALIASES.put("ki_keywords", "ki_keywords");
        PROPERTY_ALIASES.put("keywords", "ki_keywords");
        PROPERTY_ALIASES.put("ki_locked", "ki_locked");
        PROPERTY_ALIASES.put("locked", "ki_locked");
        PROPERTY_ALIASES.put("ki_fp_filters", "ki_fp_filters");
        PROPERTY_ALIASES.put("filters", "ki_fp_filters");
        PROPERTY_ALIASES.put("fp_filters", "ki_fp_filters");
    }

    private final SymbolOptions options;

    public SymbolBuilder(SymbolOptions options) {
        this.options = options;
    }

    public SymbolBuilder() {
        this(new SymbolOptions());
    }

    public SymbolOptions getOptions() {
        return options;
    }

    /**
     * Maps a property label from a row file to the property name used in
     * symbols.
     * @param label The label, without its trailing colon.
     * @return The standard property name, or null if the label names a
     * custom property.
     */
    public static String canonicalPropertyName(String label) {
        return PROPERTY_ALIASES.get(label.trim().toLowerCase());
    }

    private static class Property {
        String value;
        final BigDecimal yOffset;
        final String justify;
        final boolean hide;

        Property(String value, BigDecimal yOffset, String justify, boolean hide) {
            this.value = value;
            this.yOffset = yOffset;
            this.justify = justify;
            this.hide = hide;
        }
    }

    private Map<String, Property> collectProperties(PartDefinition part) {
        String justify = options.getJustify();
        Map<String, Property> props = new LinkedHashMap<>();
        props.put("Reference", new Property(DEFAULT_REFERENCE, new BigDecimal("2.5").multiply(Grid.PITCH_MM),
                justify, false));
        props.put("Value", new Property(part.getName(), new BigDecimal("0.5").multiply(Grid.PITCH_MM),
                justify, false));
        props.put("Footprint", new Property("", BigDecimal.ZERO, "right", true));
        props.put("Datasheet", new Property("", BigDecimal.ZERO, "right", true));
        props.put("Description", new Property("", BigDecimal.ZERO, "left", true));
        props.put("ki_keywords", new Property("", BigDecimal.ZERO, "left", true));
        props.put("ki_locked", new Property("", BigDecimal.ZERO, "left", true));
        props.put("ki_fp_filters", new Property("", BigDecimal.ZERO, "left", true));

        int customCount = 0;
        for (Map.Entry<String, String> e : part.getProperties().entrySet()) {
            String label = e.getKey().trim();
            String value = e.getValue() == null ? "" : e.getValue().trim();
            String name = canonicalPropertyName(label);
            if (name == null) {
                // Custom properties go below the body; a '*' in the label hides them
                if (label.contains("*")) {
                    name = label.replace("*", "");
                    props.put(name, new Property(value, BigDecimal.ZERO, justify, true));
                } else {
                    name = label;
                    BigDecimal y = Grid.PITCH_MM.multiply(BigDecimal.valueOf(customCount * 2L).add(new BigDecimal("0.5")))
                            .negate();
                    props.put(name, new Property(value, y, justify, false));
                    customCount++;
                }
            } else {
                props.get(name).value = value;
            }
        }
        return props;
    }

    /**
     * Builds the symbol of a part.
     * @param part The part.
     * @return The {@code (symbol ...)} tree.
     * @throws InvalidPartNameException if the part name is blank.
     * @throws IllegalArgumentException if the part has no real pins.
     */
    public SexpList buildSymbol(PartDefinition part) {
        String partName = part.getName() == null ? "" : part.getName().trim();
        if (partName.isEmpty()) {
            throw new InvalidPartNameException("Invalid part name in symbol rows");
        }
        Map<String, UnitPins> units = options.createGrouper().arrange(part.getPins());
        boolean hasRealPin = false;
        for (UnitPins unit : units.values()) {
            hasRealPin |= !unit.getRealPins().isEmpty();
        }
        if (!hasRealPin) {
            throw new IllegalArgumentException("No valid pins defined for part " + partName
                    + " (all pins are placeholders)");
        }

        SymbolLayoutEngine engine = new SymbolLayoutEngine(options.getLayout());
        List<PinRecord> allPins = new ArrayList<>();
        for (UnitPins unit : units.values()) {
            allPins.addAll(unit.getRealPins());
        }
        int pinLength = engine.computePinLength(allPins);

        List<UnitLayout> layouts = new ArrayList<>();
        int ordinal = 1;
        for (UnitPins unit : units.values()) {
            layouts.add(engine.layoutUnit(unit, ordinal++, pinLength));
        }

        SexpList symbol = SexpList.of(SymbolTags.SYMBOL, SexpAtom.quoted(partName));
        if (options.getLayout().isHidePinNumbers()) {
            symbol.add(SexpList.of(SymbolTags.PIN_NUMBERS, SexpList.of(SymbolTags.HIDE, SymbolTags.YES)));
        }
        symbol.add(SexpList.of(SymbolTags.EXCLUDE_FROM_SIM, SymbolTags.NO));
        symbol.add(SexpList.of(SymbolTags.IN_BOM, SymbolTags.YES));
        symbol.add(SexpList.of(SymbolTags.ON_BOARD, SymbolTags.YES));

        addProperties(symbol, collectProperties(part), layouts);

        for (UnitLayout layout : layouts) {
            symbol.add(buildUnit(partName, layout, units.size() > 1));
        }
        symbol.add(SexpList.of(SymbolTags.EMBEDDED_FONTS, SymbolTags.NO));
        return symbol;
    }

    /**
     * Places the properties at the top-left corner of the union of all unit
     * bodies so they clear every unit.
     */
    private void addProperties(SexpList symbol, Map<String, Property> props, List<UnitLayout> layouts) {
        int left = Integer.MAX_VALUE;
        int top = Integer.MIN_VALUE;
        int bottom = Integer.MAX_VALUE;
        for (UnitLayout u : layouts) {
            left = Math.min(left, u.getX0());
            top = Math.max(top, u.getY1());
            bottom = Math.min(bottom, u.getY0());
        }
        BigDecimal tlX = Grid.toMm(left);
        BigDecimal tlY = Grid.toMm(top);
        BigDecimal brY = Grid.toMm(bottom);
        for (Map.Entry<String, Property> e : props.entrySet()) {
            Property p = e.getValue();
            BigDecimal anchorY = p.yOffset.signum() >= 0 ? tlY.add(HALF_FONT) : brY.subtract(HALF_FONT);
            symbol.add(SexpList.of(SymbolTags.PROPERTY, SexpAtom.quoted(e.getKey()), SexpAtom.quoted(p.value),
                    SexpList.of(SymbolTags.AT, tlX, anchorY.add(p.yOffset), 0),
                    SexpList.of(SymbolTags.EFFECTS, font(),
                            SexpList.of(SymbolTags.JUSTIFY, p.justify),
                            SexpList.of(SymbolTags.HIDE, p.hide ? SymbolTags.YES : SymbolTags.NO))));
        }
    }

    private static SexpList font() {
        return SexpList.of(SymbolTags.FONT, SexpList.of(SymbolTags.SIZE, FONT_SIZE, FONT_SIZE));
    }

    /**
     * @param partName Name of the part.
     * @param ordinal Position of the unit, starting at 1.
     * @return Name of the unit's child symbol.
     */
    public static String unitSymbolName(String partName, int ordinal) {
        return partName + "_" + ordinal + "_1";
    }

    private SexpList buildUnit(String partName, UnitLayout layout, boolean multiUnit) {
        SexpList unit = SexpList.of(SymbolTags.SYMBOL, SexpAtom.quoted(unitSymbolName(partName, layout.getOrdinal())));
        if (multiUnit && !PinRecord.DEFAULT_UNIT_ID.equals(layout.getUnitId())) {
            unit.add(SexpList.of(SymbolTags.UNIT_NAME, SexpAtom.quoted(layout.getUnitId())));
        }
        unit.add(SexpList.of(SymbolTags.RECTANGLE,
                SexpList.of(SymbolTags.START, Grid.toMm(layout.getX0()), Grid.toMm(layout.getY0())),
                SexpList.of(SymbolTags.END, Grid.toMm(layout.getX1()), Grid.toMm(layout.getY1())),
                SexpList.of(SymbolTags.STROKE, SexpList.of(SymbolTags.WIDTH, STROKE_WIDTH),
                        SexpList.of(SymbolTags.TYPE, "solid")),
                SexpList.of(SymbolTags.FILL, SexpList.of(SymbolTags.TYPE, "background"))));
        if (options.isDebugLayout()) {
            addDebugOutlines(unit, layout);
        }
        for (PlacedPin placed : layout.getPins()) {
            for (SexpList pin : buildPins(placed, layout.getPinLength())) {
                unit.add(pin);
            }
        }
        return unit;
    }

    /**
     * Creates the pin lists for a placed pin. A bundled pin becomes one
     * visible pin with its first number followed by a hidden pin at the same
     * spot for every other number.
     * @param placed The placed pin.
     * @param pinLength Pin length in grid units.
     * @return One list per pin number.
     */
    public List<SexpList> buildPins(PlacedPin placed, int pinLength) {
        PinRecord pin = placed.getPin();
        String[] names = TextMetrics.splitAlternates(pin.getName(), options.getLayout().getAltPinDelimiter());
        List<SexpList> pins = new ArrayList<>();
        List<String> numbers = pin.getNumbers();
        for (int i = 0; i < numbers.size(); i++) {
            SexpList p = SexpList.of(SymbolTags.PIN, pin.getType().getToken(), pin.getStyle().getToken(),
                    SexpList.of(SymbolTags.AT, Grid.toMm(placed.getX()), Grid.toMm(placed.getY()),
                            placed.getOrientation()),
                    SexpList.of(SymbolTags.LENGTH, Grid.toMm(pinLength)));
            if (i > 0 || pin.isHidden()) {
                p.add(SexpList.of(SymbolTags.HIDE, SymbolTags.YES));
            }
            p.add(SexpList.of(SymbolTags.NAME, SexpAtom.quoted(names[0]), SexpList.of(SymbolTags.EFFECTS, font())));
            p.add(SexpList.of(SymbolTags.NUMBER, SexpAtom.quoted(numbers.get(i)),
                    SexpList.of(SymbolTags.EFFECTS, font())));
            for (int a = 1; a < names.length; a++) {
                p.add(SexpList.of(SymbolTags.ALTERNATE, SexpAtom.quoted(names[a]), pin.getType().getToken(),
                        pin.getStyle().getToken()));
            }
            pins.add(p);
        }
        return pins;
    }

    private static SexpList outline(int x0, int y0, int x1, int y1, String alpha) {
        return SexpList.of(SymbolTags.RECTANGLE,
                SexpList.of(SymbolTags.START, Grid.toMm(x0), Grid.toMm(y0)),
                SexpList.of(SymbolTags.END, Grid.toMm(x1), Grid.toMm(y1)),
                SexpList.of(SymbolTags.STROKE, SexpList.of(SymbolTags.WIDTH, STROKE_WIDTH.divide(BigDecimal.valueOf(2))),
                        SexpList.of(SymbolTags.TYPE, "solid")),
                SexpList.of(SymbolTags.FILL, SexpList.of(SymbolTags.TYPE, SymbolTags.COLOR),
                        SexpList.of(SymbolTags.COLOR, 0, 0, 0, new BigDecimal(alpha))));
    }

    private static void addDebugOutlines(SexpList unit, UnitLayout u) {
        int x0 = u.getX0();
        int y0 = u.getY0();
        int x1 = u.getX1();
        int y1 = u.getY1();
        int lrW = u.getLrWidth();
        int lrH = u.getLrHeight();
        int tbW = u.getTbWidth();
        int tbH = u.getTbHeight();
        unit.add(outline(x0, y0 + tbH, x0 + lrW, y0 + tbH + lrH, "0.1"));
        unit.add(outline(x1, y0 + tbH, x1 - lrW, y0 + tbH + lrH, "0.1"));
        unit.add(outline(x0 + lrW, y0, x0 + lrW + tbW, y0 + tbH, "0.1"));
        unit.add(outline(x0 + lrW, y1 - tbH, x0 + lrW + tbW, y1, "0.1"));
        unit.add(outline(x0, y0, x0 + 1, y0 + 1, "0.3"));
        unit.add(outline(x1, y1, x1 - 1, y1 - 1, "0.3"));
    }
}
