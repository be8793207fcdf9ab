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
import java.util.List;
import java.util.Objects;

/**
 * One pin of a part as read from a row file. A record normally carries one
 * pin number; a bundled record carries every number of the pins it stands
 * for, with the visible number first. Spacer records mark an empty slot on a
 * side and carry no name.
 *
 * Records are immutable. Operations that change a pin, such as stripping
 * spacer markers or bundling, create new records through {@link #toBuilder()}.
 */
public class PinRecord {

    /** Pin number marker that reserves an empty slot. */
    public static final String SPACER_MARKER = "*";

    public static final PinSide DEFAULT_SIDE = PinSide.LEFT;
    public static final PinElectricalType DEFAULT_TYPE = PinElectricalType.PASSIVE;
    public static final PinGraphicStyle DEFAULT_STYLE = PinGraphicStyle.LINE;
    public static final String DEFAULT_UNIT_ID = "1";

    private final List<String> numbers;
    private final String name;
    private final PinElectricalType type;
    private final PinGraphicStyle style;
    private final PinSide side;
    private final String unit;
    private final boolean hidden;
    private final boolean spacer;
    private final int rowIndex;

    private PinRecord(Builder b) {
        if (b.numbers.isEmpty()) {
            throw new IllegalArgumentException("A pin needs at least one number");
        }
        for (String number : b.numbers) {
            if (number == null || number.trim().isEmpty()) {
                throw new IllegalArgumentException("Pin " + b.name + " has a blank pin number");
            }
        }
        this.numbers = Collections.unmodifiableList(new ArrayList<>(b.numbers));
        this.name = Objects.requireNonNull(b.name);
        this.type = Objects.requireNonNull(b.type);
        this.style = Objects.requireNonNull(b.style);
        this.side = Objects.requireNonNull(b.side);
        this.unit = Objects.requireNonNull(b.unit);
        this.hidden = b.hidden;
        this.spacer = b.spacer;
        this.rowIndex = b.rowIndex;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a spacer occupying one slot on the given side of a unit.
     * @param side Side of the spacer.
     * @param unit Unit the spacer belongs to.
     * @param rowIndex Position of the spacer on its side.
     * @return The spacer record.
     */
    public static PinRecord spacer(PinSide side, String unit, int rowIndex) {
        return builder().number(SPACER_MARKER).name("").side(side).unit(unit).rowIndex(rowIndex)
                .spacer(true).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.numbers = new ArrayList<>(numbers);
        b.name = name;
        b.type = type;
        b.style = style;
        b.side = side;
        b.unit = unit;
        b.hidden = hidden;
        b.spacer = spacer;
        b.rowIndex = rowIndex;
        return b;
    }

    /**
     * @return The visible pin number, which is the first of {@link #getNumbers()}.
     */
    public String getNumber() {
        return numbers.get(0);
    }

    public List<String> getNumbers() {
        return numbers;
    }

    public boolean isBundled() {
        return numbers.size() > 1;
    }

    public String getName() {
        return name;
    }

    public PinElectricalType getType() {
        return type;
    }

    public PinGraphicStyle getStyle() {
        return style;
    }

    public PinSide getSide() {
        return side;
    }

    public String getUnit() {
        return unit;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean isSpacer() {
        return spacer;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PinRecord p = (PinRecord) o;
        return hidden == p.hidden && spacer == p.spacer && rowIndex == p.rowIndex
                && numbers.equals(p.numbers) && name.equals(p.name) && type == p.type
                && style == p.style && side == p.side && unit.equals(p.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numbers, name, type, style, side, unit, hidden, spacer, rowIndex);
    }

    @Override
    public String toString() {
        if (spacer) {
            return "<spacer " + side + " unit " + unit + ">";
        }
        return (numbers.size() == 1 ? numbers.get(0) : numbers.toString()) + ":" + name
                + " (" + type + ", " + style + ", " + side + ", unit " + unit
                + (hidden ? ", hidden" : "") + ")";
    }

    /**
     * Collects pin attributes. Any attribute not set keeps its default: side
     * left, type passive, style line, unit "1", visible.
     */
    public static class Builder {
        private List<String> numbers = new ArrayList<>();
        private String name = "";
        private PinElectricalType type = DEFAULT_TYPE;
        private PinGraphicStyle style = DEFAULT_STYLE;
        private PinSide side = DEFAULT_SIDE;
        private String unit = DEFAULT_UNIT_ID;
        private boolean hidden;
        private boolean spacer;
        private int rowIndex;

        private Builder() {
        }

        public Builder number(String number) {
            this.numbers = new ArrayList<>();
            this.numbers.add(Objects.requireNonNull(number));
            return this;
        }

        public Builder numbers(List<String> numbers) {
            this.numbers = new ArrayList<>(numbers);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(PinElectricalType type) {
            this.type = type;
            return this;
        }

        public Builder style(PinGraphicStyle style) {
            this.style = style;
            return this;
        }

        public Builder side(PinSide side) {
            this.side = side;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder hidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public Builder spacer(boolean spacer) {
            this.spacer = spacer;
            return this;
        }

        public Builder rowIndex(int rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public PinRecord build() {
            return new PinRecord(this);
        }
    }
}
