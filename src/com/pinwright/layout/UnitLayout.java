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

import java.util.Collections;
import java.util.List;

/**
 * The computed geometry of one unit: its body rectangle, the sizes of the pin
 * regions along each side and the position of every pin. All values are in
 * grid units with the origin at the body center and y pointing up.
 */
public class UnitLayout {

    private final String unitId;

    private final int ordinal;

    private final int width;
    private final int height;

    private final int x0;
    private final int y0;
    private final int x1;
    private final int y1;

    private final int lrWidth;
    private final int lrHeight;
    private final int tbWidth;
    private final int tbHeight;

    private final int pinLength;

    private final List<PlacedPin> pins;

    UnitLayout(String unitId, int ordinal, int width, int height, int lrWidth, int lrHeight,
               int tbWidth, int tbHeight, int pinLength, List<PlacedPin> pins) {
        this.unitId = unitId;
        this.ordinal = ordinal;
        this.width = width;
        this.height = height;
        this.x0 = Grid.gridify(-width / 2.0);
        this.y0 = Grid.gridify(-height / 2.0);
        this.x1 = Grid.gridify(width / 2.0);
        this.y1 = Grid.gridify(height / 2.0);
        this.lrWidth = lrWidth;
        this.lrHeight = lrHeight;
        this.tbWidth = tbWidth;
        this.tbHeight = tbHeight;
        this.pinLength = pinLength;
        this.pins = Collections.unmodifiableList(pins);
    }

    public String getUnitId() {
        return unitId;
    }

    /** @return Position of the unit within its part, starting at 1. */
    public int getOrdinal() {
        return ordinal;
    }

    /** @return Body width before snapping the corners to the grid. */
    public int getWidth() {
        return width;
    }

    /** @return Body height before snapping the corners to the grid. */
    public int getHeight() {
        return height;
    }

    /** @return Left edge of the body. */
    public int getX0() {
        return x0;
    }

    /** @return Bottom edge of the body. */
    public int getY0() {
        return y0;
    }

    /** @return Right edge of the body. */
    public int getX1() {
        return x1;
    }

    /** @return Top edge of the body. */
    public int getY1() {
        return y1;
    }

    public int getLrWidth() {
        return lrWidth;
    }

    public int getLrHeight() {
        return lrHeight;
    }

    public int getTbWidth() {
        return tbWidth;
    }

    public int getTbHeight() {
        return tbHeight;
    }

    public int getPinLength() {
        return pinLength;
    }

    /**
     * @return The placed pins side by side, spacers excluded.
     */
    public List<PlacedPin> getPins() {
        return pins;
    }

    @Override
    public String toString() {
        return "unit " + unitId + " [" + x0 + "," + y0 + " .. " + x1 + "," + y1 + "] " + pins.size() + " pins";
    }
}
