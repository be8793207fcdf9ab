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

import com.pinwright.pin.PinRecord;
import com.pinwright.pin.PinSide;

/**
 * A pin with the grid position of its connection point.
 */
public class PlacedPin {

    private final PinRecord pin;

    private final int x;

    private final int y;

    private final PinSide side;

    public PlacedPin(PinRecord pin, int x, int y, PinSide side) {
        this.pin = pin;
        this.x = x;
        this.y = y;
        this.side = side;
    }

    public PinRecord getPin() {
        return pin;
    }

    /** @return X of the connection point in grid units. */
    public int getX() {
        return x;
    }

    /** @return Y of the connection point in grid units. */
    public int getY() {
        return y;
    }

    public PinSide getSide() {
        return side;
    }

    public int getOrientation() {
        return side.getOrientation();
    }

    @Override
    public String toString() {
        return pin + " @(" + x + "," + y + ")";
    }
}
