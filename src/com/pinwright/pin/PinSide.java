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

/**
 * The side of a symbol body a pin sticks out of. Each side carries the pin
 * orientation (in degrees) that makes the open end of the pin face away from
 * the body.
 */
public enum PinSide {
    LEFT("left", "l", 0),
    RIGHT("right", "r", 180),
    TOP("top", "t", 270),
    BOTTOM("bottom", "b", 90);

    private final String token;

    private final String shortName;

    private final int orientation;

    private PinSide(String token, String shortName, int orientation) {
        this.token = token;
        this.shortName = shortName;
        this.orientation = orientation;
    }

    public String getToken() {
        return token;
    }

    public int getOrientation() {
        return orientation;
    }

    /**
     * @return True for left and right, whose pins are stacked vertically.
     */
    public boolean isVertical() {
        return this == LEFT || this == RIGHT;
    }

    public static PinSide fromString(String value) {
        String v = value.trim().toLowerCase();
        for (PinSide side : values()) {
            if (side.token.equals(v) || side.shortName.equals(v)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Invalid value for side: " + value);
    }

    /**
     * Gets the side whose pins have the given orientation.
     * @param orientation Pin angle in degrees; 0, 90, 180 or 270 (modulo 360).
     * @return The side.
     * @throws IllegalArgumentException for any other angle.
     */
    public static PinSide fromOrientation(int orientation) {
        int o = ((orientation % 360) + 360) % 360;
        for (PinSide side : values()) {
            if (side.orientation == o) {
                return side;
            }
        }
        throw new IllegalArgumentException("No side has pin orientation " + orientation);
    }

    @Override
    public String toString() {
        return token;
    }
}
