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

import java.math.BigDecimal;

import com.pinwright.sexp.SexpAtom;

/**
 * The schematic grid. Layout works in whole grid units so that every pin end
 * and body corner lands on the grid; values are converted to millimeters only
 * when a symbol is written.
 */
public class Grid {

    /** Grid pitch in millimeters. */
    public static final BigDecimal PITCH_MM = new BigDecimal("1.27");

    public static final double PITCH = PITCH_MM.doubleValue();

    /** Shortest pin, in grid units. */
    public static final int MIN_PIN_LENGTH = 2;

    /** Space a pin occupies along a side, in grid units. */
    public static final int PIN_HEIGHT = 2;

    /** Distance between neighboring pins, in grid units. */
    public static final int PIN_SPACING = 2;

    /** Clearance between the end of a side and the closest pin, in grid units. */
    public static final int SIDE_CLEARANCE = 1;

    /** Minimum gap between the names on the left and right sides, in grid units. */
    public static final int LR_SEPARATION = 2;

    /** Minimum gap between the names on the top and bottom sides, in grid units. */
    public static final int TB_SEPARATION = 2;

    /** Gap between the inner end of a pin and its name, in millimeters. */
    public static final double PIN_NAME_OFFSET_MM = 0.85;

    /** Absorbs floating point noise when a width is an exact grid multiple. */
    private static final double EPSILON = 1e-9;

    public enum Rounding {
        UP,
        DOWN,
        /** Nearest, halves away from zero. */
        ROUND;

        public static Rounding fromString(String value) {
            try {
                return valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid gridify policy '" + value
                        + "'. Use 'up', 'down', or 'round'.");
            }
        }
    }

    /**
     * Snaps a length measured in grid units to a whole number of grid units.
     * @param units The length in grid units.
     * @param policy How to round.
     * @return The snapped length in grid units.
     */
    public static int gridify(double units, Rounding policy) {
        switch (policy) {
            case UP:
                return (int) Math.ceil(units - EPSILON);
            case DOWN:
                return (int) Math.floor(units + EPSILON);
            case ROUND:
            default:
                if (units > 0) {
                    return (int) Math.floor(units + 0.5 + EPSILON);
                }
                return (int) Math.ceil(units - 0.5 - EPSILON);
        }
    }

    public static int gridify(double units) {
        return gridify(units, Rounding.ROUND);
    }

    /**
     * Snaps a millimeter length to the grid.
     * @param mm The length in millimeters.
     * @param policy How to round.
     * @return The snapped length in grid units.
     */
    public static int gridifyMm(double mm, Rounding policy) {
        return gridify(mm / PITCH, policy);
    }

    public static double mmToUnits(double mm) {
        return mm / PITCH;
    }

    /**
     * @param units A length in grid units.
     * @return The same length in millimeters, exact.
     */
    public static BigDecimal toMm(int units) {
        return PITCH_MM.multiply(BigDecimal.valueOf(units));
    }

    /**
     * @param units A length in grid units.
     * @return A numeric atom holding the length in millimeters.
     */
    public static SexpAtom mmAtom(int units) {
        return SexpAtom.of(toMm(units));
    }

    /**
     * Checks if a millimeter value is a whole multiple of the grid pitch.
     * @param mm The value.
     * @return True if on grid.
     */
    public static boolean isOnGrid(BigDecimal mm) {
        return mm.remainder(PITCH_MM).signum() == 0;
    }
}
