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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestGrid {

    @ParameterizedTest
    @CsvSource({
            "2.0, UP, 2",
            "2.1, UP, 3",
            "2.9, DOWN, 2",
            "2.5, ROUND, 3",
            "2.49, ROUND, 2",
            "-2.5, ROUND, -3",
            "-2.1, UP, -2",
            "0.0, ROUND, 0",
    })
    public void testGridify(double units, Grid.Rounding policy, int expected) {
        Assertions.assertEquals(expected, Grid.gridify(units, policy));
    }

    @Test
    public void testGridifyIgnoresFloatingPointNoise() {
        // 3 pitches computed through millimeters is not exactly 3.0
        double units = Grid.mmToUnits(3 * 1.27);
        Assertions.assertEquals(3, Grid.gridify(units, Grid.Rounding.UP));
        Assertions.assertEquals(3, Grid.gridify(units, Grid.Rounding.DOWN));
        Assertions.assertEquals(3, Grid.gridifyMm(3.81, Grid.Rounding.UP));
    }

    @Test
    public void testMillimeters() {
        Assertions.assertEquals(0, new BigDecimal("3.81").compareTo(Grid.toMm(3)));
        Assertions.assertEquals(0, new BigDecimal("-635").compareTo(Grid.toMm(-500)));
        Assertions.assertEquals("3.81", Grid.mmAtom(3).getValue());
        Assertions.assertEquals("0", Grid.mmAtom(0).getValue());
        Assertions.assertTrue(Grid.isOnGrid(new BigDecimal("-7.62")));
        Assertions.assertTrue(Grid.isOnGrid(BigDecimal.ZERO));
        Assertions.assertFalse(Grid.isOnGrid(new BigDecimal("3.8")));
    }

    @Test
    public void testRoundingNames() {
        Assertions.assertEquals(Grid.Rounding.UP, Grid.Rounding.fromString(" up "));
        Assertions.assertEquals(Grid.Rounding.ROUND, Grid.Rounding.fromString("Round"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Grid.Rounding.fromString("nearest"));
    }

    @Test
    public void testTextMetrics() {
        Assertions.assertEquals(3 * 1.27 * 0.9, TextMetrics.textWidth("ABC"), 1e-9);
        Assertions.assertEquals(4 * 1.27 * 0.9, TextMetrics.textWidth("A/BCDE/F", "/"), 1e-9);
        Assertions.assertEquals(8 * 1.27 * 0.9, TextMetrics.textWidth("A/BCDE/F", ""), 1e-9);
        Assertions.assertArrayEquals(new String[] {"A", "", "B"}, TextMetrics.splitAlternates("A//B", "/"));
        Assertions.assertArrayEquals(new String[] {"A.B"}, TextMetrics.splitAlternates("A.B", null));
        Assertions.assertArrayEquals(new String[] {"A", "B"}, TextMetrics.splitAlternates("A.B", "."));
    }
}
