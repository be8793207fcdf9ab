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

package com.pinwright.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestParams {

    private static final String KEY = "PW_TEST_PARAM";

    @ParameterizedTest
    @CsvSource({
            ", false",
            "'', false",
            "0, false",
            "false, false",
            "FALSE, false",
            "1, true",
            "true, true",
            "yes, true",
    })
    public void testIsSet(String value, boolean expected) {
        Assertions.assertEquals(expected, Params.isSet(value));
    }

    @Test
    public void testParamFromSystemProperty() {
        Assertions.assertNull(Params.getParamValue(KEY));
        Assertions.assertFalse(Params.isParamSet(KEY));
        Assertions.assertEquals("dflt", Params.getParamOrDefault(KEY, "dflt"));
        Assertions.assertEquals(7, Params.getParamOrDefaultIntSetting(KEY, 7));
        try {
            System.setProperty(KEY, " 42 ");
            Assertions.assertTrue(Params.isParamSet(KEY));
            Assertions.assertEquals(42, Params.getParamIntValue(KEY));
            Assertions.assertEquals(42, Params.getParamOrDefaultIntSetting(KEY, 7));
            Assertions.assertEquals("42", Params.getParamOrDefault(KEY, "dflt"));

            System.setProperty(KEY, "forty-two");
            Assertions.assertNull(Params.getParamIntValue(KEY));
            Assertions.assertEquals(7, Params.getParamOrDefaultIntSetting(KEY, 7));

            System.setProperty(KEY, " ");
            Assertions.assertEquals("dflt", Params.getParamOrDefault(KEY, "dflt"));
        } finally {
            System.clearProperty(KEY);
        }
    }

    @Test
    public void testDefaults() {
        Assertions.assertEquals(20241209, Params.PW_DEFAULT_LIB_VERSION);
        Assertions.assertEquals("kicad_symbol_editor", Params.PW_DEFAULT_GENERATOR);
    }
}
