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

package com.pinwright.support;

import org.junit.jupiter.params.converter.ArgumentConversionException;
import org.junit.jupiter.params.converter.SimpleArgumentConverter;

/**
 * Used for converting '|' separated String[] definitions in JUnit's CsvSource
 * parameterized tests, where the comma already separates the arguments. An
 * empty or blank value gives an empty array.
 */
public class StringArrayConverter extends SimpleArgumentConverter {

    @Override
    protected Object convert(Object arg0, Class<?> arg1) throws ArgumentConversionException {
        if (arg0 == null && String[].class.isAssignableFrom(arg1)) {
            return new String[0];
        }
        if (arg0 instanceof String && String[].class.isAssignableFrom(arg1)) {
            String value = (String) arg0;
            if (value.trim().isEmpty()) {
                return new String[0];
            }
            return value.trim().split("\\s*\\|\\s*", -1);
        }
        throw new ArgumentConversionException("ERROR: Unrecognized parameter '" + arg0
                                    + "', could not be converted to a String[].");
    }
}
