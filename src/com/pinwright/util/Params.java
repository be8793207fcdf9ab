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

/**
 * Aims to be a centralized helper class to manage global PinWright settings.
 * Each setting can be given as an environment variable or as a JVM property
 * of the same name.
 */
public class Params {

    public static String PW_WARNINGS_AS_ERRORS_NAME = "PW_WARNINGS_AS_ERRORS";

    public static String PW_DEBUG_SYMBOL_LAYOUT_NAME = "PW_DEBUG_SYMBOL_LAYOUT";

    public static String PW_LIB_VERSION_NAME = "PW_LIB_VERSION";

    public static String PW_GENERATOR_NAME = "PW_GENERATOR";

    public static String PW_GENERATOR_VERSION_NAME = "PW_GENERATOR_VERSION";

    public static int PW_DEFAULT_LIB_VERSION = 20241209;

    public static String PW_DEFAULT_GENERATOR = "kicad_symbol_editor";

    public static String PW_DEFAULT_GENERATOR_VERSION = "8.0";

    /**
     * Flag to turn every row-file warning into an error that stops the
     * conversion of the affected part.
     */
    public static boolean PW_WARNINGS_AS_ERRORS = isParamSet(PW_WARNINGS_AS_ERRORS_NAME);

    /**
     * Flag to add faint outlines of the pin regions along each side of every
     * generated unit, to help see how a body was sized.
     */
    public static boolean PW_DEBUG_SYMBOL_LAYOUT = isParamSet(PW_DEBUG_SYMBOL_LAYOUT_NAME);

    /**
     * File format version written into new symbol libraries.
     */
    public static int PW_LIB_VERSION = getParamOrDefaultIntSetting(PW_LIB_VERSION_NAME, PW_DEFAULT_LIB_VERSION);

    /**
     * Generator name written into new symbol libraries.
     */
    public static String PW_GENERATOR = getParamOrDefault(PW_GENERATOR_NAME, PW_DEFAULT_GENERATOR);

    /**
     * Generator version written into new symbol libraries.
     */
    public static String PW_GENERATOR_VERSION = getParamOrDefault(PW_GENERATOR_VERSION_NAME,
            PW_DEFAULT_GENERATOR_VERSION);

    /**
     * @param key Name of a PinWright parameter.
     * @return True if the environment variable or JVM property of that name
     * holds a value that {@link #isSet(String)} accepts.
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * A parameter counts as set unless its value is missing, empty, "0" or
     * "false" in any case.
     * @param value Value of an environment variable or JVM property.
     * @return True if the value turns the parameter on.
     */
    public static boolean isSet(String value) {
        if (value == null || value.isEmpty()) return false;
        return !value.equals("0") && !value.equalsIgnoreCase("false");
    }

    /**
     * @param key Name of a PinWright parameter.
     * @return The parameter as an integer, or null if it is not given. A
     * value that is not an integer is reported as a warning and ignored.
     */
    public static Integer getParamIntValue(String key) {
        String value = getParamValue(key);
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            MessageGenerator.warning("Ignoring parameter " + key + ", '" + value + "' is not an integer.");
            return null;
        }
    }

    /**
     * Looks the parameter up as an environment variable first and as a JVM
     * property second.
     * @param key Name of a PinWright parameter.
     * @return The raw value, or null if neither is given.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        return value != null ? value : System.getProperty(key);
    }

    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer value = getParamIntValue(key);
        return value == null ? defaultValue : value;
    }

    /**
     * @param key Name of a PinWright parameter.
     * @param defaultValue Used when the parameter is missing or blank.
     * @return The trimmed parameter value or the default.
     */
    public static String getParamOrDefault(String key, String defaultValue) {
        String value = getParamValue(key);
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }
}
