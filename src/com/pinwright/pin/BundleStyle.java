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
 * What is appended to the name of a pin that stands for several bundled pins.
 */
public enum BundleStyle {
    /** Name is left as is. */
    NONE("none"),
    /** NAME[n] */
    COUNT("count"),
    /** NAME[n-1:0] */
    RANGE("range");

    private final String token;

    private BundleStyle(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Decorates a bundle's name with its size. Bundles of one pin keep their
     * name.
     * @param name Shared name of the bundled pins.
     * @param count Number of pins in the bundle.
     * @return The name to show on the bundled pin.
     */
    public String apply(String name, int count) {
        if (count <= 1) {
            return name;
        }
        switch (this) {
            case COUNT:
                return name + "[" + count + "]";
            case RANGE:
                return name + "[" + (count - 1) + ":0]";
            default:
                return name;
        }
    }

    public static BundleStyle fromString(String value) {
        String v = value.trim().toLowerCase();
        for (BundleStyle s : values()) {
            if (s.token.equals(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Invalid bundle style: " + value + ", use none, count or range");
    }

    @Override
    public String toString() {
        return token;
    }
}
