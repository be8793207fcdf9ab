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

/**
 * Settings that shape the geometry of a symbol unit.
 */
public class LayoutOptions {

    public static final double DEFAULT_PUSH = 0.5;

    private double push = DEFAULT_PUSH;

    private boolean ccw;

    private boolean scrunch;

    private boolean hidePinNumbers;

    private String altPinDelimiter;

    /**
     * @return Where pin groups sit along their side: 0 at the start, 0.5
     * centered, 1 at the end.
     */
    public double getPush() {
        return push;
    }

    public LayoutOptions setPush(double push) {
        if (!(push >= 0.0 && push <= 1.0)) {
            throw new IllegalArgumentException("Push must be between 0.0 and 1.0 but is " + push);
        }
        this.push = push;
        return this;
    }

    /**
     * @return True if right-side pins run bottom to top and top-side pins run
     * right to left.
     */
    public boolean isCcw() {
        return ccw;
    }

    public LayoutOptions setCcw(boolean ccw) {
        this.ccw = ccw;
        return this;
    }

    /**
     * @return True if the left and right pin columns are tucked under the top
     * and bottom pin rows.
     */
    public boolean isScrunch() {
        return scrunch;
    }

    public LayoutOptions setScrunch(boolean scrunch) {
        this.scrunch = scrunch;
        return this;
    }

    public boolean isHidePinNumbers() {
        return hidePinNumbers;
    }

    public LayoutOptions setHidePinNumbers(boolean hidePinNumbers) {
        this.hidePinNumbers = hidePinNumbers;
        return this;
    }

    /**
     * @return Separator between a pin's primary name and its alternate names,
     * or null if names are not split.
     */
    public String getAltPinDelimiter() {
        return altPinDelimiter;
    }

    public LayoutOptions setAltPinDelimiter(String altPinDelimiter) {
        this.altPinDelimiter = altPinDelimiter == null || altPinDelimiter.isEmpty() ? null : altPinDelimiter;
        return this;
    }
}
