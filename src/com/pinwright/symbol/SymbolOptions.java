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

package com.pinwright.symbol;

import com.pinwright.layout.LayoutOptions;
import com.pinwright.pin.BundleStyle;
import com.pinwright.pin.PinElectricalType;
import com.pinwright.pin.PinGraphicStyle;
import com.pinwright.pin.PinGrouper;
import com.pinwright.pin.PinRecord;
import com.pinwright.pin.PinSide;
import com.pinwright.pin.PinSortOrder;
import com.pinwright.util.Params;

/**
 * All settings that control how parts become symbols: the pin attribute
 * defaults applied while reading rows, pin ordering and bundling, layout and
 * property placement.
 */
public class SymbolOptions {

    private PinSide defaultSide = PinRecord.DEFAULT_SIDE;

    private PinElectricalType defaultType = PinRecord.DEFAULT_TYPE;

    private PinGraphicStyle defaultStyle = PinRecord.DEFAULT_STYLE;

    private PinSortOrder sortOrder = PinSortOrder.ROW;

    private boolean reverse;

    private int bundleLevel;

    private BundleStyle bundleStyle = BundleStyle.COUNT;

    private String justify = "right";

    private boolean debugLayout = Params.PW_DEBUG_SYMBOL_LAYOUT;

    private final LayoutOptions layout = new LayoutOptions();

    public PinSide getDefaultSide() {
        return defaultSide;
    }

    public SymbolOptions setDefaultSide(PinSide defaultSide) {
        this.defaultSide = defaultSide;
        return this;
    }

    public PinElectricalType getDefaultType() {
        return defaultType;
    }

    public SymbolOptions setDefaultType(PinElectricalType defaultType) {
        this.defaultType = defaultType;
        return this;
    }

    public PinGraphicStyle getDefaultStyle() {
        return defaultStyle;
    }

    public SymbolOptions setDefaultStyle(PinGraphicStyle defaultStyle) {
        this.defaultStyle = defaultStyle;
        return this;
    }

    public PinSortOrder getSortOrder() {
        return sortOrder;
    }

    public SymbolOptions setSortOrder(PinSortOrder sortOrder) {
        this.sortOrder = sortOrder;
        return this;
    }

    public boolean isReverse() {
        return reverse;
    }

    public SymbolOptions setReverse(boolean reverse) {
        this.reverse = reverse;
        return this;
    }

    /**
     * @return 0 for no bundling, 1 to bundle power pins, 2 to also bundle
     * no-connect pins.
     */
    public int getBundleLevel() {
        return bundleLevel;
    }

    public SymbolOptions setBundleLevel(int bundleLevel) {
        if (bundleLevel < 0) {
            throw new IllegalArgumentException("Bundle level can't be negative: " + bundleLevel);
        }
        this.bundleLevel = bundleLevel;
        return this;
    }

    public BundleStyle getBundleStyle() {
        return bundleStyle;
    }

    public SymbolOptions setBundleStyle(BundleStyle bundleStyle) {
        this.bundleStyle = bundleStyle;
        return this;
    }

    /**
     * @return Justification of the visible properties: left, center or right.
     */
    public String getJustify() {
        return justify;
    }

    public SymbolOptions setJustify(String justify) {
        String j = justify.trim().toLowerCase();
        if (!j.equals("left") && !j.equals("center") && !j.equals("right")) {
            throw new IllegalArgumentException("Invalid justification: " + justify + ", use left, center or right");
        }
        this.justify = j;
        return this;
    }

    public boolean isDebugLayout() {
        return debugLayout;
    }

    public SymbolOptions setDebugLayout(boolean debugLayout) {
        this.debugLayout = debugLayout;
        return this;
    }

    public LayoutOptions getLayout() {
        return layout;
    }

    /**
     * @return A grouper configured with this ordering and bundling.
     */
    public PinGrouper createGrouper() {
        return new PinGrouper(sortOrder, reverse, bundleLevel, bundleStyle);
    }
}
