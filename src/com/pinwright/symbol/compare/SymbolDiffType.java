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

package com.pinwright.symbol.compare;

/**
 * An enumeration of all the checked difference types between two symbols or
 * symbol libraries in {@link SymbolComparator}.
 */
public enum SymbolDiffType {
    LIBRARY_FORMAT,
    LIBRARY_VERSION,
    LIBRARY_SYMBOL_COUNT,
    SYMBOL_DUPLICATE,
    SYMBOL_NAME,
    SYMBOL_MISSING,
    SYMBOL_EXTRA,
    SYMBOL_ATTRIBUTE,
    SYMBOL_ATTRIBUTE_MISSING,
    SYMBOL_ATTRIBUTE_EXTRA,
    PROPERTY_VALUE,
    PROPERTY_EFFECTS,
    PROPERTY_COUNT,
    PROPERTY_DUPLICATE,
    PROPERTY_MISSING,
    PROPERTY_EXTRA,
    UNIT_GEOMETRY,
    UNIT_COUNT,
    UNIT_DUPLICATE,
    UNIT_MISSING,
    UNIT_EXTRA,
    PIN_TYPE,
    PIN_STYLE,
    PIN_NAME,
    PIN_POSITION,
    PIN_LENGTH,
    PIN_HIDE,
    PIN_ALTERNATES,
    PIN_COUNT,
    PIN_DUPLICATE,
    PIN_MISSING,
    PIN_EXTRA;

    private boolean isMissingType;

    private boolean isExtraType;

    private boolean isDuplicateType;

    private boolean isNonNullMismatch;

    private String elementName;

    private SymbolDiffType() {
        this.isMissingType = this.name().endsWith("_MISSING");
        this.isExtraType = this.name().endsWith("_EXTRA");
        this.isDuplicateType = this.name().endsWith("_DUPLICATE");
        this.isNonNullMismatch = !isMissingType && !isExtraType && !isDuplicateType;
        String element = this.name().replaceAll("_(MISSING|EXTRA|DUPLICATE)$", "");
        this.elementName = element.toLowerCase().replace('_', ' ');
    }

    /**
     * @return the isMissingType
     */
    public boolean isMissingType() {
        return isMissingType;
    }

    /**
     * @return the isExtraType
     */
    public boolean isExtraType() {
        return isExtraType;
    }

    /**
     * @return True if this type reports a key that occurs more than once on
     * one side of the comparison.
     */
    public boolean isDuplicateType() {
        return isDuplicateType;
    }

    /**
     * @return the isNonNullMismatch
     */
    public boolean isNonNullMismatch() {
        return isNonNullMismatch;
    }

    /**
     * @return The kind of element this type reports on, e.g. "pin" for
     * {@link #PIN_MISSING}.
     */
    public String getElementName() {
        return elementName;
    }
}
