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
 * This is a helper class for {@link SymbolComparator} that encapsulates the
 * reference information for a difference found between two symbols or
 * libraries.
 */
public class SymbolDiff {

    private SymbolDiffType type;

    private Object gold;

    private Object test;

    private String symbolName;

    private String unitName;

    private String notEqualString;

    public SymbolDiff(SymbolDiffType type, Object gold, Object test, String symbolName, String unitName,
            String notEqualString) {
        this.type = type;
        this.gold = gold;
        this.test = test;
        this.symbolName = symbolName;
        this.unitName = unitName;
        this.notEqualString = notEqualString;
    }

    public SymbolDiffType getType() {
        return type;
    }

    public Object getGold() {
        return gold;
    }

    public Object getTest() {
        return test;
    }

    public String getSymbolName() {
        return symbolName;
    }

    public String getUnitName() {
        return unitName;
    }

    public String getContext() {
        if (symbolName == null) return "";
        if (unitName == null) return " in symbol " + symbolName;
        return " in unit " + unitName + " of symbol " + symbolName;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();

        if (type.isMissingType()) {
            sb.append("Missing ")
              .append(type.getElementName()).append(' ')
              .append(gold);
        } else if (type.isExtraType()) {
            sb.append("Extra ")
              .append(type.getElementName()).append(' ')
              .append(test);
        } else if (type.isDuplicateType()) {
            sb.append("Duplicate ")
              .append(type.getElementName()).append(' ')
              .append(gold != null ? gold + " (gold)" : test + " (test)");
        } else {
            sb.append("Mismatch found (")
              .append(notEqualString).append("), expected ")
              .append(gold).append(", but found ").append(test);
        }

        sb.append(getContext());
        return sb.toString();
    }
}
