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

package com.pinwright.symbol.merge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when two libraries are merged without permission to overwrite and
 * both hold symbols of the same name.
 */
public class DuplicateSymbolException extends RuntimeException {

    private static final long serialVersionUID = 2806407312869503532L;

    private final List<String> symbolNames;

    public DuplicateSymbolException(Collection<String> symbolNames) {
        super(buildMessage(symbolNames));
        List<String> names = new ArrayList<>(symbolNames);
        Collections.sort(names);
        this.symbolNames = Collections.unmodifiableList(names);
    }

    private static String buildMessage(Collection<String> symbolNames) {
        List<String> names = new ArrayList<>(symbolNames);
        Collections.sort(names);
        return "Cannot merge libraries: The following symbols exist in both libraries: "
                + String.join(", ", names) + ". Use --overwrite to replace them.";
    }

    /**
     * @return The names found in both libraries, sorted.
     */
    public List<String> getSymbolNames() {
        return symbolNames;
    }
}
