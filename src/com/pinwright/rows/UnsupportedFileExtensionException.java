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

package com.pinwright.rows;

/**
 * Thrown when a file handed to a conversion does not have the extension the
 * conversion reads or writes.
 */
public class UnsupportedFileExtensionException extends RuntimeException {

    private final String extension;

    public UnsupportedFileExtensionException(String extension, String message) {
        super(message);
        this.extension = extension;
    }

    /**
     * @return The offending extension, without the dot.
     */
    public String getExtension() {
        return extension;
    }
}
