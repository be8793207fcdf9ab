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

package com.pinwright.sexp;

/**
 * Thrown when symbolic tree text cannot be tokenized or parsed.
 */
public class SexpParseException extends RuntimeException {

    public SexpParseException(SexpToken token, String message) {
        super(message + " at " + token);
    }

    public SexpParseException(String message) {
        super(message);
    }

    public SexpParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SexpParseException unexpectedEOF() {
        return new SexpParseException("Reached end of input while parsing expression");
    }
}
