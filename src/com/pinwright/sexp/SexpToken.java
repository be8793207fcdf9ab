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

import java.util.Objects;

/**
 * One token read by {@link SexpTokenizer}: a parenthesis or an atom, with the
 * character offset where it starts.
 */
public class SexpToken {

    public enum Kind {
        LEFT_PAREN,
        RIGHT_PAREN,
        ATOM
    }

    public final Kind kind;
    public final String text;
    public final boolean quoted;
    public final long charOffset;

    public SexpToken(Kind kind, String text, boolean quoted, long charOffset) {
        this.kind = Objects.requireNonNull(kind);
        this.text = Objects.requireNonNull(text);
        this.quoted = quoted;
        this.charOffset = charOffset;
    }

    public boolean isLeftParen() {
        return kind == Kind.LEFT_PAREN;
    }

    public boolean isRightParen() {
        return kind == Kind.RIGHT_PAREN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SexpToken token = (SexpToken) o;
        return charOffset == token.charOffset && quoted == token.quoted
                && kind == token.kind && text.equals(token.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, quoted, charOffset);
    }

    @Override
    public String toString() {
        String displayText = quoted ? "\"" + text + "\"" : text;
        if (displayText.length()>120) {
            displayText = displayText.substring(0,100)+"[shortened, length is "+text.length()+"]";
        }
        return displayText +"@"+charOffset;
    }
}
