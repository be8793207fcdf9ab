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
 * A node of a symbolic tree: either an {@link SexpAtom} or a {@link SexpList}.
 * Symbol and library files are read into and written from trees of these
 * nodes.
 */
public abstract class SexpNode {

    public abstract boolean isAtom();

    public boolean isList() {
        return !isAtom();
    }

    public SexpAtom asAtom() {
        if (!isAtom()) {
            throw new ClassCastException("Expected an atom but found list " + this);
        }
        return (SexpAtom) this;
    }

    public SexpList asList() {
        if (isAtom()) {
            throw new ClassCastException("Expected a list but found atom " + this);
        }
        return (SexpList) this;
    }

    /**
     * Creates a deep copy of this node. No part of the copy is shared with the
     * original.
     * @return The copied node.
     */
    public abstract SexpNode copy();

    /**
     * Builds a canonical single-line rendering of this node where quoting is
     * dropped and numeric atoms are normalized. Two nodes that are
     * {@link #equals(Object)} have the same canonical string.
     * @return The canonical string.
     */
    public String toCanonicalString() {
        StringBuilder sb = new StringBuilder();
        appendCanonical(sb);
        return sb.toString();
    }

    protected abstract void appendCanonical(StringBuilder sb);

    @Override
    public String toString() {
        return SexpWriter.toCompactString(this);
    }
}
