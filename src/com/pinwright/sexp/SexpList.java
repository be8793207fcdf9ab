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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list node of a symbolic tree. By convention the first element is
 * an atom naming the list (its tag), e.g. {@code (pin input line ...)} has the
 * tag "pin". Children are looked up by tag rather than by position wherever
 * the format allows it.
 */
public class SexpList extends SexpNode {

    private final List<SexpNode> elements;

    public SexpList() {
        elements = new ArrayList<>();
    }

    public SexpList(List<? extends SexpNode> elements) {
        this.elements = new ArrayList<>(elements);
    }

    /**
     * Convenience factory that converts each item into a node: existing nodes
     * are added as is, {@link Integer}s and {@link BigDecimal}s become numeric
     * atoms, and anything else becomes an unquoted atom from its string form.
     * @param tag The tag of the new list.
     * @param items The remaining elements.
     * @return The new list.
     */
    public static SexpList of(String tag, Object... items) {
        SexpList list = new SexpList();
        list.add(new SexpAtom(tag));
        for (Object item : items) {
            list.add(toNode(item));
        }
        return list;
    }

    private static SexpNode toNode(Object item) {
        if (item instanceof SexpNode) {
            return (SexpNode) item;
        } else if (item instanceof Integer) {
            return SexpAtom.of((Integer) item);
        } else if (item instanceof BigDecimal) {
            return SexpAtom.of((BigDecimal) item);
        }
        return new SexpAtom(String.valueOf(item));
    }

    public SexpList add(SexpNode node) {
        elements.add(node);
        return this;
    }

    public SexpList add(Object item) {
        return add(toNode(item));
    }

    public void addAll(List<? extends SexpNode> nodes) {
        elements.addAll(nodes);
    }

    public void set(int index, SexpNode node) {
        elements.set(index, node);
    }

    public boolean remove(SexpNode node) {
        return elements.remove(node);
    }

    public SexpNode get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public List<SexpNode> getElements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * @return The tag of this list, or null if the list is empty or does not
     * start with an atom.
     */
    public String getTag() {
        if (elements.isEmpty() || !elements.get(0).isAtom()) {
            return null;
        }
        return elements.get(0).asAtom().getValue();
    }

    public boolean hasTag(String tag) {
        String t = getTag();
        return t != null && t.equalsIgnoreCase(tag);
    }

    /**
     * Gets the string value of the atom at the given index.
     * @param index Index into this list (the tag is index 0).
     * @return The atom's value, or null if the index is out of range or the
     * element there is a list.
     */
    public String getAtomValue(int index) {
        if (index < 0 || index >= elements.size()) return null;
        SexpNode n = elements.get(index);
        return n.isAtom() ? n.asAtom().getValue() : null;
    }

    /**
     * Gets the atom at the given index.
     * @param index Index into this list.
     * @return The atom, or null if absent or not an atom.
     */
    public SexpAtom getAtom(int index) {
        if (index < 0 || index >= elements.size()) return null;
        SexpNode n = elements.get(index);
        return n.isAtom() ? n.asAtom() : null;
    }

    /**
     * @return All children after the tag.
     */
    public List<SexpNode> getChildren() {
        if (elements.isEmpty()) return Collections.emptyList();
        return Collections.unmodifiableList(elements.subList(1, elements.size()));
    }

    /**
     * @return The child lists of this list, skipping atoms.
     */
    public List<SexpList> getChildLists() {
        List<SexpList> lists = new ArrayList<>();
        for (SexpNode n : elements) {
            if (n.isList()) {
                lists.add(n.asList());
            }
        }
        return lists;
    }

    /**
     * Finds the first direct child list with the given tag (case-insensitive).
     * @param tag The tag to look for.
     * @return The child list, or null if none exists.
     */
    public SexpList findChild(String tag) {
        for (SexpNode n : elements) {
            if (n.isList() && n.asList().hasTag(tag)) {
                return n.asList();
            }
        }
        return null;
    }

    /**
     * Finds all direct child lists with the given tag (case-insensitive).
     * @param tag The tag to look for.
     * @return The matching child lists in order.
     */
    public List<SexpList> findChildren(String tag) {
        List<SexpList> matches = new ArrayList<>();
        for (SexpNode n : elements) {
            if (n.isList() && n.asList().hasTag(tag)) {
                matches.add(n.asList());
            }
        }
        return matches;
    }

    /**
     * Finds the first direct child list with the given tag whose atom at
     * keyIndex has the given value, e.g. {@code findByKey("property", 1,
     * "Reference")}.
     * @param tag The tag of the child.
     * @param keyIndex Index of the key atom within the child.
     * @param key Expected value of the key atom.
     * @return The matching child, or null.
     */
    public SexpList findByKey(String tag, int keyIndex, String key) {
        for (SexpList child : findChildren(tag)) {
            if (key.equals(child.getAtomValue(keyIndex))) {
                return child;
            }
        }
        return null;
    }

    /**
     * Follows a path of tags down the tree, taking the first match at each
     * level, e.g. {@code findPath("effects", "font", "size")}.
     * @param tags The tags to follow.
     * @return The list at the end of the path, or null if any step is missing.
     */
    public SexpList findPath(String... tags) {
        SexpList current = this;
        for (String tag : tags) {
            current = current.findChild(tag);
            if (current == null) return null;
        }
        return current;
    }

    /**
     * Gets the value of the first atom after the tag in the named child, such
     * as "20241209" for {@code (version 20241209)}.
     * @param tag Tag of the child list.
     * @return The value, or null if the child or its value is missing.
     */
    public String getChildValue(String tag) {
        SexpList child = findChild(tag);
        return child == null ? null : child.getAtomValue(1);
    }

    @Override
    public boolean isAtom() {
        return false;
    }

    @Override
    public SexpList copy() {
        SexpList c = new SexpList();
        for (SexpNode n : elements) {
            c.add(n.copy());
        }
        return c;
    }

    @Override
    protected void appendCanonical(StringBuilder sb) {
        sb.append('(');
        boolean first = true;
        for (SexpNode n : elements) {
            if (!first) sb.append(' ');
            n.appendCanonical(sb);
            first = false;
        }
        sb.append(')');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elements.equals(((SexpList) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
