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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes symbolic trees in the layout used by symbol library files: a list
 * whose elements are all atoms is written on one line, any other list is
 * broken over several lines with one tab of indentation per nesting level.
 */
public class SexpWriter {

    private static final char INDENT = '\t';

    /**
     * Checks if an atom has to be written inside double quotes to be read back
     * as the same atom.
     * @param atom The atom.
     * @return True if quotes are needed.
     */
    public static boolean needsQuotes(SexpAtom atom) {
        if (atom.isQuoted()) return true;
        String value = atom.getValue();
        if (value.isEmpty()) return true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '(' || c == ')' || c == '"' || c == '\\' || Character.isWhitespace(c)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders an atom, adding quotes and escapes as needed.
     * @param atom The atom.
     * @return The text form of the atom.
     */
    public static String atomToString(SexpAtom atom) {
        if (!needsQuotes(atom)) {
            return atom.getValue();
        }
        String value = atom.getValue();
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Renders a node on a single line.
     * @param node The node to render.
     * @return The text form of the node without line breaks.
     */
    public static String toCompactString(SexpNode node) {
        StringBuilder sb = new StringBuilder();
        appendCompact(sb, node);
        return sb.toString();
    }

    private static void appendCompact(StringBuilder sb, SexpNode node) {
        if (node.isAtom()) {
            sb.append(atomToString(node.asAtom()));
            return;
        }
        sb.append('(');
        boolean first = true;
        for (SexpNode n : node.asList().getElements()) {
            if (!first) sb.append(' ');
            appendCompact(sb, n);
            first = false;
        }
        sb.append(')');
    }

    /**
     * Renders a node over several lines with tab indentation.
     * @param node The node to render.
     * @return The text, ending with a newline.
     */
    public static String toPrettyString(SexpNode node) {
        StringBuilder sb = new StringBuilder();
        appendPretty(sb, node, 0);
        sb.append('\n');
        return sb.toString();
    }

    private static boolean allAtoms(SexpList list) {
        for (SexpNode n : list.getElements()) {
            if (n.isList()) return false;
        }
        return true;
    }

    private static void appendPretty(StringBuilder sb, SexpNode node, int depth) {
        if (node.isAtom() || allAtoms(node.asList())) {
            appendCompact(sb, node);
            return;
        }
        sb.append('(');
        boolean first = true;
        for (SexpNode n : node.asList().getElements()) {
            if (n.isList()) {
                sb.append('\n');
                for (int i = 0; i <= depth; i++) {
                    sb.append(INDENT);
                }
                appendPretty(sb, n, depth + 1);
            } else {
                if (!first) sb.append(' ');
                appendCompact(sb, n);
            }
            first = false;
        }
        sb.append('\n');
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        sb.append(')');
    }

    public static void write(Writer out, SexpNode node) throws IOException {
        out.write(toPrettyString(node));
    }

    /**
     * Writes a tree to a file in UTF-8, replacing any existing content.
     * @param fileName The file to write.
     * @param node The root of the tree.
     */
    public static void writeFile(Path fileName, SexpNode node) {
        try (BufferedWriter bw = Files.newBufferedWriter(fileName, StandardCharsets.UTF_8)) {
            write(bw, node);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't write file: " + fileName, e);
        }
    }
}
