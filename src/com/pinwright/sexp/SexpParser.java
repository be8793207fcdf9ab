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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Reads the text form of a symbolic tree. The input must hold exactly one
 * top-level expression, which is normally a list.
 */
public class SexpParser implements AutoCloseable {

    protected final SexpTokenizer tokenizer;

    public SexpParser(Path fileName, Reader in) {
        this.tokenizer = new SexpTokenizer(fileName, in);
    }

    public SexpParser(Path fileName) throws IOException {
        this(fileName, Files.newBufferedReader(fileName, StandardCharsets.UTF_8));
    }

    /**
     * Parses a symbolic tree held in a string.
     * @param text The text to parse.
     * @return The root node.
     */
    public static SexpNode parse(String text) {
        try (SexpParser p = new SexpParser(null, new StringReader(text))) {
            return p.parseNode();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses a string that must contain a list at the top level.
     * @param text The text to parse.
     * @return The root list.
     */
    public static SexpList parseList(String text) {
        return requireList(parse(text), null);
    }

    /**
     * Reads a file that must contain a list at the top level, such as a symbol
     * library.
     * @param fileName The file to read.
     * @return The root list.
     */
    public static SexpList readFile(Path fileName) {
        try (SexpParser p = new SexpParser(fileName)) {
            return requireList(p.parseNode(), fileName);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't read file: " + fileName, e);
        }
    }

    private static SexpList requireList(SexpNode node, Path fileName) {
        if (!node.isList()) {
            throw new SexpParseException("Expected a list at the top level"
                    + (fileName == null ? "" : " of " + fileName) + " but found atom " + node);
        }
        return node.asList();
    }

    private SexpToken getNextToken() {
        SexpToken t = tokenizer.getOptionalNextToken();
        if (t == null) {
            throw SexpParseException.unexpectedEOF();
        }
        return t;
    }

    /**
     * Parses the single top-level expression and checks that nothing follows
     * it.
     * @return The root node.
     */
    public SexpNode parseNode() {
        SexpNode root = parseExpression(getNextToken());
        SexpToken extra = tokenizer.getOptionalNextToken();
        if (extra != null) {
            throw new SexpParseException(extra, "Unexpected content after the top-level expression");
        }
        return root;
    }

    private SexpNode parseExpression(SexpToken first) {
        if (first.isRightParen()) {
            throw new SexpParseException(first, "Unbalanced closing parenthesis");
        }
        if (!first.isLeftParen()) {
            return new SexpAtom(first.text, first.quoted);
        }
        // Explicit stack so that deeply nested input cannot overflow the call stack
        Deque<SexpList> open = new ArrayDeque<>();
        open.push(new SexpList());
        while (true) {
            SexpToken t = getNextToken();
            if (t.isLeftParen()) {
                SexpList child = new SexpList();
                open.peek().add(child);
                open.push(child);
            } else if (t.isRightParen()) {
                SexpList done = open.pop();
                if (open.isEmpty()) {
                    return done;
                }
            } else {
                open.peek().add(new SexpAtom(t.text, t.quoted));
            }
        }
    }

    @Override
    public void close() throws IOException {
        tokenizer.close();
    }
}
