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
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Tokenize a character stream containing a symbolic tree. Input is buffered
 * internally, so wrapping the reader in a {@link java.io.BufferedReader} is not
 * needed.
 */
public class SexpTokenizer implements AutoCloseable {

    private final Path fileName;

    private final Reader in;

    private final char[] buffer = new char[8192];

    private int offset = 0;
    private int available = 0;
    private boolean sawEOF = false;

    protected long charOffset;

    protected final int maxTokenLength;

    public static final int DEFAULT_MAX_TOKEN_LENGTH = 8192*16;

    public SexpTokenizer(Path fileName, Reader in, int maxTokenLength) {
        this.fileName = fileName;
        this.in = in;
        this.maxTokenLength = maxTokenLength;
    }

    public SexpTokenizer(Path fileName, Reader in) {
        this(fileName, in, DEFAULT_MAX_TOKEN_LENGTH);
    }

    private void fill() throws IOException {
        if (offset < available || sawEOF) {
            return;
        }
        int read = in.read(buffer, 0, buffer.length);
        offset = 0;
        if (read == -1) {
            sawEOF = true;
            available = 0;
        } else {
            available = read;
        }
    }

    /**
     * @return The next character, or -1 at the end of input.
     */
    private int peekChar() throws IOException {
        fill();
        if (offset >= available) {
            return -1;
        }
        return buffer[offset];
    }

    private int readChar() throws IOException {
        int c = peekChar();
        if (c != -1) {
            offset++;
            charOffset++;
        }
        return c;
    }

    private static boolean endsTokenSwitch(char c) {
        switch (c) {
            case '"':
            case '(':
            case ')':
            case ' ':
            case '\n':
            case '\r':
            case '\t':
            case '\f':
                return true;
            default:
                return false;
        }
    }

    private static boolean[] makeTokenEnderTable() {
        boolean[] res = new boolean[128];
        for (int i = 0; i < 128; i++) {
            res[i] = endsTokenSwitch((char) i);
        }
        return res;
    }

    private static final boolean[] ENDS_TOKEN = makeTokenEnderTable();

    private static boolean endsToken(int c) {
        return c < 0 || (c < 128 && ENDS_TOKEN[c]);
    }

    private TokenTooLongException tokenTooLong(long startOffset, StringBuilder sb) {
        String start = sb.length() > 100 ? sb.substring(0, 100) : sb.toString();
        return new TokenTooLongException("ERROR: Token starting at character offset " + startOffset
                + " exceeds " + maxTokenLength + " characters: " + start + "...\n\t Please revisit why"
                + " this token is so long or increase the limit in " + getClass().getCanonicalName());
    }

    /**
     * Starting quote is expected to have already been read. Reads up to the
     * closing quote, resolving backslash escapes.
     */
    private String getQuotedToken(long startOffset) throws IOException {
        StringBuilder sb = new StringBuilder();
        while (true) {
            int c = readChar();
            if (c == -1) {
                throw SexpParseException.unexpectedEOF();
            }
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                int escaped = readChar();
                switch (escaped) {
                    case -1:
                        throw SexpParseException.unexpectedEOF();
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    default:
                        sb.append((char) escaped);
                }
            } else {
                sb.append((char) c);
            }
            if (sb.length() > maxTokenLength) {
                throw tokenTooLong(startOffset, sb);
            }
        }
    }

    private String getUnquotedToken(char first, long startOffset) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        while (!endsToken(peekChar())) {
            sb.append((char) readChar());
            if (sb.length() > maxTokenLength) {
                throw tokenTooLong(startOffset, sb);
            }
        }
        if (peekChar() == '"') {
            throw new SexpParseException("Cannot have quote inside of token " + sb
                    + " at character offset " + charOffset);
        }
        return sb.toString();
    }

    /**
     * Get the next token
     * @return The token, or null if at end of input
     */
    public SexpToken getOptionalNextToken() {
        try {
            int ch;
            while ((ch = readChar()) != -1) {
                long start = charOffset - 1;
                switch (ch) {
                    case '"':
                        return new SexpToken(SexpToken.Kind.ATOM, getQuotedToken(start), true, start);
                    case '(':
                        return new SexpToken(SexpToken.Kind.LEFT_PAREN, "(", false, start);
                    case ')':
                        return new SexpToken(SexpToken.Kind.RIGHT_PAREN, ")", false, start);
                    case ' ':
                    case '\n':
                    case '\r':
                    case '\t':
                    case '\f':
                        break;
                    default:
                        return new SexpToken(SexpToken.Kind.ATOM, getUnquotedToken((char) ch, start), false, start);
                }
            }
            //EOF
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: IOException while reading file: " + fileName, e);
        }
    }

    public long getCharOffset() {
        return charOffset;
    }

    public Path getFileName() {
        return fileName;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
