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

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestSexpTokenizer {

    private static List<SexpToken> tokenize(String text, int maxTokenLength) {
        List<SexpToken> tokens = new ArrayList<>();
        SexpTokenizer t = new SexpTokenizer(null, new StringReader(text), maxTokenLength);
        SexpToken token;
        while ((token = t.getOptionalNextToken()) != null) {
            tokens.add(token);
        }
        return tokens;
    }

    private static List<SexpToken> tokenize(String text) {
        return tokenize(text, SexpTokenizer.DEFAULT_MAX_TOKEN_LENGTH);
    }

    private static String repeatString(String s, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }

    @Test
    public void testTokenKindsAndOffsets() {
        List<SexpToken> tokens = tokenize("(pin input line\n\t(at 0 -2.54 180))");
        Assertions.assertEquals(11, tokens.size());
        Assertions.assertTrue(tokens.get(0).isLeftParen());
        Assertions.assertEquals(new SexpToken(SexpToken.Kind.ATOM, "pin", false, 1), tokens.get(1));
        Assertions.assertEquals(new SexpToken(SexpToken.Kind.ATOM, "input", false, 5), tokens.get(2));
        Assertions.assertEquals("-2.54", tokens.get(7).text);
        Assertions.assertTrue(tokens.get(9).isRightParen());
        Assertions.assertTrue(tokens.get(10).isRightParen());
    }

    @Test
    public void testQuotedTokenEscapes() {
        List<SexpToken> tokens = tokenize("\"a \\\"b\\\"\\n\\\\c\" \"\"");
        Assertions.assertEquals(2, tokens.size());
        Assertions.assertEquals("a \"b\"\n\\c", tokens.get(0).text);
        Assertions.assertTrue(tokens.get(0).quoted);
        Assertions.assertEquals("", tokens.get(1).text);
        Assertions.assertTrue(tokens.get(1).quoted);
    }

    @Test
    public void testQuotedTokenKeepsParentheses() {
        List<SexpToken> tokens = tokenize("(name \"VCC (3.3V)\")");
        Assertions.assertEquals(4, tokens.size());
        Assertions.assertEquals("VCC (3.3V)", tokens.get(2).text);
    }

    @Test
    public void testEmptyInput() {
        Assertions.assertTrue(tokenize("  \n\t ").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {15, 16})
    public void testTokenAtLimit(int length) {
        String token = repeatString("x", length);
        Assertions.assertEquals(token, tokenize("(" + token + ")", 16).get(1).text);
        Assertions.assertEquals(token, tokenize("\"" + token + "\"", 16).get(0).text);
    }

    @Test
    public void testTokenTooLong() {
        String token = repeatString("x", 17);
        Assertions.assertThrows(TokenTooLongException.class, () -> tokenize("(" + token + ")", 16));
        Assertions.assertThrows(TokenTooLongException.class, () -> tokenize("\"" + token + "\"", 16));
    }

    @Test
    public void testQuoteInsideToken() {
        SexpParseException e = Assertions.assertThrows(SexpParseException.class, () -> tokenize("(ab\"cd\")"));
        Assertions.assertTrue(e.getMessage().contains("ab"));
    }

    @Test
    public void testUnterminatedQuote() {
        Assertions.assertThrows(SexpParseException.class, () -> tokenize("(name \"VCC"));
    }
}
