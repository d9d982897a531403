/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.cukecore.parser;

import io.cukecore.common.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured description of a parse failure. Carries enough data for a
 * caller to build its own diagnostics: what was expected, where (1-based),
 * the offending fragment and a snippet of the input that was not consumed.
 */
public class SyntaxError {

    public static final int SNIPPET_LENGTH = 50;

    public final String message;
    public final String expected;
    public final int line;
    public final int column;
    public final String fragment;
    public final String snippet;

    public SyntaxError(String message, String expected, int line, int column, String fragment, String snippet) {
        this.message = message;
        this.expected = expected;
        this.line = line;
        this.column = column;
        this.fragment = fragment;
        this.snippet = snippet;
    }

    public static SyntaxError at(Token token, String message, String expected) {
        String remaining = token.resource.getText().substring(token.pos);
        String snippet = StringUtils.truncate(remaining, SNIPPET_LENGTH, false);
        String fragment = token.type == TokenType.EOF ? "" : token.text;
        return new SyntaxError(message, expected, token.line + 1, token.col + 1, fragment, snippet);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getMessage() {
        return message;
    }

    public String getExpected() {
        return expected;
    }

    public String getFragment() {
        return fragment;
    }

    public String getSnippet() {
        return snippet;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("message", message);
        map.put("expected", expected);
        map.put("line", line);
        map.put("column", column);
        map.put("fragment", fragment);
        map.put("snippet", snippet);
        return map;
    }

    @Override
    public String toString() {
        return "[" + line + ":" + column + "] " + message;
    }

}
