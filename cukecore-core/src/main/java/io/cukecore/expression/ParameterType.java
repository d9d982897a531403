/*
 * The MIT License
 *
 * Copyright 2025 The cukecore Authors
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
package io.cukecore.expression;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of parameter types usable as {@code {name}} in an
 * expression. Each type parses a prefix of the text starting at a given
 * index and returns the converted value with the index where it stopped, or
 * null if the text there does not fit.
 */
public enum ParameterType {

    STRING("string") {
        @Override
        Capture parse(String text, int start) {
            if (start >= text.length() || text.charAt(start) != '"') {
                return null;
            }
            StringBuilder sb = new StringBuilder();
            int i = start + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\' && i + 1 < text.length() && (text.charAt(i + 1) == '"' || text.charAt(i + 1) == '\\')) {
                    sb.append(text.charAt(i + 1));
                    i += 2;
                } else if (c == '"') {
                    return new Capture(sb.toString(), i + 1);
                } else {
                    sb.append(c);
                    i++;
                }
            }
            return null; // unterminated
        }
    },

    INT("int") {
        @Override
        Capture parse(String text, int start) {
            int digitsStart = skipSign(text, start);
            int end = skipDigits(text, digitsStart);
            if (end == digitsStart) {
                return null;
            }
            return new Capture(toInteger(text.substring(start, end)), end);
        }
    },

    FLOAT("float") {
        @Override
        Capture parse(String text, int start) {
            int digitsStart = skipSign(text, start);
            int dot = skipDigits(text, digitsStart);
            if (dot == digitsStart || dot >= text.length() || text.charAt(dot) != '.') {
                return null;
            }
            int end = skipDigits(text, dot + 1);
            if (end == dot + 1) {
                return null;
            }
            return new Capture(Double.parseDouble(text.substring(start, end)), end);
        }
    },

    WORD("word") {
        @Override
        Capture parse(String text, int start) {
            int end = start;
            while (end < text.length() && !isWordBreak(text.charAt(end))) {
                end++;
            }
            return end == start ? null : new Capture(text.substring(start, end), end);
        }
    },

    ATOM("atom") {
        @Override
        Capture parse(String text, int start) {
            int end = start;
            while (end < text.length() && isAtomChar(text.charAt(end))) {
                end++;
            }
            return end == start ? null : new Capture(Atom.of(text.substring(start, end)), end);
        }
    };

    /**
     * A converted value and the index just past the text it was parsed from.
     */
    public record Capture(Object value, int end) {
    }

    private static final Map<String, ParameterType> BY_NAME = new HashMap<>();

    static {
        for (ParameterType type : values()) {
            BY_NAME.put(type.typeName, type);
        }
    }

    private final String typeName;

    ParameterType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * @return the type for the name used inside braces, or null if unknown
     */
    public static ParameterType forName(String name) {
        return BY_NAME.get(name);
    }

    abstract Capture parse(String text, int start);

    private static int skipSign(String text, int start) {
        if (start < text.length() && (text.charAt(start) == '-' || text.charAt(start) == '+')) {
            return start + 1;
        }
        return start;
    }

    private static int skipDigits(String text, int start) {
        int i = start;
        while (i < text.length() && text.charAt(i) >= '0' && text.charAt(i) <= '9') {
            i++;
        }
        return i;
    }

    private static Object toInteger(String digits) {
        BigInteger value = new BigInteger(digits);
        if (value.bitLength() < 64) {
            return value.longValue();
        }
        return value;
    }

    private static boolean isWordBreak(char c) {
        return c == ' ' || c == '\t' || c == '\n';
    }

    private static boolean isAtomChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '@';
    }

}
