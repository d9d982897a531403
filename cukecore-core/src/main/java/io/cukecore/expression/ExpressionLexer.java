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

import io.cukecore.common.Resource;
import io.cukecore.parser.BaseLexer;
import io.cukecore.parser.TokenType;

import static io.cukecore.parser.TokenType.*;

/**
 * Splits an expression pattern into literal text, whitespace, escapes,
 * parameters, optional text and alternations. Malformed constructs fail
 * immediately with an {@link ExpressionException}.
 */
public class ExpressionLexer extends BaseLexer {

    static final String ESCAPABLE = "{}()/\\";

    public ExpressionLexer(Resource resource) {
        super(resource);
    }

    @Override
    protected TokenType scanToken() {
        if (isAtEnd()) {
            return EOF;
        }
        char c = peek();
        switch (c) {
            case '\\':
                return scanEscape();
            case '{':
                return scanParameter();
            case '(':
                return scanOptional();
            default:
                if (isPatternSpace(c)) {
                    while (isPatternSpace(peek())) {
                        advance();
                    }
                    return E_SPACE;
                }
                if (scanAlternation()) {
                    return E_ALTERNATION;
                }
                while (!isAtEnd() && !isLiteralBreak(peek())) {
                    advance();
                }
                return E_TEXT;
        }
    }

    private TokenType scanEscape() {
        char next = peek(1);
        if (next == '\0' || ESCAPABLE.indexOf(next) == -1) {
            String fragment = source.substring(pos, Math.min(pos + 2, length));
            throw new ExpressionException("invalid escape '" + fragment + "'", source, pos, fragment);
        }
        advance(2);
        return E_ESCAPE;
    }

    private TokenType scanParameter() {
        int close = source.indexOf('}', pos);
        if (close == -1) {
            throw new ExpressionException("unterminated parameter, expected '}'", source, pos, source.substring(pos));
        }
        String fragment = source.substring(pos, close + 1);
        String name = fragment.substring(1, fragment.length() - 1);
        if (name.endsWith("?")) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.isEmpty()) {
            throw new ExpressionException("empty parameter, expected a type name", source, pos, fragment);
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isLetter(c) && !isDigit(c) && c != '_') {
                throw new ExpressionException("invalid parameter type name '" + name + "'", source, pos, fragment);
            }
        }
        advance(fragment.length());
        return E_PARAMETER;
    }

    private TokenType scanOptional() {
        int close = source.indexOf(')', pos);
        if (close == -1) {
            throw new ExpressionException("unterminated optional text, expected ')'", source, pos, source.substring(pos));
        }
        if (close == pos + 1) {
            throw new ExpressionException("empty optional text", source, pos, "()");
        }
        advance(close + 1 - pos);
        return E_OPTIONAL;
    }

    // word ( '/' word )+ where no word is empty, otherwise nothing is consumed
    private boolean scanAlternation() {
        int end = skipAlternationWord(pos);
        if (end == pos) {
            return false;
        }
        int options = 1;
        while (end < length && source.charAt(end) == '/') {
            int next = skipAlternationWord(end + 1);
            if (next == end + 1) {
                break;
            }
            end = next;
            options++;
        }
        if (options < 2) {
            return false;
        }
        advance(end - pos);
        return true;
    }

    private int skipAlternationWord(int start) {
        int i = start;
        while (i < length && isAlternationChar(source.charAt(i))) {
            i++;
        }
        return i;
    }

    static boolean isPatternSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n';
    }

    static boolean isAlternationChar(char c) {
        return c != '/' && c != '\\' && c != '{' && c != '(' && c != ')' && !isPatternSpace(c);
    }

    static boolean isLiteralBreak(char c) {
        return c == '{' || c == '\\' || c == '(' || isPatternSpace(c);
    }

}
