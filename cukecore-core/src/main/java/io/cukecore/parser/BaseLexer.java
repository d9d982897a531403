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

import io.cukecore.common.Resource;

import java.util.ArrayList;
import java.util.List;

import static io.cukecore.parser.TokenType.*;

/**
 * Abstract base class for lexers. Provides common utilities for character
 * handling, position tracking, and tokenization.
 */
public abstract class BaseLexer {

    protected final Resource resource;
    protected final String source;
    protected final int length;

    protected int pos;
    protected int line;
    protected int col;
    protected int tokenStart;
    protected int tokenLine;
    protected int tokenCol;

    protected BaseLexer(Resource resource) {
        this.resource = resource;
        this.source = resource.getText();
        this.length = source.length();
    }

    // ========== Public API ==========

    public Token nextToken() {
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
        TokenType type = scanToken();
        String text = source.substring(tokenStart, pos);
        return new Token(resource, type, tokenStart, tokenLine, tokenCol, text);
    }

    protected abstract TokenType scanToken();

    /**
     * Tokenizes the whole source, keeping only primary tokens. The last token
     * in the list is always EOF.
     */
    public static List<Token> tokenize(BaseLexer lexer) {
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            if (token.type.primary) {
                list.add(token);
            }
        } while (token.type != EOF);
        return list;
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : source.charAt(pos);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : source.charAt(index);
    }

    protected char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
        return c;
    }

    protected void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    protected boolean match(char expected) {
        if (pos >= length || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    protected boolean lookingAt(String text) {
        return source.startsWith(text, pos);
    }

    protected boolean isAtLineEnd() {
        char c = peek();
        return c == '\r' || c == '\n' || isAtEnd();
    }

    protected void advanceToLineEnd() {
        while (!isAtLineEnd()) {
            advance();
        }
    }

    // ========== Character Classification ==========

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    protected static boolean isSpaceOrTab(char c) {
        return c == ' ' || c == '\t';
    }

    protected static boolean isNewLine(char c) {
        return c == '\r' || c == '\n';
    }

}
