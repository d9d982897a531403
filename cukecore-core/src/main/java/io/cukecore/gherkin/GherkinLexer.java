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
package io.cukecore.gherkin;

import io.cukecore.common.Resource;
import io.cukecore.parser.BaseLexer;
import io.cukecore.parser.TokenType;

import static io.cukecore.parser.TokenType.*;

/**
 * Line-oriented lexer for Gherkin. Recognizes section keywords, step
 * keywords, tags, table rows, doc-string delimiters and content lines and
 * comments. Anything else becomes a {@link TokenType#G_DESC} line, which the
 * parser accepts only where free text is allowed.
 */
public class GherkinLexer extends BaseLexer {

    static final String TRIPLE_QUOTE = "\"\"\"";

    static final String[] STEP_KEYWORDS = {"Given", "When", "Then", "And", "But", "*"};

    private GherkinState gState = GherkinState.GHERKIN;
    private boolean docLineStart;
    private boolean inDescription; // between Feature: and the first tag or section

    private enum GherkinState {
        GHERKIN,        // start of a line, after leading whitespace
        GS_DESC,        // rest of line after Feature:, Scenario: etc.
        GS_TAGS,        // tag line
        GS_TABLE_ROW,   // after |
        GS_DOC_STRING,  // between """
        GS_STEP         // after Given/When/Then/And/But/*
    }

    public GherkinLexer(Resource resource) {
        super(resource);
    }

    @Override
    protected TokenType scanToken() {
        if (isAtEnd()) {
            return EOF;
        }
        return switch (gState) {
            case GHERKIN -> scanGherkinInitial();
            case GS_DESC -> scanRestOfLine(G_DESC);
            case GS_TAGS -> scanGherkinTags();
            case GS_TABLE_ROW -> scanGherkinTableRow();
            case GS_DOC_STRING -> scanGherkinDocString();
            case GS_STEP -> scanRestOfLine(G_RHS);
        };
    }

    // ========== Whitespace ==========

    private TokenType scanWhitespace() {
        boolean newLine = false;
        while (!isAtEnd()) {
            char c = peek();
            if (isNewLine(c)) {
                newLine = true;
            } else if (!isSpaceOrTab(c)) {
                break;
            }
            advance();
        }
        if (newLine) {
            gState = GherkinState.GHERKIN;
            return WS_LF;
        }
        return WS;
    }

    private TokenType scanHorizontalWhitespace() {
        while (isSpaceOrTab(peek())) {
            advance();
        }
        return WS;
    }

    // ========== GHERKIN State ==========

    private TokenType scanGherkinInitial() {
        char c = peek();
        if (isSpaceOrTab(c) || isNewLine(c)) {
            return scanWhitespace();
        }
        if (c == '#') {
            advanceToLineEnd();
            return G_COMMENT;
        }
        if (c == '@') {
            inDescription = false;
            gState = GherkinState.GS_TAGS;
            return scanGherkinTag();
        }
        if (c == '|') {
            advance();
            gState = GherkinState.GS_TABLE_ROW;
            return G_PIPE;
        }
        if (lookingAt(TRIPLE_QUOTE) && !inDescription) {
            advance(3);
            gState = GherkinState.GS_DOC_STRING;
            docLineStart = false;
            return G_TRIPLE_QUOTE;
        }
        TokenType keyword = scanSectionKeyword();
        if (keyword != null) {
            if (keyword != G_EXAMPLES) {
                inDescription = keyword == G_FEATURE;
            }
            gState = GherkinState.GS_DESC;
            return keyword;
        }
        for (String prefix : STEP_KEYWORDS) {
            if (lookingAt(prefix) && isSpaceOrTab(peek(prefix.length()))) {
                advance(prefix.length());
                gState = GherkinState.GS_STEP;
                return G_PREFIX;
            }
        }
        // free text, e.g. a feature description line
        advanceToLineEnd();
        return G_DESC;
    }

    private TokenType scanSectionKeyword() {
        if (consumeKeyword(Keywords.FEATURE)) {
            return G_FEATURE;
        }
        if (consumeKeyword(Keywords.BACKGROUND)) {
            return G_BACKGROUND;
        }
        if (consumeKeyword(Keywords.SCENARIO_OUTLINE)) {
            return G_SCENARIO_OUTLINE;
        }
        if (consumeKeyword(Keywords.SCENARIO)) {
            return G_SCENARIO;
        }
        if (consumeKeyword(Keywords.EXAMPLES)) {
            return G_EXAMPLES;
        }
        return null;
    }

    private boolean consumeKeyword(String[] synonyms) {
        for (String keyword : synonyms) {
            if (lookingAt(keyword)) {
                advance(keyword.length());
                return true;
            }
        }
        return false;
    }

    private TokenType scanRestOfLine(TokenType type) {
        char c = peek();
        if (isNewLine(c)) {
            return scanWhitespace();
        }
        if (isSpaceOrTab(c)) {
            return scanHorizontalWhitespace();
        }
        advanceToLineEnd();
        return type;
    }

    // ========== GS_TAGS State ==========

    private TokenType scanGherkinTag() {
        advance(); // @
        while (!isAtEnd() && isTagChar(peek())) {
            advance();
        }
        return G_TAG;
    }

    static boolean isTagChar(char c) {
        return isLetter(c) || isDigit(c) || c == '_' || c == '-';
    }

    private TokenType scanGherkinTags() {
        char c = peek();
        if (isNewLine(c)) {
            return scanWhitespace();
        }
        if (isSpaceOrTab(c)) {
            return scanHorizontalWhitespace();
        }
        if (c == '@' && isSpaceOrTab(source.charAt(pos - 1))) {
            return scanGherkinTag();
        }
        if (c == '#') {
            advanceToLineEnd();
            return G_COMMENT;
        }
        // anything else on a tag line is invalid, including @ right after a
        // tag name, the parser reports it
        while (!isAtLineEnd() && !isSpaceOrTab(peek())) {
            advance();
        }
        return G_RHS;
    }

    // ========== GS_TABLE_ROW State ==========

    private TokenType scanGherkinTableRow() {
        char c = peek();
        if (isNewLine(c)) {
            return scanWhitespace();
        }
        if (c == '|') {
            advance();
            return G_PIPE;
        }
        // cell content keeps its surrounding spaces, trimmed by the parser
        while (!isAtLineEnd() && peek() != '|') {
            advance();
        }
        return G_TABLE_CELL;
    }

    // ========== GS_DOC_STRING State ==========

    private TokenType scanGherkinDocString() {
        if (docLineStart) {
            docLineStart = false;
            int i = pos;
            while (i < length && isSpaceOrTab(source.charAt(i))) {
                i++;
            }
            if (!source.startsWith(TRIPLE_QUOTE, i)) {
                // content line, leading whitespace is significant
                advanceToLineEnd();
                return G_DOC_LINE;
            }
            if (i > pos) {
                advance(i - pos);
                return WS;
            }
        }
        char c = peek();
        if (isNewLine(c)) {
            if (c == '\r') {
                advance();
            }
            match('\n');
            docLineStart = true;
            return WS_LF;
        }
        if (isSpaceOrTab(c)) {
            return scanHorizontalWhitespace();
        }
        if (lookingAt(TRIPLE_QUOTE)) {
            advance(3);
            gState = GherkinState.GHERKIN;
            return G_TRIPLE_QUOTE;
        }
        // text after the opening delimiter, rejected by the parser
        advanceToLineEnd();
        return G_RHS;
    }

}
