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

public enum TokenType {

    WS_LF(false),
    WS(false),
    EOF,
    //==== gherkin
    G_PREFIX,
    G_COMMENT(false),
    G_DESC,
    G_FEATURE,
    G_BACKGROUND,
    G_SCENARIO,
    G_SCENARIO_OUTLINE,
    G_EXAMPLES,
    G_TAG,
    G_TRIPLE_QUOTE,
    G_DOC_LINE,
    G_PIPE,
    G_TABLE_CELL,
    G_RHS,
    //==== step expressions
    E_TEXT,
    E_SPACE,
    E_ESCAPE,
    E_PARAMETER,
    E_OPTIONAL,
    E_ALTERNATION;

    // note that EOF is "primary" for parsing and not considered white-space
    public final boolean primary;

    TokenType() {
        this(true);
    }

    TokenType(boolean primary) {
        this.primary = primary;
    }

}
