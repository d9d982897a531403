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

public class ExpressionException extends RuntimeException {

    private final String pattern;
    private final int index;
    private final String fragment;

    public ExpressionException(String message, String pattern, int index, String fragment) {
        super(message + " at index " + index + " in expression: " + pattern);
        this.pattern = pattern;
        this.index = index;
        this.fragment = fragment;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * @return 0-based index into the pattern where the problem starts
     */
    public int getIndex() {
        return index;
    }

    public String getFragment() {
        return fragment;
    }

}
