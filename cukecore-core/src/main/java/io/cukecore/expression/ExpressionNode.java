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

import java.util.List;

/**
 * One element of a compiled {@link Expression}.
 */
public class ExpressionNode {

    public enum Kind {
        LITERAL, PARAMETER, OPTIONAL, ALTERNATION
    }

    private final Kind kind;
    private final String text;
    private final ParameterType parameterType;
    private final boolean optional;
    private final List<String> options;

    private ExpressionNode(Kind kind, String text, ParameterType parameterType, boolean optional, List<String> options) {
        this.kind = kind;
        this.text = text;
        this.parameterType = parameterType;
        this.optional = optional;
        this.options = options;
    }

    public static ExpressionNode literal(String text) {
        return new ExpressionNode(Kind.LITERAL, text, null, false, List.of());
    }

    public static ExpressionNode parameter(ParameterType type, boolean optional) {
        return new ExpressionNode(Kind.PARAMETER, null, type, optional, List.of());
    }

    public static ExpressionNode optional(String text) {
        return new ExpressionNode(Kind.OPTIONAL, text, null, false, List.of());
    }

    public static ExpressionNode alternation(List<String> options) {
        return new ExpressionNode(Kind.ALTERNATION, null, null, false, List.copyOf(options));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the literal or optional text, null for the other kinds
     */
    public String getText() {
        return text;
    }

    public ParameterType getParameterType() {
        return parameterType;
    }

    public boolean isOptional() {
        return optional;
    }

    public List<String> getOptions() {
        return options;
    }

    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
                return "literal:" + text;
            case PARAMETER:
                return "parameter:" + parameterType.getTypeName() + (optional ? "?" : "");
            case OPTIONAL:
                return "optional:" + text;
            default:
                return "alternation:" + String.join("/", options);
        }
    }

}
