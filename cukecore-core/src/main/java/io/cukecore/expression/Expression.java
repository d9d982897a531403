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
import io.cukecore.parser.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A compiled step expression such as {@code I have {int} cucumber(s)}.
 * Instances are immutable: compile once, then call {@link #match(String)}
 * from any thread.
 * <p>
 * Matching is a single left-to-right walk that never backtracks. Each node
 * either consumes a fixed prefix of the remaining text or, for optional
 * parameters and optional text, decides by looking at that prefix alone.
 */
public class Expression {

    private static final Logger logger = LoggerFactory.getLogger(Expression.class);

    private final String pattern;
    private final List<ExpressionNode> nodes;

    private Expression(String pattern, List<ExpressionNode> nodes) {
        this.pattern = pattern;
        this.nodes = List.copyOf(nodes);
    }

    public static Expression compile(String pattern) {
        List<Token> tokens = BaseLexer.tokenize(new ExpressionLexer(Resource.text(pattern)));
        List<ExpressionNode> nodes = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        for (Token token : tokens) {
            switch (token.type) {
                case E_TEXT:
                case E_SPACE:
                    literal.append(token.text);
                    break;
                case E_ESCAPE:
                    literal.append(token.text.charAt(1));
                    break;
                case E_PARAMETER:
                    flush(literal, nodes);
                    nodes.add(toParameter(pattern, token));
                    break;
                case E_OPTIONAL:
                    flush(literal, nodes);
                    nodes.add(ExpressionNode.optional(token.text.substring(1, token.text.length() - 1)));
                    break;
                case E_ALTERNATION:
                    flush(literal, nodes);
                    nodes.add(ExpressionNode.alternation(Arrays.asList(token.text.split("/"))));
                    break;
                default: // EOF
                    flush(literal, nodes);
            }
        }
        Expression expression = new Expression(pattern, nodes);
        logger.debug("compiled expression: {} -> {}", pattern, expression.nodes);
        return expression;
    }

    private static void flush(StringBuilder literal, List<ExpressionNode> nodes) {
        if (literal.length() > 0) {
            nodes.add(ExpressionNode.literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static ExpressionNode toParameter(String pattern, Token token) {
        String name = token.text.substring(1, token.text.length() - 1);
        boolean optional = name.endsWith("?");
        if (optional) {
            name = name.substring(0, name.length() - 1);
        }
        ParameterType type = ParameterType.forName(name);
        if (type == null) {
            throw new ExpressionException("unknown parameter type: " + name, pattern, token.pos, token.text);
        }
        return ExpressionNode.parameter(type, optional);
    }

    /**
     * @return the captured values in pattern order, where an optional
     * parameter that was not present contributes null, or null if the text
     * does not match
     */
    public List<Object> match(String text) {
        List<Object> args = new ArrayList<>();
        int pos = 0;
        for (ExpressionNode node : nodes) {
            switch (node.getKind()) {
                case LITERAL:
                    if (!text.startsWith(node.getText(), pos)) {
                        return null;
                    }
                    pos += node.getText().length();
                    break;
                case PARAMETER:
                    ParameterType.Capture capture = node.getParameterType().parse(text, pos);
                    if (capture != null) {
                        args.add(capture.value());
                        pos = capture.end();
                    } else if (node.isOptional()) {
                        args.add(null);
                    } else {
                        return null;
                    }
                    break;
                case OPTIONAL:
                    if (text.startsWith(node.getText(), pos)) {
                        pos += node.getText().length();
                    }
                    break;
                case ALTERNATION:
                    String found = null;
                    for (String option : node.getOptions()) {
                        if (text.startsWith(option, pos)) {
                            found = option;
                            break;
                        }
                    }
                    if (found == null) {
                        return null;
                    }
                    pos += found.length();
                    break;
            }
        }
        if (pos != text.length()) {
            return null;
        }
        return Collections.unmodifiableList(args);
    }

    public boolean matches(String text) {
        return match(text) != null;
    }

    public String getPattern() {
        return pattern;
    }

    public List<ExpressionNode> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return pattern;
    }

}
