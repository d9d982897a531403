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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static io.cukecore.parser.TokenType.*;

/**
 * Recursive-descent helper over a list of primary tokens. Sub-classes call
 * {@link #enter(NodeType, TokenType)} / {@link #exit()} around each grammar
 * rule, which builds a {@link Node} tree as a side effect of consuming tokens.
 */
public abstract class BaseParser {

    static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    private static final int MAX_DEPTH = 64;

    protected final Resource resource;
    protected final List<Token> tokens;
    private final int size;

    private int position = 0;

    private int stackPointer = 0;
    private final int[] positionStack = new int[MAX_DEPTH];
    private final Node[] nodeStack = new Node[MAX_DEPTH];

    protected BaseParser(Resource resource, List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.resource = resource;
        this.tokens = tokens;
        size = tokens.size();
        positionStack[0] = position;
        nodeStack[0] = new Node(NodeType.ROOT);
        stackPointer = 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, position - 5);
        int end = Math.min(position + 5, size);
        for (int i = start; i < end; i++) {
            if (i == position) {
                sb.append(">>");
            }
            sb.append(tokens.get(i)).append(' ');
        }
        sb.append("| current node: [").append(nodeStack[stackPointer - 1].type).append(']');
        return sb.toString();
    }

    protected Node rootNode() {
        return nodeStack[0];
    }

    // ========== Errors ==========

    protected ParserException error(String message, String expected) {
        return error(peekToken(), message, expected);
    }

    protected ParserException error(Token token, String message, String expected) {
        SyntaxError error = SyntaxError.at(token, message, expected);
        if (logger.isTraceEnabled()) {
            logger.trace("{} - parser state: {}", error, this);
        }
        return new ParserException(error);
    }

    // ========== Node Markers ==========

    protected void enter(NodeType type) {
        push(type);
    }

    protected boolean enter(NodeType type, TokenType token) {
        if (peek() != token) {
            return false;
        }
        push(type);
        consumeNext();
        return true;
    }

    private void push(NodeType type) {
        if (stackPointer >= MAX_DEPTH) {
            throw new IllegalStateException("too much recursion");
        }
        positionStack[stackPointer] = position;
        nodeStack[stackPointer] = new Node(type);
        stackPointer++;
    }

    protected boolean exit() {
        Node node = nodeStack[stackPointer - 1];
        nodeStack[stackPointer - 2].add(node);
        stackPointer--;
        nodeStack[stackPointer] = null;
        return true;
    }

    // ========== Token Cursor ==========

    protected TokenType peek() {
        return peekToken().type;
    }

    protected Token peekToken() {
        return tokens.get(Math.min(position, size - 1));
    }

    protected Token lastToken() {
        return position == 0 ? peekToken() : tokens.get(position - 1);
    }

    /**
     * @return the type of the first token at or after the cursor that is not of the given type
     */
    protected TokenType peekPast(TokenType skip) {
        int i = position;
        while (i < size - 1 && tokens.get(i).type == skip) {
            i++;
        }
        return tokens.get(i).type;
    }

    protected boolean peekIf(TokenType token) {
        return peek() == token;
    }

    protected boolean peekAnyOf(TokenType... types) {
        TokenType current = peek();
        for (TokenType type : types) {
            if (current == type) {
                return true;
            }
        }
        return false;
    }

    protected boolean peekIfOnLine(TokenType token, int line) {
        Token next = peekToken();
        return next.type == token && next.line == line;
    }

    protected boolean consumeIf(TokenType token) {
        if (peekIf(token)) {
            consumeNext();
            return true;
        }
        return false;
    }

    protected void consume(TokenType token, String expected) {
        if (!consumeIf(token)) {
            throw error("expected: " + expected, expected);
        }
    }

    protected void consumeNext() {
        nodeStack[stackPointer - 1].add(new Node(next()));
    }

    protected Token next() {
        Token token = peekToken();
        if (position < size - 1) {
            position++;
        }
        return token;
    }

}
