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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class Node implements Iterable<Node> {

    public final NodeType type;
    public final Token token;
    private final List<Node> children = new ArrayList<>(4);

    public Node(NodeType type) {
        this.type = type;
        this.token = null;
    }

    public Node(Token token) {
        this.type = NodeType.TOKEN;
        this.token = token;
    }

    public boolean isToken() {
        return type == NodeType.TOKEN;
    }

    public boolean isToken(TokenType tokenType) {
        return type == NodeType.TOKEN && token.type == tokenType;
    }

    public Token getFirstToken() {
        if (isToken()) {
            return token;
        }
        return children.isEmpty() ? null : children.get(0).getFirstToken();
    }

    public Node findFirstChild(NodeType type) {
        for (Node child : children) {
            if (child.type == type) {
                return child;
            }
            Node temp = child.findFirstChild(type);
            if (temp != null) {
                return temp;
            }
        }
        return null;
    }

    public void add(Node node) {
        children.add(node);
    }

    public Node get(int index) {
        return children.get(index);
    }

    public Node getFirst() {
        return children.get(0);
    }

    public int size() {
        return children.size();
    }

    @Override
    public Iterator<Node> iterator() {
        return children.iterator();
    }

    public String toStringWithoutType() {
        if (isToken()) {
            return token.text;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < children.size(); i++) {
            if (i != 0) {
                sb.append(' ');
            }
            sb.append(children.get(i).toStringWithoutType());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        if (isToken()) {
            return token.text;
        }
        return "[" + type + "] " + toStringWithoutType();
    }

}
