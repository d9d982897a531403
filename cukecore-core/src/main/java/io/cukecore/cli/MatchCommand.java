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
package io.cukecore.cli;

import io.cukecore.expression.Atom;
import io.cukecore.expression.Expression;
import io.cukecore.expression.ExpressionException;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * The 'match' subcommand, matches text against a step expression and prints
 * the captured values as a JSON array.
 * <pre>
 * cukecore match "I have {int} cucumber(s)" "I have 5 cucumbers"
 * </pre>
 * Exits with 1 when the text does not match and 2 when the expression does
 * not compile.
 */
@Command(
        name = "match",
        mixinStandardHelpOptions = true,
        description = "Match text against a step expression"
)
public class MatchCommand implements Callable<Integer> {

    static final int NO_MATCH = 1;
    static final int COMPILE_ERROR = 2;

    private static final Logger logger = LoggerFactory.getLogger(MatchCommand.class);

    @Parameters(index = "0", description = "Step expression, e.g. \"I have {int} items\"")
    String pattern;

    @Parameters(index = "1", description = "Text to match")
    String text;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        Expression expression;
        try {
            expression = Expression.compile(pattern);
        } catch (ExpressionException e) {
            logger.error("invalid expression: {}", e.getMessage());
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("message", e.getMessage());
            error.put("index", e.getIndex());
            error.put("fragment", e.getFragment());
            spec.commandLine().getOut().println(JSONValue.toJSONString(error));
            return COMPILE_ERROR;
        }
        List<Object> args = expression.match(text);
        if (args == null) {
            spec.commandLine().getErr().println("no match");
            return NO_MATCH;
        }
        List<Object> values = new ArrayList<>(args.size());
        for (Object arg : args) {
            values.add(arg instanceof Atom ? arg.toString() : arg);
        }
        spec.commandLine().getOut().println(JSONValue.toJSONString(values));
        return 0;
    }

}
