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

import io.cukecore.gherkin.Feature;
import io.cukecore.gherkin.Scenario;
import io.cukecore.parser.ParserException;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * The 'parse' subcommand, prints a feature file as JSON.
 * <p>
 * Usage examples:
 * <pre>
 * # the parsed tree
 * cukecore parse src/test/resources/checkout.feature
 *
 * # every outline replaced by one scenario per examples row
 * cukecore parse --expand src/test/resources/checkout.feature
 * </pre>
 * Exits with 1 when the file cannot be read or parsed, the parse error is
 * printed as JSON.
 */
@Command(
        name = "parse",
        mixinStandardHelpOptions = true,
        description = "Parse a feature file and print it as JSON"
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ParseCommand.class);

    @Parameters(index = "0", description = "Feature file to parse")
    Path file;

    @Option(
            names = {"-e", "--expand"},
            description = "Expand scenario outlines into concrete scenarios"
    )
    boolean expand;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        Feature feature;
        try {
            feature = Feature.read(file);
        } catch (UncheckedIOException e) {
            logger.error("cannot read {}: {}", file, e.getMessage());
            spec.commandLine().getErr().println("cannot read file: " + file);
            return 1;
        } catch (ParserException e) {
            logger.error("{}: {}", file, e.getMessage());
            out.println(JSONValue.toJSONString(e.getError().toMap()));
            return 1;
        }
        Map<String, Object> map = feature.toMap();
        if (expand) {
            List<Map<String, Object>> scenarios = new ArrayList<>();
            for (Scenario scenario : feature.getExpandedScenarios()) {
                scenarios.add(scenario.toMap());
            }
            map.put("scenarios", scenarios);
        }
        out.println(JSONValue.toJSONString(map));
        return 0;
    }

}
