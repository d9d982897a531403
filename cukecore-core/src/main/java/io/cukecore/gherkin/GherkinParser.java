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
import io.cukecore.common.StringUtils;
import io.cukecore.parser.BaseLexer;
import io.cukecore.parser.BaseParser;
import io.cukecore.parser.Node;
import io.cukecore.parser.NodeType;
import io.cukecore.parser.ParserException;
import io.cukecore.parser.SyntaxError;
import io.cukecore.parser.Token;
import io.cukecore.parser.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static io.cukecore.parser.TokenType.*;

/**
 * Builds a {@link Feature} in two passes: a recursive-descent pass over the
 * tokens that produces a {@link Node} tree (available via {@link #getAst()}),
 * then a transform of that tree into the immutable model. The first problem
 * found stops parsing with a {@link ParserException}.
 */
public class GherkinParser extends BaseParser {

    private static final Logger logger = LoggerFactory.getLogger(GherkinParser.class);

    private static final TokenType[] SECTION_END = {G_TAG, G_SCENARIO, G_SCENARIO_OUTLINE, EOF};

    private static final TokenType[] DESCRIPTION = {G_DESC, G_PREFIX, G_RHS, G_PIPE, G_TABLE_CELL, G_EXAMPLES, G_FEATURE};

    private Node ast;

    public GherkinParser(Resource resource) {
        super(resource, BaseLexer.tokenize(new GherkinLexer(resource)));
    }

    /**
     * @return the G_FEATURE root of the tree built by the last call to {@link #parse()}
     */
    public Node getAst() {
        return ast;
    }

    public Feature parse() {
        ast = parseAst();
        Feature feature = transformToFeature(ast);
        if (logger.isDebugEnabled()) {
            logger.debug("parsed feature '{}' from {}: {} section(s), background: {}",
                    feature.getName(), resource, feature.getSections().size(), feature.isBackgroundPresent());
        }
        return feature;
    }

    // ========== AST Building ==========

    private Node parseAst() {
        enter(NodeType.G_FEATURE);
        boolean tagged = tags();
        if (!consumeIf(G_FEATURE)) {
            throw error(tagged ? "expected Feature: after tags" : "expected Feature:", "Feature:");
        }
        Token keyword = lastToken();
        if (!peekIfOnLine(G_DESC, keyword.line)) {
            throw error(keyword, "expected feature name", "feature name");
        }
        consumeNext();
        description();
        background();
        while (!peekIf(EOF)) {
            scenarioOrOutline();
        }
        exit();
        return rootNode().getFirst();
    }

    private boolean tags() {
        if (!peekIf(G_TAG)) {
            return false;
        }
        enter(NodeType.G_TAGS);
        while (peekIf(G_TAG)) {
            Token tag = peekToken();
            if (tag.text.length() < 2) {
                throw error("invalid tag, expected a name after @", "tag name");
            }
            consumeNext();
            if (peekIfOnLine(G_RHS, tag.line)) {
                if (peekToken().text.startsWith("@")) {
                    throw error("invalid tag, tags must be separated by whitespace", "tag");
                }
                throw error("invalid tag, tag names may only contain letters, digits, _ and -", "tag");
            }
        }
        return exit();
    }

    private boolean description() {
        if (!peekAnyOf(DESCRIPTION)) {
            return false;
        }
        enter(NodeType.G_DESCRIPTION);
        while (peekAnyOf(DESCRIPTION)) {
            consumeNext();
        }
        return exit();
    }

    private boolean background() {
        if (!enter(NodeType.G_BACKGROUND, G_BACKGROUND)) {
            return false;
        }
        // trailing text on the Background: line is ignored
        if (peekIfOnLine(G_DESC, lastToken().line)) {
            consumeNext();
        }
        steps();
        expectSectionEnd("step, Scenario: or Scenario Outline:");
        return exit();
    }

    private void scenarioOrOutline() {
        TokenType next = peekPast(G_TAG);
        if (next == G_SCENARIO) {
            scenario();
        } else if (next == G_SCENARIO_OUTLINE) {
            scenarioOutline();
        } else if (peekIf(G_TAG)) {
            tags();
            throw error("expected Scenario: or Scenario Outline: after tags", "Scenario:");
        } else {
            throw unexpected("Scenario: or Scenario Outline:");
        }
    }

    private void scenario() {
        enter(NodeType.G_SCENARIO);
        tags();
        consume(G_SCENARIO, "Scenario:");
        sectionName();
        steps();
        expectSectionEnd("step, Scenario: or Scenario Outline:");
        exit();
    }

    private void scenarioOutline() {
        enter(NodeType.G_SCENARIO_OUTLINE);
        tags();
        consume(G_SCENARIO_OUTLINE, "Scenario Outline:");
        Token keyword = lastToken();
        String name = sectionName();
        steps();
        int count = 0;
        while (peekIf(G_EXAMPLES) || (peekIf(G_TAG) && peekPast(G_TAG) == G_EXAMPLES)) {
            examples();
            count++;
        }
        if (count == 0) {
            if (peekAnyOf(SECTION_END)) {
                SyntaxError error = SyntaxError.at(keyword, "Scenario Outline has no Examples", "Examples:");
                throw new OutlineWithoutExamplesException(name, error);
            }
            throw unexpected("step or Examples:");
        }
        expectSectionEnd("Examples:, Scenario: or Scenario Outline:");
        exit();
    }

    private void examples() {
        enter(NodeType.G_EXAMPLES);
        tags();
        consume(G_EXAMPLES, "Examples:");
        sectionName();
        if (!peekIf(G_PIPE)) {
            throw error("expected Examples table header row", "table");
        }
        table();
        exit();
    }

    private String sectionName() {
        if (peekIfOnLine(G_DESC, lastToken().line)) {
            consumeNext();
            return lastToken().text.trim();
        }
        return StringUtils.EMPTY;
    }

    private void steps() {
        while (step()) {
            // collect steps
        }
    }

    private boolean step() {
        if (!enter(NodeType.G_STEP, G_PREFIX)) {
            return false;
        }
        Token keyword = lastToken();
        if (!peekIfOnLine(G_RHS, keyword.line)) {
            throw error(keyword, "expected step text after " + keyword.text, "step text");
        }
        consumeNext();
        if (docString()) {
            if (peekIf(G_PIPE)) {
                throw error("a step can have a doc string or a table, not both", "step");
            }
        } else if (table()) {
            if (peekIf(G_TRIPLE_QUOTE)) {
                throw error("a step can have a doc string or a table, not both", "step");
            }
        }
        return exit();
    }

    private boolean docString() {
        if (!enter(NodeType.G_DOC_STRING, G_TRIPLE_QUOTE)) {
            return false;
        }
        Token open = lastToken();
        if (peekIfOnLine(G_RHS, open.line)) {
            throw error("unexpected text after opening \"\"\"", "end of line");
        }
        while (consumeIf(G_DOC_LINE)) {
            // collect content lines
        }
        if (!consumeIf(G_TRIPLE_QUOTE)) {
            throw error(open, "unterminated doc string, expected closing \"\"\"", "\"\"\"");
        }
        return exit();
    }

    private boolean table() {
        if (!peekIf(G_PIPE)) {
            return false;
        }
        enter(NodeType.G_TABLE);
        while (tableRow()) {
            // collect rows
        }
        return exit();
    }

    private boolean tableRow() {
        if (!peekIf(G_PIPE)) {
            return false;
        }
        int rowLine = peekToken().line;
        enter(NodeType.G_TABLE_ROW);
        while (peekIfOnLine(G_PIPE, rowLine) || peekIfOnLine(G_TABLE_CELL, rowLine)) {
            consumeNext();
        }
        return exit();
    }

    private void expectSectionEnd(String expected) {
        if (!peekAnyOf(SECTION_END)) {
            throw unexpected(expected);
        }
    }

    private ParserException unexpected(String expected) {
        Token token = peekToken();
        String message = switch (token.type) {
            case G_BACKGROUND -> "unexpected Background:, only one is allowed, before the first scenario";
            case G_FEATURE -> "unexpected Feature:, only one is allowed per file";
            case G_EXAMPLES -> "unexpected Examples:, only allowed after a Scenario Outline";
            case G_PIPE -> "unexpected table row, expected " + expected;
            case G_TRIPLE_QUOTE -> "unexpected doc string, expected " + expected;
            default -> "unexpected text, expected " + expected;
        };
        return error(token, message, expected);
    }

    // ========== AST to Domain Transformation ==========

    private Feature transformToFeature(Node node) {
        List<String> tags = List.of();
        String name = null;
        String description = StringUtils.EMPTY;
        Background background = null;
        List<FeatureSection> sections = new ArrayList<>();
        int line = -1;
        for (Node child : node) {
            switch (child.type) {
                case G_TAGS -> tags = transformTags(child);
                case TOKEN -> {
                    if (child.token.type == G_FEATURE) {
                        line = child.token.line;
                    } else if (child.token.type == G_DESC) {
                        name = child.token.text.trim();
                    }
                }
                case G_DESCRIPTION -> description = transformDescription(child);
                case G_BACKGROUND -> background = transformBackground(child);
                case G_SCENARIO -> sections.add(FeatureSection.of(sections.size(), transformScenario(child)));
                case G_SCENARIO_OUTLINE -> sections.add(FeatureSection.of(sections.size(), transformScenarioOutline(child)));
                default -> {
                    // nothing else is produced at this level
                }
            }
        }
        return new Feature(name, description, background, sections, tags, line);
    }

    private static List<String> transformTags(Node node) {
        Set<String> tags = new LinkedHashSet<>();
        for (Node child : node) {
            if (child.isToken(G_TAG)) {
                tags.add(child.token.text.substring(1));
            }
        }
        return new ArrayList<>(tags);
    }

    private String transformDescription(Node node) {
        List<String> lines = new ArrayList<>();
        int lastLine = -1;
        for (Node child : node) {
            int line = child.token.line;
            if (line == lastLine) {
                continue;
            }
            lastLine = line;
            String text = child.token.getLineText().trim();
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        return StringUtils.join(lines, "\n");
    }

    private Background transformBackground(Node node) {
        List<Step> steps = new ArrayList<>();
        for (Node child : node) {
            if (child.type == NodeType.G_STEP) {
                steps.add(transformStep(child));
            }
        }
        return new Background(steps, node.getFirstToken().line);
    }

    private Scenario transformScenario(Node node) {
        List<String> tags = List.of();
        String name = StringUtils.EMPTY;
        List<Step> steps = new ArrayList<>();
        int line = -1;
        for (Node child : node) {
            switch (child.type) {
                case G_TAGS -> tags = transformTags(child);
                case TOKEN -> {
                    if (child.token.type == G_SCENARIO) {
                        line = child.token.line;
                    } else if (child.token.type == G_DESC) {
                        name = child.token.text.trim();
                    }
                }
                case G_STEP -> steps.add(transformStep(child));
                default -> {
                    // ignore
                }
            }
        }
        return new Scenario(name, steps, tags, line);
    }

    private ScenarioOutline transformScenarioOutline(Node node) {
        List<String> tags = List.of();
        String name = StringUtils.EMPTY;
        List<Step> steps = new ArrayList<>();
        List<Examples> examples = new ArrayList<>();
        int line = -1;
        for (Node child : node) {
            switch (child.type) {
                case G_TAGS -> tags = transformTags(child);
                case TOKEN -> {
                    if (child.token.type == G_SCENARIO_OUTLINE) {
                        line = child.token.line;
                    } else if (child.token.type == G_DESC) {
                        name = child.token.text.trim();
                    }
                }
                case G_STEP -> steps.add(transformStep(child));
                case G_EXAMPLES -> examples.add(transformExamples(child));
                default -> {
                    // ignore
                }
            }
        }
        return new ScenarioOutline(name, steps, tags, examples, line);
    }

    private Examples transformExamples(Node node) {
        List<String> tags = List.of();
        String name = StringUtils.EMPTY;
        List<List<String>> rows = null;
        Node tableNode = null;
        int line = -1;
        for (Node child : node) {
            switch (child.type) {
                case G_TAGS -> tags = transformTags(child);
                case TOKEN -> {
                    if (child.token.type == G_EXAMPLES) {
                        line = child.token.line;
                    } else if (child.token.type == G_DESC) {
                        name = child.token.text.trim();
                    }
                }
                case G_TABLE -> {
                    tableNode = child;
                    rows = transformTable(child);
                }
                default -> {
                    // ignore
                }
            }
        }
        List<String> header = rows.get(0);
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() != header.size()) {
                Token first = tableNode.get(i).getFirstToken();
                throw error(first, "Examples row has " + row.size() + " cell(s) but the header has " + header.size(),
                        header.size() + " cell(s)");
            }
        }
        return new Examples(name, tags, header, rows.subList(1, rows.size()), line);
    }

    private Step transformStep(Node node) {
        String keyword = null;
        String text = null;
        String docString = null;
        List<List<String>> table = null;
        int line = -1;
        for (Node child : node) {
            switch (child.type) {
                case TOKEN -> {
                    if (child.token.type == G_PREFIX) {
                        keyword = child.token.text;
                        line = child.token.line;
                    } else if (child.token.type == G_RHS) {
                        text = child.token.text.trim();
                    }
                }
                case G_DOC_STRING -> docString = transformDocString(child);
                case G_TABLE -> table = transformTable(child);
                default -> {
                    // ignore
                }
            }
        }
        return new Step(keyword, text, docString, table, line);
    }

    private static String transformDocString(Node node) {
        List<String> lines = new ArrayList<>();
        for (Node child : node) {
            if (child.isToken(G_DOC_LINE)) {
                lines.add(child.token.text);
            }
        }
        return joinDocString(lines);
    }

    /**
     * Strips the smallest indentation found on a non-empty line from every
     * line, joins with a newline and trims trailing whitespace.
     */
    static String joinDocString(List<String> lines) {
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isEmpty()) {
                indent = Math.min(indent, StringUtils.countLeadingWhitespace(line));
            }
        }
        if (indent == Integer.MAX_VALUE) {
            indent = 0;
        }
        List<String> stripped = new ArrayList<>(lines.size());
        for (String line : lines) {
            stripped.add(line.length() <= indent ? StringUtils.EMPTY : line.substring(indent));
        }
        return StringUtils.trimTrailing(StringUtils.join(stripped, "\n"));
    }

    private List<List<String>> transformTable(Node node) {
        List<List<String>> rows = new ArrayList<>(node.size());
        for (Node row : node) {
            rows.add(transformTableRow(row));
        }
        return rows;
    }

    // cells are the segments between pipes, only a blank segment after the last pipe is dropped
    private List<String> transformTableRow(Node node) {
        List<String> cells = new ArrayList<>();
        String current = null;
        for (int i = 1; i < node.size(); i++) {
            Token token = node.get(i).token;
            if (token.type == G_PIPE) {
                cells.add(current == null ? StringUtils.EMPTY : current.trim());
                current = null;
            } else {
                current = token.text;
            }
        }
        if (current != null && !current.isBlank()) {
            cells.add(current.trim());
        }
        if (cells.isEmpty()) {
            throw error(node.getFirstToken(), "table row has no cells", "|");
        }
        return cells;
    }

}
