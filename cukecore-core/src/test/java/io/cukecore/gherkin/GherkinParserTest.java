package io.cukecore.gherkin;

import io.cukecore.common.Resource;
import io.cukecore.parser.Node;
import io.cukecore.parser.NodeType;
import io.cukecore.parser.ParserException;
import io.cukecore.parser.SyntaxError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GherkinParserTest {

    Feature feature;
    Scenario scenario;
    ScenarioOutline outline;

    private void feature(String text) {
        GherkinParser parser = new GherkinParser(Resource.text(text));
        feature = parser.parse();
        scenario = null;
        outline = null;
        if (!feature.getSections().isEmpty()) {
            FeatureSection section = feature.getSections().get(0);
            scenario = section.getScenario();
            outline = section.getScenarioOutline();
        }
    }

    private static SyntaxError error(String text) {
        ParserException e = assertThrows(ParserException.class, () -> Feature.parse(text));
        return e.getError();
    }

    @Test
    void testFeatureBasics() {
        feature("""
                Feature: foo
                """);
        assertEquals("foo", feature.getName());
        assertEquals("", feature.getDescription());
        assertEquals(0, feature.getLine());
        assertTrue(feature.getTags().isEmpty());
        assertNull(feature.getBackground());
        assertFalse(feature.isBackgroundPresent());
        assertTrue(feature.getSections().isEmpty());

        feature("""
                Feature: foo
                    bar

                  baz
                """);
        assertEquals("foo", feature.getName());
        assertEquals("bar\nbaz", feature.getDescription());

        feature("""
                @tag1 @tag2
                @tag1
                Feature: foo
                """);
        assertEquals(List.of("tag1", "tag2"), feature.getTags());
        assertEquals(2, feature.getLine());
    }

    @Test
    void testLeadingBlankLinesAndComments() {
        feature("\n\n# a comment\n   \nFeature: padded\n");
        assertEquals("padded", feature.getName());
        assertEquals(4, feature.getLine());
    }

    @Test
    void testDescriptionMayLookLikeSteps() {
        feature("""
                Feature: f
                  Given this is only a description
                  | and so is this |
                Scenario: s
                """);
        assertEquals("Given this is only a description\n| and so is this |", feature.getDescription());
        assertEquals("s", scenario.getName());
    }

    @Test
    void testTripleQuoteInDescription() {
        feature("""
                Feature: f
                  some text
                  \"""
                  more
                Scenario: s
                  Given x
                """);
        assertEquals("some text\n\"\"\"\nmore", feature.getDescription());
        assertEquals(1, scenario.getSteps().size());
        assertFalse(scenario.getSteps().get(0).hasDocString());
    }

    @Test
    void testScenarioBasics() {
        feature("""
                Feature: f
                Scenario: foo
                  Given a thing
                  When I do "x"
                  Then ok
                """);
        assertEquals("foo", scenario.getName());
        assertEquals(1, scenario.getLine());
        assertEquals(3, scenario.getSteps().size());
        Step step = scenario.getSteps().get(0);
        assertEquals("Given", step.getKeyword());
        assertEquals("a thing", step.getText());
        assertEquals(2, step.getLine());
        assertFalse(step.hasDocString());
        assertFalse(step.hasDataTable());
        assertEquals("When", scenario.getSteps().get(1).getKeyword());
        assertEquals("I do \"x\"", scenario.getSteps().get(1).getText());
        assertEquals(4, scenario.getSteps().get(2).getLine());
    }

    @Test
    void testStepTextIsTrimmed() {
        feature("Feature: f\nScenario: s\n  Given   lots of space   \t\n");
        assertEquals("lots of space", scenario.getSteps().get(0).getText());
    }

    @Test
    void testAllStepKeywords() {
        feature("""
                Feature: f
                Scenario:
                  Given a
                  When b
                  Then c
                  And d
                  But e
                  * f
                """);
        assertEquals("", scenario.getName());
        List<Step> steps = scenario.getSteps();
        assertEquals(6, steps.size());
        String[] keywords = {"Given", "When", "Then", "And", "But", "*"};
        for (int i = 0; i < keywords.length; i++) {
            assertEquals(keywords[i], steps.get(i).getKeyword());
        }
        assertEquals("f", steps.get(5).getText());
    }

    @Test
    void testKeywordsAreCaseSensitive() {
        SyntaxError error = error("""
                Feature: f
                Scenario: s
                  given lower case
                """);
        assertEquals(3, error.line);
        assertEquals(3, error.column);
        assertEquals("given lower case", error.fragment);
    }

    @Test
    void testCrLfLineEndings() {
        feature("Feature: f\r\nScenario: s\r\n  Given x\r\n  Then y\r\n");
        assertEquals("f", feature.getName());
        assertEquals(2, scenario.getSteps().size());
        assertEquals("x", scenario.getSteps().get(0).getText());
        assertEquals(3, scenario.getSteps().get(1).getLine());
    }

    @Test
    void testBackground() {
        feature("""
                Feature: f
                Background: ignored text
                  Given setup
                  And more setup
                Scenario: s
                  Then x
                """);
        Background background = feature.getBackground();
        assertNotNull(background);
        assertEquals(1, background.getLine());
        assertEquals(2, background.getSteps().size());
        List<Step> all = scenario.getStepsIncludingBackground(background);
        assertEquals(3, all.size());
        assertEquals("setup", all.get(0).getText());
        assertEquals("x", all.get(2).getText());
        // the background is not merged into the scenario itself
        assertEquals(1, scenario.getSteps().size());
    }

    @Test
    void testSecondBackgroundIsAnError() {
        SyntaxError error = error("""
                Feature: f
                Background:
                  Given a
                Background:
                  Given b
                """);
        assertEquals(4, error.line);
        assertTrue(error.message.contains("Background"));
    }

    @Test
    void testBackgroundAfterScenarioIsAnError() {
        SyntaxError error = error("""
                Feature: f
                Scenario: s
                  Given a
                Background:
                  Given b
                """);
        assertEquals(4, error.line);
    }

    @Test
    void testTags() {
        feature("""
                @feature-tag
                Feature: f

                @one @two_2
                @three # trailing comment
                Scenario: first
                  Given a

                Scenario: second
                  Given b
                """);
        assertEquals(List.of("feature-tag"), feature.getTags());
        assertEquals(List.of("one", "two_2", "three"), scenario.getTags());
        // feature tags are not inherited
        assertTrue(feature.getSection(1).getScenario().getTags().isEmpty());
    }

    @Test
    void testInvalidTags() {
        SyntaxError error = error("""
                Feature: f
                @foo!bar
                Scenario: s
                """);
        assertEquals(2, error.line);
        assertTrue(error.message.contains("invalid tag"));

        error = error("""
                Feature: f
                @ lonely
                Scenario: s
                """);
        assertEquals(2, error.line);
        assertEquals(1, error.column);

        error = error("Feature: f\n@a@b\nScenario: s\n");
        assertEquals(2, error.line);
        assertEquals(3, error.column);
        assertTrue(error.message.contains("invalid tag"));
        assertTrue(error.message.contains("separated by whitespace"));
    }

    @Test
    void testTagsWithoutSection() {
        SyntaxError error = error("""
                Feature: f
                Scenario: s
                  Given a
                @dangling
                """);
        assertTrue(error.message.contains("after tags"));
        assertEquals("", error.fragment);
    }

    @Test
    void testDocString() {
        feature("""
                Feature: f
                Scenario: s
                  Given text
                    \"""
                      Hello
                      World
                    \"""
                  Then done
                """);
        Step step = scenario.getSteps().get(0);
        assertTrue(step.hasDocString());
        assertEquals("Hello\nWorld", step.getDocString());
        assertNull(step.getDataTable());
        assertEquals(2, scenario.getSteps().size());
    }

    @Test
    void testDocStringKeepsRelativeIndentationAndBlankLines() {
        feature("""
                Feature: f
                Scenario: s
                  Given text
                    \"""
                      a
                        b

                      # not a comment
                      Scenario: not a keyword
                      | not a table |


                    \"""
                """);
        assertEquals("a\n  b\n\n# not a comment\nScenario: not a keyword\n| not a table |",
                scenario.getSteps().get(0).getDocString());
    }

    @Test
    void testEmptyDocString() {
        feature("Feature: f\nScenario: s\n  Given text\n    \"\"\"\n    \"\"\"\n");
        assertEquals("", scenario.getSteps().get(0).getDocString());
    }

    @Test
    void testJoinDocString() {
        assertEquals("Hello\nWorld", GherkinParser.joinDocString(List.of("  Hello", "  World")));
        assertEquals("x\n\n  y", GherkinParser.joinDocString(List.of("\tx", "", "\t  y", "   ")));
        assertEquals("", GherkinParser.joinDocString(List.of()));
        // whitespace-only lines still count toward the common indentation
        assertEquals("  Hello\n\n  World", GherkinParser.joinDocString(List.of("      Hello", "    ", "      World")));
    }

    @Test
    void testDocStringWithLessIndentedWhitespaceLine() {
        feature("Feature: f\nScenario: s\n  Given text\n    \"\"\"\n      Hello\n    \n      World\n    \"\"\"\n");
        assertEquals("  Hello\n\n  World", scenario.getSteps().get(0).getDocString());
    }

    @Test
    void testUnterminatedDocString() {
        SyntaxError error = error("""
                Feature: f
                Scenario: s
                  Given text
                    \"""
                    hello
                """);
        assertEquals(4, error.line);
        assertEquals(5, error.column);
        assertTrue(error.message.contains("unterminated"));
    }

    @Test
    void testTextAfterOpeningDocStringDelimiter() {
        SyntaxError error = error("""
                Feature: f
                Scenario: s
                  Given text
                    \"""json
                    {}
                    \"""
                """);
        assertEquals(4, error.line);
        assertEquals(8, error.column);
        assertEquals("json", error.fragment);
    }

    @Test
    void testDataTable() {
        feature("""
                Feature: f
                Scenario: s
                  Given users

                    | name  | age |
                    | alice | 30  |
                    | a | | c |
                    | no trailing | pipe
                  Then done
                """);
        Step step = scenario.getSteps().get(0);
        assertTrue(step.hasDataTable());
        assertFalse(step.hasDocString());
        List<List<String>> table = step.getDataTable();
        assertEquals(4, table.size());
        assertEquals(List.of("name", "age"), table.get(0));
        assertEquals(List.of("alice", "30"), table.get(1));
        assertEquals(List.of("a", "", "c"), table.get(2));
        assertEquals(List.of("no trailing", "pipe"), table.get(3));
        assertEquals("done", scenario.getSteps().get(1).getText());
    }

    @Test
    void testTableRowWithoutCells() {
        SyntaxError error = error("""
                Feature: f
                Scenario: s
                  Given users
                    | name |
                    |
                """);
        assertEquals(5, error.line);
        assertEquals(5, error.column);
        assertTrue(error.message.contains("no cells"));
    }

    @Test
    void testDocStringAndTableOnOneStep() {
        SyntaxError error = error("""
                Feature: f
                Scenario: s
                  Given both
                    \"""
                    text
                    \"""
                    | a |
                """);
        assertEquals(7, error.line);
        assertTrue(error.message.contains("not both"));

        error = error("""
                Feature: f
                Scenario: s
                  Given both
                    | a |
                    \"""
                    text
                    \"""
                """);
        assertEquals(5, error.line);
    }

    @Test
    void testUnexpectedLineInScenario() {
        SyntaxError error = error("Feature: f\nScenario: s\n  oops here\n  Given x\n");
        assertEquals(3, error.line);
        assertEquals(3, error.column);
        assertEquals("oops here", error.fragment);
        assertTrue(error.snippet.startsWith("oops here\n  Given x"));
        assertTrue(error.message.contains("unexpected text"));
    }

    @Test
    void testMissingFeature() {
        SyntaxError error = error("""
                @tag
                Scenario: x
                """);
        assertEquals(2, error.line);
        assertEquals(1, error.column);
        assertTrue(error.message.contains("after tags"));
        assertEquals("Feature:", error.expected);

        error = error("hello\nFeature: x\n");
        assertEquals(1, error.line);
        assertEquals("hello", error.fragment);

        error = error("");
        assertEquals(1, error.line);
        assertEquals("", error.fragment);
        assertEquals("", error.snippet);
    }

    @Test
    void testMissingFeatureName() {
        SyntaxError error = error("Feature:   \nScenario: s\n");
        assertEquals(1, error.line);
        assertEquals(1, error.column);
        assertEquals("expected feature name", error.message);
    }

    @Test
    void testScenarioOutline() {
        feature("""
                Feature: f
                @outline-tag
                Scenario Outline: eat <count>
                  Given I have <count> cucumbers
                  Then I have <left> left
                  @smoke
                  Examples: first
                    | count | left |
                    | 12    | 5    |
                  @regression
                  Scenarios:
                    | count | left |
                    | 20    | 15   |
                    | 1     | 0    |
                """);
        assertNull(scenario);
        assertNotNull(outline);
        assertTrue(feature.getSections().get(0).isOutline());
        assertEquals("eat <count>", outline.getName());
        assertEquals(2, outline.getLine());
        assertEquals(List.of("outline-tag"), outline.getTags());
        assertEquals(2, outline.getExamples().size());
        Examples first = outline.getExamples().get(0);
        assertEquals("first", first.getName());
        assertEquals(6, first.getLine());
        assertEquals(List.of("smoke"), first.getTags());
        assertEquals(List.of("count", "left"), first.getTableHeader());
        assertEquals(List.of(List.of("12", "5")), first.getTableBody());
        Examples second = outline.getExamples().get(1);
        assertEquals("", second.getName());
        assertEquals(List.of("regression"), second.getTags());
        assertEquals(2, second.getTableBody().size());
        assertEquals("I have <count> cucumbers", outline.getSteps().get(0).getText());
    }

    @Test
    void testOutlineExpansion() {
        feature("""
                Feature: f
                @outline-tag
                Scenario Template: eat
                  Given I have <count> cucumbers
                  Then I have <left> left
                  @smoke
                  Examples: first
                    | count | left |
                    | 12    | 5    |
                  @regression @outline-tag
                  Examples:
                    | count | left |
                    | 20    | 15   |
                    | 1     | 0    |
                """);
        List<Scenario> scenarios = outline.expand();
        assertEquals(3, scenarios.size());
        assertEquals(3, feature.getExpandedScenarios().size());

        Scenario s1 = scenarios.get(0);
        assertEquals("eat (first: row 1)", s1.getName());
        assertEquals(List.of("outline-tag", "smoke"), s1.getTags());
        assertEquals("I have 12 cucumbers", s1.getSteps().get(0).getText());
        assertEquals("I have 5 left", s1.getSteps().get(1).getText());
        assertEquals(2, s1.getLine());

        Scenario s2 = scenarios.get(1);
        assertEquals("eat (row 1)", s2.getName());
        assertEquals(List.of("outline-tag", "regression"), s2.getTags());
        assertEquals("I have 20 cucumbers", s2.getSteps().get(0).getText());

        Scenario s3 = scenarios.get(2);
        assertEquals("eat (row 2)", s3.getName());
        assertEquals("I have 1 cucumbers", s3.getSteps().get(0).getText());
        assertEquals("I have 0 left", s3.getSteps().get(1).getText());
    }

    @Test
    void testExpansionReplacesDocStringAndTableCells() {
        feature("""
                Feature: f
                Scenario Outline: o
                  Given a body
                    \"""
                    {"id": <id>}
                    \"""
                  And a table
                    | id   | <id>   |
                    | name | <name> |
                  Examples:
                    | id | name  |
                    | 7  | seven |
                """);
        Scenario expanded = outline.expand().get(0);
        assertEquals("{\"id\": 7}", expanded.getSteps().get(0).getDocString());
        assertEquals(List.of(List.of("id", "7"), List.of("name", "seven")), expanded.getSteps().get(1).getDataTable());
        // the outline itself is untouched
        assertEquals("{\"id\": <id>}", outline.getSteps().get(0).getDocString());
    }

    @Test
    void testTagsAfterExamplesBelongToNextSection() {
        feature("""
                Feature: f
                Scenario Outline: o
                  Given <a>
                  Examples:
                    | a |
                    | 1 |
                @next
                Scenario: s
                  Given b
                """);
        assertTrue(outline.getExamples().get(0).getTags().isEmpty());
        Scenario next = feature.getSection(1).getScenario();
        assertEquals(List.of("next"), next.getTags());
        assertEquals(7, next.getLine());
        assertEquals(2, feature.getExpandedScenarios().size());
    }

    @Test
    void testOutlineWithoutExamples() {
        OutlineWithoutExamplesException e = assertThrows(OutlineWithoutExamplesException.class, () -> Feature.parse("""
                Feature: f
                Scenario Outline: lonely
                  Given <a>
                Scenario: next
                  Given b
                """));
        assertEquals("lonely", e.getOutlineName());
        assertEquals(2, e.getError().line);
        assertEquals(1, e.getError().column);
        assertEquals("Scenario Outline:", e.getError().fragment);

        assertThrows(OutlineWithoutExamplesException.class, () -> Feature.parse("""
                Feature: f
                Scenario Outline: at the end
                  Given <a>
                """));
    }

    @Test
    void testExamplesErrors() {
        SyntaxError error = error("""
                Feature: f
                Scenario Outline: o
                  Given <a>
                  Examples:
                Scenario: s
                """);
        assertEquals(5, error.line);
        assertTrue(error.message.contains("header row"));

        error = error("""
                Feature: f
                Scenario Outline: o
                  Given <a>
                  Examples:
                    | a | b |
                    | 1 |
                """);
        assertEquals(6, error.line);
        assertEquals(5, error.column);
        assertTrue(error.message.contains("cell"));

        error = error("""
                Feature: f
                Scenario: s
                  Given a
                  Examples:
                    | a |
                """);
        assertEquals(4, error.line);
        assertTrue(error.message.contains("Examples"));
    }

    @Test
    void testExamplesWithHeaderOnly() {
        feature("""
                Feature: f
                Scenario Outline: o
                  Given <a>
                  Examples:
                    | a |
                """);
        assertTrue(outline.getExamples().get(0).getTableBody().isEmpty());
        assertTrue(outline.expand().isEmpty());
    }

    @Test
    void testFeatureSectionsKeepOrder() {
        feature("""
                Feature: f
                Scenario: one
                  Given a
                Scenario Outline: two
                  Given <x>
                  Examples:
                    | x |
                    | 1 |
                Scenario: three
                  Given c
                """);
        List<FeatureSection> sections = feature.getSections();
        assertEquals(3, sections.size());
        for (int i = 0; i < sections.size(); i++) {
            assertEquals(i, sections.get(i).getIndex());
        }
        assertEquals("one", sections.get(0).getName());
        assertEquals("two", sections.get(1).getName());
        assertEquals("three", sections.get(2).getName());
        List<String> names = feature.getExpandedScenarios().stream().map(Scenario::getName).toList();
        assertEquals(List.of("one", "two (row 1)", "three"), names);
    }

    @Test
    void testModelIsUnmodifiable() {
        feature("""
                @t
                Feature: f
                Scenario: s
                  Given a
                    | x |
                """);
        assertThrows(UnsupportedOperationException.class, () -> feature.getTags().add("other"));
        assertThrows(UnsupportedOperationException.class, () -> feature.getSections().clear());
        assertThrows(UnsupportedOperationException.class, () -> scenario.getSteps().clear());
        assertThrows(UnsupportedOperationException.class, () -> scenario.getSteps().get(0).getDataTable().get(0).add("y"));
    }

    @Test
    void testAst() {
        GherkinParser parser = new GherkinParser(Resource.text("""
                @tag1
                Feature: name
                  description
                Scenario: test
                  * def x = 1
                """));
        parser.parse();
        Node ast = parser.getAst();
        assertEquals(NodeType.G_FEATURE, ast.type);
        assertEquals(NodeType.G_TAGS, ast.get(0).type);
        assertNotNull(ast.findFirstChild(NodeType.G_DESCRIPTION));
        Node scenarioNode = ast.findFirstChild(NodeType.G_SCENARIO);
        assertNotNull(scenarioNode);
        Node stepNode = scenarioNode.findFirstChild(NodeType.G_STEP);
        assertEquals("* def x = 1", stepNode.toStringWithoutType());
    }

    @Test
    void testFeatureFiles() {
        Feature checkout = Feature.read(Resource.classPath("features/outline.feature"));
        assertEquals("Checkout", checkout.getName());
        assertEquals("Customers can buy things.", checkout.getDescription());
        assertEquals(List.of("checkout"), checkout.getTags());
        assertEquals(5, checkout.getBackground().getLine());
        assertEquals(2, checkout.getSections().size());
        List<Scenario> scenarios = checkout.getExpandedScenarios();
        assertEquals(4, scenarios.size());
        assertEquals("eating <start> cucumbers (small: row 1)", scenarios.get(0).getName());
        assertEquals(List.of("outline-tag", "smoke"), scenarios.get(0).getTags());
        assertEquals("there are 12 cucumbers", scenarios.get(0).getSteps().get(0).getText());
        assertEquals(List.of("outline-tag", "regression"), scenarios.get(1).getTags());
        assertEquals("eating <start> cucumbers (large: row 2)", scenarios.get(2).getName());
        assertEquals("I should have 99 cucumbers", scenarios.get(2).getSteps().get(2).getText());
        assertEquals(9, scenarios.get(2).getLine());
        assertEquals("plain", scenarios.get(3).getName());
        assertEquals(25, scenarios.get(3).getLine());

        Feature steps = Feature.read(Resource.classPath("features/steps.feature"));
        assertEquals(List.of("api"), steps.getTags());
        assertEquals(2, steps.getLine());
        assertEquals("Exercises doc strings and data tables.\nSecond line of the description.", steps.getDescription());
        Scenario doc = steps.getSection(0).getScenario();
        assertEquals(3, doc.getSteps().size());
        assertEquals("{\n  \"name\": \"cucumber\"\n}", doc.getSteps().get(0).getDocString());
        assertEquals(15, doc.getSteps().get(2).getLine());
        Scenario table = steps.getSection(1).getScenario();
        assertEquals(List.of("tables"), table.getTags());
        assertEquals(List.of(List.of("name", "age"), List.of("alice", "30"), List.of("bob", "")),
                table.getSteps().get(0).getDataTable());
        assertEquals("And", table.getSteps().get(1).getKeyword());
        assertEquals("* is not a keyword here", table.getSteps().get(1).getText());
        assertEquals("*", table.getSteps().get(2).getKeyword());
        assertEquals("But", table.getSteps().get(3).getKeyword());
    }

    @Test
    void testBrokenFeatureFile() {
        ParserException e = assertThrows(ParserException.class,
                () -> Feature.read(Resource.classPath("features/broken.feature")));
        assertEquals(5, e.getError().line);
        assertEquals(7, e.getError().column);
        assertTrue(e.getMessage().startsWith("parse error at line 5, column 7"));
    }

    @Test
    void testToMap() {
        feature("""
                Feature: f
                Scenario: s
                  Given a
                """);
        Map<String, Object> map = feature.toMap();
        assertEquals("f", map.get("name"));
        assertEquals(0, map.get("line"));
        List<?> sections = (List<?>) map.get("scenarios");
        assertEquals(1, sections.size());
    }

}
