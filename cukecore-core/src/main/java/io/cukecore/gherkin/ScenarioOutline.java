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
package io.cukecore.gherkin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ScenarioOutline {

    public static final String KEYWORD = "Scenario Outline";

    private final String name;
    private final List<Step> steps;
    private final List<String> tags;
    private final List<Examples> examples;
    private final int line;

    public ScenarioOutline(String name, List<Step> steps, List<String> tags, List<Examples> examples, int line) {
        if (examples.isEmpty()) {
            throw new IllegalArgumentException("Scenario Outline '" + name + "' has no Examples");
        }
        this.name = name == null ? "" : name;
        this.steps = List.copyOf(steps);
        this.tags = List.copyOf(tags);
        this.examples = List.copyOf(examples);
        this.line = line;
    }

    /**
     * Creates one concrete scenario per Examples row. Blocks and rows keep
     * their written order, placeholders are substituted in step text, doc
     * strings and data tables, and the tags are the outline tags followed by
     * the tags of the owning Examples block.
     */
    public List<Scenario> expand() {
        List<Scenario> list = new ArrayList<>();
        for (Examples block : examples) {
            Set<String> combined = new LinkedHashSet<>(tags);
            combined.addAll(block.getTags());
            List<String> scenarioTags = new ArrayList<>(combined);
            for (int i = 0; i < block.getTableBody().size(); i++) {
                Map<String, String> values = block.getRowAsMap(i);
                List<Step> scenarioSteps = new ArrayList<>(steps.size());
                for (Step step : steps) {
                    scenarioSteps.add(step.replacePlaceholders(values));
                }
                list.add(new Scenario(expandedName(block, i + 1), scenarioSteps, scenarioTags, line));
            }
        }
        return list;
    }

    private String expandedName(Examples block, int rowNumber) {
        if (block.getName().isEmpty()) {
            return name + " (row " + rowNumber + ")";
        }
        return name + " (" + block.getName() + ": row " + rowNumber + ")";
    }

    public String getName() {
        return name;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<Examples> getExamples() {
        return examples;
    }

    public int getLine() {
        return line;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", "outline");
        map.put("name", name);
        map.put("line", line);
        map.put("tags", tags);
        List<Map<String, Object>> stepList = new ArrayList<>(steps.size());
        steps.forEach(step -> stepList.add(step.toMap()));
        map.put("steps", stepList);
        List<Map<String, Object>> examplesList = new ArrayList<>(examples.size());
        examples.forEach(e -> examplesList.add(e.toMap()));
        map.put("examples", examplesList);
        return map;
    }

    @Override
    public String toString() {
        return KEYWORD + ": " + name;
    }

}
