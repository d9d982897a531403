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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Feature {

    public static final String KEYWORD = "Feature";

    private final String name;
    private final String description;
    private final Background background;
    private final List<FeatureSection> sections;
    private final List<String> tags;
    private final int line;

    public Feature(String name, String description, Background background,
                   List<FeatureSection> sections, List<String> tags, int line) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.background = background;
        this.sections = List.copyOf(sections);
        this.tags = List.copyOf(tags);
        this.line = line;
    }

    public static Feature parse(String text) {
        return read(Resource.text(text));
    }

    public static Feature read(Path path) {
        return read(Resource.path(path));
    }

    public static Feature read(Resource resource) {
        GherkinParser parser = new GherkinParser(resource);
        return parser.parse();
    }

    public boolean isBackgroundPresent() {
        return background != null;
    }

    /**
     * @return every plain scenario, and every outline expanded into one
     * scenario per Examples row, in textual order
     */
    public List<Scenario> getExpandedScenarios() {
        List<Scenario> list = new ArrayList<>();
        for (FeatureSection section : sections) {
            list.addAll(section.getScenarios());
        }
        return list;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the background, or null when the feature has none
     */
    public Background getBackground() {
        return background;
    }

    public List<FeatureSection> getSections() {
        return sections;
    }

    public FeatureSection getSection(int index) {
        return sections.get(index);
    }

    public List<String> getTags() {
        return tags;
    }

    public int getLine() {
        return line;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("description", description);
        map.put("line", line);
        map.put("tags", tags);
        if (background != null) {
            map.put("background", background.toMap());
        }
        List<Map<String, Object>> list = new ArrayList<>(sections.size());
        sections.forEach(section -> list.add(section.toMap()));
        map.put("scenarios", list);
        return map;
    }

    @Override
    public String toString() {
        return KEYWORD + ": " + name;
    }

}
