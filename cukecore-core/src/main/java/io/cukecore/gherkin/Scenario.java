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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Scenario {

    public static final String KEYWORD = "Scenario";

    private final String name;
    private final List<Step> steps;
    private final List<String> tags;
    private final int line;

    public Scenario(String name, List<Step> steps, List<String> tags, int line) {
        this.name = name == null ? "" : name;
        this.steps = List.copyOf(steps);
        this.tags = List.copyOf(tags);
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public List<Step> getSteps() {
        return steps;
    }

    /**
     * @param background may be null
     * @return the background steps followed by the steps of this scenario
     */
    public List<Step> getStepsIncludingBackground(Background background) {
        if (background == null) {
            return steps;
        }
        List<Step> list = new ArrayList<>(background.getSteps());
        list.addAll(steps);
        return list;
    }

    public List<String> getTags() {
        return tags;
    }

    public int getLine() {
        return line;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", "scenario");
        map.put("name", name);
        map.put("line", line);
        map.put("tags", tags);
        List<Map<String, Object>> list = new ArrayList<>(steps.size());
        steps.forEach(step -> list.add(step.toMap()));
        map.put("steps", list);
        return map;
    }

    @Override
    public String toString() {
        return KEYWORD + ": " + name;
    }

}
