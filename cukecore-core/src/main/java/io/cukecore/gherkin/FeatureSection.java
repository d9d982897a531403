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

import java.util.List;
import java.util.Map;

/**
 * A top-level section of a feature, either a scenario or a scenario outline.
 */
public class FeatureSection {

    private final int index;
    private final Scenario scenario;
    private final ScenarioOutline scenarioOutline;

    private FeatureSection(int index, Scenario scenario, ScenarioOutline scenarioOutline) {
        this.index = index;
        this.scenario = scenario;
        this.scenarioOutline = scenarioOutline;
    }

    public static FeatureSection of(int index, Scenario scenario) {
        return new FeatureSection(index, scenario, null);
    }

    public static FeatureSection of(int index, ScenarioOutline outline) {
        return new FeatureSection(index, null, outline);
    }

    public boolean isOutline() {
        return scenarioOutline != null;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return the scenario, or null if this section is an outline
     */
    public Scenario getScenario() {
        return scenario;
    }

    /**
     * @return the outline, or null if this section is a plain scenario
     */
    public ScenarioOutline getScenarioOutline() {
        return scenarioOutline;
    }

    public String getName() {
        return isOutline() ? scenarioOutline.getName() : scenario.getName();
    }

    public int getLine() {
        return isOutline() ? scenarioOutline.getLine() : scenario.getLine();
    }

    public List<String> getTags() {
        return isOutline() ? scenarioOutline.getTags() : scenario.getTags();
    }

    public List<Scenario> getScenarios() {
        return isOutline() ? scenarioOutline.expand() : List.of(scenario);
    }

    public Map<String, Object> toMap() {
        return isOutline() ? scenarioOutline.toMap() : scenario.toMap();
    }

    @Override
    public String toString() {
        return isOutline() ? scenarioOutline.toString() : scenario.toString();
    }

}
