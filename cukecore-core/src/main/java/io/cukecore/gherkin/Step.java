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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Step {

    private final String keyword;
    private final String text;
    private final String docString;
    private final List<List<String>> dataTable;
    private final int line;

    public Step(String keyword, String text, String docString, List<List<String>> dataTable, int line) {
        if (docString != null && dataTable != null) {
            throw new IllegalArgumentException("a step cannot have both a doc string and a data table");
        }
        this.keyword = keyword;
        this.text = text;
        this.docString = docString;
        this.dataTable = dataTable == null ? null : copyRows(dataTable);
        this.line = line;
    }

    static List<List<String>> copyRows(List<List<String>> rows) {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(List.copyOf(row));
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Replaces every {@code <name>} placeholder in the text, doc string and
     * data table cells.
     */
    Step replacePlaceholders(Map<String, String> values) {
        List<List<String>> table = null;
        if (dataTable != null) {
            table = new ArrayList<>(dataTable.size());
            for (List<String> row : dataTable) {
                List<String> cells = new ArrayList<>(row.size());
                for (String cell : row) {
                    cells.add(replacePlaceholders(cell, values));
                }
                table.add(cells);
            }
        }
        return new Step(keyword, replacePlaceholders(text, values), replacePlaceholders(docString, values), table, line);
    }

    static String replacePlaceholders(String text, Map<String, String> values) {
        if (text == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : values.entrySet()) {
            text = text.replace('<' + entry.getKey() + '>', entry.getValue());
        }
        return text;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    public String getDocString() {
        return docString;
    }

    public boolean hasDocString() {
        return docString != null;
    }

    public List<List<String>> getDataTable() {
        return dataTable;
    }

    public boolean hasDataTable() {
        return dataTable != null;
    }

    public int getLine() {
        return line;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("keyword", keyword);
        map.put("text", text);
        map.put("line", line);
        if (docString != null) {
            map.put("docString", docString);
        }
        if (dataTable != null) {
            map.put("dataTable", dataTable);
        }
        return map;
    }

    @Override
    public String toString() {
        return keyword + " " + text;
    }

}
