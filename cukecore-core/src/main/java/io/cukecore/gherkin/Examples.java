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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Examples {

    public static final String KEYWORD = "Examples";

    private final String name;
    private final List<String> tags;
    private final List<String> tableHeader;
    private final List<List<String>> tableBody;
    private final int line;

    public Examples(String name, List<String> tags, List<String> tableHeader, List<List<String>> tableBody, int line) {
        for (List<String> row : tableBody) {
            if (row.size() != tableHeader.size()) {
                throw new IllegalArgumentException("row " + row + " does not match header " + tableHeader);
            }
        }
        this.name = name == null ? "" : name;
        this.tags = List.copyOf(tags);
        this.tableHeader = List.copyOf(tableHeader);
        this.tableBody = Step.copyRows(tableBody);
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getTableHeader() {
        return tableHeader;
    }

    public List<List<String>> getTableBody() {
        return tableBody;
    }

    public int getLine() {
        return line;
    }

    /**
     * @param rowIndex 0-based index into the table body
     * @return column name to cell value, in column order
     */
    public Map<String, String> getRowAsMap(int rowIndex) {
        List<String> row = tableBody.get(rowIndex);
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < tableHeader.size(); i++) {
            map.put(tableHeader.get(i), row.get(i));
        }
        return map;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("line", line);
        map.put("tags", tags);
        map.put("header", tableHeader);
        map.put("rows", tableBody);
        return map;
    }

}
