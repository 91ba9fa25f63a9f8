/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
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
package io.vero.ast;

/**
 * A table plus optional accessors. Row and range indexes are 1-based as written in the DSL.
 *
 * @param projectName cross-project qualifier, null for the current project
 */
public record TableReference(String tableName, String projectName, String column, Integer rowIndex,
                             Integer rangeStart, Integer rangeEnd, Integer cellRow, Integer cellColumn) implements AstNode {

    public static TableReference of(String tableName) {
        return new TableReference(tableName, null, null, null, null, null, null, null);
    }

    public static TableReference of(String projectName, String tableName) {
        return new TableReference(tableName, projectName, null, null, null, null, null, null);
    }

    /**
     * Key under which the table is preloaded, {@code Project.Table} when qualified.
     */
    public String qualifiedName() {
        return projectName == null ? tableName : projectName + "." + tableName;
    }

    public boolean isCell() {
        return cellRow != null && cellColumn != null;
    }

    public boolean isRange() {
        return rangeStart != null && rangeEnd != null;
    }

}
