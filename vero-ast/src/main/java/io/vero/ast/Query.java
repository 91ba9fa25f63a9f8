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

import java.util.List;

/**
 * Right-hand side of a data query statement.
 */
public sealed interface Query extends AstNode permits Query.TableQuery, Query.AggregationQuery {

    TableReference table();

    DataCondition where();

    enum Position {FIRST, LAST, RANDOM}

    enum Function {COUNT, SUM, AVERAGE, MIN, MAX, DISTINCT, ROWS, COLUMNS, HEADERS}

    record TableQuery(Position position, TableReference table, List<String> columns, DataCondition where,
                      List<OrderBy> orderBy, Integer limit, Integer offset, Expression defaultValue) implements Query {

        public TableQuery {
            columns = AstNode.list(columns);
            orderBy = AstNode.list(orderBy);
        }

    }

    record AggregationQuery(Function function, TableReference table, String column, boolean distinct,
                            DataCondition where) implements Query {
    }

}
