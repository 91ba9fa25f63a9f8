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
package io.vero.compiler.data;

import io.vero.ast.OrderBy;
import io.vero.ast.Query;
import io.vero.ast.Statement;
import io.vero.ast.TableReference;
import io.vero.compiler.Scope;
import io.vero.compiler.expr.ExpressionCompiler;

import java.util.ArrayList;
import java.util.List;

import static io.vero.common.StringUtils.quote;

/**
 * Fluent query chains against the preloaded data manager:
 * {@code await dataManager.query('Users').where(...).orderBy([...]).limit(5).execute()}.
 */
public class DataQueryCompiler {

    private final ConditionCompiler conditions;
    private final ExpressionCompiler expressions;

    public DataQueryCompiler(ConditionCompiler conditions, ExpressionCompiler expressions) {
        this.conditions = conditions;
        this.expressions = expressions;
    }

    public List<String> compile(Statement.DataQuery s, Scope scope) {
        return List.of(scope.declare(s.variableName()) + " = " + expression(s.query(), s.resultType(), scope) + ";");
    }

    public String expression(Query query, Statement.ResultType resultType, Scope scope) {
        if (query == null || query.table() == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder("await ");
        sb.append(TableAccessCompiler.DATA_MANAGER).append(".query(").append(quote(query.table().qualifiedName())).append(")");
        if (query instanceof Query.TableQuery q) {
            tableQuery(sb, q, resultType, scope);
            if (q.defaultValue() != null) {
                return "(" + sb + ") ?? " + expressions.compile(q.defaultValue(), scope);
            }
        } else if (query instanceof Query.AggregationQuery q) {
            aggregation(sb, q, scope);
        }
        return sb.toString();
    }

    private void tableQuery(StringBuilder sb, Query.TableQuery q, Statement.ResultType resultType, Scope scope) {
        TableReference table = q.table();
        if (!q.columns().isEmpty()) {
            List<String> columns = new ArrayList<>();
            for (String column : q.columns()) {
                columns.add(quote(column));
            }
            sb.append(".select(").append(columns.size() == 1 ? columns.get(0) : "[" + String.join(", ", columns) + "]").append(")");
        } else if (table.column() != null) {
            sb.append(".select(").append(quote(table.column())).append(")");
        }
        if (table.rowIndex() != null) {
            sb.append(".row(").append(table.rowIndex()).append(")");
        } else if (table.isRange()) {
            sb.append(".range(").append(table.rangeStart()).append(", ").append(table.rangeEnd()).append(")");
        }
        if (q.where() != null) {
            sb.append(".where(").append(conditions.predicate(q.where(), scope)).append(")");
        }
        if (!q.orderBy().isEmpty()) {
            List<String> items = new ArrayList<>();
            for (OrderBy o : q.orderBy()) {
                items.add("{ column: " + quote(o.column()) + ", direction: " + quote(o.direction().name()) + " }");
            }
            sb.append(".orderBy([").append(String.join(", ", items)).append("])");
        }
        if (q.offset() != null) {
            sb.append(".offset(").append(q.offset()).append(")");
        }
        if (q.limit() != null) {
            sb.append(".limit(").append(q.limit()).append(")");
        }
        if (table.isCell()) {
            sb.append(".cell(").append(table.cellRow()).append(", ").append(table.cellColumn()).append(")");
        } else if (q.position() != null) {
            sb.append(switch (q.position()) {
                case FIRST -> ".first()";
                case LAST -> ".last()";
                case RANDOM -> ".random()";
            });
        } else if (isScalar(resultType)) {
            sb.append(".first()");
        } else {
            sb.append(".execute()");
        }
    }

    private static boolean isScalar(Statement.ResultType resultType) {
        return resultType == Statement.ResultType.TEXT || resultType == Statement.ResultType.NUMBER
                || resultType == Statement.ResultType.FLAG;
    }

    private void aggregation(StringBuilder sb, Query.AggregationQuery q, Scope scope) {
        if (q.where() != null) {
            sb.append(".where(").append(conditions.predicate(q.where(), scope)).append(")");
        }
        String column = q.column() != null ? q.column() : q.table().column();
        String arg = column == null ? "" : quote(column);
        Query.Function function = q.function() == null ? Query.Function.COUNT : q.function();
        sb.append(switch (function) {
            case COUNT -> q.distinct() && column != null ? ".countDistinct(" + arg + ")" : ".count()";
            case SUM -> ".sum(" + arg + ")";
            case AVERAGE -> ".average(" + arg + ")";
            case MIN -> ".min(" + arg + ")";
            case MAX -> ".max(" + arg + ")";
            case DISTINCT -> ".distinct(" + arg + ")";
            case ROWS -> ".rowCount()";
            case COLUMNS -> ".columnCount()";
            case HEADERS -> ".headers()";
        });
    }

}
