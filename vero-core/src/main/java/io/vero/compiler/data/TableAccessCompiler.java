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

import io.vero.ast.ComparisonOperator;
import io.vero.ast.DataCondition;
import io.vero.ast.OrderBy;
import io.vero.ast.Statement;
import io.vero.ast.TableReference;
import io.vero.common.StringUtils;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileContext;
import io.vero.compiler.Scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.vero.common.StringUtils.quote;

/**
 * Row, rows, column and count access over tables preloaded once per feature, or once per
 * call in page, page-action and fixture units. Tables are only ever read through the
 * {@code Data} accessor (or {@code <Project>Data} for cross-project references) that the
 * preload block binds.
 */
public class TableAccessCompiler {

    public static final String DATA_MANAGER = "dataManager";
    public static final String DATA = "Data";

    private final CompileContext context;
    private final ConditionCompiler conditions;

    public TableAccessCompiler(CompileContext context, ConditionCompiler conditions) {
        this.context = context;
        this.conditions = conditions;
    }

    public static String accessorFor(String projectName) {
        return projectName == null ? DATA : StringUtils.toPascalCase(projectName) + DATA;
    }

    private static String member(String owner, String name) {
        return StringUtils.isIdentifier(name) ? owner + "." + name : owner + "[" + quote(name) + "]";
    }

    public static String source(TableReference table) {
        return member(accessorFor(table.projectName()), table.tableName());
    }

    // ========== Preload ==========

    /**
     * Describe-level bindings plus one {@code beforeAll} loading exactly the given tables.
     *
     * @param tables qualified table names
     */
    public static List<String> preload(Set<String> tables) {
        CodeBuilder cb = new CodeBuilder();
        cb.lines(bindings(tables));
        cb.blank();
        cb.block("test.beforeAll(async () => {", load(tables), "});");
        return cb.toLines();
    }

    /**
     * The data manager and one empty accessor per table group, declared once per unit.
     */
    public static List<String> bindings(Set<String> tables) {
        List<String> lines = new ArrayList<>();
        lines.add("const " + DATA_MANAGER + " = createDataManager();");
        groups(tables).keySet().forEach(accessor -> lines.add("let " + accessor + ": Record<string, DataRow[]> = {};"));
        return lines;
    }

    /**
     * Loads the tables and fills the accessors. Runs in {@code beforeAll} for features and at the
     * top of a page method or fixture body elsewhere.
     */
    public static List<String> load(Set<String> tables) {
        List<String> names = new ArrayList<>();
        for (String qualified : tables) {
            names.add(quote(qualified));
        }
        CodeBuilder cb = new CodeBuilder();
        cb.line("await " + DATA_MANAGER + ".preloadTables([" + String.join(", ", names) + "]);");
        groups(tables).forEach((accessor, entries) -> {
            cb.open(accessor + " = {");
            for (String[] entry : entries) {
                String key = StringUtils.isIdentifier(entry[0]) ? entry[0] : quote(entry[0]);
                cb.line(key + ": " + DATA_MANAGER + ".getTable(" + quote(entry[1]) + "),");
            }
            cb.close("};");
        });
        return cb.toLines();
    }

    private static Map<String, List<String[]>> groups(Set<String> tables) {
        Map<String, List<String[]>> groups = new LinkedHashMap<>();
        groups.put(DATA, new ArrayList<>());
        for (String qualified : tables) {
            int pos = qualified.indexOf('.');
            String project = pos == -1 ? null : qualified.substring(0, pos);
            String table = pos == -1 ? qualified : qualified.substring(pos + 1);
            groups.computeIfAbsent(accessorFor(project), k -> new ArrayList<>()).add(new String[]{table, qualified});
        }
        groups.values().removeIf(List::isEmpty);
        return groups;
    }

    // ========== Statements ==========

    public List<String> row(Statement.Row s, Scope scope) {
        CodeBuilder cb = new CodeBuilder();
        TableReference table = s.table();
        String picked = context.nextTemp("row");
        Statement.RowModifier modifier = s.modifier() == null ? Statement.RowModifier.FIRST : s.modifier();
        if (modifier == Statement.RowModifier.FIRST && s.orderBy().isEmpty()) {
            String pick = s.where() == null ? source(table) + "[0]" : source(table) + ".find(" + conditions.predicate(s.where(), scope) + ")";
            cb.line("const " + picked + " = " + pick + ";");
        } else {
            String rows = context.nextTemp("rows");
            cb.line("const " + rows + " = " + pipeline(table, s.where(), s.orderBy(), scope) + ";");
            String index = switch (modifier) {
                case FIRST -> "0";
                case LAST -> rows + ".length - 1";
                case RANDOM -> "Math.floor(Math.random() * " + rows + ".length)";
            };
            cb.line("const " + picked + " = " + rows + "[" + index + "];");
        }
        cb.open("if (!" + picked + ") {");
        cb.line("throw new Error(" + quote("No matching row found in " + table.qualifiedName()) + ");");
        cb.close("}");
        cb.line(scope.declare(s.variableName()) + " = " + DATA_MANAGER + ".resolveReferences("
                + quote(table.qualifiedName()) + ", " + picked + ");");
        return cb.toLines();
    }

    public List<String> rows(Statement.Rows s, Scope scope) {
        String expr = pipeline(s.table(), s.where(), s.orderBy(), scope) + slice(s.limit(), s.offset());
        return List.of(scope.declare(s.variableName()) + " = " + DATA_MANAGER + ".resolveAllReferences("
                + quote(s.table().qualifiedName()) + ", " + expr + ");");
    }

    public List<String> column(Statement.ColumnAccess s, Scope scope) {
        String column = s.column() != null ? s.column() : s.table().column();
        String expr = pipeline(s.table(), s.where(), List.of(), scope) + ".map((row) => row[" + quote(column) + "])";
        if (s.distinct()) {
            expr = "[...new Set(" + expr + ")]";
        }
        return List.of(scope.declare(s.variableName()) + " = " + expr + ";");
    }

    public List<String> count(Statement.Count s, Scope scope) {
        return List.of(scope.declare(s.variableName()) + " = " + pipeline(s.table(), s.where(), List.of(), scope) + ".length;");
    }

    /**
     * Legacy LOAD with a single optional filter, compiled onto the same pipeline.
     */
    public List<String> load(Statement.Load s, Scope scope) {
        TableReference table = TableReference.of(s.projectName(), s.tableName());
        DataCondition where = null;
        if (s.where() != null) {
            where = DataCondition.Comparison.of(s.where().field(), ComparisonOperator.fromSymbol(s.where().operator()),
                    s.where().value());
        }
        return List.of(scope.declare(s.variable()) + " = " + DATA_MANAGER + ".resolveAllReferences("
                + quote(table.qualifiedName()) + ", " + pipeline(table, where, List.of(), scope) + ");");
    }

    // ========== Pipeline ==========

    String pipeline(TableReference table, DataCondition where, List<OrderBy> orderBy, Scope scope) {
        String expr = source(table);
        if (where != null) {
            expr = expr + ".filter(" + conditions.predicate(where, scope) + ")";
        }
        if (!orderBy.isEmpty()) {
            if (where == null) {
                expr = "[..." + expr + "]";
            }
            expr = expr + ".sort(" + comparator(orderBy) + ")";
        }
        return expr;
    }

    static String comparator(List<OrderBy> orderBy) {
        List<String> parts = new ArrayList<>();
        for (OrderBy o : orderBy) {
            String a = "a[" + quote(o.column()) + "]";
            String b = "b[" + quote(o.column()) + "]";
            if (o.direction() == OrderBy.Direction.DESC) {
                parts.add("(" + a + " < " + b + " ? 1 : " + a + " > " + b + " ? -1 : 0)");
            } else {
                parts.add("(" + a + " > " + b + " ? 1 : " + a + " < " + b + " ? -1 : 0)");
            }
        }
        return "(a, b) => " + String.join(" || ", parts);
    }

    static String slice(Integer limit, Integer offset) {
        int start = offset == null ? 0 : offset;
        if (limit == null) {
            return start == 0 ? "" : ".slice(" + start + ")";
        }
        return start == 0 ? ".slice(0, " + limit + ")" : ".slice(" + start + ", " + (start + limit) + ")";
    }

}
