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
package io.vero.compiler.debug;

import io.vero.ast.AstNode;
import io.vero.ast.Statement;
import io.vero.ast.Target;
import io.vero.compiler.CodeBuilder;
import io.vero.compiler.CompileContext;
import io.vero.compiler.locator.SelectorResolver;
import io.vero.compiler.scan.AstChildren;

import java.util.List;

import static io.vero.common.StringUtils.quote;

/**
 * Debug stepping for generated scenarios. The emitted {@code __debug__} object talks to an
 * external controller over the child-process message channel:
 * <ul>
 *   <li>outbound: {@code step:before}, {@code step:after}, {@code execution:paused}, {@code variable}</li>
 *   <li>inbound: {@code resume}, {@code step}, {@code stop}, {@code set-breakpoints}</li>
 * </ul>
 * A step blocks while paused until {@code resume}, {@code step} or {@code stop} arrives;
 * {@code stop} exits the process immediately.
 */
public class DebugInstrumenter {

    public static final String DEBUG = "__debug__";

    private static final List<String> PREAMBLE = List.of(
            "const __debug__ = {",
            "  breakpoints: new Set<number>(JSON.parse(process.env.VERO_BREAKPOINTS || '[]')),",
            "  stepping: false,",
            "  send(message: Record<string, unknown>) {",
            "    if (process.send) {",
            "      process.send(message);",
            "    }",
            "  },",
            "  async beforeStep(line: number, action: string, target?: string) {",
            "    this.send({ type: 'step:before', line, action, target });",
            "    if (this.stepping || this.breakpoints.has(line)) {",
            "      this.send({ type: 'execution:paused', line, action, target });",
            "      await this.waitForResume();",
            "    }",
            "  },",
            "  async afterStep(line: number, action: string, success: boolean, duration: number) {",
            "    this.send({ type: 'step:after', line, action, success, duration });",
            "  },",
            "  variable(name: string, value: unknown) {",
            "    this.send({ type: 'variable', name, value });",
            "  },",
            "  waitForResume(): Promise<void> {",
            "    return new Promise((resolve) => {",
            "      const handler = (message: any) => {",
            "        if (message?.type === 'stop') {",
            "          process.exit(0);",
            "        }",
            "        if (message?.type !== 'resume' && message?.type !== 'step') {",
            "          return;",
            "        }",
            "        this.stepping = message.type === 'step';",
            "        process.off('message', handler);",
            "        resolve();",
            "      };",
            "      process.on('message', handler);",
            "    });",
            "  },",
            "};",
            "",
            "process.on('message', (message: any) => {",
            "  if (message?.type === 'set-breakpoints') {",
            "    __debug__.breakpoints = new Set<number>(message.breakpoints || []);",
            "  }",
            "});"
    );

    private final CompileContext context;

    public DebugInstrumenter(CompileContext context) {
        this.context = context;
    }

    public static List<String> preamble() {
        return PREAMBLE;
    }

    /**
     * Wraps one compiled top-level statement with before/after hooks. A failure is reported and
     * then re-thrown.
     *
     * @param declared variable the statement declares, hoisted above the wrapper; may be null
     */
    public List<String> wrap(Statement statement, List<String> body, String declared) {
        int line = statement.line();
        String action = quote(statement.getClass().getSimpleName());
        String target = describeTarget(statement);
        String start = context.nextTemp("step");
        CodeBuilder cb = new CodeBuilder();
        if (declared != null) {
            cb.line("let " + declared + ": any;");
        }
        cb.line("await " + DEBUG + ".beforeStep(" + line + ", " + action + ", " + (target == null ? "undefined" : quote(target)) + ");");
        cb.line("const " + start + " = Date.now();");
        cb.open("try {");
        cb.lines(body);
        if (declared != null) {
            cb.line(DEBUG + ".variable(" + quote(declared) + ", " + declared + ");");
        }
        cb.line("await " + DEBUG + ".afterStep(" + line + ", " + action + ", true, Date.now() - " + start + ");");
        cb.reopen("} catch (e) {");
        cb.line("await " + DEBUG + ".afterStep(" + line + ", " + action + ", false, Date.now() - " + start + ");");
        cb.line("throw e;");
        cb.close("}");
        return cb.toLines();
    }

    /**
     * First target among the statement's direct children, null when it has none.
     */
    public static String describeTarget(Statement statement) {
        for (AstNode child : AstChildren.of(statement)) {
            if (child instanceof Target t) {
                return SelectorResolver.describe(t);
            }
        }
        return null;
    }

    /**
     * Name of the variable a statement declares in its enclosing block, or null.
     */
    public static String declaredVariable(Statement statement) {
        if (statement instanceof Statement.GetStorage s) {
            return s.variable();
        } else if (statement instanceof Statement.PerformAssignment s) {
            return s.variableName();
        } else if (statement instanceof Statement.Load s) {
            return s.variable();
        } else if (statement instanceof Statement.Row s) {
            return s.variableName();
        } else if (statement instanceof Statement.Rows s) {
            return s.variableName();
        } else if (statement instanceof Statement.ColumnAccess s) {
            return s.variableName();
        } else if (statement instanceof Statement.Count s) {
            return s.variableName();
        } else if (statement instanceof Statement.DataQuery s) {
            return s.variableName();
        } else if (statement instanceof Statement.UtilityAssignment s) {
            return s.variableName();
        }
        return null;
    }

}
