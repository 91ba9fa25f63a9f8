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
 * One method per {@link Statement} variant; adding a variant breaks every implementation at compile time.
 */
public interface StatementVisitor<R> {

    R visit(Statement.Click s);

    R visit(Statement.RightClick s);

    R visit(Statement.DoubleClick s);

    R visit(Statement.ForceClick s);

    R visit(Statement.Drag s);

    R visit(Statement.Fill s);

    R visit(Statement.Open s);

    R visit(Statement.Check s);

    R visit(Statement.Uncheck s);

    R visit(Statement.Hover s);

    R visit(Statement.Press s);

    R visit(Statement.Wait s);

    R visit(Statement.WaitFor s);

    R visit(Statement.Return s);

    R visit(Statement.Refresh s);

    R visit(Statement.SwitchToNewTab s);

    R visit(Statement.SwitchToTab s);

    R visit(Statement.OpenInNewTab s);

    R visit(Statement.CloseTab s);

    R visit(Statement.AcceptDialog s);

    R visit(Statement.DismissDialog s);

    R visit(Statement.SwitchToFrame s);

    R visit(Statement.SwitchToMainFrame s);

    R visit(Statement.Download s);

    R visit(Statement.SetCookie s);

    R visit(Statement.ClearCookies s);

    R visit(Statement.SetStorage s);

    R visit(Statement.GetStorage s);

    R visit(Statement.ClearStorage s);

    R visit(Statement.Scroll s);

    R visit(Statement.WaitForNavigation s);

    R visit(Statement.WaitForNetworkIdle s);

    R visit(Statement.WaitForUrl s);

    R visit(Statement.Log s);

    R visit(Statement.TakeScreenshot s);

    R visit(Statement.Upload s);

    R visit(Statement.Perform s);

    R visit(Statement.PerformAssignment s);

    R visit(Statement.Verify s);

    R visit(Statement.VerifyUrl s);

    R visit(Statement.VerifyTitle s);

    R visit(Statement.VerifyHas s);

    R visit(Statement.VerifyScreenshot s);

    R visit(Statement.VerifyVariable s);

    R visit(Statement.VerifyResponse s);

    R visit(Statement.ApiRequest s);

    R visit(Statement.MockApi s);

    R visit(Statement.ForEach s);

    R visit(Statement.IfElse s);

    R visit(Statement.Repeat s);

    R visit(Statement.TryCatch s);

    R visit(Statement.Load s);

    R visit(Statement.Row s);

    R visit(Statement.Rows s);

    R visit(Statement.ColumnAccess s);

    R visit(Statement.Count s);

    R visit(Statement.DataQuery s);

    R visit(Statement.UtilityAssignment s);

    R visit(Statement.Unsupported s);
}
