package org.ember.script.api;

import org.ember.script.diagnostics.Diagnostic;
import org.ember.script.frontend.parser.ast.Stmt;

import java.util.List;

/**
 * The output of the front end alone: the parsed program and any syntax errors.
 *
 * @param statements The statements that parsed successfully.
 * @param diagnostics The syntax errors, in report order.
 */
public record ParseResult(
        List<Stmt> statements,
        List<Diagnostic> diagnostics
) {
    public ParseResult {
        statements = List.copyOf(statements);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
