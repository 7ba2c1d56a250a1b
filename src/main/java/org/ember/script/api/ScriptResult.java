package org.ember.script.api;

import org.ember.script.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of one run of a script.
 *
 * @param status How far the run got.
 * @param diagnostics All syntax errors, or the single runtime error, in report order.
 */
public record ScriptResult(
        Status status,
        List<Diagnostic> diagnostics
) {
    /**
     * The overall result of a run.
     */
    public enum Status {
        /** Every statement executed. */
        OK,
        /** Lexing or parsing failed; nothing was executed. */
        SYNTAX_ERROR,
        /** Execution stopped at a runtime error. */
        RUNTIME_ERROR
    }

    public ScriptResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Renders the diagnostics as report lines, e.g. {@code [line 3] Runtime Error: Division by zero.}
     * @return One line per diagnostic.
     */
    public List<String> diagnosticLines() {
        return diagnostics.stream().map(Diagnostic::toString).toList();
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }
}
