package org.ember.script.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages during a single run of the
 * script pipeline.
 * <p>
 * This decouples error reporting from the lexer, parser and interpreter.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a syntax error found by the lexer or the parser.
     *
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     */
    public void reportSyntaxError(String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.SYNTAX, message, lineNumber));
    }

    /**
     * Reports an error raised during evaluation.
     *
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     */
    public void reportRuntimeError(String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.RUNTIME, message, lineNumber));
    }

    /**
     * Checks if errors of any kind have been reported.
     *
     * @return {@code true} if at least one diagnostic exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Checks if syntax errors have been reported.
     *
     * @return {@code true} if at least one syntax error exists.
     */
    public boolean hasSyntaxErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.SYNTAX);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return One line per diagnostic, in report order.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
