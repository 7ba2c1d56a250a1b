package org.ember.script.diagnostics;

/**
 * Represents a single diagnostic message that occurs while a script is
 * scanned, parsed or executed.
 *
 * @param type The stage that produced the diagnostic.
 * @param message The diagnostic message.
 * @param lineNumber The 1-based source line of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        int lineNumber
) {
    /**
     * The kind of a diagnostic. Syntax and runtime errors are never conflated.
     */
    public enum Type {
        /** A lexing or parsing error. The program is not executed. */
        SYNTAX,
        /** An error raised while evaluating the program. */
        RUNTIME
    }

    @Override
    public String toString() {
        String label = type == Type.RUNTIME ? "Runtime Error" : "Error";
        return String.format("[line %d] %s: %s", lineNumber, label, message);
    }
}
