package org.ember.script.runtime;

import org.ember.script.frontend.lexer.Token;

/**
 * Raised when evaluation fails. Aborts the current run; the {@link Interpreter}
 * turns it into a single runtime diagnostic.
 */
public class RuntimeError extends RuntimeException {

    /**
     * The category of a runtime failure.
     */
    public enum Kind {
        /** An operator was applied to operands of the wrong type. */
        TYPE_MISMATCH,
        /** A division had a zero divisor. */
        DIVISION_BY_ZERO,
        /** A variable was read or assigned without being declared in any enclosing scope. */
        UNDEFINED_VARIABLE
    }

    private final Kind kind;
    private final Token token;

    /**
     * Constructs a new runtime error.
     * @param kind The category of the failure.
     * @param token The token at which the failure occurred, used for the line number.
     * @param message The detail message.
     */
    public RuntimeError(Kind kind, Token token, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
    }

    public Kind getKind() {
        return kind;
    }

    public Token getToken() {
        return token;
    }
}
