package org.ember.script.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, DOT, MINUS, PLUS, SEMICOLON, SLASH, STAR,

    // One or two character tokens.
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,

    // Literals.
    /** A variable name. */
    IDENTIFIER,
    /** A double-quoted string literal; the token value is the unquoted text. */
    STRING,
    /** A numeric literal; the token value is a {@code Double}. */
    NUMBER,

    // Keywords.
    AND, ELSE, FALSE, FOR, IF, NIL, OR, PRINT, TRUE, VAR, WHILE,

    /** Represents the end of the source text. */
    EOF
}
