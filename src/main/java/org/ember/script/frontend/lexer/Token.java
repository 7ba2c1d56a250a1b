package org.ember.script.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param lexeme The exact text of the token from the source code.
 * @param literal The processed value of a literal token ({@code Double} or {@code String}), otherwise null.
 * @param line The 1-based line number where the token was found.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenType type,
        String lexeme,
        Object literal,
        int line,
        int column
) {
}
