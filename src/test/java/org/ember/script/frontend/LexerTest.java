package org.ember.script.frontend;

import org.ember.script.diagnostics.Diagnostic;
import org.ember.script.diagnostics.DiagnosticsEngine;
import org.ember.script.frontend.lexer.Lexer;
import org.ember.script.frontend.lexer.Token;
import org.ember.script.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is converted into the expected token stream
 * and that lexical errors are collected rather than stopping the scan.
 */
public class LexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    /**
     * Verifies tokenization of a declaration with comments and whitespace, including
     * literal values and line numbers.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        String source = String.join("\n",
                "// a comment",
                "var answer = 42.5; // trailing",
                "print \"hi\";"
        );
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.VAR, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER, TokenType.SEMICOLON,
                TokenType.PRINT, TokenType.STRING, TokenType.SEMICOLON, TokenType.EOF);
        assertThat(tokens.get(1)).extracting(Token::lexeme, Token::line, Token::column).containsExactly("answer", 2, 5);
        assertThat(tokens.get(3).literal()).isEqualTo(42.5);
        assertThat(tokens.get(6)).extracting(Token::lexeme, Token::literal).containsExactly("\"hi\"", "hi");
        assertThat(tokens.get(6).line()).isEqualTo(3);
    }

    /**
     * Verifies that two-character operators win over their one-character prefixes.
     */
    @Test
    @Tag("unit")
    void testMaximalMunchOperators() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("== = != ! <= < >= > / * - + ( ) { } , .", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.EQUAL_EQUAL, TokenType.EQUAL, TokenType.BANG_EQUAL, TokenType.BANG,
                TokenType.LESS_EQUAL, TokenType.LESS, TokenType.GREATER_EQUAL, TokenType.GREATER,
                TokenType.SLASH, TokenType.STAR, TokenType.MINUS, TokenType.PLUS,
                TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE,
                TokenType.COMMA, TokenType.DOT, TokenType.EOF);
    }

    /**
     * Keywords are recognized only as whole words; other words, including keywords
     * of larger dialects, are identifiers.
     */
    @Test
    @Tag("unit")
    void testKeywordsAndIdentifiers() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = "and or if else while for var print true false nil orchid _x1 class fun";

        // Act
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.AND, TokenType.OR, TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.FOR,
                TokenType.VAR, TokenType.PRINT, TokenType.TRUE, TokenType.FALSE, TokenType.NIL,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.EOF);
    }

    /**
     * A dot without digits on both sides is not part of a number.
     */
    @Test
    @Tag("unit")
    void testNumberWithoutFractionDigitsLeavesDot() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("12. .5", diagnostics).scanTokens();

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.NUMBER, TokenType.DOT, TokenType.DOT, TokenType.NUMBER, TokenType.EOF);
        assertThat(tokens.get(0).literal()).isEqualTo(12.0);
        assertThat(tokens.get(3).literal()).isEqualTo(5.0);
    }

    /**
     * Verifies that the lexer keeps going after errors, reports each one on its own line,
     * and still returns the valid tokens plus the end marker.
     */
    @Test
    @Tag("unit")
    void testErrorsAreCollected() {
        // Arrange
        String source = String.join("\n",
                "var a = 1 @ 2;",
                "print a # b;"
        );
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::lineNumber, Diagnostic::message)
                .containsExactly(
                        tuple(1, "Unexpected character '@'."),
                        tuple(2, "Unexpected character '#'."));
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.EOF);
        assertThat(tokens).hasSize(11);
    }

    /**
     * An unterminated string is reported at the line where it opened, not where input ended.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStringReportsStartLine() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("print 1;\nprint \"open\nstill open", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.message()).isEqualTo("Unterminated string.");
        assertThat(error.lineNumber()).isEqualTo(2);
        assertThat(error.type()).isEqualTo(Diagnostic.Type.SYNTAX);
        assertThat(types(tokens)).containsExactly(
                TokenType.PRINT, TokenType.NUMBER, TokenType.SEMICOLON, TokenType.PRINT, TokenType.EOF);
        assertThat(tokens.get(tokens.size() - 1).line()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testMultiLineStringAdvancesLineCounter() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("\"a\nb\" x", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).literal()).isEqualTo("a\nb");
        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(1).line()).isEqualTo(2);
    }
}
