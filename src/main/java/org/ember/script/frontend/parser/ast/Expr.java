package org.ember.script.frontend.parser.ast;

import org.ember.script.frontend.lexer.Token;
import org.ember.script.runtime.Value;

import java.util.List;

/**
 * Expression nodes. Built bottom-up by the parser and never mutated afterwards.
 */
public sealed interface Expr extends AstNode
        permits Expr.Literal, Expr.Grouping, Expr.Unary, Expr.Binary, Expr.Logical, Expr.Variable, Expr.Assign {

    /**
     * A literal value.
     * @param value The embedded runtime value.
     */
    record Literal(Value value) implements Expr {}

    /**
     * A parenthesized expression.
     * @param expression The inner expression.
     */
    record Grouping(Expr expression) implements Expr {
        @Override
        public List<AstNode> getChildren() {
            return List.of(expression);
        }
    }

    /**
     * A prefix operator application ({@code -} or {@code !}).
     * @param operator The operator token.
     * @param right The operand.
     */
    record Unary(Token operator, Expr right) implements Expr {
        @Override
        public List<AstNode> getChildren() {
            return List.of(right);
        }
    }

    /**
     * An arithmetic, comparison or equality operator application.
     * @param left The left operand.
     * @param operator The operator token.
     * @param right The right operand.
     */
    record Binary(Expr left, Token operator, Expr right) implements Expr {
        @Override
        public List<AstNode> getChildren() {
            return List.of(left, right);
        }
    }

    /**
     * A short-circuiting {@code and} / {@code or}.
     * @param left The left operand, always evaluated.
     * @param operator The {@code and} or {@code or} token.
     * @param right The right operand, evaluated only when the left does not decide the result.
     */
    record Logical(Expr left, Token operator, Expr right) implements Expr {
        @Override
        public List<AstNode> getChildren() {
            return List.of(left, right);
        }
    }

    /**
     * A variable reference.
     * @param name The identifier token.
     */
    record Variable(Token name) implements Expr {}

    /**
     * An assignment to an existing variable. Evaluates to the assigned value.
     * @param name The identifier token of the target.
     * @param value The right-hand side.
     */
    record Assign(Token name, Expr value) implements Expr {
        @Override
        public List<AstNode> getChildren() {
            return List.of(value);
        }
    }
}
