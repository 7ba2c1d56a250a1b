package org.ember.script.frontend.parser.ast;

import org.ember.script.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement nodes. A {@code for} loop has no node of its own; the parser
 * rewrites it into a {@link Block} around a {@link While}.
 */
public sealed interface Stmt extends AstNode
        permits Stmt.Expression, Stmt.Print, Stmt.Var, Stmt.Block, Stmt.If, Stmt.While {

    /**
     * An expression evaluated for its side effects.
     * @param expression The expression.
     */
    record Expression(Expr expression) implements Stmt {
        @Override
        public List<AstNode> getChildren() {
            return List.of(expression);
        }
    }

    /**
     * Writes the rendered value of an expression.
     * @param expression The expression to print.
     */
    record Print(Expr expression) implements Stmt {
        @Override
        public List<AstNode> getChildren() {
            return List.of(expression);
        }
    }

    /**
     * A variable declaration.
     * @param name The identifier token.
     * @param initializer The initializer, or null to bind {@code nil}.
     */
    record Var(Token name, Expr initializer) implements Stmt {
        @Override
        public List<AstNode> getChildren() {
            return initializer == null ? List.of() : List.of(initializer);
        }
    }

    /**
     * A braced block. Executes in its own scope.
     * @param statements The statements of the block, in order.
     */
    record Block(List<Stmt> statements) implements Stmt {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public List<AstNode> getChildren() {
            return List.copyOf(statements);
        }
    }

    /**
     * A conditional.
     * @param condition The condition.
     * @param thenBranch The branch executed when the condition is truthy.
     * @param elseBranch The branch executed otherwise, or null.
     */
    record If(Expr condition, Stmt thenBranch, Stmt elseBranch) implements Stmt {
        @Override
        public List<AstNode> getChildren() {
            List<AstNode> children = new ArrayList<>();
            children.add(condition);
            children.add(thenBranch);
            if (elseBranch != null) children.add(elseBranch);
            return children;
        }
    }

    /**
     * A pre-tested loop.
     * @param condition The loop condition.
     * @param body The loop body.
     */
    record While(Expr condition, Stmt body) implements Stmt {
        @Override
        public List<AstNode> getChildren() {
            return List.of(condition, body);
        }
    }
}
