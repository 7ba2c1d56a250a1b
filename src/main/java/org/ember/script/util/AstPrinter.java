package org.ember.script.util;

import org.ember.script.frontend.parser.ast.Expr;
import org.ember.script.frontend.parser.ast.Stmt;
import org.ember.script.runtime.Value;

/**
 * Renders AST nodes as parenthesized prefix text for debugging, e.g.
 * {@code (+ 1 (group (* 2 3)))}.
 */
public final class AstPrinter {

	private AstPrinter() {}

	/**
	 * Renders a statement.
	 * @param stmt The statement.
	 * @return The prefix form of the statement.
	 */
	public static String print(Stmt stmt) {
		if (stmt instanceof Stmt.Expression s) return "(; " + print(s.expression()) + ")";
		if (stmt instanceof Stmt.Print s) return "(print " + print(s.expression()) + ")";
		if (stmt instanceof Stmt.Var s) {
			if (s.initializer() == null) return "(var " + s.name().lexeme() + ")";
			return "(var " + s.name().lexeme() + " " + print(s.initializer()) + ")";
		}
		if (stmt instanceof Stmt.Block s) {
			StringBuilder sb = new StringBuilder("(block");
			for (Stmt inner : s.statements()) {
				sb.append(' ').append(print(inner));
			}
			return sb.append(')').toString();
		}
		if (stmt instanceof Stmt.If s) {
			String text = "(if " + print(s.condition()) + " " + print(s.thenBranch());
			if (s.elseBranch() != null) text += " " + print(s.elseBranch());
			return text + ")";
		}
		if (stmt instanceof Stmt.While s) return "(while " + print(s.condition()) + " " + print(s.body()) + ")";
		throw new IllegalArgumentException("Unknown statement: " + stmt);
	}

	/**
	 * Renders an expression.
	 * @param expr The expression.
	 * @return The prefix form of the expression.
	 */
	public static String print(Expr expr) {
		if (expr instanceof Expr.Literal e) {
			return e.value() instanceof Value.Str str ? "\"" + str.value() + "\"" : e.value().display();
		}
		if (expr instanceof Expr.Grouping e) return "(group " + print(e.expression()) + ")";
		if (expr instanceof Expr.Unary e) return "(" + e.operator().lexeme() + " " + print(e.right()) + ")";
		if (expr instanceof Expr.Binary e) {
			return "(" + e.operator().lexeme() + " " + print(e.left()) + " " + print(e.right()) + ")";
		}
		if (expr instanceof Expr.Logical e) {
			return "(" + e.operator().lexeme() + " " + print(e.left()) + " " + print(e.right()) + ")";
		}
		if (expr instanceof Expr.Variable e) return e.name().lexeme();
		if (expr instanceof Expr.Assign e) return "(= " + e.name().lexeme() + " " + print(e.value()) + ")";
		throw new IllegalArgumentException("Unknown expression: " + expr);
	}
}
