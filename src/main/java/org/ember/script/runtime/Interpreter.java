package org.ember.script.runtime;

import org.ember.script.diagnostics.DiagnosticsEngine;
import org.ember.script.frontend.lexer.Token;
import org.ember.script.frontend.parser.ast.Expr;
import org.ember.script.frontend.parser.ast.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Walks the AST and executes it against a chain of {@link Environment}s.
 * <p>
 * The global environment lives as long as the interpreter, so consecutive calls to
 * {@link #interpret(List, DiagnosticsEngine)} see each other's variables. It is not thread-safe.
 */
public class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);
    static final String NESTING_TOO_DEEP = "Expression nested too deeply.";

    private final Consumer<String> output;
    private final Environment globals = new Environment();
    private Environment environment = globals;
    private int currentLine = 1;

    /**
     * Constructs a new interpreter.
     * @param output Receives one line per executed {@code print} statement.
     */
    public Interpreter(Consumer<String> output) {
        this.output = output;
    }

    /**
     * Executes the statements in order. The first runtime error stops the run and is
     * reported to the diagnostics engine; the remaining statements are skipped.
     * Running out of stack on a deeply nested expression is reported the same way.
     *
     * @param statements The program to run.
     * @param diagnostics The engine that receives a runtime error, if one occurs.
     * @return {@code true} if every statement completed, {@code false} after a runtime error.
     */
    public boolean interpret(List<Stmt> statements, DiagnosticsEngine diagnostics) {
        try {
            for (Stmt statement : statements) {
                execute(statement);
            }
            return true;
        } catch (RuntimeError error) {
            LOG.debug("Run aborted by {} at line {}", error.getKind(), error.getToken().line());
            diagnostics.reportRuntimeError(error.getMessage(), error.getToken().line());
            return false;
        } catch (StackOverflowError error) {
            LOG.debug("Run aborted by stack overflow near line {}", currentLine);
            diagnostics.reportRuntimeError(NESTING_TOO_DEEP, currentLine);
            return false;
        }
    }

    public Environment getGlobals() {
        return globals;
    }

    private void execute(Stmt stmt) {
        if (stmt instanceof Stmt.Expression s) {
            evaluate(s.expression());
        } else if (stmt instanceof Stmt.Print s) {
            output.accept(evaluate(s.expression()).display());
        } else if (stmt instanceof Stmt.Var s) {
            Value value = s.initializer() == null ? Value.NIL : evaluate(s.initializer());
            environment.define(s.name().lexeme(), value);
        } else if (stmt instanceof Stmt.Block s) {
            executeBlock(s.statements(), new Environment(environment));
        } else if (stmt instanceof Stmt.If s) {
            if (Value.isTruthy(evaluate(s.condition()))) {
                execute(s.thenBranch());
            } else if (s.elseBranch() != null) {
                execute(s.elseBranch());
            }
        } else if (stmt instanceof Stmt.While s) {
            while (Value.isTruthy(evaluate(s.condition()))) {
                execute(s.body());
            }
        } else {
            throw new IllegalStateException("Unhandled statement type: " + stmt.getClass().getSimpleName());
        }
    }

    /**
     * Runs the statements in the given scope and restores the previous scope on every exit path.
     */
    private void executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = this.environment;
        try {
            this.environment = scope;
            for (Stmt statement : statements) {
                execute(statement);
            }
        } finally {
            this.environment = previous;
        }
    }

    private Value evaluate(Expr expr) {
        if (expr instanceof Expr.Literal e) {
            return e.value();
        } else if (expr instanceof Expr.Grouping e) {
            return evaluate(e.expression());
        } else if (expr instanceof Expr.Unary e) {
            return evaluateUnary(e);
        } else if (expr instanceof Expr.Binary e) {
            return evaluateBinary(e);
        } else if (expr instanceof Expr.Logical e) {
            return evaluateLogical(e);
        } else if (expr instanceof Expr.Variable e) {
            return environment.get(e.name());
        } else if (expr instanceof Expr.Assign e) {
            Value value = evaluate(e.value());
            return environment.assign(e.name(), value);
        }
        throw new IllegalStateException("Unhandled expression type: " + expr.getClass().getSimpleName());
    }

    private Value evaluateUnary(Expr.Unary unary) {
        currentLine = unary.operator().line();
        Value right = evaluate(unary.right());

        switch (unary.operator().type()) {
            case MINUS:
                return new Value.Num(-numberOperand(unary.operator(), right));
            case BANG:
                return Value.of(!Value.isTruthy(right));
            default:
                throw new IllegalStateException("Unknown unary operator: " + unary.operator().lexeme());
        }
    }

    private Value evaluateLogical(Expr.Logical logical) {
        currentLine = logical.operator().line();
        Value left = evaluate(logical.left());

        // The operand that decides the outcome is the result.
        switch (logical.operator().type()) {
            case OR:
                if (Value.isTruthy(left)) return left;
                break;
            case AND:
                if (!Value.isTruthy(left)) return left;
                break;
            default:
                throw new IllegalStateException("Unknown logical operator: " + logical.operator().lexeme());
        }

        return evaluate(logical.right());
    }

    private Value evaluateBinary(Expr.Binary binary) {
        Token operator = binary.operator();
        currentLine = operator.line();
        Value left = evaluate(binary.left());
        Value right = evaluate(binary.right());

        return switch (operator.type()) {
            case PLUS -> add(operator, left, right);
            case MINUS -> {
                double[] operands = numberOperands(operator, left, right);
                yield new Value.Num(operands[0] - operands[1]);
            }
            case STAR -> {
                double[] operands = numberOperands(operator, left, right);
                yield new Value.Num(operands[0] * operands[1]);
            }
            case SLASH -> {
                double[] operands = numberOperands(operator, left, right);
                if (operands[1] == 0.0) {
                    throw new RuntimeError(RuntimeError.Kind.DIVISION_BY_ZERO, operator, "Division by zero.");
                }
                yield new Value.Num(operands[0] / operands[1]);
            }
            case GREATER -> {
                double[] operands = numberOperands(operator, left, right);
                yield Value.of(operands[0] > operands[1]);
            }
            case GREATER_EQUAL -> {
                double[] operands = numberOperands(operator, left, right);
                yield Value.of(operands[0] >= operands[1]);
            }
            case LESS -> {
                double[] operands = numberOperands(operator, left, right);
                yield Value.of(operands[0] < operands[1]);
            }
            case LESS_EQUAL -> {
                double[] operands = numberOperands(operator, left, right);
                yield Value.of(operands[0] <= operands[1]);
            }
            case EQUAL_EQUAL -> Value.of(isEqual(left, right));
            case BANG_EQUAL -> Value.of(!isEqual(left, right));
            default -> throw new IllegalStateException("Unknown binary operator: " + operator.lexeme());
        };
    }

    private Value add(Token operator, Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return new Value.Num(l.value() + r.value());
        }
        if (left instanceof Value.Str l && right instanceof Value.Str r) {
            return new Value.Str(l.value() + r.value());
        }
        LOG.debug("'+' applied to {} and {}", left.typeName(), right.typeName());
        throw new RuntimeError(RuntimeError.Kind.TYPE_MISMATCH, operator,
                "Operands must be two numbers or two strings.");
    }

    /**
     * Different kinds are never equal; numbers use IEEE comparison, the other kinds compare by content.
     */
    private static boolean isEqual(Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return l.value() == r.value();
        }
        return left.equals(right);
    }

    private static double numberOperand(Token operator, Value operand) {
        if (operand instanceof Value.Num n) {
            return n.value();
        }
        LOG.debug("'{}' applied to {}", operator.lexeme(), operand.typeName());
        throw new RuntimeError(RuntimeError.Kind.TYPE_MISMATCH, operator, "Operand must be a number.");
    }

    private static double[] numberOperands(Token operator, Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return new double[]{l.value(), r.value()};
        }
        LOG.debug("'{}' applied to {} and {}", operator.lexeme(), left.typeName(), right.typeName());
        throw new RuntimeError(RuntimeError.Kind.TYPE_MISMATCH, operator, "Operands must be numbers.");
    }
}
