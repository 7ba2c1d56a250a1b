package org.ember.script.runtime;

import org.ember.script.frontend.lexer.Token;

import java.util.HashMap;
import java.util.Map;

/**
 * One lexical scope of variable bindings. Lookups and assignments walk the
 * {@code enclosing} links outward; definitions always go into this scope.
 * <p>
 * The enclosing link is only followed outward. A scope is discarded by the
 * block that created it and is never reachable from its parent.
 */
public class Environment {

    private final Environment enclosing;
    private final Map<String, Value> values = new HashMap<>();

    /**
     * Creates a root (global) environment.
     */
    public Environment() {
        this(null);
    }

    /**
     * Creates a scope nested in the given one.
     * @param enclosing The lexically surrounding scope, or null for a root scope.
     */
    public Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    /**
     * Binds a name in this scope, replacing any existing binding of the same name here.
     * @param name The variable name.
     * @param value The value to bind.
     */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    /**
     * Looks up a variable, searching from this scope outward.
     * @param name The identifier token being read.
     * @return The bound value.
     * @throws RuntimeError with {@link RuntimeError.Kind#UNDEFINED_VARIABLE} if no scope binds the name.
     */
    public Value get(Token name) {
        for (Environment scope = this; scope != null; scope = scope.enclosing) {
            Value value = scope.values.get(name.lexeme());
            if (value != null) {
                return value;
            }
        }
        throw undefined(name);
    }

    /**
     * Overwrites an existing binding in the nearest scope that has one. Never creates a binding.
     * @param name The identifier token being assigned.
     * @param value The new value.
     * @return The assigned value.
     * @throws RuntimeError with {@link RuntimeError.Kind#UNDEFINED_VARIABLE} if no scope binds the name.
     */
    public Value assign(Token name, Value value) {
        for (Environment scope = this; scope != null; scope = scope.enclosing) {
            if (scope.values.containsKey(name.lexeme())) {
                scope.values.put(name.lexeme(), value);
                return value;
            }
        }
        throw undefined(name);
    }

    public Environment getEnclosing() {
        return enclosing;
    }

    private static RuntimeError undefined(Token name) {
        return new RuntimeError(RuntimeError.Kind.UNDEFINED_VARIABLE, name,
                "Undefined variable '" + name.lexeme() + "'.");
    }
}
