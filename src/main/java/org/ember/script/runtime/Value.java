package org.ember.script.runtime;

import java.math.BigDecimal;

/**
 * The closed set of runtime values. The interface is sealed, so the compiler
 * knows every variant; operations that only accept some kinds test for those
 * and treat the rest uniformly.
 */
public sealed interface Value permits Value.Num, Value.Str, Value.Bool, Value.Nil {

    /** The single nil value. */
    Value NIL = new Nil();
    /** Boolean true. */
    Value TRUE = new Bool(true);
    /** Boolean false. */
    Value FALSE = new Bool(false);

    /**
     * Renders the value the way {@code print} writes it.
     * @return The textual form of the value.
     */
    String display();

    /**
     * Returns the name of this value's type, for error messages.
     * @return The type name.
     */
    String typeName();

    /**
     * Returns the boolean constant for a Java boolean.
     * @param value The value to wrap.
     * @return {@link #TRUE} or {@link #FALSE}.
     */
    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Applies the truthiness rule used by conditions and the logical operators:
     * {@code nil}, {@code false} and the number zero are falsy, everything else is truthy.
     * @param value The value to test.
     * @return Whether the value counts as true.
     */
    static boolean isTruthy(Value value) {
        if (value instanceof Nil) return false;
        if (value instanceof Bool b) return b.value();
        if (value instanceof Num n) return n.value() != 0.0;
        if (value instanceof Str) return true;
        throw new IllegalStateException("Unhandled value type: " + value.getClass().getSimpleName());
    }

    /**
     * A double-precision number.
     * @param value The numeric value.
     */
    record Num(double value) implements Value {
        /**
         * Plain decimal notation without exponent. Integral values have no fractional part,
         * so {@code 10000000} prints as {@code 10000000} and {@code 0.0001} as {@code 0.0001}.
         * Negative zero prints as {@code -0}; infinities and NaN keep Java's spelling.
         */
        @Override
        public String display() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            if (value == 0.0) {
                return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }

        @Override
        public String typeName() {
            return "number";
        }
    }

    /**
     * An immutable string.
     * @param value The string content.
     */
    record Str(String value) implements Value {
        @Override
        public String display() {
            return value;
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    /**
     * A boolean.
     * @param value The boolean value.
     */
    record Bool(boolean value) implements Value {
        @Override
        public String display() {
            return Boolean.toString(value);
        }

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    /**
     * The absence of a value. Use {@link Value#NIL}.
     */
    record Nil() implements Value {
        @Override
        public String display() {
            return "nil";
        }

        @Override
        public String typeName() {
            return "nil";
        }
    }
}
