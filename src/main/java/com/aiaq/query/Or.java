package com.aiaq.query;

/**
 * Logical disjunction with short-circuiting. Like {@link And}, it yields the raw value of the last operand
 * evaluated.
 */
public record Or(Object left, Object right) implements Expression {
    @Override
    public String toString() {
        return Values.repr(left) + " | " + Values.repr(right);
    }
}
