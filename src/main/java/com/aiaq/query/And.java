package com.aiaq.query;

/**
 * Logical conjunction with short-circuiting. Evaluates to the value of the last operand evaluated, not to a
 * forced boolean: {@code and(a, b)} yields {@code a}'s value when it is falsy and {@code b}'s value otherwise.
 */
public record And(Object left, Object right) implements Expression {
    @Override
    public String toString() {
        return Values.repr(left) + " & " + Values.repr(right);
    }
}
