package com.aiaq.query;

import java.util.Objects;

/**
 * Logical negation. Negating a {@code Not} returns the wrapped expression itself.
 */
public record Not(Expression operand) implements Expression {
    public Not {
        Objects.requireNonNull(operand, "operand must not be null");
    }

    @Override
    public Expression not() {
        return operand;
    }

    @Override
    public String toString() {
        if (operand instanceof Atom || operand instanceof NamedAttribute || operand instanceof NamedAttributeTuple
                || operand instanceof ComputedAttribute) {
            return "~" + operand;
        }
        return "~(" + operand + ")";
    }
}
