package com.aiaq.query;

import java.util.Objects;

/**
 * Looks up a single named field on the operand. Evaluates to {@code null} when the operand has no such field.
 */
public record NamedAttribute(String name) implements Expression {
    public NamedAttribute {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String toString() {
        return "NamedAttribute('" + name + "')";
    }
}
