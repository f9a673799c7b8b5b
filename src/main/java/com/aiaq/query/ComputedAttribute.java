package com.aiaq.query;

import java.util.Objects;
import java.util.function.Function;

/**
 * Wraps an arbitrary function so it can take part in expressions. The result is not memoized.
 * Two computed attributes are equal only if they are the same instance.
 */
public final class ComputedAttribute implements Expression {
    private final Function<Object, Object> function;
    private final String description;

    public ComputedAttribute(Function<Object, Object> function, String description) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.description = description;
    }

    public static ComputedAttribute of(Function<Object, Object> function) {
        return new ComputedAttribute(function, null);
    }

    public static ComputedAttribute named(String description, Function<Object, Object> function) {
        return new ComputedAttribute(function, description);
    }

    /** An attribute that ignores its operand. */
    public static ComputedAttribute constant(Object value) {
        return new ComputedAttribute(ignored -> value, String.valueOf(value));
    }

    public Function<Object, Object> function() {
        return function;
    }

    @Override
    public String toString() {
        return description != null ? description : "ComputedAttribute(" + function + ")";
    }
}
