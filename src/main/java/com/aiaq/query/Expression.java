package com.aiaq.query;

/**
 * An immutable predicate or value computation over a node (or any value).
 * <p>
 * Expressions are built with the combinators below, or with the static factories in {@link Expressions}.
 * Combinators never mutate their operands; they wrap them. Operands may be other expressions, plain values,
 * or {@link java.util.function.Function}/{@link java.util.function.Predicate} instances, which are wrapped
 * into {@link ComputedAttribute}s.
 * <p>
 * Applying an expression to a final value yields a value. Applying it to something that still needs
 * evaluation (a non-atom expression or a function) yields a new composed expression instead.
 */
public sealed interface Expression
        permits Atom, NamedAttribute, NamedAttributeTuple, ComputedAttribute, FunctionComposition,
                Comparison, And, Or, Not {

    default Object apply(Object operand) {
        return ExpressionEvaluator.evaluate(this, operand);
    }

    /** Applies this expression and reports whether the result is truthy. */
    default boolean test(Object operand) {
        return Values.truthy(Values.reduce(this, operand));
    }

    default Expression eq(Object other) {
        return Expressions.eq(this, other);
    }

    default Expression notEq(Object other) {
        return Expressions.notEq(this, other);
    }

    default Expression lt(Object other) {
        return Expressions.lt(this, other);
    }

    default Expression gt(Object other) {
        return Expressions.gt(this, other);
    }

    default Expression le(Object other) {
        return Expressions.le(this, other);
    }

    default Expression ge(Object other) {
        return Expressions.ge(this, other);
    }

    default Expression and(Object other) {
        return Expressions.and(this, other);
    }

    default Expression or(Object other) {
        return Expressions.or(this, other);
    }

    default Expression not() {
        return Expressions.not(this);
    }
}
