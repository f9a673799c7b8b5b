package com.aiaq.query;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Static combinators for building expressions. Operands can be expressions, plain values or functions;
 * functions are wrapped into {@link ComputedAttribute}s.
 */
public final class Expressions {
    private Expressions() {
    }

    public static Expression eq(Object left, Object right) {
        return new Comparison(Comparison.Operator.EQ, wrap(left), wrap(right));
    }

    public static Expression notEq(Object left, Object right) {
        return new Comparison(Comparison.Operator.NE, wrap(left), wrap(right));
    }

    public static Expression lt(Object left, Object right) {
        return new Comparison(Comparison.Operator.LT, wrap(left), wrap(right));
    }

    public static Expression gt(Object left, Object right) {
        return new Comparison(Comparison.Operator.GT, wrap(left), wrap(right));
    }

    public static Expression le(Object left, Object right) {
        return new Comparison(Comparison.Operator.LE, wrap(left), wrap(right));
    }

    public static Expression ge(Object left, Object right) {
        return new Comparison(Comparison.Operator.GE, wrap(left), wrap(right));
    }

    public static Expression compare(Comparison.Operator operator, Object left, Object right) {
        return new Comparison(operator, wrap(left), wrap(right));
    }

    public static Expression and(Object left, Object right) {
        return new And(wrap(left), wrap(right));
    }

    /** Left-folds the operands with {@link #and(Object, Object)}. */
    public static Expression allOf(Object first, Object... rest) {
        Object result = wrap(first);
        for (Object operand : rest) {
            result = and(result, operand);
        }
        return result instanceof Expression e ? e : ComputedAttribute.constant(result);
    }

    public static Expression or(Object left, Object right) {
        return new Or(wrap(left), wrap(right));
    }

    public static Expression not(Object operand) {
        if (operand instanceof Not not) {
            return not.operand();
        }
        Object wrapped = wrap(operand);
        if (wrapped instanceof Expression expression) {
            return new Not(expression);
        }
        return new Not(ComputedAttribute.constant(wrapped));
    }

    /**
     * Applies {@code expression} to {@code operand}. Equivalent to {@code expression.apply(operand)}, but also
     * accepts plain functions.
     */
    public static Object apply(Object expression, Object operand) {
        Object wrapped = wrap(expression);
        if (wrapped instanceof Expression e) {
            return e.apply(operand);
        }
        throw new IllegalArgumentException("Not an expression or function: " + Values.repr(expression));
    }

    /** Truthiness of {@code test} applied to {@code value}. A {@code null} test accepts everything. */
    public static boolean test(Object test, Object value) {
        return test == null || Values.truthy(Values.call(test, value));
    }

    @SuppressWarnings("unchecked")
    static Object wrap(Object operand) {
        if (operand instanceof Expression) {
            return operand;
        }
        if (operand instanceof Function) {
            return ComputedAttribute.of((Function<Object, Object>) operand);
        }
        if (operand instanceof Predicate) {
            Predicate<Object> predicate = (Predicate<Object>) operand;
            return ComputedAttribute.of(predicate::test);
        }
        return operand;
    }
}
