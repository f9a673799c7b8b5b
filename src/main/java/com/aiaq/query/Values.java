package com.aiaq.query;

import org.eclipse.collections.api.RichIterable;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Value semantics shared by the evaluator and the selection engine: truthiness, equality, ordering and
 * application of expressions or plain functions to a value. {@code null} is the absent value.
 */
public final class Values {
    private Values() {
    }

    public static boolean needsEvaluation(Object x) {
        if (x instanceof Expression) {
            return !(x instanceof Atom);
        }
        return x instanceof Function || x instanceof Predicate;
    }

    /**
     * Applies {@code functor} to {@code value}. Expressions are reduced until they yield a final value or an atom.
     */
    @SuppressWarnings("unchecked")
    public static Object call(Object functor, Object value) {
        if (functor instanceof Expression) {
            return reduce(functor, value);
        }
        if (functor instanceof Function) {
            return ((Function<Object, Object>) functor).apply(value);
        }
        if (functor instanceof Predicate) {
            return ((Predicate<Object>) functor).test(value);
        }
        throw new IllegalArgumentException("Not an expression or function: " + repr(functor));
    }

    /**
     * The value of an operand slot: plain values stand for themselves, expressions are applied to
     * {@code operand} repeatedly while they keep yielding non-atom expressions.
     */
    public static Object reduce(Object side, Object operand) {
        if (!(side instanceof Expression expression)) {
            return side;
        }
        Object value = expression.apply(operand);
        if (needsEvaluation(operand)) {
            return value;
        }
        while (value instanceof Expression next && !(value instanceof Atom)) {
            value = next.apply(operand);
        }
        return value;
    }

    public static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return isIntegral(n) ? n.longValue() != 0L : n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof RichIterable<?> r) {
            return r.notEmpty();
        }
        if (value instanceof Iterable<?> it) {
            return it.iterator().hasNext();
        }
        if (value instanceof Optional<?> o) {
            return o.isPresent();
        }
        return true;
    }

    public static boolean equal(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Atom atom && b instanceof CharSequence s) {
            return atom.name().contentEquals(s);
        }
        if (b instanceof Atom atom && a instanceof CharSequence s) {
            return atom.name().contentEquals(s);
        }
        if (a instanceof Number x && b instanceof Number y) {
            return compareNumbers(x, y) == 0;
        }
        return a.equals(b);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b) {
        if (a == null || b == null) {
            throw new EvaluationException("Cannot order an absent value: " + repr(a) + " vs " + repr(b));
        }
        if (a instanceof Number x && b instanceof Number y) {
            return compareNumbers(x, y);
        }
        if (a instanceof Atom atom && b instanceof CharSequence s) {
            return atom.name().compareTo(s.toString());
        }
        if (b instanceof Atom atom && a instanceof CharSequence s) {
            return s.toString().compareTo(atom.name());
        }
        if (a instanceof CharSequence x && b instanceof CharSequence y) {
            return x.toString().compareTo(y.toString());
        }
        if (a instanceof Comparable comparable && a.getClass().isInstance(b)) {
            try {
                return comparable.compareTo(b);
            } catch (ClassCastException e) {
                throw new EvaluationException("Cannot compare " + repr(a) + " with " + repr(b), e);
            }
        }
        throw new EvaluationException("Ordering not supported between "
                + a.getClass().getSimpleName() + " and " + b.getClass().getSimpleName());
    }

    public static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        throw new EvaluationException("Not a number: " + repr(value));
    }

    private static int compareNumbers(Number x, Number y) {
        if (isIntegral(x) && isIntegral(y)) {
            return Long.compare(x.longValue(), y.longValue());
        }
        double dx = x.doubleValue();
        double dy = y.doubleValue();
        return dx < dy ? -1 : (dx > dy ? 1 : 0);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger;
    }

    public static String repr(Object value) {
        if (value instanceof CharSequence) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
