package com.aiaq.query;

/**
 * Single dispatch point for expression evaluation.
 */
final class ExpressionEvaluator {
    private ExpressionEvaluator() {
    }

    static Object evaluate(Expression expression, Object operand) {
        // Atoms are the fixed point of the algebra
        if (expression instanceof Atom) {
            return expression;
        }

        // Defer application until a concrete value arrives
        if (Values.needsEvaluation(operand)) {
            Object stage = Expressions.wrap(operand);
            if (expression instanceof FunctionComposition composition) {
                return composition.prepend(stage);
            }
            return FunctionComposition.of(expression, stage);
        }

        if (expression instanceof NamedAttribute attribute) {
            return lookup(operand, attribute.name());
        }

        if (expression instanceof NamedAttributeTuple tuple) {
            if (operand instanceof AttributeSource source) {
                for (String name : tuple.names()) {
                    if (source.hasAttribute(name)) {
                        return source.attribute(name);
                    }
                }
            }
            return null;
        }

        if (expression instanceof ComputedAttribute computed) {
            return computed.function().apply(operand);
        }

        if (expression instanceof FunctionComposition composition) {
            Object value = operand;
            for (Object stage : composition.stages()) {
                value = Values.call(stage, value);
            }
            return value;
        }

        if (expression instanceof Comparison comparison) {
            Object left = Values.reduce(comparison.left(), operand);
            Object right = Values.reduce(comparison.right(), operand);
            return compare(comparison.operator(), left, right);
        }

        if (expression instanceof And and) {
            Object left = Values.reduce(and.left(), operand);
            if (!Values.truthy(left)) {
                return left;
            }
            return Values.reduce(and.right(), operand);
        }

        if (expression instanceof Or or) {
            Object left = Values.reduce(or.left(), operand);
            if (Values.truthy(left)) {
                return left;
            }
            return Values.reduce(or.right(), operand);
        }

        if (expression instanceof Not not) {
            return !Values.truthy(Values.reduce(not.operand(), operand));
        }

        throw new IllegalStateException("Unhandled expression: " + expression.getClass().getName());
    }

    private static Object lookup(Object operand, String name) {
        if (operand instanceof AttributeSource source && source.hasAttribute(name)) {
            return source.attribute(name);
        }
        return null;
    }

    private static boolean compare(Comparison.Operator operator, Object left, Object right) {
        return switch (operator) {
            case EQ -> Values.equal(left, right);
            case NE -> !Values.equal(left, right);
            case LT -> Values.compare(left, right) < 0;
            case GT -> Values.compare(left, right) > 0;
            case LE -> Values.compare(left, right) <= 0;
            case GE -> Values.compare(left, right) >= 0;
        };
    }
}
