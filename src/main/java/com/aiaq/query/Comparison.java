package com.aiaq.query;

import java.util.Objects;

/**
 * Compares the values of two operands. Always evaluates to a strict {@link Boolean}.
 */
public record Comparison(Operator operator, Object left, Object right) implements Expression {

    public enum Operator {
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
        }
    }

    public Comparison {
        Objects.requireNonNull(operator, "operator must not be null");
    }

    @Override
    public String toString() {
        return Values.repr(left) + " " + operator.symbol() + " " + Values.repr(right);
    }
}
