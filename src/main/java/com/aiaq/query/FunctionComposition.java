package com.aiaq.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A left-to-right pipeline of expressions and functions. An empty pipeline is the identity.
 * <p>
 * Applied to a final value, the value is threaded through every stage in order. Applied to something that
 * still needs evaluation, the result is a new pipeline with that stage in front, so {@code f(g(h))} accumulates
 * without evaluating anything.
 */
public record FunctionComposition(ImmutableList<Object> stages) implements Expression {

    public static FunctionComposition of(Object... stages) {
        return new FunctionComposition(Lists.immutable.with(stages));
    }

    public FunctionComposition prepend(Object stage) {
        return new FunctionComposition(Lists.immutable.with(stage).newWithAll(stages));
    }

    @Override
    public String toString() {
        return stages.makeString("compose(", ", ", ")");
    }
}
