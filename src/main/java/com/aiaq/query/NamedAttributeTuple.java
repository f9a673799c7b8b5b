package com.aiaq.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Looks up the first field present on the operand among a list of synonyms, e.g. {@code type} then
 * {@code component_type}.
 */
public record NamedAttributeTuple(ImmutableList<String> names) implements Expression {
    public NamedAttributeTuple {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("NamedAttributeTuple needs at least one name");
        }
    }

    public static NamedAttributeTuple of(String... names) {
        return new NamedAttributeTuple(Lists.immutable.with(names));
    }

    @Override
    public String toString() {
        return "NamedAttributeTuple(" + names.makeString("(", ", ", ")") + ")";
    }
}
