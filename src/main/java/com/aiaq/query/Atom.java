package com.aiaq.query;

/**
 * A self-evaluating entity of the query language, such as a block type, a block category or a component type.
 * Applying an atom to anything returns the atom itself. An atom compares equal to a string holding its name.
 */
public non-sealed interface Atom extends Expression {
    String name();
}
