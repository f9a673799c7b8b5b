package com.aiaq.model;

import com.aiaq.query.Atom;

/**
 * How a block connects: a top-level declaration, a statement in a sequence, or a value plugged into an input.
 * {@link #MUTATION} marks block types whose actual kind depends on the block's mutation.
 */
public enum BlockKind implements Atom {
    DECLARATION,
    STATEMENT,
    VALUE,
    MUTATION
}
