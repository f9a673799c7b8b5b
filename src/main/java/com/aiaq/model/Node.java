package com.aiaq.model;

import com.aiaq.query.Atom;
import com.aiaq.query.AttributeSource;

import java.util.List;

/**
 * A block or component in a project. Nodes are built once by the loaders and only read afterwards.
 */
public interface Node extends AttributeSource {
    /** Unique within one loaded project. */
    String id();

    Atom type();

    /**
     * Structural children in order. For blocks, the blocks plugged into value inputs followed by the blocks of
     * every statement input; the block's own {@code next} continuation is never included.
     */
    List<? extends Node> children();

    Node parent();

    /** The nearest statement-sequence ancestor. Same as {@link #parent()} unless a node says otherwise. */
    default Node logicalParent() {
        return parent();
    }

    Screen screen();
}
