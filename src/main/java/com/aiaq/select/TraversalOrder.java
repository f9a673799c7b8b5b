package com.aiaq.select;

import com.aiaq.model.Block;
import com.aiaq.model.Node;

import java.util.Locale;

public enum TraversalOrder {
    /** Depth first for blocks, breadth first for components. */
    NATURAL,
    BREADTH,
    DEPTH;

    public TraversalOrder resolve(Node root) {
        if (this != NATURAL) {
            return this;
        }
        return root instanceof Block ? DEPTH : BREADTH;
    }

    public static TraversalOrder fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown traversal order: " + name, e);
        }
    }
}
