package com.aiaq.query;

import com.aiaq.model.Node;

import java.util.Collections;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * Memoized heights and depths, keyed by node identity. Entries go away with their nodes, so one cache can serve
 * any number of loaded projects.
 */
public final class AttributeCache {
    private static final AttributeCache SHARED = new AttributeCache();

    private final Map<Node, Integer> heights = Collections.synchronizedMap(new WeakHashMap<>());
    private final Map<Node, Integer> depths = Collections.synchronizedMap(new WeakHashMap<>());

    public static AttributeCache shared() {
        return SHARED;
    }

    /** 0 for a node without children, otherwise one more than the tallest child. */
    public int height(Node node) {
        Integer known = heights.get(node);
        if (known != null) {
            return known;
        }
        int height = 0;
        for (Node child : node.children()) {
            height = Math.max(height, height(child) + 1);
        }
        heights.put(node, height);
        return height;
    }

    /** Number of logical-parent hops from {@code node} up to its root. */
    public int depth(Node node) {
        Integer known = depths.get(node);
        if (known != null) {
            return known;
        }
        int depth = 0;
        for (Node current = node.logicalParent(); current != null; current = current.logicalParent()) {
            Integer base = depths.get(current);
            if (base != null) {
                depth += base + 1;
                break;
            }
            depth++;
        }
        depths.put(node, depth);
        return depth;
    }

    public void clear() {
        heights.clear();
        depths.clear();
    }
}
