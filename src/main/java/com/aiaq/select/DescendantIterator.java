package com.aiaq.select;

import com.aiaq.model.Node;
import com.aiaq.query.Expressions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a node and everything below it using an explicit work list. Nodes failing {@code test} are left out of
 * the result; with {@code skipFailures} their subtrees are not visited either.
 */
public final class DescendantIterator implements Iterator<Node> {
    private final Deque<Node> worklist = new ArrayDeque<>();
    private final TraversalOrder order;
    private final Object test;
    private final boolean skipFailures;
    private Node pending;

    public DescendantIterator(Node root, TraversalOrder order, Object test, boolean skipFailures) {
        this.order = order.resolve(root);
        this.test = test;
        this.skipFailures = skipFailures;
        worklist.add(root);
    }

    public static Stream<Node> stream(Node root, TraversalOrder order, Object test, boolean skipFailures) {
        DescendantIterator iterator = new DescendantIterator(root, order, test, skipFailures);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    @Override
    public boolean hasNext() {
        while (pending == null && !worklist.isEmpty()) {
            Node item = worklist.pollFirst();
            boolean failed = test != null && !Expressions.test(test, item);
            if (failed && skipFailures) {
                continue;
            }
            List<? extends Node> children = item.children();
            if (order == TraversalOrder.BREADTH) {
                worklist.addAll(children);
            } else {
                // front of the queue, in child order
                for (int i = children.size() - 1; i >= 0; i--) {
                    Node child = children.get(i);
                    if (child != item) {
                        worklist.addFirst(child);
                    }
                }
            }
            if (!failed) {
                pending = item;
            }
        }
        return pending != null;
    }

    @Override
    public Node next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Node result = pending;
        pending = null;
        return result;
    }
}
