package com.aiaq.select;

import com.aiaq.query.Expressions;

/**
 * The entries of a parent selection accepted by a rule. Re-evaluated on each iteration, so it never goes stale.
 */
public class NamedCollectionView<T> extends Selector<T> {
    private final Selection<T> parent;
    private final Object rule;

    public NamedCollectionView(Selection<T> parent, Object rule) {
        super(() -> parent.entries().filter(entry -> Expressions.test(rule, entry.getValue())));
        this.parent = parent;
        this.rule = rule;
    }

    public Selection<T> parent() {
        return parent;
    }

    public Object rule() {
        return rule;
    }
}
