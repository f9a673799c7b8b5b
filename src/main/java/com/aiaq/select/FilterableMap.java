package com.aiaq.select;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiPredicate;

public class FilterableMap<K, V> extends LinkedHashMap<K, V> {
    private static final long serialVersionUID = 1L;

    public FilterableMap() {
    }

    public FilterableMap(Map<? extends K, ? extends V> entries) {
        super(entries);
    }

    /** The entries accepted by {@code rule}, or this map if {@code rule} is {@code null}. */
    public FilterableMap<K, V> filter(BiPredicate<? super K, ? super V> rule) {
        if (rule == null) {
            return this;
        }
        FilterableMap<K, V> result = new FilterableMap<>();
        forEach((key, value) -> {
            if (rule.test(key, value)) {
                result.put(key, value);
            }
        });
        return result;
    }
}
