package com.aiaq.select;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * An insertion-ordered, id-indexed collection. This is the only selection that can be written to; loaders fill it
 * while building a project.
 */
public class NamedCollection<T> extends Selection<T> {
    private final Map<String, T> items = new LinkedHashMap<>();

    public void put(String id, T item) {
        items.put(id, item);
    }

    @Override
    protected Stream<Map.Entry<String, T>> entries() {
        return items.entrySet().stream().map(entry -> Selector.entry(entry.getKey(), entry.getValue()));
    }

    @Override
    public T get(String id) {
        return items.get(id);
    }

    @Override
    public boolean contains(String id) {
        return items.containsKey(id);
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public long count() {
        return items.size();
    }

    @Override
    public boolean isEmpty() {
        return items.isEmpty();
    }
}
