package com.aiaq.select;

import com.aiaq.model.Node;

import java.util.AbstractMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * A selection computed from a stream source each time it is iterated.
 */
public class Selector<T> extends Selection<T> {
    private final Supplier<Stream<Map.Entry<String, T>>> source;

    public Selector(Supplier<Stream<Map.Entry<String, T>>> source) {
        this.source = source;
    }

    public static <N extends Node> Selector<N> of(N node) {
        return new Selector<>(() -> Stream.of(entry(node.id(), node)));
    }

    /**
     * Keys every value with {@code key}, keeping the first value seen for a key.
     */
    public static <V> Selector<V> distinct(Supplier<Stream<V>> values, Function<? super V, String> key) {
        return new Selector<>(() -> {
            Set<String> seen = new HashSet<>();
            return values.get()
                    .filter(value -> seen.add(key.apply(value)))
                    .map(value -> entry(key.apply(value), value));
        });
    }

    static <V> Map.Entry<String, V> entry(String key, V value) {
        return new AbstractMap.SimpleImmutableEntry<>(key, value);
    }

    @Override
    protected Stream<Map.Entry<String, T>> entries() {
        return source.get();
    }
}
