package com.aiaq.select;

import com.aiaq.query.AttributeSource;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Flattens one field of every element of a parent selection, e.g. the blocks of all screens of a project.
 */
public class UnionSelector<P, T> extends Selection<T> {
    private final Selection<P> collection;
    private final String field;
    private final Function<? super P, ? extends Selection<T>> accessor;

    public UnionSelector(Selection<P> collection, String field, Function<? super P, ? extends Selection<T>> accessor) {
        this.collection = collection;
        this.field = field;
        this.accessor = accessor;
    }

    public String field() {
        return field;
    }

    @Override
    protected Stream<Map.Entry<String, T>> entries() {
        return collection.stream().flatMap(owner -> accessor.apply(owner).entries());
    }

    /**
     * Looks {@code id} up in each owner's field, falling back to an element whose {@code name} attribute matches.
     */
    @Override
    public T get(String id) {
        for (P owner : collection) {
            Selection<T> haystack = accessor.apply(owner);
            T found = haystack.get(id);
            if (found != null) {
                return found;
            }
            for (T candidate : haystack) {
                if (candidate instanceof AttributeSource source && id.equals(source.attribute("name"))) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
