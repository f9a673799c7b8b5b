package com.aiaq.select;

import com.aiaq.model.Block;
import com.aiaq.model.Component;
import com.aiaq.model.Node;
import com.aiaq.model.Screen;
import com.aiaq.query.Expressions;
import com.aiaq.query.Values;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A lazy, re-iterable collection of nodes (or values derived from nodes) keyed by id.
 * <p>
 * Filtering, narrowing and traversal return new selections without touching the source; they are evaluated each
 * time they are iterated. Aggregations iterate once and return a scalar or, when grouping expressions are given, a
 * {@link FilterableMap} from group key to aggregate. Elements for which a grouping expression is absent
 * ({@code null}) do not belong to any group. With more than one grouping expression the key is an immutable list of
 * the values.
 * <p>
 * Tests, value expressions and grouping expressions can be {@link com.aiaq.query.Expression}s or
 * {@link java.util.function.Function}/{@link java.util.function.Predicate} instances.
 */
public abstract class Selection<T> implements Iterable<T> {

    /** Entries in selection order. Produces a fresh stream on every call. */
    protected abstract Stream<Map.Entry<String, T>> entries();

    public Stream<T> stream() {
        return entries().map(Map.Entry::getValue);
    }

    @Override
    public Iterator<T> iterator() {
        return stream().iterator();
    }

    /** The elements for which every test is truthy. */
    public Selector<T> filter(Object test, Object... more) {
        Object rule = more.length == 0 ? test : Expressions.allOf(test, more);
        return new NamedCollectionView<>(this, rule);
    }

    public Selector<Screen> screens() {
        return screens(null);
    }

    /**
     * The screens in this selection together with the screens owning the blocks in this selection.
     */
    public Selector<Screen> screens(Object test) {
        return Selector.distinct(() -> Stream.concat(
                stream().filter(Screen.class::isInstance)
                        .map(Screen.class::cast)
                        .filter(screen -> Screen.FORM.equals(screen.type().name()))
                        .filter(screen -> Expressions.test(test, screen)),
                stream().filter(Block.class::isInstance)
                        .map(Block.class::cast)
                        .filter(block -> Expressions.test(test, block))
                        .map(Block::screen)
                        .filter(Objects::nonNull)), Screen::id);
    }

    public Selector<Component> components() {
        return components(null);
    }

    public Selector<Component> components(Object test) {
        return narrow(Component.class, test);
    }

    public Selector<Block> blocks() {
        return blocks(null);
    }

    public Selector<Block> blocks(Object test) {
        return narrow(Block.class, test);
    }

    private <N extends Node> Selector<N> narrow(Class<N> type, Object test) {
        return Selector.distinct(() -> stream().filter(type::isInstance)
                .map(type::cast)
                .filter(node -> Expressions.test(test, node)), Node::id);
    }

    public Selector<Block> callers() {
        return callers(null);
    }

    /**
     * Procedure call blocks, on the same screen, that call one of the procedure definitions in this selection.
     */
    public Selector<Block> callers(Object filter) {
        return Selector.distinct(() -> stream().filter(Block.class::isInstance)
                .map(Block.class::cast)
                .filter(Block::isProcedureDefinition)
                .flatMap(definition -> definition.screen().blocks().stream()
                        .filter(Block::isProcedureCall)
                        .filter(call -> Objects.equals(call.fields().get("PROCNAME"), definition.fields().get("NAME")))
                        .filter(call -> Expressions.test(filter, call))), Block::id);
    }

    public Selector<Block> callees() {
        throw new UnsupportedOperationException("callees is not implemented");
    }

    public Selector<Block> branch(int branch) {
        throw new UnsupportedOperationException("branch is not implemented");
    }

    /**
     * Applies {@code functor} to every element and keeps the non-absent results, in order.
     */
    public MutableList<Object> map(Object functor) {
        MutableList<Object> result = Lists.mutable.empty();
        for (T item : this) {
            Object value = Values.call(functor, item);
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    /**
     * The value of {@code expression} for every element, keyed by the element's id. Absent values are dropped.
     */
    public Selector<Object> select(Object expression) {
        return new Selector<>(() -> entries()
                .map(entry -> Selector.<Object>entry(entry.getKey(), Values.call(expression, entry.getValue())))
                .filter(entry -> entry.getValue() != null));
    }

    public Selector<Node> descendants() {
        return descendants(null, TraversalOrder.NATURAL, false);
    }

    public Selector<Node> descendants(Object test) {
        return descendants(test, TraversalOrder.NATURAL, false);
    }

    /**
     * Every node in this selection and everything below it.
     *
     * @param test         optional filter on the yielded nodes
     * @param order        traversal order
     * @param skipFailures whether a node failing {@code test} also hides its subtree
     */
    public Selector<Node> descendants(Object test, TraversalOrder order, boolean skipFailures) {
        return Selector.distinct(() -> stream().filter(Node.class::isInstance)
                .map(Node.class::cast)
                .flatMap(root -> DescendantIterator.stream(root, order, test, skipFailures)), Node::id);
    }

    public long count() {
        return entries().count();
    }

    public FilterableMap<Object, Long> count(Object... groupBy) {
        requireGroups(groupBy);
        FilterableMap<Object, Long> result = new FilterableMap<>();
        for (T item : this) {
            Object key = groupKey(item, groupBy);
            if (key != null) {
                result.merge(key, 1L, Long::sum);
            }
        }
        return result;
    }

    /**
     * Arithmetic mean of {@code function} over the elements, ignoring absent values. {@code NaN} when there is
     * nothing to average.
     */
    public double avg(Object function) {
        double sum = 0.0;
        long count = 0;
        for (T item : this) {
            Object value = Values.call(function, item);
            if (value != null) {
                sum += Values.toDouble(value);
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public FilterableMap<Object, Double> avg(Object function, Object... groupBy) {
        requireGroups(groupBy);
        Map<Object, double[]> state = new LinkedHashMap<>();
        for (T item : this) {
            Object key = groupKey(item, groupBy);
            Object value = key == null ? null : Values.call(function, item);
            if (value != null) {
                double[] sumAndCount = state.computeIfAbsent(key, k -> new double[2]);
                sumAndCount[0] += Values.toDouble(value);
                sumAndCount[1]++;
            }
        }
        FilterableMap<Object, Double> result = new FilterableMap<>();
        state.forEach((key, sumAndCount) -> result.put(key, sumAndCount[0] / sumAndCount[1]));
        return result;
    }

    /** Smallest value of {@code function}, or {@code null} if there is none. */
    public Object min(Object function) {
        return extreme(function, -1);
    }

    public FilterableMap<Object, Object> min(Object function, Object... groupBy) {
        return extremes(function, -1, groupBy);
    }

    /** Largest value of {@code function}, or {@code null} if there is none. */
    public Object max(Object function) {
        return extreme(function, 1);
    }

    public FilterableMap<Object, Object> max(Object function, Object... groupBy) {
        return extremes(function, 1, groupBy);
    }

    private Object extreme(Object function, int sign) {
        Object best = null;
        for (T item : this) {
            Object value = Values.call(function, item);
            if (value != null && (best == null || sign * Values.compare(value, best) > 0)) {
                best = value;
            }
        }
        return best;
    }

    private FilterableMap<Object, Object> extremes(Object function, int sign, Object[] groupBy) {
        requireGroups(groupBy);
        FilterableMap<Object, Object> result = new FilterableMap<>();
        for (T item : this) {
            Object key = groupKey(item, groupBy);
            Object value = key == null ? null : Values.call(function, item);
            if (value == null) {
                continue;
            }
            Object best = result.get(key);
            if (best == null || sign * Values.compare(value, best) > 0) {
                result.put(key, value);
            }
        }
        return result;
    }

    private static Object groupKey(Object item, Object[] groupBy) {
        if (groupBy.length == 1) {
            return Values.call(groupBy[0], item);
        }
        MutableList<Object> parts = Lists.mutable.withInitialCapacity(groupBy.length);
        for (Object expression : groupBy) {
            Object value = Values.call(expression, item);
            if (value == null) {
                return null;
            }
            parts.add(value);
        }
        return parts.toImmutable();
    }

    private static void requireGroups(Object[] groupBy) {
        if (groupBy == null || groupBy.length == 0) {
            throw new IllegalArgumentException("At least one group-by expression is required");
        }
    }

    public boolean isEmpty() {
        return entries().findAny().isEmpty();
    }

    public int size() {
        return (int) entries().count();
    }

    /**
     * Element at {@code index}; negative indexes count from the end. Linear in the size of the selection.
     */
    public T get(int index) {
        int remaining = index >= 0 ? index : index + size();
        if (remaining >= 0) {
            for (T item : this) {
                if (remaining-- == 0) {
                    return item;
                }
            }
        }
        throw new IndexOutOfBoundsException("Index " + index + " out of range for selection");
    }

    /** Element with the given id, or {@code null}. */
    public T get(String id) {
        return entries().filter(entry -> entry.getKey().equals(id))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    public boolean contains(String id) {
        return entries().anyMatch(entry -> entry.getKey().equals(id));
    }

    /** A read-only snapshot of the selection. */
    public Map<String, T> asMap() {
        Map<String, T> snapshot = new LinkedHashMap<>();
        entries().forEach(entry -> snapshot.putIfAbsent(entry.getKey(), entry.getValue()));
        return Collections.unmodifiableMap(snapshot);
    }

    @Override
    public String toString() {
        return stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
