package com.aiaq.query;

import com.aiaq.model.Block;
import com.aiaq.model.BlockKind;
import com.aiaq.model.Component;
import com.aiaq.model.Node;
import com.aiaq.select.Selector;
import org.eclipse.collections.api.map.ConcurrentMutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.map.mutable.ConcurrentHashMap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ready-made expressions over blocks and components.
 * <p>
 * Lookups return {@code null} when a node lacks the attribute, e.g. {@link #KIND} on a component. Accessors for
 * single entries of the mutation, field and property maps are interned: asking twice for the same name returns the
 * same instance.
 */
public final class Attributes {
    private static final MutableMap<String, Expression> BY_NAME = Maps.mutable.empty();
    private static final ConcurrentMutableMap<String, Expression> MUTATIONS = new ConcurrentHashMap<>();
    private static final ConcurrentMutableMap<String, Expression> FIELDS_BY_NAME = new ConcurrentHashMap<>();
    private static final ConcurrentMutableMap<String, Expression> PROPERTIES_BY_NAME = new ConcurrentHashMap<>();

    public static final Expression TYPE = register("type", NamedAttributeTuple.of("type", "component_type"));
    public static final Expression NAME = register("name", NamedAttributeTuple.of("name", "instance_name"));
    public static final Expression KIND = register("kind", new NamedAttribute("kind"));
    public static final Expression EXTERNAL = register("external", new NamedAttribute("external"));
    public static final Expression VERSION = register("version", new NamedAttribute("version"));
    public static final Expression CATEGORY = register("category",
            NamedAttributeTuple.of("category", "category_string"));
    public static final Expression HELP_STRING = register("help_string", new NamedAttribute("help_string"));
    public static final Expression SHOW_ON_PALETTE = register("show_on_palette",
            new NamedAttribute("show_on_palette"));
    public static final Expression VISIBLE = register("visible", new NamedAttribute("visible"));
    public static final Expression NON_VISIBLE = register("non_visible", Expressions.not(VISIBLE));
    public static final Expression ICON_NAME = register("icon_name", new NamedAttribute("icon_name"));
    public static final Expression RETURN_TYPE = register("return_type", new NamedAttribute("return_type"));
    public static final Expression GENERIC = register("generic", new NamedAttribute("generic"));
    public static final Expression DISABLED = register("disabled", new NamedAttribute("disabled"));
    public static final Expression LOGICALLY_DISABLED = register("logically_disabled",
            new NamedAttribute("logically_disabled"));
    public static final Expression LOGICALLY_ENABLED = register("logically_enabled",
            Expressions.not(LOGICALLY_DISABLED));

    /** A component's {@code Enabled} property, or for blocks the negation of {@link #DISABLED}. */
    public static final Expression ENABLED = register("enabled", ComputedAttribute.named("enabled", node -> {
        if (node instanceof Component component) {
            Object enabled = component.properties().get("Enabled");
            return enabled == null || !"false".equalsIgnoreCase(String.valueOf(enabled));
        }
        return !Values.truthy(DISABLED.apply(node));
    }));

    public static final Expression TOP_LEVEL = register("top_level", ComputedAttribute.named("top_level",
            node -> node instanceof Block block && block.parent() == null));
    public static final Expression PARENT = register("parent", new NamedAttribute("parent"));
    public static final Expression MUTATION = register("mutation", ComputedAttribute.named("mutation",
            node -> mapEntry(node, "mutation", null)));
    public static final Expression FIELDS = register("fields", ComputedAttribute.named("fields",
            node -> mapEntry(node, "fields", null)));
    public static final Expression PROPERTIES = register("properties", ComputedAttribute.named("properties",
            node -> mapEntry(node, "properties", null)));

    /** The top of the statement stack containing the operand. */
    public static final Expression ROOT_BLOCK = register("root_block", ComputedAttribute.named("root_block",
            Attributes::rootBlock));

    public static final Expression HEIGHT = register("height", height(AttributeCache.shared()));
    public static final Expression DEPTH = register("depth", depth(AttributeCache.shared()));

    public static final Expression IS_PROCEDURE = register("is_procedure",
            Expressions.or(TYPE.eq("procedures_defreturn"), TYPE.eq("procedures_defnoreturn")));
    public static final Expression IS_CALLED = register("is_called", ComputedAttribute.named("is_called",
            node -> node instanceof Node n && !Selector.of(n).callers().isEmpty()));
    public static final Expression LEAF = register("leaf", ComputedAttribute.named("leaf",
            node -> node instanceof Node n && n.children().isEmpty()));
    public static final Expression DECLARATION = register("declaration",
            Expressions.or(Expressions.or(TYPE.eq("component_event"), TYPE.eq("global_declaration")), IS_PROCEDURE));
    public static final Expression STATEMENT = register("statement", KIND.eq(BlockKind.STATEMENT));
    public static final Expression VALUE = register("value", KIND.eq(BlockKind.VALUE));

    private Attributes() {
    }

    /** Looks up one of the constants above by its attribute name, e.g. {@code logically_disabled}. */
    public static Optional<Expression> named(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /** Accessor for one entry of a block's mutation, e.g. {@code mutation("component_type")}. */
    public static Expression mutation(String name) {
        return MUTATIONS.getIfAbsentPut(name, () -> ComputedAttribute.named("mutation." + name,
                node -> mapEntry(node, "mutation", name)));
    }

    /** Accessor for one field of a block, e.g. {@code field("OP")}. */
    public static Expression field(String name) {
        return FIELDS_BY_NAME.getIfAbsentPut(name, () -> ComputedAttribute.named("fields." + name,
                node -> mapEntry(node, "fields", name)));
    }

    /** Accessor for one designer property of a component, e.g. {@code property("Text")}. */
    public static Expression property(String name) {
        return PROPERTIES_BY_NAME.getIfAbsentPut(name, () -> ComputedAttribute.named("properties." + name,
                node -> mapEntry(node, "properties", name)));
    }

    /** Accepts nodes with any ancestor. */
    public static Expression hasAncestor() {
        return hasAncestor(null);
    }

    /**
     * Accepts nodes with a strict ancestor, along {@code parent}, that matches {@code target}: the same node if
     * {@code target} is a node, a truthy result if it is an expression or function, any ancestor if it is
     * {@code null}.
     */
    public static Expression hasAncestor(Object target) {
        return ComputedAttribute.named("has_ancestor(" + describe(target) + ")", node -> {
            if (!(node instanceof Node start)) {
                return false;
            }
            for (Node current = start.parent(); current != null; current = current.parent()) {
                if (matches(target, current)) {
                    return true;
                }
            }
            return false;
        });
    }

    public static Expression hasDescendant() {
        return hasDescendant(null);
    }

    /** Like {@link #hasAncestor(Object)}, searching the subtree below the node instead. */
    public static Expression hasDescendant(Object target) {
        return ComputedAttribute.named("has_descendant(" + describe(target) + ")", node -> {
            if (!(node instanceof Node start)) {
                return false;
            }
            Deque<Node> pending = new ArrayDeque<>(start.children());
            while (!pending.isEmpty()) {
                Node current = pending.pollFirst();
                if (matches(target, current)) {
                    return true;
                }
                pending.addAll(current.children());
            }
            return false;
        });
    }

    public static Expression height(AttributeCache cache) {
        return ComputedAttribute.named("height", node -> node instanceof Node n ? cache.height(n) : null);
    }

    public static Expression depth(AttributeCache cache) {
        return ComputedAttribute.named("depth", node -> node instanceof Node n ? cache.depth(n) : null);
    }

    private static boolean matches(Object target, Node candidate) {
        if (target == null) {
            return true;
        }
        if (target instanceof Expression || target instanceof Function || target instanceof Predicate) {
            return Expressions.test(target, candidate);
        }
        return target == candidate;
    }

    private static Object rootBlock(Object node) {
        if (!(node instanceof Node current)) {
            return node;
        }
        while (current.logicalParent() != null) {
            current = current.logicalParent();
        }
        return current;
    }

    private static Object mapEntry(Object node, String attribute, String key) {
        if (node instanceof AttributeSource source && source.hasAttribute(attribute)) {
            Object value = source.attribute(attribute);
            if (value instanceof Map<?, ?> map) {
                return key == null ? map : map.get(key);
            }
        }
        return null;
    }

    private static String describe(Object target) {
        return target instanceof Node node ? node.id() : String.valueOf(target);
    }

    private static Expression register(String name, Expression expression) {
        BY_NAME.put(name, expression);
        return expression;
    }
}
