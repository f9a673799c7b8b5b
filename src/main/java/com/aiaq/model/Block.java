package com.aiaq.model;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A block from a screen's blocks file. Blocks are created by {@link BlockFactory} and read-only afterwards.
 */
public class Block implements Node {
    private static final Set<String> ATTRIBUTES = Set.of("id", "type", "category", "kind", "parent",
            "logical_parent", "output", "fields", "mutation", "values", "statements", "next", "x", "y", "inline",
            "comment", "disabled", "logically_disabled", "screen", "return_type", "generic", "component");

    private final String id;
    private final BlockType type;
    private final Screen screen;

    Block parent;
    Block logicalParent;
    Block output;
    Block next;
    final Map<String, List<Block>> values = new LinkedHashMap<>();
    final Map<String, List<Block>> statements = new LinkedHashMap<>();
    Map<String, String> fields = Map.of();
    Map<String, String> mutation;
    Integer x;
    Integer y;
    boolean inline;
    String comment;
    boolean disabled;
    boolean logicallyDisabled;
    Component component;

    Block(String id, BlockType type, Screen screen) {
        this.id = id;
        this.type = type;
        this.screen = screen;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public BlockType type() {
        return type;
    }

    public BlockCategory category() {
        return type.category();
    }

    /**
     * The effective kind. Component getters/setters and method calls are resolved from their mutation: a getter or
     * a method with a return type is a value, everything else a statement.
     *
     * @throws StructuralException if the static kind is a mutation no rule applies to
     */
    public BlockKind kind() {
        if (type.kind() != BlockKind.MUTATION) {
            return type.kind();
        }
        if (BlockTypes.COMPONENT_SET_GET.equals(type)) {
            return mutation != null && "get".equals(mutation.get("set_or_get")) ? BlockKind.VALUE : BlockKind.STATEMENT;
        }
        if (BlockTypes.COMPONENT_METHOD.equals(type)) {
            return returnType() != null ? BlockKind.VALUE : BlockKind.STATEMENT;
        }
        throw new StructuralException("Unknown kind for block type " + type.name());
    }

    /**
     * Return type of the component method this block calls, or {@code null} if the block is not a method call, the
     * method returns nothing, or the catalog does not know the component type or method.
     */
    public String returnType() {
        if (!BlockTypes.COMPONENT_METHOD.equals(type) || mutation == null) {
            return null;
        }
        String methodName = mutation.get("method_name");
        return catalog().componentType(mutation.get("component_type"))
                .map(componentType -> componentType.methods().get(methodName))
                .map(ComponentType.Method::returnType)
                .orElse(null);
    }

    public boolean generic() {
        return mutation != null && "true".equals(mutation.get("is_generic"));
    }

    public boolean isTopLevel() {
        return parent == null;
    }

    public boolean isProcedureDefinition() {
        return BlockTypes.PROCEDURES_DEFNORETURN.equals(type) || BlockTypes.PROCEDURES_DEFRETURN.equals(type);
    }

    public boolean isProcedureCall() {
        return BlockTypes.PROCEDURES_CALLNORETURN.equals(type) || BlockTypes.PROCEDURES_CALLRETURN.equals(type);
    }

    @Override
    public List<Block> children() {
        MutableList<Block> result = Lists.mutable.empty();
        values.values().forEach(result::addAll);
        statements.values().forEach(result::addAll);
        return result.asUnmodifiable();
    }

    @Override
    public Block parent() {
        return parent;
    }

    @Override
    public Block logicalParent() {
        return logicalParent;
    }

    public Block output() {
        return output;
    }

    public Block next() {
        return next;
    }

    public Map<String, List<Block>> values() {
        return Collections.unmodifiableMap(values);
    }

    /** Statement inputs by name. Each list holds the whole statement sequence of the input. */
    public Map<String, List<Block>> statements() {
        return Collections.unmodifiableMap(statements);
    }

    public Map<String, String> fields() {
        return fields;
    }

    public Map<String, String> mutation() {
        return mutation;
    }

    public Integer x() {
        return x;
    }

    public Integer y() {
        return y;
    }

    public boolean inline() {
        return inline;
    }

    public String comment() {
        return comment;
    }

    public boolean disabled() {
        return disabled;
    }

    public boolean logicallyDisabled() {
        return logicallyDisabled;
    }

    @Override
    public Screen screen() {
        return screen;
    }

    public Component component() {
        return component;
    }

    private TypeCatalog catalog() {
        return screen != null ? screen.catalog() : TypeCatalog.standard();
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return ATTRIBUTES.contains(attribute);
    }

    @Override
    public Object attribute(String attribute) {
        return switch (attribute) {
            case "id" -> id;
            case "type" -> type;
            case "category" -> category();
            case "kind" -> kind();
            case "parent" -> parent;
            case "logical_parent" -> logicalParent;
            case "output" -> output;
            case "fields" -> fields;
            case "mutation" -> mutation;
            case "values" -> values();
            case "statements" -> statements();
            case "next" -> next;
            case "x" -> x;
            case "y" -> y;
            case "inline" -> inline;
            case "comment" -> comment;
            case "disabled" -> disabled;
            case "logically_disabled" -> logicallyDisabled;
            case "screen" -> screen;
            case "return_type" -> returnType();
            case "generic" -> generic();
            case "component" -> component;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return "Block(" + id + ", " + type.name() + ")";
    }
}
