package com.aiaq.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Component implements Node {
    private static final Set<String> ATTRIBUTES = Set.of("id", "uuid", "type", "name", "version", "properties",
            "path", "parent", "screen");

    private final ComponentContainer parent;
    private final String uuid;
    private final ComponentType type;
    private final String name;
    private final Object version;
    private final Map<String, Object> properties;
    private final String path;

    Component(ComponentContainer parent, String uuid, ComponentType type, String name, Object version,
              Map<String, Object> properties) {
        this.parent = parent;
        this.uuid = uuid;
        this.type = type;
        this.name = name;
        this.version = version;
        this.properties = properties == null ? Map.of() : Collections.unmodifiableMap(properties);
        this.path = parent != null ? parent.path() + "/" + name : name;
    }

    @Override
    public String id() {
        return uuid;
    }

    public String uuid() {
        return uuid;
    }

    @Override
    public ComponentType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public Object version() {
        return version;
    }

    public Map<String, Object> properties() {
        return properties;
    }

    /** Instance names from the screen down to this component, separated by {@code /}. */
    public String path() {
        return path;
    }

    @Override
    public ComponentContainer parent() {
        return parent;
    }

    @Override
    public List<? extends Component> children() {
        return List.of();
    }

    @Override
    public Screen screen() {
        Component current = this;
        while (current.parent() != null) {
            current = current.parent();
        }
        return current instanceof Screen screen ? screen : null;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return ATTRIBUTES.contains(attribute);
    }

    @Override
    public Object attribute(String attribute) {
        return switch (attribute) {
            case "id" -> id();
            case "uuid" -> uuid;
            case "type" -> type;
            case "name" -> name;
            case "version" -> version;
            case "properties" -> properties;
            case "path" -> path;
            case "parent" -> parent;
            case "screen" -> screen();
            default -> null;
        };
    }

    @Override
    public String toString() {
        return type + "(" + uuid + ", " + name + ")";
    }
}
