package com.aiaq.model;

import com.aiaq.query.AttributeSource;
import com.aiaq.query.Atom;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ConcurrentMutableMap;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.map.mutable.ConcurrentHashMap;

import java.util.Set;

/**
 * A component type from the catalog, such as {@code Button} or {@code Form}. Types that are not in the catalog
 * are treated as extensions.
 */
public final class ComponentType implements Atom, AttributeSource {
    private static final Set<String> ATTRIBUTES = Set.of("name", "type", "external", "version", "category_string",
            "help_string", "show_on_palette", "visible", "icon_name", "methods", "events", "properties");
    private static final ConcurrentMutableMap<String, ComponentType> EXTENSIONS = new ConcurrentHashMap<>();

    public record Parameter(String name, String type) {}

    public record Method(String name, String description, boolean deprecated, ImmutableList<Parameter> params,
                         String returnType) {}

    public record Event(String name, String description, boolean deprecated, ImmutableList<Parameter> params) {}

    public record Property(String name, String editorType, String defaultValue, String description, String type,
                           String rw, boolean deprecated) {}

    private final String name;
    private final String type;
    private final boolean external;
    private final int version;
    private final String categoryString;
    private final String helpString;
    private final boolean showOnPalette;
    private final boolean visible;
    private final String iconName;
    private final ImmutableMap<String, Method> methods;
    private final ImmutableMap<String, Event> events;
    private final ImmutableMap<String, Property> properties;

    private ComponentType(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.external = builder.external;
        this.version = builder.version;
        this.categoryString = builder.categoryString;
        this.helpString = builder.helpString;
        this.showOnPalette = builder.showOnPalette;
        this.visible = builder.visible;
        this.iconName = builder.iconName;
        this.methods = builder.methods.toImmutable();
        this.events = builder.events.toImmutable();
        this.properties = builder.properties.toImmutable();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** A type the catalog does not know about. One instance per name. */
    public static ComponentType extension(String name) {
        return EXTENSIONS.getIfAbsentPut(name, () -> builder(name).external(true).build());
    }

    @Override
    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public boolean external() {
        return external;
    }

    public int version() {
        return version;
    }

    public String categoryString() {
        return categoryString;
    }

    public String helpString() {
        return helpString;
    }

    public boolean showOnPalette() {
        return showOnPalette;
    }

    public boolean visible() {
        return visible;
    }

    public String iconName() {
        return iconName;
    }

    public ImmutableMap<String, Method> methods() {
        return methods;
    }

    public ImmutableMap<String, Event> events() {
        return events;
    }

    public ImmutableMap<String, Property> properties() {
        return properties;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return ATTRIBUTES.contains(attribute);
    }

    @Override
    public Object attribute(String attribute) {
        return switch (attribute) {
            case "name" -> name;
            case "type" -> type;
            case "external" -> external;
            case "version" -> version;
            case "category_string" -> categoryString;
            case "help_string" -> helpString;
            case "show_on_palette" -> showOnPalette;
            case "visible" -> visible;
            case "icon_name" -> iconName;
            case "methods" -> methods;
            case "events" -> events;
            case "properties" -> properties;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private String type;
        private boolean external;
        private int version = 1;
        private String categoryString;
        private String helpString;
        private boolean showOnPalette = true;
        private boolean visible;
        private String iconName;
        private final MutableMap<String, Method> methods = Maps.mutable.empty();
        private final MutableMap<String, Event> events = Maps.mutable.empty();
        private final MutableMap<String, Property> properties = Maps.mutable.empty();

        private Builder(String name) {
            this.name = name;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder external(boolean external) {
            this.external = external;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder categoryString(String categoryString) {
            this.categoryString = categoryString;
            return this;
        }

        public Builder helpString(String helpString) {
            this.helpString = helpString;
            return this;
        }

        public Builder showOnPalette(boolean showOnPalette) {
            this.showOnPalette = showOnPalette;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder iconName(String iconName) {
            this.iconName = iconName;
            return this;
        }

        public Builder method(Method method) {
            methods.put(method.name(), method);
            return this;
        }

        public Builder method(String methodName, String returnType) {
            return method(new Method(methodName, null, false, Lists.immutable.empty(), returnType));
        }

        public Builder event(Event event) {
            events.put(event.name(), event);
            return this;
        }

        public Builder property(Property property) {
            properties.put(property.name(), property);
            return this;
        }

        public ComponentType build() {
            return new ComponentType(this);
        }
    }
}
