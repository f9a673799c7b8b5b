package com.aiaq.model;

import com.aiaq.io.JsonReader;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ComponentCatalog {
    private static final Logger log = LoggerFactory.getLogger(ComponentCatalog.class);

    public static final String DEFAULT_RESOURCE = "simple_components.json";

    private final ImmutableMap<String, ComponentType> types;

    public ComponentCatalog(Iterable<ComponentType> types) {
        MutableMap<String, ComponentType> byName = Maps.mutable.empty();
        for (ComponentType type : types) {
            byName.put(type.name(), type);
        }
        this.types = byName.toImmutable();
    }

    public static ComponentCatalog loadDefault() throws IOException {
        try (InputStream input = ComponentCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new FileNotFoundException("Missing catalog resource " + DEFAULT_RESOURCE);
            }
            return load(input);
        }
    }

    public static ComponentCatalog load(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input);
        }
    }

    public static ComponentCatalog load(InputStream input) throws IOException {
        Object json = new JsonReader().read(input);
        if (!(json instanceof List<?> descriptors)) {
            throw new IOException("Component catalog must be a JSON array of descriptors");
        }
        MutableList<ComponentType> types = Lists.mutable.empty();
        for (Object descriptor : descriptors) {
            if (descriptor instanceof Map<?, ?> map) {
                types.add(fromDescriptor(map));
            }
        }
        log.info("Loaded {} component types", types.size());
        return new ComponentCatalog(types);
    }

    public Optional<ComponentType> lookup(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public int size() {
        return types.size();
    }

    static ComponentType fromDescriptor(Map<?, ?> descriptor) {
        ComponentType.Builder builder = ComponentType.builder(text(descriptor, "name"))
                .type(text(descriptor, "type"))
                .external(flag(descriptor, "external"))
                .version(number(descriptor, "version", 1))
                .categoryString(text(descriptor, "categoryString"))
                .helpString(text(descriptor, "helpString"))
                .showOnPalette(!descriptor.containsKey("showOnPalette") || flag(descriptor, "showOnPalette"))
                .visible(!flag(descriptor, "nonVisible"))
                .iconName(text(descriptor, "iconName"));

        MutableMap<String, ComponentType.Property> properties = Maps.mutable.empty();
        for (Map<?, ?> property : objects(descriptor, "properties")) {
            String name = text(property, "name");
            properties.put(name, new ComponentType.Property(name, text(property, "editorType"),
                    text(property, "defaultValue"), null, null, null, false));
        }
        // block properties carry the type and access information
        for (Map<?, ?> property : objects(descriptor, "blockProperties")) {
            String name = text(property, "name");
            ComponentType.Property designer = properties.get(name);
            properties.put(name, new ComponentType.Property(name,
                    designer != null ? designer.editorType() : null,
                    designer != null ? designer.defaultValue() : null,
                    text(property, "description"), text(property, "type"), text(property, "rw"),
                    flag(property, "deprecated")));
        }
        properties.forEachValue(builder::property);

        for (Map<?, ?> event : objects(descriptor, "events")) {
            builder.event(new ComponentType.Event(text(event, "name"), text(event, "description"),
                    flag(event, "deprecated"), parameters(event)));
        }
        for (Map<?, ?> method : objects(descriptor, "methods")) {
            builder.method(new ComponentType.Method(text(method, "name"), text(method, "description"),
                    flag(method, "deprecated"), parameters(method), text(method, "returnType")));
        }
        return builder.build();
    }

    private static ImmutableList<ComponentType.Parameter> parameters(Map<?, ?> descriptor) {
        return objects(descriptor, "params")
                .collect(p -> new ComponentType.Parameter(text(p, "name"), text(p, "type")))
                .toImmutable();
    }

    private static MutableList<Map<?, ?>> objects(Map<?, ?> descriptor, String key) {
        MutableList<Map<?, ?>> result = Lists.mutable.empty();
        if (descriptor.get(key) instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof Map<?, ?> map) {
                    result.add(map);
                }
            }
        }
        return result;
    }

    private static String text(Map<?, ?> descriptor, String key) {
        Object value = descriptor.get(key);
        return value == null ? null : value.toString();
    }

    // descriptor files write booleans both as JSON booleans and as "true"/"false" strings
    private static boolean flag(Map<?, ?> descriptor, String key) {
        Object value = descriptor.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static int number(Map<?, ?> descriptor, String key, int defaultValue) {
        Object value = descriptor.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {} '{}' in component descriptor", key, value);
            }
        }
        return defaultValue;
    }
}
