package com.aiaq.io;

import com.aiaq.model.ComponentDescriptor;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads screen definitions. The usual framing is
 * <pre>
 * #|
 * $JSON
 * {"YaVersion":"208","Source":"Form","Properties":{...}}
 * |#
 * </pre>
 * but a file holding only the JSON line is accepted too.
 */
public class FormReader {
    private static final String JSON_MARKER = "$JSON";
    private static final Set<String> STRUCTURAL_KEYS = Set.of("$Components", "$Name", "$Type", "$Version", "Uuid");

    private final JsonReader json = new JsonReader();

    public FormDocument read(InputStream input) throws IOException {
        return read(new String(input.readAllBytes(), StandardCharsets.UTF_8));
    }

    public FormDocument read(String content) throws IOException {
        Object parsed = json.read(extractJson(content));
        if (!(parsed instanceof Map<?, ?> document)) {
            throw new IOException("Screen file does not contain a JSON object");
        }
        Object properties = document.get("Properties");
        if (!(properties instanceof Map<?, ?> root)) {
            throw new IOException("Screen file has no Properties object");
        }
        Object version = document.containsKey("AlexaVersion") ? document.get("AlexaVersion") : document.get("YaVersion");
        return new FormDocument(describe(root), toInteger(version));
    }

    private static String extractJson(String content) throws IOException {
        List<String> lines = content.lines().collect(Collectors.toList());
        if (lines.size() > 2) {
            if (!JSON_MARKER.equals(lines.get(1).trim())) {
                throw new IOException("Unknown screen format: " + lines.get(1));
            }
            return lines.get(2);
        }
        if (lines.size() == 1 && !lines.get(0).isBlank()) {
            return lines.get(0);
        }
        throw new IOException("Unknown screen format: expected a framed or single-line JSON screen");
    }

    private static ComponentDescriptor describe(Map<?, ?> json) throws IOException {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : json.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!STRUCTURAL_KEYS.contains(key)) {
                properties.put(key, entry.getValue());
            }
        }
        String uuid = text(json.get("Uuid"));
        String type = text(json.get("$Type"));
        String name = text(json.get("$Name"));
        String version = text(json.get("$Version"));
        Object components = json.get("$Components");
        if (components == null) {
            return new ComponentDescriptor(uuid, type, name, version, properties, null);
        }
        if (!(components instanceof List<?> list)) {
            throw new IOException("$Components of " + name + " is not an array");
        }
        MutableList<ComponentDescriptor> children = Lists.mutable.empty();
        for (Object child : list) {
            if (!(child instanceof Map<?, ?> childJson)) {
                throw new IOException("Component entry of " + name + " is not an object");
            }
            children.add(describe(childJson));
        }
        return new ComponentDescriptor(uuid, type, name, version, properties, children.toImmutable());
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Integer toInteger(Object value) throws IOException {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.valueOf(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IOException("Invalid version number: " + value, e);
        }
    }
}
