package com.aiaq.output;

import com.aiaq.model.Block;
import com.aiaq.model.Component;
import com.aiaq.model.Node;
import com.aiaq.model.Screen;
import com.aiaq.query.Atom;
import org.eclipse.collections.api.RichIterable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders query results as JSON. Nodes are written as small summary objects, atoms (types, categories, kinds) by
 * name, maps as objects and any iterable, including selections, as an array. Tuple keys of grouped results are
 * written as {@code (a, b)}.
 */
public class OutputFormatter {
    // Map.entry rejects null values
    private static final Object NULL = new Object();

    private final boolean prettyPrint;
    private final boolean sortKeys;

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(Object value) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        write(value, 0, sb);
        return sb.toString();
    }

    private void write(Object value, int indent, StringBuilder sb) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Boolean b) {
            sb.append(b);
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            sb.append(Double.isNaN(d) || Double.isInfinite(d) ? "null" : Double.toString(d));
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof CharSequence s) {
            appendString(s.toString(), sb);
        } else if (value instanceof Node node) {
            writeObject(summary(node), indent, sb);
        } else if (value instanceof Atom atom) {
            appendString(atom.name(), sb);
        } else if (value instanceof Map<?, ?> map) {
            writeObject(map, indent, sb);
        } else if (value instanceof Iterable<?> iterable) {
            writeArray(iterable.iterator(), indent, sb);
        } else {
            appendString(String.valueOf(value), sb);
        }
    }

    private void writeObject(Map<?, ?> map, int indent, StringBuilder sb) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        List<Map.Entry<String, Object>> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            entries.add(Map.entry(keyText(entry.getKey()), entry.getValue() == null ? NULL : entry.getValue()));
        }
        if (sortKeys) {
            entries.sort(Map.Entry.comparingByKey());
        }

        String indentStr = " ".repeat(indent);
        sb.append(prettyPrint ? "{\n" : "{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : entries) {
            if (!first) {
                sb.append(prettyPrint ? ",\n" : ",");
            }
            first = false;
            if (prettyPrint) {
                sb.append(indentStr).append("  ");
            }
            appendString(entry.getKey(), sb);
            sb.append(prettyPrint ? ": " : ":");
            write(entry.getValue() == NULL ? null : entry.getValue(), indent + 2, sb);
        }
        if (prettyPrint) {
            sb.append("\n").append(indentStr);
        }
        sb.append("}");
    }

    private void writeArray(Iterator<?> elements, int indent, StringBuilder sb) {
        if (!elements.hasNext()) {
            sb.append("[]");
            return;
        }

        String indentStr = " ".repeat(indent);
        sb.append(prettyPrint ? "[\n" : "[");
        boolean first = true;
        while (elements.hasNext()) {
            if (!first) {
                sb.append(prettyPrint ? ",\n" : ",");
            }
            first = false;
            if (prettyPrint) {
                sb.append(indentStr).append("  ");
            }
            write(elements.next(), indent + 2, sb);
        }
        if (prettyPrint) {
            sb.append("\n").append(indentStr);
        }
        sb.append("]");
    }

    static Map<String, Object> summary(Node node) {
        Map<String, Object> description = new LinkedHashMap<>();
        if (node instanceof Block block) {
            description.put("id", block.id());
            description.put("type", block.type().name());
            description.put("screen", block.screen() != null ? block.screen().name() : null);
            description.put("disabled", block.disabled());
            if (block.x() != null) {
                description.put("x", block.x());
                description.put("y", block.y());
            }
            if (block.comment() != null) {
                description.put("comment", block.comment());
            }
            if (block.mutation() != null) {
                description.put("mutation", block.mutation());
            }
            if (!block.fields().isEmpty()) {
                description.put("fields", block.fields());
            }
        } else if (node instanceof Component component) {
            description.put("name", component.name());
            description.put("type", component.type().name());
            description.put("uuid", component.uuid());
            if (node instanceof Screen screen) {
                description.put("components", screen.components().size() - 1);
                description.put("blocks", screen.blocks().size());
            } else {
                description.put("path", component.path());
            }
        } else {
            description.put("id", node.id());
            description.put("type", node.type().name());
        }
        return description;
    }

    private static String keyText(Object key) {
        if (key instanceof Atom atom) {
            return atom.name();
        }
        if (key instanceof RichIterable<?> tuple) {
            return tuple.collect(OutputFormatter::keyText).makeString("(", ", ", ")");
        }
        if (key instanceof Iterable<?> iterable) {
            List<String> parts = new ArrayList<>();
            iterable.forEach(part -> parts.add(keyText(part)));
            return "(" + String.join(", ", parts) + ")";
        }
        return String.valueOf(key);
    }

    private static void appendString(String s, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
