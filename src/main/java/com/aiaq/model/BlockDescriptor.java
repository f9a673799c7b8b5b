package com.aiaq.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A block as read from a blocks file: type name, fields, mutation and the descriptors plugged into its inputs.
 * Maps keep document order.
 */
public record BlockDescriptor(String id, String type, Map<String, String> fields, Map<String, String> mutation,
                              Map<String, BlockDescriptor> values, Map<String, BlockDescriptor> statements,
                              BlockDescriptor next, Integer x, Integer y, boolean inline, boolean disabled,
                              String comment) {

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final String type;
        private String id;
        private final Map<String, String> fields = new LinkedHashMap<>();
        private Map<String, String> mutation;
        private final Map<String, BlockDescriptor> values = new LinkedHashMap<>();
        private final Map<String, BlockDescriptor> statements = new LinkedHashMap<>();
        private BlockDescriptor next;
        private Integer x;
        private Integer y;
        private boolean inline;
        private boolean disabled;
        private String comment;

        private Builder(String type) {
            this.type = type;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder field(String name, String value) {
            fields.put(name, value);
            return this;
        }

        public Builder mutation(String name, String value) {
            if (mutation == null) {
                mutation = new LinkedHashMap<>();
            }
            mutation.put(name, value);
            return this;
        }

        // an empty map still means a mutation element was present
        public Builder mutation(Map<String, String> attributes) {
            mutation = new LinkedHashMap<>(attributes);
            return this;
        }

        public Builder value(String name, BlockDescriptor block) {
            values.put(name, block);
            return this;
        }

        public Builder statement(String name, BlockDescriptor block) {
            statements.put(name, block);
            return this;
        }

        public Builder next(BlockDescriptor next) {
            this.next = next;
            return this;
        }

        public Builder position(Integer x, Integer y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder inline(boolean inline) {
            this.inline = inline;
            return this;
        }

        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public BlockDescriptor build() {
            return new BlockDescriptor(id, type, Collections.unmodifiableMap(new LinkedHashMap<>(fields)),
                    mutation == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(mutation)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(values)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(statements)), next, x, y, inline, disabled,
                    comment);
        }
    }
}
