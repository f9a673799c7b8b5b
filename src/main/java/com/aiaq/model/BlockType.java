package com.aiaq.model;

import com.aiaq.query.Atom;

import java.util.Objects;

public record BlockType(String name, BlockCategory category, BlockKind kind) implements Atom {
    public BlockType {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
