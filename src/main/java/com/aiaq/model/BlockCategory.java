package com.aiaq.model;

import com.aiaq.query.Atom;

public record BlockCategory(String name) implements Atom {
    @Override
    public String toString() {
        return name;
    }
}
