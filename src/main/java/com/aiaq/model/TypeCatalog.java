package com.aiaq.model;

import com.aiaq.query.Atom;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

public interface TypeCatalog {
    Optional<BlockType> blockType(String name);

    Optional<ComponentType> componentType(String name);

    // block types win over component types
    default Optional<Atom> resolve(String name) {
        Optional<BlockType> block = blockType(name);
        if (block.isPresent()) {
            return Optional.of(block.get());
        }
        return componentType(name).map(Atom.class::cast);
    }

    static TypeCatalog standard() {
        return StandardCatalogHolder.INSTANCE;
    }

    static TypeCatalog of(ComponentCatalog components) {
        return new TypeCatalog() {
            @Override
            public Optional<BlockType> blockType(String name) {
                return BlockTypes.lookup(name);
            }

            @Override
            public Optional<ComponentType> componentType(String name) {
                return components.lookup(name);
            }
        };
    }

    final class StandardCatalogHolder {
        private static final TypeCatalog INSTANCE = load();

        private StandardCatalogHolder() {
        }

        private static TypeCatalog load() {
            try {
                return of(ComponentCatalog.loadDefault());
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to load bundled component catalog", e);
            }
        }
    }
}
