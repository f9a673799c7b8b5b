package com.aiaq.model;

/**
 * Raised when project content cannot be classified: a legacy block type that names no known component, an
 * unknown block type, or a block whose kind cannot be determined.
 */
public class StructuralException extends RuntimeException {
    public StructuralException(String message) {
        super(message);
    }
}
