package com.aiaq.query;

public interface AttributeSource {
    boolean hasAttribute(String name);

    /**
     * @return the value of the named field, or {@code null} if the field is absent or has no value
     */
    Object attribute(String name);
}
