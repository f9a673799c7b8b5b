package com.aiaq.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Map;

// children is null for plain components, non-null (possibly empty) for containers
public record ComponentDescriptor(String uuid, String type, String name, String version,
                                  Map<String, Object> properties, ImmutableList<ComponentDescriptor> children) {

    public static ComponentDescriptor leaf(String uuid, String type, String name, String version,
                                           Map<String, Object> properties) {
        return new ComponentDescriptor(uuid, type, name, version, properties, null);
    }

    public static ComponentDescriptor container(String uuid, String type, String name, String version,
                                                Map<String, Object> properties,
                                                ComponentDescriptor... children) {
        return new ComponentDescriptor(uuid, type, name, version, properties, Lists.immutable.with(children));
    }

    public boolean isContainer() {
        return children != null;
    }
}
