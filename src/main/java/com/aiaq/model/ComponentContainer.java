package com.aiaq.model;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class ComponentContainer extends Component {
    private final MutableList<Component> children = Lists.mutable.empty();

    ComponentContainer(ComponentContainer parent, String uuid, ComponentType type, String name, Object version,
                       Map<String, Object> properties) {
        super(parent, uuid, type, name, version, properties);
    }

    @Override
    public List<Component> children() {
        return Collections.unmodifiableList(children);
    }

    void addChild(Component child) {
        children.add(child);
    }
}
