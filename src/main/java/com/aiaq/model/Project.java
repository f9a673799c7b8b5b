package com.aiaq.model;

import com.aiaq.select.NamedCollection;
import com.aiaq.select.Selection;
import com.aiaq.select.UnionSelector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loaded App Inventor project: its screens, project properties and asset names.
 */
public class Project {
    private final String name;
    private final NamedCollection<Screen> screens = new NamedCollection<>();
    private final Map<String, String> properties;
    private final List<String> assets;

    public Project(String name, Map<String, String> properties, List<String> assets) {
        this.name = name;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.assets = List.copyOf(assets);
    }

    public String name() {
        return name;
    }

    public void addScreen(Screen screen) {
        screens.put(screen.id(), screen);
        screen.attachTo(this);
    }

    public Selection<Screen> screens() {
        return screens;
    }

    /** Components of all screens. A component can be looked up by uuid or by instance name. */
    public UnionSelector<Screen, Component> components() {
        return new UnionSelector<>(screens, "components", Screen::components);
    }

    public UnionSelector<Screen, Block> blocks() {
        return new UnionSelector<>(screens, "blocks", Screen::blocks);
    }

    public Map<String, String> properties() {
        return properties;
    }

    public List<String> assets() {
        return assets;
    }

    @Override
    public String toString() {
        return "Project(" + name + ", screens=" + screens.size() + ")";
    }
}
