package com.aiaq.model;

import com.aiaq.select.DescendantIterator;
import com.aiaq.select.NamedCollection;
import com.aiaq.select.Selection;
import com.aiaq.select.Selector;
import com.aiaq.select.TraversalOrder;

import java.util.Map;
import java.util.Set;

/**
 * The root of one design surface: the Form component, its component tree and the blocks written for it.
 */
public class Screen extends ComponentContainer {
    public static final String FORM = "Form";

    private static final Set<String> ATTRIBUTES = Set.of("blocks", "components", "ya_version", "blocks_version",
            "project");

    private final TypeCatalog catalog;
    private final NamedCollection<Block> blocks = new NamedCollection<>();
    private Integer yaVersion;
    private Integer blocksVersion;
    private Project project;

    Screen(String uuid, ComponentType type, String name, Object version, Map<String, Object> properties,
           TypeCatalog catalog) {
        super(null, uuid, type, name, version, properties);
        this.catalog = catalog;
    }

    /**
     * Builds a screen and its component tree from the root descriptor of a form file. Component types missing from
     * {@code catalog} become extension types.
     */
    public static Screen fromForm(ComponentDescriptor form, TypeCatalog catalog) {
        Screen screen = new Screen(form.uuid(), resolveType(catalog, form.type() != null ? form.type() : FORM),
                form.name(), parseVersion(form.version()), form.properties(), catalog);
        if (form.children() != null) {
            for (ComponentDescriptor child : form.children()) {
                attach(screen, child, catalog);
            }
        }
        return screen;
    }

    private static void attach(ComponentContainer parent, ComponentDescriptor descriptor, TypeCatalog catalog) {
        ComponentType type = resolveType(catalog, descriptor.type());
        Object version = parseVersion(descriptor.version());
        if (descriptor.isContainer()) {
            ComponentContainer container = new ComponentContainer(parent, descriptor.uuid(), type,
                    descriptor.name(), version, descriptor.properties());
            parent.addChild(container);
            for (ComponentDescriptor child : descriptor.children()) {
                attach(container, child, catalog);
            }
        } else {
            parent.addChild(new Component(parent, descriptor.uuid(), type, descriptor.name(), version,
                    descriptor.properties()));
        }
    }

    private static ComponentType resolveType(TypeCatalog catalog, String name) {
        return catalog.componentType(name).orElseGet(() -> ComponentType.extension(name));
    }

    private static Object parseVersion(String version) {
        if (version == null) {
            return null;
        }
        try {
            return Integer.valueOf(version.trim());
        } catch (NumberFormatException e) {
            return version;
        }
    }

    // screens are keyed by name
    @Override
    public String id() {
        return name();
    }

    public TypeCatalog catalog() {
        return catalog;
    }

    /** Every component of the screen, breadth first, starting with the screen itself. */
    public Selector<Component> components() {
        return Selector.distinct(() -> DescendantIterator.stream(this, TraversalOrder.BREADTH, null, false)
                .map(Component.class::cast), Component::id);
    }

    /** Every block of the screen, top-level or nested, in document order. */
    public Selection<Block> blocks() {
        return blocks;
    }

    public Component findComponent(String instanceName) {
        for (Component component : components()) {
            if (component.name() != null && component.name().equals(instanceName)) {
                return component;
            }
        }
        return null;
    }

    public Integer yaVersion() {
        return yaVersion;
    }

    public Integer blocksVersion() {
        return blocksVersion;
    }

    public Project project() {
        return project;
    }

    public void setVersions(Integer yaVersion, Integer blocksVersion) {
        this.yaVersion = yaVersion;
        this.blocksVersion = blocksVersion;
    }

    void registerBlock(Block block) {
        blocks.put(block.id(), block);
    }

    void attachTo(Project project) {
        this.project = project;
    }

    @Override
    public boolean hasAttribute(String attribute) {
        return ATTRIBUTES.contains(attribute) || super.hasAttribute(attribute);
    }

    @Override
    public Object attribute(String attribute) {
        return switch (attribute) {
            case "id" -> id();
            case "blocks" -> blocks;
            case "components" -> components();
            case "ya_version" -> yaVersion;
            case "blocks_version" -> blocksVersion;
            case "project" -> project;
            default -> super.attribute(attribute);
        };
    }
}
