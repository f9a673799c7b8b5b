package com.aiaq.model;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns block descriptors into the blocks of one screen, linking parents, inputs and continuations.
 * <p>
 * Blocks files older than {@link #VERSIONED_LANGUAGE} may name a component instance where the block type belongs,
 * e.g. {@code Button1_Click}. Such types are rewritten to the generic component block types before anything else
 * about the block is derived.
 */
public final class BlockFactory {
    private static final Logger log = LoggerFactory.getLogger(BlockFactory.class);

    // first blocks language version with canonical type names
    public static final int VERSIONED_LANGUAGE = 17;

    private final Screen screen;
    private final TypeCatalog catalog;
    private final Integer languageVersion;
    private final AtomicInteger generatedIds;

    public BlockFactory(Screen screen, Integer languageVersion) {
        this(screen, languageVersion, new AtomicInteger());
    }

    /**
     * Blocks without an id are numbered from {@code generatedIds}. Factories for the screens of one project share
     * the counter so those ids stay unique across the project.
     */
    public BlockFactory(Screen screen, Integer languageVersion, AtomicInteger generatedIds) {
        this.screen = screen;
        this.catalog = screen.catalog();
        this.languageVersion = languageVersion;
        this.generatedIds = generatedIds;
    }

    public List<Block> build(List<BlockDescriptor> topLevel) {
        MutableList<Block> roots = Lists.mutable.empty();
        for (BlockDescriptor descriptor : topLevel) {
            roots.add(build(descriptor));
        }
        return roots;
    }

    public Block build(BlockDescriptor descriptor) {
        return create(descriptor, Lists.mutable.empty(), null, null);
    }

    private Block create(BlockDescriptor descriptor, MutableList<Block> siblings, Block parent, Block slotOwner) {
        String typeName = descriptor.type();
        Map<String, String> mutation = descriptor.mutation();
        if (isLegacy(typeName)) {
            String canonical = reclassify(descriptor);
            if (mutation == null) {
                mutation = synthesizeMutation(descriptor, canonical);
            }
            log.debug("Reclassified legacy block type {} as {}", typeName, canonical);
            typeName = canonical;
        }
        String name = typeName;
        BlockType type = catalog.blockType(name)
                .orElseThrow(() -> new StructuralException("Unknown block type: " + name));

        String id = descriptor.id() != null ? descriptor.id() : String.valueOf(generatedIds.getAndIncrement());
        Block block = new Block(id, type, screen);
        screen.registerBlock(block);
        siblings.add(block);

        block.parent = parent;
        block.logicalParent = slotOwner != null ? slotOwner : parent;
        block.x = descriptor.x();
        block.y = descriptor.y();
        block.inline = descriptor.inline();
        block.comment = descriptor.comment();
        block.fields = descriptor.fields() != null ? descriptor.fields() : Map.of();
        block.mutation = mutation;
        block.disabled = descriptor.disabled();
        block.logicallyDisabled = block.disabled || (slotOwner != null && slotOwner.logicallyDisabled);
        block.component = resolveComponent(block);

        for (Map.Entry<String, BlockDescriptor> input : descriptor.values().entrySet()) {
            MutableList<Block> chain = Lists.mutable.empty();
            block.values.put(input.getKey(), chain.asUnmodifiable());
            Block child = create(input.getValue(), chain, block, block);
            child.output = block;
        }
        for (Map.Entry<String, BlockDescriptor> input : descriptor.statements().entrySet()) {
            MutableList<Block> chain = Lists.mutable.empty();
            block.statements.put(input.getKey(), chain.asUnmodifiable());
            create(input.getValue(), chain, block, block);
        }
        if (descriptor.next() != null) {
            block.next = create(descriptor.next(), siblings, block, slotOwner);
        }
        return block;
    }

    private boolean isLegacy(String typeName) {
        if (catalog.blockType(typeName).isPresent()) {
            return false;
        }
        if (languageVersion != null && languageVersion >= VERSIONED_LANGUAGE) {
            return false;
        }
        return !BlockTypes.isKnownPrefix(prefix(typeName));
    }

    private String reclassify(BlockDescriptor descriptor) {
        String typeName = descriptor.type();
        String instanceName = prefix(typeName);
        if (screen.findComponent(instanceName) == null) {
            throw new StructuralException("Unknown block type: " + typeName);
        }
        String rest = suffix(typeName);
        if (rest.startsWith("setproperty") || rest.startsWith("getproperty")) {
            return BlockTypes.COMPONENT_SET_GET.name();
        }
        if (descriptor.statements().containsKey("DO")) {
            return BlockTypes.COMPONENT_EVENT.name();
        }
        return BlockTypes.COMPONENT_METHOD.name();
    }

    private Map<String, String> synthesizeMutation(BlockDescriptor descriptor, String canonical) {
        String instanceName = prefix(descriptor.type());
        String rest = suffix(descriptor.type());
        Component instance = screen.findComponent(instanceName);
        Map<String, String> mutation = new LinkedHashMap<>();
        mutation.put("component_type", instance.type().name());
        mutation.put("instance_name", instanceName);
        if (BlockTypes.COMPONENT_SET_GET.name().equals(canonical)) {
            mutation.put("set_or_get", rest.startsWith("getproperty") ? "get" : "set");
            String property = descriptor.fields().get("PROP");
            if (property != null) {
                mutation.put("property_name", property);
            }
        } else if (BlockTypes.COMPONENT_EVENT.name().equals(canonical)) {
            mutation.put("event_name", rest);
        } else {
            mutation.put("method_name", rest);
        }
        return mutation;
    }

    private Component resolveComponent(Block block) {
        if (!BlockTypes.COMPONENTS.equals(block.category()) || block.mutation == null || block.generic()) {
            return null;
        }
        String instanceName = block.mutation.get("instance_name");
        if (instanceName == null) {
            return null;
        }
        Component component = screen.findComponent(instanceName);
        if (component == null) {
            log.warn("Block {} on screen {} refers to missing component {}", block.id(), screen.name(), instanceName);
        }
        return component;
    }

    private static String prefix(String typeName) {
        int split = typeName.indexOf('_');
        return split < 0 ? typeName : typeName.substring(0, split);
    }

    private static String suffix(String typeName) {
        int split = typeName.indexOf('_');
        return split < 0 ? "" : typeName.substring(split + 1);
    }
}
