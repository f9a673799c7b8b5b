package com.aiaq.io;

import com.aiaq.model.BlockDescriptor;

import java.util.List;

// versions are null without a yacodeblocks header
public record BlocksDocument(Integer languageVersion, Integer yaVersion, List<BlockDescriptor> blocks) {

    public static BlocksDocument empty() {
        return new BlocksDocument(null, null, List.of());
    }
}
