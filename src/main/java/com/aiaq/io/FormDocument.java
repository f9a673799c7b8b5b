package com.aiaq.io;

import com.aiaq.model.ComponentDescriptor;

public record FormDocument(ComponentDescriptor form, Integer yaVersion) {
}
