package com.aiaq.model;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentCatalogTest {

    private static ComponentCatalog parse(String json) throws IOException {
        return ComponentCatalog.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testBundledCatalog() throws IOException {
        ComponentCatalog catalog = ComponentCatalog.loadDefault();

        ComponentType button = catalog.lookup("Button").orElseThrow();
        assertTrue(button.visible());
        assertTrue(button.events().containsKey("Click"));
        assertTrue(button.properties().containsKey("Enabled"));
        assertFalse(catalog.lookup("Clock").orElseThrow().visible());
        assertEquals("number", catalog.lookup("Canvas").orElseThrow().methods().get("GetPixelColor").returnType());
        assertTrue(catalog.lookup("Nope").isEmpty());
    }

    @Test
    public void testDescriptorFlagsAcceptStringsAndBooleans() throws IOException {
        ComponentCatalog catalog = parse("[{\"name\":\"Widget\",\"type\":\"com.example.Widget\","
                + "\"external\":\"true\",\"version\":\"3\",\"nonVisible\":true,\"showOnPalette\":\"false\","
                + "\"categoryString\":\"EXTENSION\",\"iconName\":\"widget.png\"}]");

        ComponentType widget = catalog.lookup("Widget").orElseThrow();
        assertEquals(1, catalog.size());
        assertEquals("com.example.Widget", widget.type());
        assertTrue(widget.external());
        assertEquals(3, widget.version());
        assertFalse(widget.visible());
        assertFalse(widget.showOnPalette());
        assertEquals("EXTENSION", widget.categoryString());
        assertEquals("widget.png", widget.attribute("icon_name"));
    }

    @Test
    public void testBlockPropertiesAreMergedWithDesignerProperties() throws IOException {
        ComponentCatalog catalog = parse("[{\"name\":\"Widget\","
                + "\"properties\":[{\"name\":\"Size\",\"editorType\":\"non_negative_integer\",\"defaultValue\":\"4\"}],"
                + "\"blockProperties\":[{\"name\":\"Size\",\"type\":\"number\",\"rw\":\"read-write\"},"
                + "{\"name\":\"Area\",\"type\":\"number\",\"rw\":\"read-only\"}],"
                + "\"methods\":[{\"name\":\"Grow\",\"params\":[{\"name\":\"by\",\"type\":\"number\"}],"
                + "\"returnType\":\"boolean\"}],"
                + "\"events\":[{\"name\":\"Grown\",\"params\":[]}]}]");

        ComponentType widget = catalog.lookup("Widget").orElseThrow();
        ComponentType.Property size = widget.properties().get("Size");
        assertEquals("non_negative_integer", size.editorType());
        assertEquals("4", size.defaultValue());
        assertEquals("number", size.type());
        assertEquals("read-write", size.rw());
        assertNull(widget.properties().get("Area").editorType());
        assertEquals("read-only", widget.properties().get("Area").rw());

        ComponentType.Method grow = widget.methods().get("Grow");
        assertEquals("boolean", grow.returnType());
        assertEquals("by", grow.params().get(0).name());
        assertTrue(widget.events().get("Grown").params().isEmpty());
        assertEquals(1, widget.version());
    }

    @Test
    public void testCatalogMustBeAnArray() {
        assertThrows(IOException.class, () -> parse("{\"name\":\"Widget\"}"));
    }

    @Test
    public void testCustomCatalogStillKnowsBlockTypes() throws IOException {
        TypeCatalog catalog = TypeCatalog.of(parse("[{\"name\":\"Widget\"}]"));

        assertTrue(catalog.componentType("Widget").isPresent());
        assertTrue(catalog.componentType("Button").isEmpty());
        assertSame(BlockTypes.CONTROLS_IF, catalog.resolve("controls_if").orElseThrow());
        assertEquals("Widget", catalog.resolve("Widget").orElseThrow().name());
    }
}
