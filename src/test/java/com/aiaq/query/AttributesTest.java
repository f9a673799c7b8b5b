package com.aiaq.query;

import com.aiaq.TestProjects;
import com.aiaq.model.Block;
import com.aiaq.model.BlockKind;
import com.aiaq.model.BlockTypes;
import com.aiaq.model.Component;
import com.aiaq.model.ComponentDescriptor;
import com.aiaq.model.ComponentType;
import com.aiaq.model.Node;
import com.aiaq.model.Screen;
import com.aiaq.model.TypeCatalog;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AttributesTest {

    @Test
    public void testHeightIsZeroForLeavesAndOneMoreThanTallestChild() {
        Screen screen = TestProjects.conditional();

        for (Block block : screen.blocks()) {
            int height = (Integer) Attributes.HEIGHT.apply(block);
            if (block.children().isEmpty()) {
                assertEquals(0, height, block.id());
                assertTrue(Attributes.LEAF.test(block));
            } else {
                int tallest = block.children().stream()
                        .mapToInt(child -> (Integer) Attributes.HEIGHT.apply(child))
                        .max()
                        .orElseThrow();
                assertEquals(tallest + 1, height, block.id());
            }
        }
        assertEquals(2, Attributes.HEIGHT.apply(screen.blocks().get("if1")));
    }

    @Test
    public void testDepthFollowsLogicalParents() {
        Screen screen = TestProjects.conditional();

        for (Block block : screen.blocks()) {
            int depth = (Integer) Attributes.DEPTH.apply(block);
            if (block.logicalParent() == null) {
                assertEquals(0, depth, block.id());
            } else {
                assertEquals((Integer) Attributes.DEPTH.apply(block.logicalParent()) + 1, depth, block.id());
            }
        }
        // second statement of the body sits at the same depth as the first
        assertEquals(1, Attributes.DEPTH.apply(screen.blocks().get("set2")));
        assertEquals(2, Attributes.DEPTH.apply(screen.blocks().get("num2")));
    }

    @Test
    public void testSeparateCachesAgree() {
        Screen screen = TestProjects.conditional();
        AttributeCache cache = new AttributeCache();
        Expression height = Attributes.height(cache);
        Expression depth = Attributes.depth(cache);

        for (Block block : screen.blocks()) {
            assertEquals(Attributes.HEIGHT.apply(block), height.apply(block));
            assertEquals(Attributes.DEPTH.apply(block), depth.apply(block));
        }
        cache.clear();
        assertEquals(2, cache.depth(screen.blocks().get("txt1")));
        assertEquals(0, cache.height(screen.blocks().get("txt1")));
    }

    @Test
    public void testComponentHeightAndDepth() {
        Screen screen = TestProjects.procedures().screens().get("Screen1");
        Component label = screen.findComponent("Label1");

        assertEquals(2, Attributes.HEIGHT.apply(screen));
        assertEquals(2, Attributes.DEPTH.apply(label));
        assertEquals(0, Attributes.DEPTH.apply(screen));
        assertNull(Attributes.HEIGHT.apply("text"));
    }

    @Test
    public void testMapAccessorsAreInterned() {
        assertSame(Attributes.mutation("component_type"), Attributes.mutation("component_type"));
        assertSame(Attributes.field("OP"), Attributes.field("OP"));
        assertSame(Attributes.property("Text"), Attributes.property("Text"));
        assertNotSame(Attributes.field("NAME"), Attributes.mutation("NAME"));
    }

    @Test
    public void testMapAccessors() {
        Screen screen = TestProjects.procedures().screens().get("Screen1");
        Block setText = screen.blocks().get("setText");

        assertEquals("Label", Attributes.mutation("component_type").apply(setText));
        assertEquals("Text", Attributes.field("PROP").apply(setText));
        assertNull(Attributes.field("NOPE").apply(setText));
        assertNull(Attributes.mutation("component_type").apply(screen.blocks().get("defFoo")));
        assertEquals("Screen1", Attributes.property("Title").apply(screen));
        assertSame(setText.mutation(), Attributes.MUTATION.apply(setText));
        assertNull(Attributes.PROPERTIES.apply(setText));
    }

    @Test
    public void testNameAndTypeFallBackToMutation() {
        Screen screen = TestProjects.procedures().screens().get("Screen1");

        assertEquals("Button1", Attributes.NAME.apply(screen.findComponent("Button1")));
        assertEquals("Button", Attributes.TYPE.apply(screen.findComponent("Button1")).toString());
        assertSame(BlockTypes.COMPONENT_EVENT, Attributes.TYPE.apply(screen.blocks().get("click1")));
    }

    @Test
    public void testHasAncestor() {
        Screen screen = TestProjects.conditional();
        Block text = screen.blocks().get("txt1");
        Block conditional = screen.blocks().get("if1");

        assertTrue(Attributes.hasAncestor().test(text));
        assertFalse(Attributes.hasAncestor().test(conditional));
        assertTrue(Attributes.hasAncestor(conditional).test(text));
        assertFalse(Attributes.hasAncestor(text).test(conditional));
        assertTrue(Attributes.hasAncestor(Attributes.TYPE.eq(BlockTypes.LOGIC_COMPARE)).test(text));
        assertFalse(Attributes.hasAncestor(Attributes.TYPE.eq(BlockTypes.LOGIC_COMPARE))
                .test(screen.blocks().get("num1")));
    }

    @Test
    public void testHasDescendant() {
        Screen screen = TestProjects.conditional();
        Block conditional = screen.blocks().get("if1");

        assertTrue(Attributes.hasDescendant().test(conditional));
        assertFalse(Attributes.hasDescendant().test(screen.blocks().get("txt1")));
        assertTrue(Attributes.hasDescendant(Attributes.TYPE.eq(BlockTypes.TEXT)).test(conditional));
        assertTrue(Attributes.hasDescendant(screen.blocks().get("num2")).test(conditional));
        assertFalse(Attributes.hasDescendant(conditional).test(conditional));
    }

    @Test
    public void testRootBlock() {
        Screen screen = TestProjects.conditional();
        Block conditional = screen.blocks().get("if1");

        for (Block block : screen.blocks()) {
            assertSame(conditional, Attributes.ROOT_BLOCK.apply(block), block.id());
        }
    }

    @Test
    public void testKindAttributes() {
        Screen screen = TestProjects.procedures().screens().get("Screen1");

        assertEquals(BlockKind.DECLARATION, Attributes.KIND.apply(screen.blocks().get("defFoo")));
        assertTrue(Attributes.STATEMENT.test(screen.blocks().get("callFoo1")));
        assertTrue(Attributes.VALUE.test(screen.blocks().get("callBar")));
        assertTrue(Attributes.STATEMENT.test(screen.blocks().get("notify1")));
        assertFalse(Attributes.VALUE.test(screen.findComponent("Button1")));
        assertNull(Attributes.KIND.apply(screen.findComponent("Button1")));
    }

    @Test
    public void testDeclarations() {
        Screen screen = TestProjects.procedures().screens().get("Screen1");

        assertTrue(Attributes.DECLARATION.test(screen.blocks().get("defFoo")));
        assertTrue(Attributes.DECLARATION.test(screen.blocks().get("click1")));
        assertFalse(Attributes.DECLARATION.test(screen.blocks().get("callFoo1")));
        assertTrue(Attributes.IS_PROCEDURE.test(screen.blocks().get("defBar")));
        assertFalse(Attributes.IS_PROCEDURE.test(screen.blocks().get("callBar")));
        assertTrue(Attributes.TOP_LEVEL.test(screen.blocks().get("defUnused")));
        assertFalse(Attributes.TOP_LEVEL.test(screen.blocks().get("callFoo2")));
    }

    @Test
    public void testIsCalled() {
        Screen screen = TestProjects.procedures().screens().get("Screen1");

        assertTrue(Attributes.IS_CALLED.test(screen.blocks().get("defFoo")));
        assertTrue(Attributes.IS_CALLED.test(screen.blocks().get("defBar")));
        assertFalse(Attributes.IS_CALLED.test(screen.blocks().get("defUnused")));
        assertFalse(Attributes.IS_CALLED.test(screen.blocks().get("callFoo1")));
    }

    @Test
    public void testEnabledAndLogicallyDisabled() {
        Screen screen = TestProjects.screen(TestProjects.form("Screen1"),
                TestProjects.block("if1", "controls_if")
                        .disabled(true)
                        .statement("DO0", TestProjects.block("set1", "lexical_variable_set").build())
                        .build());
        Block conditional = screen.blocks().get("if1");
        Block nested = screen.blocks().get("set1");

        assertFalse(Attributes.ENABLED.test(conditional));
        assertTrue(Attributes.ENABLED.test(nested));
        assertFalse(Attributes.DISABLED.test(nested));
        assertTrue(Attributes.LOGICALLY_DISABLED.test(nested));
        assertFalse(Attributes.LOGICALLY_ENABLED.test(nested));
    }

    @Test
    public void testComponentEnabledProperty() {
        Screen screen = Screen.fromForm(TestProjects.form("Screen1",
                ComponentDescriptor.leaf("b1", "Button", "On", "1", Map.of()),
                ComponentDescriptor.leaf("b2", "Button", "Off", "1", Map.of("Enabled", "False"))),
                TypeCatalog.standard());

        assertTrue(Attributes.ENABLED.test(screen.findComponent("On")));
        assertFalse(Attributes.ENABLED.test(screen.findComponent("Off")));
    }

    @Test
    public void testComponentTypeAttributes() {
        ComponentType clock = TypeCatalog.standard().componentType("Clock").orElseThrow();
        ComponentType button = TypeCatalog.standard().componentType("Button").orElseThrow();

        assertTrue(Attributes.NON_VISIBLE.test(clock));
        assertTrue(Attributes.VISIBLE.test(button));
        assertEquals(Boolean.FALSE, Attributes.EXTERNAL.apply(button));
        assertEquals("Clock", Attributes.NAME.apply(clock));
    }

    @Test
    public void testNamedLookup() {
        assertSame(Attributes.LOGICALLY_DISABLED, Attributes.named("logically_disabled").orElseThrow());
        assertSame(Attributes.HEIGHT, Attributes.named("height").orElseThrow());
        assertTrue(Attributes.named("no_such_attribute").isEmpty());
    }

    @Test
    public void testParentAttribute() {
        Screen screen = TestProjects.conditional();
        Node comparison = screen.blocks().get("cmp1");

        assertSame(screen.blocks().get("if1"), Attributes.PARENT.apply(comparison));
        assertNull(Attributes.PARENT.apply(screen.blocks().get("if1")));
    }
}
