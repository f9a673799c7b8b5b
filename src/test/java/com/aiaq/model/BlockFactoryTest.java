package com.aiaq.model;

import com.aiaq.TestProjects;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.aiaq.TestProjects.block;
import static com.aiaq.TestProjects.component;
import static com.aiaq.TestProjects.form;
import static org.junit.jupiter.api.Assertions.*;

public class BlockFactoryTest {

    @Test
    public void testValueInputsLinkParentAndOutput() {
        Screen screen = TestProjects.conditional();
        Block conditional = screen.blocks().get("if1");
        Block comparison = screen.blocks().get("cmp1");

        assertTrue(conditional.isTopLevel());
        assertSame(conditional, comparison.parent());
        assertSame(conditional, comparison.output());
        assertSame(conditional, comparison.logicalParent());
        assertEquals(List.of(comparison), conditional.values().get("IF0"));
        assertSame(screen, comparison.screen());
    }

    @Test
    public void testStatementSequenceKeepsSlotOwnerAsLogicalParent() {
        Screen screen = TestProjects.conditional();
        Block conditional = screen.blocks().get("if1");
        Block first = screen.blocks().get("set1");
        Block second = screen.blocks().get("set2");

        assertSame(conditional, first.parent());
        assertSame(first, second.parent());
        assertSame(second, first.next());
        assertSame(conditional, second.logicalParent());
        assertNull(second.output());
        assertEquals(List.of(first, second), conditional.statements().get("DO0"));
    }

    @Test
    public void testChildrenListValuesBeforeStatements() {
        Screen screen = TestProjects.conditional();
        Block conditional = screen.blocks().get("if1");

        assertEquals(List.of("cmp1", "set1", "set2"), conditional.children().stream().map(Block::id).toList());
        assertThrows(UnsupportedOperationException.class, () -> conditional.children().clear());
    }

    @Test
    public void testBlocksAreRegisteredInDocumentOrder() {
        Screen screen = TestProjects.conditional();

        assertEquals(List.of("if1", "cmp1", "txt1", "txt2", "set1", "num1", "set2", "num2"),
                List.copyOf(screen.blocks().asMap().keySet()));
    }

    @Test
    public void testMissingIdsAreGenerated() {
        Screen screen = TestProjects.screen(form("Screen1"),
                BlockDescriptor.builder("controls_if")
                        .value("IF0", BlockDescriptor.builder("logic_boolean").field("BOOL", "TRUE").build())
                        .build());

        assertEquals(2, screen.blocks().size());
        assertNotNull(screen.blocks().get("0"));
        assertNotNull(screen.blocks().get("1"));
    }

    @Test
    public void testGeneratedIdsAreUniqueAcrossScreens() {
        AtomicInteger generatedIds = new AtomicInteger();
        Project project = new Project("Shared", Map.of(), List.of());
        for (String name : List.of("Screen1", "Screen2")) {
            Screen screen = Screen.fromForm(form(name), TypeCatalog.standard());
            new BlockFactory(screen, TestProjects.LANGUAGE_VERSION, generatedIds)
                    .build(List.of(BlockDescriptor.builder("logic_boolean").field("BOOL", "TRUE").build()));
            project.addScreen(screen);
        }

        assertEquals(2, project.blocks().count());
        assertEquals(project.blocks().count(), project.blocks().blocks().count());
        assertEquals(2, project.blocks().descendants().blocks().count());
        assertNotNull(project.screens().get("Screen1").blocks().get("0"));
        assertNotNull(project.screens().get("Screen2").blocks().get("1"));
    }

    @Test
    public void testDisabledPropagatesIntoInputs() {
        BlockDescriptor body = block("set1", "lexical_variable_set")
                .value("VALUE", block("num1", "math_number").build())
                .next(block("set2", "lexical_variable_set").build())
                .build();
        Screen screen = TestProjects.screen(form("Screen1", component("b1", "Button", "Button1")),
                BlockDescriptor.builder("component_event").id("click")
                        .mutation("component_type", "Button")
                        .mutation("instance_name", "Button1")
                        .mutation("event_name", "Click")
                        .statement("DO", body)
                        .disabled(true)
                        .build());

        Block event = screen.blocks().get("click");
        assertTrue(event.disabled());
        assertTrue(event.logicallyDisabled());
        for (String id : List.of("set1", "num1", "set2")) {
            Block nested = screen.blocks().get(id);
            assertFalse(nested.disabled(), id);
            assertTrue(nested.logicallyDisabled(), id);
        }
    }

    @Test
    public void testComponentBlocksResolveTheirInstance() {
        Screen screen = TestProjects.procedures().screens().get("Screen1");

        assertSame(screen.findComponent("Button1"), screen.blocks().get("click1").component());
        assertSame(screen.findComponent("Label1"), screen.blocks().get("setText").component());
        assertNull(screen.blocks().get("defFoo").component());
    }

    @Test
    public void testUnknownBlockTypeFails() {
        StructuralException e = assertThrows(StructuralException.class,
                () -> TestProjects.screen(form("Screen1"), block("x", "frobnicate_widget").build()));
        assertTrue(e.getMessage().contains("frobnicate_widget"));
    }

    @Test
    public void testLegacyEventIsReclassified() {
        Screen screen = TestProjects.screen(form("Screen1", component("b1", "Button", "Button1")), 10,
                block("old", "Button1_Click")
                        .statement("DO", block("set1", "lexical_variable_set").build())
                        .build());

        Block event = screen.blocks().get("old");
        assertSame(BlockTypes.COMPONENT_EVENT, event.type());
        assertEquals(Map.of("component_type", "Button", "instance_name", "Button1", "event_name", "Click"),
                event.mutation());
        assertSame(screen.findComponent("Button1"), event.component());
        assertEquals(BlockKind.DECLARATION, event.kind());
    }

    @Test
    public void testLegacySetterAndGetterAreReclassified() {
        Screen screen = TestProjects.screen(form("Screen1", component("b1", "Button", "Button1")), (Integer) null,
                block("set", "Button1_setproperty")
                        .field("PROP", "Text")
                        .value("VALUE", block("get", "Button1_getproperty").field("PROP", "Width").build())
                        .build());

        Block setter = screen.blocks().get("set");
        Block getter = screen.blocks().get("get");
        assertSame(BlockTypes.COMPONENT_SET_GET, setter.type());
        assertEquals("set", setter.mutation().get("set_or_get"));
        assertEquals("Text", setter.mutation().get("property_name"));
        assertEquals(BlockKind.STATEMENT, setter.kind());
        assertEquals("get", getter.mutation().get("set_or_get"));
        assertEquals(BlockKind.VALUE, getter.kind());
    }

    @Test
    public void testLegacyMethodIsReclassified() {
        Screen screen = TestProjects.screen(form("Screen1", component("c1", "Canvas", "Canvas1")), 12,
                block("m", "Canvas1_GetPixelColor").build());

        Block method = screen.blocks().get("m");
        assertSame(BlockTypes.COMPONENT_METHOD, method.type());
        assertEquals("GetPixelColor", method.mutation().get("method_name"));
        assertEquals("Canvas", method.mutation().get("component_type"));
        assertEquals("number", method.returnType());
        assertEquals(BlockKind.VALUE, method.kind());
    }

    @Test
    public void testLegacyBlockNamingMissingComponentFails() {
        assertThrows(StructuralException.class, () -> TestProjects.screen(form("Screen1"), 10,
                block("old", "Ghost1_Click").statement("DO", block("s", "lexical_variable_set").build()).build()));
    }

    @Test
    public void testInstanceNamedTypesAreNotRewrittenInVersionedFiles() {
        assertThrows(StructuralException.class,
                () -> TestProjects.screen(form("Screen1", component("b1", "Button", "Button1")),
                        BlockFactory.VERSIONED_LANGUAGE, block("old", "Button1_Click").build()));
    }
}
