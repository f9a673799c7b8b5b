package com.aiaq.query;

import com.aiaq.TestProjects;
import com.aiaq.model.BlockKind;
import com.aiaq.model.BlockTypes;
import com.aiaq.model.ComponentType;
import com.aiaq.model.Project;
import com.aiaq.model.Screen;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {
    private final ExpressionParser parser = new ExpressionParser();

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
            "type == logic_compare; 1",
            "type = text; 2",
            "type != text; 6",
            "category == Variables; 2",
            "kind == VALUE; 5",
            "statement; 3",
            "top_level; 1",
            "~top_level; 7",
            "!leaf; 4",
            "height >= 1; 4",
            "height > 1.5; 1",
            "depth == 2; 4",
            "fields.OP == 'EQ'; 1",
            "fields.TEXT == 'hello' | fields.TEXT == 'world'; 2",
            "has_ancestor; 7",
            "has_ancestor(); 7",
            "has_ancestor(type == logic_compare); 2",
            "has_descendant(type == text); 2",
            "root_block(type == controls_if); 8",
            "root_block(declaration); 0",
            "category == Math | category == Text; 4",
            "value & depth > 1; 4",
            "(category == Math | category == Text) & fields.NUM == '1'; 1",
            "category == Math | category == Text & fields.NUM == '1'; 2",
            "kind == STATEMENT & depth == 1; 2",
            "type == controls_if & ~logically_disabled; 1",
            "~~top_level; 1",
            "false; 0",
            "true; 8"
    })
    public void testFilterCounts(String filter, long expected) {
        Screen screen = TestProjects.conditional();

        assertEquals(expected, screen.blocks().filter(parser.parse(filter)).count(), filter);
    }

    @Test
    public void testMutationAndRootBlockFilters() {
        Project project = TestProjects.procedures();

        assertEquals(13, project.blocks().filter(parser.parse("root_block(declaration)")).count());
        assertEquals(2, project.blocks().filter(parser.parse("mutation.component_type == 'Button'")).count());
        assertEquals(2, project.blocks().filter(parser.parse("is_procedure & is_called")).count());
        assertEquals(1, project.components().filter(parser.parse("properties.Title == 'Screen2'")).count());
    }

    @Test
    public void testBareIdentifiersResolveToConstants() {
        assertSame(BlockTypes.LOGIC_COMPARE, parser.parse("logic_compare"));
        assertSame(BlockTypes.LOGIC, parser.parse("Logic"));
        assertSame(BlockKind.VALUE, parser.parse("VALUE"));
        assertInstanceOf(ComponentType.class, parser.parse("Button"));
        assertSame(Attributes.HEIGHT, parser.parse("height"));
        assertSame(Attributes.field("OP"), parser.parse("fields.OP"));
    }

    @Test
    public void testPrecedence() {
        Expression expression = parser.parse("top_level | leaf & ~value");

        assertInstanceOf(Or.class, expression);
        assertInstanceOf(And.class, ((Or) expression).right());
        assertInstanceOf(Comparison.class, parser.parse("~height > 1") instanceof Not not ? not.operand() : null);
    }

    @Test
    public void testUnknownIdentifierFails() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("type == frobnicate"));
        assertEquals("Unknown identifier: frobnicate", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> parser.parse("nosuchmap.key == 1"));
    }

    @Test
    public void testMalformedFiltersFail() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("   "));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("type =="));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("type == text)"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("(type == text"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("fields.OP == 'EQ"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("height # 2"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("root_block(5)"));
    }

    @Test
    public void testErrorsReportPosition() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("top_level leaf"));
        assertTrue(e.getMessage().contains("position 10"), e.getMessage());
    }
}
