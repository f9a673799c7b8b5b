package com.aiaq;

import com.aiaq.model.BlockDescriptor;
import com.aiaq.model.BlockFactory;
import com.aiaq.model.ComponentDescriptor;
import com.aiaq.model.Project;
import com.aiaq.model.Screen;
import com.aiaq.model.TypeCatalog;

import java.util.List;
import java.util.Map;

/**
 * Small block and component trees shared by the tests.
 */
public final class TestProjects {
    public static final int LANGUAGE_VERSION = 33;

    private TestProjects() {
    }

    public static BlockDescriptor.Builder block(String id, String type) {
        return BlockDescriptor.builder(type).id(id);
    }

    public static ComponentDescriptor component(String uuid, String type, String name) {
        return ComponentDescriptor.leaf(uuid, type, name, "1", Map.of());
    }

    public static ComponentDescriptor container(String uuid, String type, String name,
                                                ComponentDescriptor... children) {
        return ComponentDescriptor.container(uuid, type, name, "1", Map.of(), children);
    }

    public static ComponentDescriptor form(String name, ComponentDescriptor... children) {
        return ComponentDescriptor.container("0", "Form", name, "27", Map.of("Title", name), children);
    }

    public static Screen screen(ComponentDescriptor form, Integer languageVersion, BlockDescriptor... blocks) {
        Screen screen = Screen.fromForm(form, TypeCatalog.standard());
        new BlockFactory(screen, languageVersion).build(List.of(blocks));
        return screen;
    }

    public static Screen screen(ComponentDescriptor form, BlockDescriptor... blocks) {
        return screen(form, LANGUAGE_VERSION, blocks);
    }

    public static BlockDescriptor componentEvent(String id, String componentType, String instance, String event,
                                                 BlockDescriptor body) {
        BlockDescriptor.Builder builder = block(id, "component_event")
                .mutation("component_type", componentType)
                .mutation("instance_name", instance)
                .mutation("event_name", event);
        if (body != null) {
            builder.statement("DO", body);
        }
        return builder.build();
    }

    public static BlockDescriptor.Builder call(String id, String procedure) {
        return block(id, "procedures_callnoreturn").field("PROCNAME", procedure);
    }

    /**
     * One top-level {@code controls_if} (if1) whose condition is a {@code logic_compare} (cmp1) of two texts (txt1,
     * txt2) and whose body sets two variables in sequence (set1 then set2, with values num1 and num2).
     */
    public static Screen conditional() {
        BlockDescriptor comparison = block("cmp1", "logic_compare")
                .field("OP", "EQ")
                .value("A", block("txt1", "text").field("TEXT", "hello").build())
                .value("B", block("txt2", "text").field("TEXT", "world").build())
                .build();
        BlockDescriptor second = block("set2", "lexical_variable_set")
                .field("VAR", "global y")
                .value("VALUE", block("num2", "math_number").field("NUM", "2").build())
                .build();
        BlockDescriptor first = block("set1", "lexical_variable_set")
                .field("VAR", "global x")
                .value("VALUE", block("num1", "math_number").field("NUM", "1").build())
                .next(second)
                .build();
        BlockDescriptor conditional = block("if1", "controls_if")
                .position(10, 20)
                .value("IF0", comparison)
                .statement("DO0", first)
                .build();
        return screen(form("Screen1"), conditional);
    }

    /**
     * Two screens. Screen1 defines procedures Foo (defFoo), Bar (defBar, returns a number) and Unused (defUnused);
     * the Button1.Click handler (click1) calls Foo twice (callFoo1, callFoo2) and sets Label1.Text to the result of
     * Bar (setText, callBar). Screen2 calls Foo once more (callFoo3) from its own Button1.Click (click2).
     */
    public static Project procedures() {
        BlockDescriptor alert = block("notify1", "component_method")
                .mutation("component_type", "Notifier")
                .mutation("instance_name", "Notifier1")
                .mutation("method_name", "ShowAlert")
                .mutation("is_generic", "false")
                .value("NOTICE", block("txtA", "text").field("TEXT", "Foo called").build())
                .build();
        BlockDescriptor defFoo = block("defFoo", "procedures_defnoreturn")
                .field("NAME", "Foo")
                .position(0, 0)
                .statement("STACK", alert)
                .build();
        BlockDescriptor defBar = block("defBar", "procedures_defreturn")
                .field("NAME", "Bar")
                .position(0, 200)
                .value("RETURN", block("num3", "math_number").field("NUM", "42").build())
                .build();
        BlockDescriptor defUnused = block("defUnused", "procedures_defnoreturn")
                .field("NAME", "Unused")
                .position(0, 400)
                .build();
        BlockDescriptor setText = block("setText", "component_set_get")
                .mutation("component_type", "Label")
                .mutation("set_or_get", "set")
                .mutation("property_name", "Text")
                .mutation("is_generic", "false")
                .mutation("instance_name", "Label1")
                .field("PROP", "Text")
                .value("VALUE", block("callBar", "procedures_callreturn").field("PROCNAME", "Bar").build())
                .build();
        BlockDescriptor calls = call("callFoo1", "Foo")
                .next(call("callFoo2", "Foo").next(setText).build())
                .build();
        BlockDescriptor click1 = componentEvent("click1", "Button", "Button1", "Click", calls);

        Screen screen1 = screen(form("Screen1",
                        component("b1", "Button", "Button1"),
                        container("h1", "HorizontalArrangement", "HorizontalArrangement1",
                                component("l1", "Label", "Label1")),
                        component("c1", "Canvas", "Canvas1"),
                        component("n1", "Notifier", "Notifier1")),
                defFoo, defBar, defUnused, click1);

        Screen screen2 = screen(form("Screen2", component("s2b1", "Button", "Button1")),
                componentEvent("click2", "Button", "Button1", "Click", call("callFoo3", "Foo").build()));

        Project project = new Project("Procedures", Map.of("main", "appinventor.ai_test.Procedures.Screen1"),
                List.of());
        project.addScreen(screen1);
        project.addScreen(screen2);
        return project;
    }
}
