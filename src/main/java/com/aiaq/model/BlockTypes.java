package com.aiaq.model;

import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.aiaq.model.BlockKind.DECLARATION;
import static com.aiaq.model.BlockKind.MUTATION;
import static com.aiaq.model.BlockKind.STATEMENT;
import static com.aiaq.model.BlockKind.VALUE;

public final class BlockTypes {
    private static final MutableMap<String, BlockType> TYPES = Maps.mutable.empty();
    private static final MutableMap<String, BlockCategory> CATEGORIES = Maps.mutable.empty();

    public static final BlockCategory CONTROL = category("Control");
    public static final BlockCategory LOGIC = category("Logic");
    public static final BlockCategory MATH = category("Math");
    public static final BlockCategory TEXT_CATEGORY = category("Text");
    public static final BlockCategory LISTS = category("Lists");
    public static final BlockCategory COLORS = category("Colors");
    public static final BlockCategory VARIABLES = category("Variables");
    public static final BlockCategory PROCEDURES = category("Procedures");
    public static final BlockCategory DICTIONARIES = category("Dictionaries");
    // plural so it does not read as the Component node class
    public static final BlockCategory COMPONENTS = category("Components");

    // Type-name prefixes used by versioned block files
    private static final Set<String> PREFIXES = Set.of("color", "component", "controls", "global", "lexical",
            "lists", "local", "logic", "math", "obfuscated", "obsfucated", "dictionaries", "procedures", "text",
            "pair");

    static {
        define(CONTROL, STATEMENT, "controls_if", "controls_forRange", "controls_forEach", "controls_while",
                "controls_eval_but_ignore", "controls_openAnotherScreen", "controls_openAnotherScreenWithStartValue",
                "controls_closeScreen", "controls_closeScreenWithValue", "controls_closeApplication",
                "controls_closeScreenWithPlainText", "controls_break");
        define(CONTROL, VALUE, "controls_choose", "controls_do_then_return", "controls_getStartValue",
                "controls_getPlainStartText");

        define(LOGIC, VALUE, "logic_boolean", "logic_false", "logic_negate", "logic_compare", "logic_operation",
                "logic_or");

        define(MATH, VALUE, "math_number", "math_compare", "math_add", "math_subtract", "math_multiply",
                "math_division", "math_power", "math_bitwise", "math_random_int", "math_random_float",
                "math_on_list", "math_single", "math_abs", "math_neg", "math_round", "math_ceiling", "math_floor",
                "math_divide", "math_trig", "math_cos", "math_tan", "math_atan2", "math_convert_angles",
                "math_format_as_decimal", "math_is_a_number", "math_convert_number");
        define(MATH, STATEMENT, "math_random_set_seed");

        define(TEXT_CATEGORY, VALUE, "text", "text_join", "text_length", "text_isEmpty", "text_compare",
                "text_trim", "text_changeCase", "text_starts_at", "text_contains", "text_split",
                "text_split_at_spaces", "text_segment", "text_replace_all", "obfuscated_text", "text_is_string");
        // misspelled name still found in older projects
        TYPES.put("obsfucated_text", TYPES.get("obfuscated_text"));

        define(LISTS, VALUE, "lists_create_with", "lists_create_with_item", "lists_is_in", "lists_length",
                "lists_is_empty", "lists_pick_random_item", "lists_position_in", "lists_select_item", "lists_copy",
                "lists_is_list", "lists_to_csv_row", "lists_to_csv_table", "lists_from_csv_row",
                "lists_from_csv_table", "lists_lookup_in_pairs", "lists_join_with_separator");
        define(LISTS, STATEMENT, "lists_add_items", "lists_insert_item", "lists_replace_item", "lists_remove_item",
                "lists_append_list");

        define(DICTIONARIES, VALUE, "dictionaries_create_with", "pair", "dictionaries_lookup",
                "dictionaries_recursive_lookup", "dictionaries_getters", "dictionaries_get_values",
                "dictionaries_is_key_in", "dictionaries_length", "dictionaries_alist_to_dict",
                "dictionaries_dict_to_alist", "dictionaries_copy", "dictionaries_walk_tree", "dictionaries_walk_all",
                "dictionaries_is_dict");
        define(DICTIONARIES, STATEMENT, "dictionaries_set_pair", "dictionaries_delete_pair",
                "dictionaries_recursive_set", "dictionaries_combine_dicts");

        define(COLORS, VALUE, "color_black", "color_white", "color_red", "color_pink", "color_orange",
                "color_yellow", "color_green", "color_cyan", "color_blue", "color_magenta", "color_light_gray",
                "color_gray", "color_dark_gray", "color_make_color", "color_split_color");

        define(VARIABLES, DECLARATION, "global_declaration");
        define(VARIABLES, VALUE, "lexical_variable_get", "local_declaration_expression");
        define(VARIABLES, STATEMENT, "lexical_variable_set", "local_declaration_statement");

        define(PROCEDURES, DECLARATION, "procedures_defnoreturn", "procedures_defreturn");
        define(PROCEDURES, STATEMENT, "procedures_callnoreturn");
        define(PROCEDURES, VALUE, "procedures_callreturn");

        define(COMPONENTS, DECLARATION, "component_event");
        define(COMPONENTS, MUTATION, "component_method", "component_set_get");
        define(COMPONENTS, VALUE, "component_component_block");
    }

    public static final BlockType CONTROLS_IF = TYPES.get("controls_if");
    public static final BlockType LOGIC_COMPARE = TYPES.get("logic_compare");
    public static final BlockType LOGIC_BOOLEAN = TYPES.get("logic_boolean");
    public static final BlockType MATH_NUMBER = TYPES.get("math_number");
    public static final BlockType MATH_ADD = TYPES.get("math_add");
    public static final BlockType TEXT = TYPES.get("text");
    public static final BlockType GLOBAL_DECLARATION = TYPES.get("global_declaration");
    public static final BlockType LEXICAL_VARIABLE_GET = TYPES.get("lexical_variable_get");
    public static final BlockType LEXICAL_VARIABLE_SET = TYPES.get("lexical_variable_set");
    public static final BlockType PROCEDURES_DEFNORETURN = TYPES.get("procedures_defnoreturn");
    public static final BlockType PROCEDURES_DEFRETURN = TYPES.get("procedures_defreturn");
    public static final BlockType PROCEDURES_CALLNORETURN = TYPES.get("procedures_callnoreturn");
    public static final BlockType PROCEDURES_CALLRETURN = TYPES.get("procedures_callreturn");
    public static final BlockType COMPONENT_EVENT = TYPES.get("component_event");
    public static final BlockType COMPONENT_METHOD = TYPES.get("component_method");
    public static final BlockType COMPONENT_SET_GET = TYPES.get("component_set_get");
    public static final BlockType COMPONENT_COMPONENT_BLOCK = TYPES.get("component_component_block");

    private BlockTypes() {
    }

    public static Optional<BlockType> lookup(String name) {
        return Optional.ofNullable(TYPES.get(name));
    }

    public static Optional<BlockCategory> findCategory(String name) {
        return Optional.ofNullable(CATEGORIES.get(name));
    }

    public static Map<String, BlockType> all() {
        return Collections.unmodifiableMap(TYPES);
    }

    public static Collection<BlockCategory> categories() {
        return Collections.unmodifiableCollection(CATEGORIES.values());
    }

    /**
     * Whether {@code prefix} is the first segment of a versioned block type name. Legacy block files instead
     * start type names with a component instance name.
     */
    public static boolean isKnownPrefix(String prefix) {
        return PREFIXES.contains(prefix);
    }

    private static BlockCategory category(String name) {
        return CATEGORIES.getIfAbsentPut(name, () -> new BlockCategory(name));
    }

    private static void define(BlockCategory category, BlockKind kind, String... names) {
        for (String name : names) {
            TYPES.put(name, new BlockType(name, category, kind));
        }
    }
}
