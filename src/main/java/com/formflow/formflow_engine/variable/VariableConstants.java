package com.formflow.formflow_engine.variable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class VariableConstants {

    private VariableConstants() {
    }

    /** Built-in template variables; placeholders, not assignable names. */
    public static final List<String> INTERNAL_VARIABLE_NAMES = List.of(
            "{{date}}",
            "{{time}}",
            "{{date:YYYY-MM-DDTHH:mm}}",
            "{{date:YYMMDD}}",
            "{{date:YYYY-MM-DD|+3}}",
            "{{time:+1h}}",
            "{{random:10}}",
            "{{selection}}",
            "{{clipboard}}"
    );

    public static final List<String> SYSTEM_RESERVED_LOOP_VARIABLES = List.of(
            "item",
            "index",
            "total",
            "iteration",
            "currentPage",
            "pageSize",
            "totalPage"
    );

    /** Loop slots whose name is fixed; users cannot alias them. */
    public static final Set<String> BUILT_IN_LOOP_SLOTS = Set.of(
            "iteration",
            "currentPage",
            "pageSize",
            "totalPage"
    );

    public static final String DEFAULT_ITEM_VARIABLE = "item";
    public static final String DEFAULT_INDEX_VARIABLE = "index";
    public static final String DEFAULT_TOTAL_VARIABLE = "total";
    public static final String ITERATION_VARIABLE = "iteration";
    public static final String CURRENT_PAGE_VARIABLE = "currentPage";
    public static final String PAGE_SIZE_VARIABLE = "pageSize";
    public static final String TOTAL_PAGE_VARIABLE = "totalPage";

    public static final Map<String, String> STANDARD_DESCRIPTIONS;

    static {
        Map<String, String> descriptions = new LinkedHashMap<>();
        descriptions.put(DEFAULT_ITEM_VARIABLE, "Current loop element");
        descriptions.put(DEFAULT_INDEX_VARIABLE, "Current loop index (0-based)");
        descriptions.put(DEFAULT_TOTAL_VARIABLE, "Total number of iterations");
        descriptions.put(ITERATION_VARIABLE, "Current iteration number (1-based)");
        descriptions.put(CURRENT_PAGE_VARIABLE, "Current page number (starts at countStart, default 1)");
        descriptions.put(PAGE_SIZE_VARIABLE, "Page size");
        descriptions.put(TOTAL_PAGE_VARIABLE, "Total number of pages");
        STANDARD_DESCRIPTIONS = Map.copyOf(descriptions);
    }
}
