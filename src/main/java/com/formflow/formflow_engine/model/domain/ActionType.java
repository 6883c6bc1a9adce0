package com.formflow.formflow_engine.model.domain;

public enum ActionType {
    // Loop core
    LOOP,
    BREAK,
    CONTINUE,
    COLLECT_DATA,  // accumulates per-iteration output, only valid inside a loop

    // Variable-producing actions (collected by the registry, executed externally)
    AI,
    SUGGEST_MODAL,
    GENERATE_FORM,

    // Executed by externally registered executors
    CREATE_FILE,
    INSERT_TEXT,
    UPDATE_FRONTMATTER,
    RUN_SCRIPT,
    RUN_COMMAND,
    WAIT,
    BUTTON,
    TEXT
}
