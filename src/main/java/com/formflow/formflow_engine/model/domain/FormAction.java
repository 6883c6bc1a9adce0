package com.formflow.formflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * One step of a form's action list. The JSON "type" property selects the subtype;
 * types this engine does not model (INSERT_TEXT, RUN_SCRIPT, ...) stay plain FormAction
 * and keep their settings in {@link #config} for the executor that handles them.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "type",
        visible = true,
        defaultImpl = FormAction.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = LoopFormAction.class, name = "LOOP"),
        @JsonSubTypes.Type(value = BreakFormAction.class, name = "BREAK"),
        @JsonSubTypes.Type(value = ContinueFormAction.class, name = "CONTINUE"),
        @JsonSubTypes.Type(value = CollectDataFormAction.class, name = "COLLECT_DATA"),
        @JsonSubTypes.Type(value = AiFormAction.class, name = "AI"),
        @JsonSubTypes.Type(value = SuggestModalFormAction.class, name = "SUGGEST_MODAL"),
        @JsonSubTypes.Type(value = GenerateFormAction.class, name = "GENERATE_FORM")
})
public class FormAction {

    private String id;
    private ActionType type;

    // Optional guard expression; the chain skips the action when it evaluates to false
    private String condition;

    private Map<String, Object> config = new HashMap<>();

    public FormAction() {
    }

    public FormAction(String id, ActionType type) {
        this.id = id;
        this.type = type;
    }
}
