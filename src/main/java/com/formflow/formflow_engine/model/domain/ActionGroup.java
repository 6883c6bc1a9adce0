package com.formflow.formflow_engine.model.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Nested action sequence owned by a loop; loops reference it by id.
 */
@Data
@NoArgsConstructor
public class ActionGroup {
    private String id;
    private String name;
    private List<FormAction> actions = new ArrayList<>();

    // Overrides the owning loop's strategy when set
    private ErrorHandlingStrategy errorHandlingStrategy;

    public ActionGroup(String id, List<FormAction> actions) {
        this.id = id;
        this.actions = actions != null ? new ArrayList<>(actions) : new ArrayList<>();
    }
}
