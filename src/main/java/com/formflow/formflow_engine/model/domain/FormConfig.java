package com.formflow.formflow_engine.model.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@NoArgsConstructor
public class FormConfig {
    private String id;
    private List<FormField> fields = new ArrayList<>();
    private List<FormAction> actions = new ArrayList<>();
    private List<ActionGroup> actionGroups = new ArrayList<>();

    public FormConfig(String id) {
        this.id = id;
    }

    /** Loop bodies are only ever reached through this index, never by walking raw sub-trees. */
    public Optional<ActionGroup> findActionGroup(String groupId) {
        if (groupId == null || actionGroups == null) return Optional.empty();
        return actionGroups.stream()
                .filter(g -> g != null && groupId.equals(g.getId()))
                .findFirst();
    }
}
