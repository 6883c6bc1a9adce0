package com.formflow.formflow_engine.model.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BreakFormAction extends FormAction {

    public BreakFormAction() {
        setType(ActionType.BREAK);
    }

    public BreakFormAction(String id) {
        this();
        setId(id);
    }
}
