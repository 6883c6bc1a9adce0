package com.formflow.formflow_engine.model.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ContinueFormAction extends FormAction {

    public ContinueFormAction() {
        setType(ActionType.CONTINUE);
    }

    public ContinueFormAction(String id) {
        this();
        setId(id);
    }
}
