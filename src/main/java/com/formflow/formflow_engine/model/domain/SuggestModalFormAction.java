package com.formflow.formflow_engine.model.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SuggestModalFormAction extends FormAction {

    // Variable the picked suggestion is stored under
    private String fieldName;

    public SuggestModalFormAction() {
        setType(ActionType.SUGGEST_MODAL);
    }
}
