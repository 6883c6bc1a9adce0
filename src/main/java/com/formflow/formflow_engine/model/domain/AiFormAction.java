package com.formflow.formflow_engine.model.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AiFormAction extends FormAction {

    private String modelTag;
    private String customPrompt;
    private String outputVariableName;

    public AiFormAction() {
        setType(ActionType.AI);
    }
}
