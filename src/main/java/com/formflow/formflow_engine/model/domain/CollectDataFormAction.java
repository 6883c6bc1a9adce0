package com.formflow.formflow_engine.model.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Collects one value per loop iteration into a form variable.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CollectDataFormAction extends FormAction {

    private String outputVariableName = "";

    // Template, resolved against the loop scope before storing
    private String content = "";

    private StorageMode storageMode = StorageMode.APPEND;
    private CollectVariableType variableType = CollectVariableType.STRING;

    public CollectDataFormAction() {
        setType(ActionType.COLLECT_DATA);
    }
}
