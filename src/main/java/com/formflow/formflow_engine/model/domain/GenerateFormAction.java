package com.formflow.formflow_engine.model.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens a sub-form at run time; each of its fields becomes a form variable.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GenerateFormAction extends FormAction {

    private List<FormField> fields = new ArrayList<>();

    public GenerateFormAction() {
        setType(ActionType.GENERATE_FORM);
    }
}
