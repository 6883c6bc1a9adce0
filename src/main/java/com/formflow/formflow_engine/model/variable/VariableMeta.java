package com.formflow.formflow_engine.model.variable;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Introspection view of one scope binding, used by suggestion panels.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariableMeta {
    private String name;
    private Object value;
    private String description;

    // true for item/index/total/iteration and the pagination names
    private boolean standard;

    // 1 = outermost frame
    private int depth;
}
