package com.formflow.formflow_engine.model.variable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableCollectOptions {
    @Builder.Default
    private boolean includeInternal = true;

    @Builder.Default
    private boolean includeSystemReserved = true;

    @Builder.Default
    private boolean includeEmpty = false;

    public static VariableCollectOptions defaults() {
        return VariableCollectOptions.builder().build();
    }

    /** Only form-declared variables: no internal or reserved names. */
    public static VariableCollectOptions declaredOnly() {
        return VariableCollectOptions.builder()
                .includeInternal(false)
                .includeSystemReserved(false)
                .build();
    }
}
