package com.formflow.formflow_engine.model.dto;

import com.formflow.formflow_engine.model.domain.FormConfig;

/**
 * Request body for POST /api/forms/conflicts/field.
 * fieldId identifies the field being renamed; null for a field that does not exist yet.
 */
public record FieldConflictRequest(
    FormConfig formConfig,
    String fieldName,
    String fieldId
) {}
