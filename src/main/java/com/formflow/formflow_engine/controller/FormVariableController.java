package com.formflow.formflow_engine.controller;

import com.formflow.formflow_engine.model.domain.FormAction;
import com.formflow.formflow_engine.model.domain.FormConfig;
import com.formflow.formflow_engine.model.domain.LoopFormAction;
import com.formflow.formflow_engine.model.dto.FieldConflictRequest;
import com.formflow.formflow_engine.model.dto.LoopVariableConflictRequest;
import com.formflow.formflow_engine.model.variable.ConflictInfo;
import com.formflow.formflow_engine.model.variable.VariableCollectOptions;
import com.formflow.formflow_engine.model.variable.VariableInfo;
import com.formflow.formflow_engine.variable.VariableConflictDetector;
import com.formflow.formflow_engine.variable.VariableConstants;
import com.formflow.formflow_engine.variable.VariableRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Authoring-time variable tooling: what a form declares and where names collide.
 */
@RestController
@RequestMapping("/api/forms")
@RequiredArgsConstructor
public class FormVariableController {

    private final VariableRegistry variableRegistry;
    private final VariableConflictDetector conflictDetector;

    @PostMapping("/variables")
    public List<VariableInfo> collectVariables(
            @RequestBody FormConfig formConfig,
            @RequestParam(defaultValue = "true") boolean includeInternal,
            @RequestParam(defaultValue = "true") boolean includeSystemReserved,
            @RequestParam(defaultValue = "false") boolean includeEmpty) {
        VariableCollectOptions options = VariableCollectOptions.builder()
                .includeInternal(includeInternal)
                .includeSystemReserved(includeSystemReserved)
                .includeEmpty(includeEmpty)
                .build();
        return variableRegistry.collectAllVariables(formConfig, options);
    }

    @PostMapping("/conflicts")
    public List<ConflictInfo> detectConflicts(@RequestBody FormConfig formConfig) {
        return conflictDetector.detectConflictsFromConfig(formConfig);
    }

    @PostMapping("/conflicts/field")
    public ResponseEntity<?> checkFieldName(@RequestBody FieldConflictRequest request) {
        if (request.formConfig() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "formConfig is required"));
        }
        if (request.fieldName() == null || request.fieldName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "fieldName is required"));
        }
        ConflictInfo conflict = conflictDetector.checkFieldNameConflict(
                request.fieldName(), request.fieldId(), request.formConfig());
        return conflict != null ? ResponseEntity.ok(conflict) : ResponseEntity.noContent().build();
    }

    @PostMapping("/conflicts/loop-variable")
    public ResponseEntity<?> checkLoopVariable(@RequestBody LoopVariableConflictRequest request) {
        if (request.formConfig() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "formConfig is required"));
        }
        if (request.variableName() == null || request.variableName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "variableName is required"));
        }
        LoopFormAction loop = request.loopAction() != null
                ? request.loopAction()
                : findLoop(request.formConfig(), request.loopActionId());
        if (loop == null) {
            return ResponseEntity.badRequest().body(Map.of("error",
                    "Loop action '" + request.loopActionId() + "' not found. Send loopActionId of an existing loop or the loopAction itself."));
        }
        ConflictInfo conflict = conflictDetector.checkLoopVariableConflict(
                request.variableName(), loop, request.formConfig(), request.siblingNames());
        return conflict != null ? ResponseEntity.ok(conflict) : ResponseEntity.noContent().build();
    }

    @GetMapping("/loop-variables/descriptions")
    public Map<String, String> loopVariableDescriptions() {
        return VariableConstants.STANDARD_DESCRIPTIONS;
    }

    private LoopFormAction findLoop(FormConfig formConfig, String loopActionId) {
        if (loopActionId == null) return null;
        for (FormAction action : variableRegistry.flattenActions(formConfig)) {
            if (action instanceof LoopFormAction loop && loopActionId.equals(loop.getId())) {
                return loop;
            }
        }
        return null;
    }
}
