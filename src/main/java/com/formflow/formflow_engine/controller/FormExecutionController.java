package com.formflow.formflow_engine.controller;

import com.formflow.formflow_engine.model.context.FormExecutionResult;
import com.formflow.formflow_engine.model.dto.FormExecutionRequest;
import com.formflow.formflow_engine.service.FormExecutionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/forms")
@RequiredArgsConstructor
public class FormExecutionController {

    private final FormExecutionService executionService;

    // Runs synchronously; a failed run is still 200 with status FAILURE in the body
    @PostMapping("/execute")
    public ResponseEntity<?> execute(@RequestBody FormExecutionRequest request) {
        if (request.formConfig() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "formConfig is required"));
        }
        FormExecutionResult result = executionService.execute(request.formConfig(), request.values());
        return ResponseEntity.ok(result);
    }
}
