package com.formflow.formflow_engine.executor;

import com.formflow.formflow_engine.model.domain.ActionType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ActionExecutorRegistry {

    private final List<ActionExecutor> executors;
    private final Map<ActionType, ActionExecutor> registry = new EnumMap<>(ActionType.class);

    @PostConstruct
    public void init() {
        executors.forEach(executor -> registry.put(executor.supportedType(), executor));
        log.info("[EXECUTORS] Registered action types: {}", registry.keySet());
    }

    public ActionExecutor get(ActionType type) {
        ActionExecutor executor = type != null ? registry.get(type) : null;
        if (executor == null) {
            throw new UnsupportedOperationException("No executor registered for action type: " + type);
        }
        return executor;
    }

    public boolean isSupported(ActionType type) {
        return type != null && registry.containsKey(type);
    }
}
