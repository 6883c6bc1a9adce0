package com.formflow.formflow_engine.executor;

import com.formflow.formflow_engine.engine.TemplateResolver;
import com.formflow.formflow_engine.exception.LoopUsageException;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.ActionResult;
import com.formflow.formflow_engine.model.domain.ActionType;
import com.formflow.formflow_engine.model.domain.CollectDataFormAction;
import com.formflow.formflow_engine.model.domain.CollectVariableType;
import com.formflow.formflow_engine.model.domain.FormAction;
import com.formflow.formflow_engine.model.domain.StorageMode;
import com.formflow.formflow_engine.variable.VariableNameValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/*
 * Config shape (COLLECT_DATA inside a loop body):
 * {
 *   "outputVariableName": "summaries",
 *   "content": "{{item}}: {{@status}}",
 *   "storageMode": "APPEND",
 *   "variableType": "ARRAY"
 * }
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollectDataActionExecutor implements ActionExecutor {

    private final TemplateResolver resolver;

    @Override
    public ActionType supportedType() {
        return ActionType.COLLECT_DATA;
    }

    @Override
    public ActionResult execute(FormAction action, ActionContext context) {
        if (!(action instanceof CollectDataFormAction collect)) {
            throw new LoopUsageException("Action '" + action.getId() + "' is not a collect-data action");
        }
        if (context.getLoopContext() == null || context.getScope() == null || !context.getScope().isInsideLoop()) {
            throw new LoopUsageException("COLLECT_DATA action '" + action.getId() + "' can only be used inside a loop body");
        }

        String name = VariableNameValidator.normalize(collect.getOutputVariableName());
        if (name == null) {
            throw new LoopUsageException("COLLECT_DATA action '" + action.getId() + "' has no output variable name");
        }

        Object content = resolver.resolveToObject(collect.getContent(), context);
        StorageMode mode = collect.getStorageMode() != null ? collect.getStorageMode() : StorageMode.APPEND;
        CollectVariableType type = collect.getVariableType() != null ? collect.getVariableType() : CollectVariableType.STRING;

        Map<String, Object> values = context.getState().getValues();
        Object stored = mode == StorageMode.REPLACE
                ? replace(content, type)
                : append(values.get(name), content, type);
        values.put(name, stored);

        log.debug("[COLLECT] {} {} -> {}", mode, name, stored);
        Map<String, Object> output = new HashMap<>();
        output.put("variable", name);
        output.put("value", stored);
        return ActionResult.success(action.getId(), ActionType.COLLECT_DATA, output);
    }

    private static Object replace(Object content, CollectVariableType type) {
        if (type == CollectVariableType.ARRAY) {
            List<Object> single = new ArrayList<>();
            single.add(content);
            return single;
        }
        return content != null ? content.toString() : "";
    }

    private static Object append(Object existing, Object content, CollectVariableType type) {
        if (type == CollectVariableType.ARRAY) {
            List<Object> list = new ArrayList<>();
            if (existing instanceof List<?> previous) {
                list.addAll(previous);
            } else if (existing != null) {
                list.add(existing);
            }
            list.add(content);
            return list;
        }
        String text = content != null ? content.toString() : "";
        if (existing == null || existing.toString().isEmpty()) return text;
        return existing + "\n" + text;
    }
}
