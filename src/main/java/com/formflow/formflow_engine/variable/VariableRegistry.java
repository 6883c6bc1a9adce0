package com.formflow.formflow_engine.variable;

import com.formflow.formflow_engine.engine.LoopVariableScope;
import com.formflow.formflow_engine.model.domain.ActionType;
import com.formflow.formflow_engine.model.domain.AiFormAction;
import com.formflow.formflow_engine.model.domain.FormAction;
import com.formflow.formflow_engine.model.domain.FormConfig;
import com.formflow.formflow_engine.model.domain.FormField;
import com.formflow.formflow_engine.model.domain.GenerateFormAction;
import com.formflow.formflow_engine.model.domain.LoopFormAction;
import com.formflow.formflow_engine.model.domain.LoopType;
import com.formflow.formflow_engine.model.domain.SuggestModalFormAction;
import com.formflow.formflow_engine.model.variable.VariableCollectOptions;
import com.formflow.formflow_engine.model.variable.VariableInfo;
import com.formflow.formflow_engine.model.variable.VariableLocation;
import com.formflow.formflow_engine.model.variable.VariableSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Collects every variable a form declares: field labels, action outputs, loop variables and,
 * optionally, the internal and reserved names nobody may reuse.
 */
@Component
public class VariableRegistry {

    private static final String INTERNAL_DESCRIPTION = "Built-in template variable";

    public List<VariableInfo> collectAllVariables(FormConfig formConfig) {
        return collectAllVariables(formConfig, VariableCollectOptions.defaults());
    }

    public List<VariableInfo> collectAllVariables(FormConfig formConfig, VariableCollectOptions options) {
        VariableCollectOptions opts = options != null ? options : VariableCollectOptions.defaults();
        List<VariableInfo> result = new ArrayList<>();
        result.addAll(collectFormFieldVariables(formConfig, opts));
        result.addAll(collectActionDerivedVariables(formConfig, opts));

        if (opts.isIncludeInternal()) {
            for (String name : VariableConstants.INTERNAL_VARIABLE_NAMES) {
                result.add(VariableInfo.builder()
                        .name(name)
                        .source(VariableSource.INTERNAL)
                        .description(INTERNAL_DESCRIPTION)
                        .reserved(true)
                        .build());
            }
        }

        if (opts.isIncludeSystemReserved()) {
            for (String name : VariableConstants.SYSTEM_RESERVED_LOOP_VARIABLES) {
                result.add(VariableInfo.builder()
                        .name(name)
                        .source(VariableSource.SYSTEM_RESERVED)
                        .description(LoopVariableScope.getVariableDescription(name))
                        .reserved(true)
                        .build());
            }
        }
        return result;
    }

    public List<VariableInfo> collectFormFieldVariables(FormConfig formConfig, VariableCollectOptions opts) {
        List<VariableInfo> result = new ArrayList<>();
        if (formConfig == null || formConfig.getFields() == null) return result;

        List<FormField> fields = formConfig.getFields();
        for (int i = 0; i < fields.size(); i++) {
            FormField field = fields.get(i);
            if (field == null || !shouldInclude(field.getLabel(), opts)) continue;
            result.add(VariableInfo.builder()
                    .name(field.getLabel())
                    .source(VariableSource.FORM_FIELD)
                    .sourceId(field.getId())
                    .description(field.getDescription())
                    .location(VariableLocation.builder().fieldId(field.getId()).index(i).build())
                    .build());
        }
        return result;
    }

    public List<VariableInfo> collectActionDerivedVariables(FormConfig formConfig, VariableCollectOptions opts) {
        List<VariableInfo> result = new ArrayList<>();
        List<FormAction> actions = flattenActions(formConfig);

        for (int index = 0; index < actions.size(); index++) {
            FormAction action = actions.get(index);
            if (action instanceof SuggestModalFormAction suggest) {
                if (shouldInclude(suggest.getFieldName(), opts)) {
                    result.add(actionVariable(suggest.getFieldName(), VariableSource.SUGGEST_MODAL, action, index));
                }
            } else if (action instanceof GenerateFormAction generated) {
                collectGeneratedFields(generated, index, opts, result);
            } else if (action instanceof LoopFormAction loop) {
                collectLoopVariables(loop, index, opts, result);
            } else if (action instanceof AiFormAction ai) {
                if (shouldInclude(ai.getOutputVariableName(), opts)) {
                    result.add(actionVariable(ai.getOutputVariableName(), VariableSource.AI_OUTPUT, action, index));
                }
            }
        }
        return result;
    }

    /**
     * Top-level actions followed depth-first by the bodies of the loops that reference them.
     * Each action group is entered at most once, so a loop whose body points back at its own
     * group terminates.
     */
    public List<FormAction> flattenActions(FormConfig formConfig) {
        List<FormAction> result = new ArrayList<>();
        if (formConfig == null) return result;
        traverse(formConfig.getActions(), formConfig, new HashSet<>(), result);
        return result;
    }

    private void traverse(List<FormAction> actions, FormConfig formConfig, Set<String> visitedGroups, List<FormAction> result) {
        if (actions == null) return;
        for (FormAction action : actions) {
            if (action == null) continue;
            result.add(action);
            if (action instanceof LoopFormAction loop
                    && loop.getActionGroupId() != null
                    && visitedGroups.add(loop.getActionGroupId())) {
                formConfig.findActionGroup(loop.getActionGroupId())
                        .ifPresent(group -> traverse(group.getActions(), formConfig, visitedGroups, result));
            }
        }
    }

    private void collectGeneratedFields(GenerateFormAction generated, int index, VariableCollectOptions opts,
                                        List<VariableInfo> result) {
        List<FormField> fields = generated.getFields();
        if (fields == null) return;
        for (int j = 0; j < fields.size(); j++) {
            FormField field = fields.get(j);
            if (field == null || !shouldInclude(field.getLabel(), opts)) continue;
            result.add(VariableInfo.builder()
                    .name(field.getLabel())
                    .source(VariableSource.FORM_FIELD)
                    .sourceId(field.getId())
                    .description(field.getDescription())
                    .location(VariableLocation.builder()
                            .actionId(generated.getId())
                            .actionType(ActionType.GENERATE_FORM)
                            .index(index)
                            .path("actions." + index + ".fields." + j)
                            .build())
                    .build());
        }
    }

    private void collectLoopVariables(LoopFormAction loop, int index, VariableCollectOptions opts,
                                      List<VariableInfo> result) {
        LoopType type = loop.getLoopType() != null ? loop.getLoopType() : LoopType.LIST;
        List<LoopSlot> slots = slotsFor(type);

        for (int k = 0; k < slots.size(); k++) {
            LoopSlot slot = slots.get(k);
            String name = slot.name().apply(loop);
            if (!shouldInclude(name, opts)) continue;
            result.add(VariableInfo.builder()
                    .name(name)
                    .source(VariableSource.LOOP_VAR)
                    .sourceId(loop.getId())
                    .description(LoopVariableScope.getVariableDescription(slot.standardName()))
                    .reserved(VariableConstants.BUILT_IN_LOOP_SLOTS.contains(slot.standardName()))
                    .location(VariableLocation.builder()
                            .actionId(loop.getId())
                            .actionType(ActionType.LOOP)
                            .actionGroupId(loop.getActionGroupId())
                            .index(index)
                            .path("loopVariables." + k)
                            .build())
                    .meta(Map.of("loopType", type.name(), "slot", slot.standardName()))
                    .build());
        }
    }

    private static List<LoopSlot> slotsFor(LoopType type) {
        LoopSlot item = new LoopSlot(VariableConstants.DEFAULT_ITEM_VARIABLE, LoopFormAction::getItemVariableName);
        LoopSlot index = new LoopSlot(VariableConstants.DEFAULT_INDEX_VARIABLE, LoopFormAction::getIndexVariableName);
        LoopSlot iteration = fixed(VariableConstants.ITERATION_VARIABLE);
        LoopSlot total = new LoopSlot(VariableConstants.DEFAULT_TOTAL_VARIABLE, LoopFormAction::getTotalVariableName);

        return switch (type) {
            case LIST, COUNT -> List.of(item, index, iteration, total);
            case CONDITION -> List.of(index, iteration);
            case PAGINATION -> List.of(item, index, iteration, total,
                    fixed(VariableConstants.CURRENT_PAGE_VARIABLE),
                    fixed(VariableConstants.PAGE_SIZE_VARIABLE),
                    fixed(VariableConstants.TOTAL_PAGE_VARIABLE));
        };
    }

    private static LoopSlot fixed(String name) {
        return new LoopSlot(name, loop -> name);
    }

    private static VariableInfo actionVariable(String name, VariableSource source, FormAction action, int index) {
        return VariableInfo.builder()
                .name(name)
                .source(source)
                .sourceId(action.getId())
                .description("")
                .location(VariableLocation.builder()
                        .actionId(action.getId())
                        .actionType(action.getType())
                        .index(index)
                        .build())
                .build();
    }

    private static boolean shouldInclude(String name, VariableCollectOptions opts) {
        if (name == null || name.isBlank()) return opts.isIncludeEmpty();
        return true;
    }

    private record LoopSlot(String standardName, Function<LoopFormAction, String> name) {
    }
}
