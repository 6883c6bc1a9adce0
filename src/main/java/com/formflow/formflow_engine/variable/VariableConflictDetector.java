package com.formflow.formflow_engine.variable;

import com.formflow.formflow_engine.model.domain.FormConfig;
import com.formflow.formflow_engine.model.domain.LoopFormAction;
import com.formflow.formflow_engine.model.variable.ConflictInfo;
import com.formflow.formflow_engine.model.variable.ConflictType;
import com.formflow.formflow_engine.model.variable.VariableInfo;
import com.formflow.formflow_engine.model.variable.VariableLocation;
import com.formflow.formflow_engine.model.variable.VariableSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds variable names declared more than once. Names compare after trimming and are
 * case-sensitive. Detection reports, it never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VariableConflictDetector {

    static final String FIELD_NAME_DUPLICATE = "field_name_duplicate";
    static final String SYSTEM_RESERVED_CONFLICT = "system_reserved_conflict";
    static final String LOOP_VARIABLE_CONFLICT = "loop_variable_conflict";
    static final String LOOP_VARIABLE_SELF_CONFLICT = "loop_variable_self_conflict";

    private final VariableRegistry registry;

    public List<ConflictInfo> detectConflictsFromConfig(FormConfig formConfig) {
        return detectConflicts(registry.collectAllVariables(formConfig));
    }

    public List<ConflictInfo> detectConflicts(List<VariableInfo> variables) {
        List<ConflictInfo> conflicts = new ArrayList<>();
        if (variables == null) return conflicts;

        Map<String, List<VariableInfo>> byName = new LinkedHashMap<>();
        for (VariableInfo variable : variables) {
            if (variable == null) continue;
            String normalized = VariableNameValidator.normalize(variable.getName());
            if (normalized == null) continue;
            byName.computeIfAbsent(normalized, k -> new ArrayList<>()).add(variable);
        }

        Set<String> allNames = byName.keySet();
        byName.forEach((name, items) -> {
            if (items.size() <= 1) return;
            ConflictType type = resolveConflictType(items);
            conflicts.add(ConflictInfo.builder()
                    .variableName(items.get(0).getName())
                    .conflictType(type)
                    .items(items)
                    .suggestion(VariableNameValidator.suggestAlternativeName(name, allNames))
                    .messageKey(messageKey(type))
                    .build());
        });

        log.debug("[VARIABLES] {} conflict(s) among {} variable(s)", conflicts.size(), variables.size());
        return conflicts;
    }

    /**
     * Conflict for a field being renamed to fieldName, ignoring the field's own binding.
     * Returns null when the name is free.
     */
    public ConflictInfo checkFieldNameConflict(String fieldName, String currentFieldId, FormConfig formConfig) {
        String normalized = VariableNameValidator.normalize(fieldName);
        if (normalized == null) return null;

        List<VariableInfo> all = registry.collectAllVariables(formConfig);
        List<VariableInfo> matches = all.stream()
                .filter(v -> !(v.getSource() == VariableSource.FORM_FIELD && Objects.equals(v.getSourceId(), currentFieldId)))
                .filter(v -> normalized.equals(VariableNameValidator.normalize(v.getName())))
                .collect(Collectors.toList());
        if (matches.isEmpty()) return null;

        ConflictType type = matches.stream().anyMatch(VariableConflictDetector::isReserved)
                ? ConflictType.RESERVED
                : ConflictType.DUPLICATE;
        return ConflictInfo.builder()
                .variableName(fieldName)
                .conflictType(type)
                .items(matches)
                .suggestion(VariableNameValidator.suggestAlternativeName(fieldName, names(all)))
                .messageKey(messageKey(type))
                .build();
    }

    /**
     * Conflict for one variable slot of a loop. siblingNames are the loop's other slot names.
     * The loop's own slots, the reserved loop names and other loops' fixed built-in slots
     * (iteration, currentPage, ...) are never reported against it.
     */
    public ConflictInfo checkLoopVariableConflict(String variableName, LoopFormAction loopAction,
                                                  FormConfig formConfig, List<String> siblingNames) {
        String normalized = VariableNameValidator.normalize(variableName);
        if (normalized == null || loopAction == null) return null;
        List<String> siblings = siblingNames != null ? siblingNames : List.of();

        List<VariableInfo> all = registry.collectAllVariables(formConfig);
        Set<String> knownNames = new LinkedHashSet<>(names(all));
        knownNames.addAll(siblings);

        boolean selfConflict = siblings.stream()
                .anyMatch(sibling -> normalized.equals(VariableNameValidator.normalize(sibling)));
        if (selfConflict) {
            VariableInfo self = VariableInfo.builder()
                    .name(variableName)
                    .source(VariableSource.LOOP_VAR)
                    .sourceId(loopAction.getId())
                    .location(VariableLocation.builder().actionId(loopAction.getId()).build())
                    .build();
            return ConflictInfo.builder()
                    .variableName(variableName)
                    .conflictType(ConflictType.SELF_CONFLICT)
                    .items(List.of(self))
                    .suggestion(VariableNameValidator.suggestAlternativeName(variableName, knownNames))
                    .messageKey(LOOP_VARIABLE_SELF_CONFLICT)
                    .build();
        }

        List<VariableInfo> matches = all.stream()
                .filter(v -> !(v.getSource() == VariableSource.LOOP_VAR && Objects.equals(v.getSourceId(), loopAction.getId())))
                .filter(v -> v.getSource() != VariableSource.SYSTEM_RESERVED)
                .filter(v -> !(v.getSource() == VariableSource.LOOP_VAR && v.isReserved()))
                .filter(v -> normalized.equals(VariableNameValidator.normalize(v.getName())))
                .collect(Collectors.toList());
        if (matches.isEmpty()) return null;

        ConflictType type = matches.stream().anyMatch(v -> v.getSource() == VariableSource.INTERNAL)
                ? ConflictType.RESERVED
                : ConflictType.CROSS_SCOPE;
        return ConflictInfo.builder()
                .variableName(variableName)
                .conflictType(type)
                .items(matches)
                .suggestion(VariableNameValidator.suggestAlternativeName(variableName, knownNames))
                .messageKey(messageKey(type))
                .build();
    }

    private static ConflictType resolveConflictType(List<VariableInfo> items) {
        if (items.stream().anyMatch(VariableConflictDetector::isReserved)) {
            return ConflictType.RESERVED;
        }
        long sources = items.stream().map(VariableInfo::getSource).distinct().count();
        return sources > 1 ? ConflictType.CROSS_SCOPE : ConflictType.DUPLICATE;
    }

    private static boolean isReserved(VariableInfo variable) {
        return variable.isReserved()
                || variable.getSource() == VariableSource.INTERNAL
                || variable.getSource() == VariableSource.SYSTEM_RESERVED;
    }

    private static List<String> names(List<VariableInfo> variables) {
        return variables.stream().map(VariableInfo::getName).filter(Objects::nonNull).collect(Collectors.toList());
    }

    private static String messageKey(ConflictType type) {
        return switch (type) {
            case RESERVED -> SYSTEM_RESERVED_CONFLICT;
            case CROSS_SCOPE -> LOOP_VARIABLE_CONFLICT;
            case SELF_CONFLICT -> LOOP_VARIABLE_SELF_CONFLICT;
            case DUPLICATE -> FIELD_NAME_DUPLICATE;
        };
    }
}
