package com.formflow.formflow_engine.variable;

import com.formflow.formflow_engine.model.domain.ActionGroup;
import com.formflow.formflow_engine.model.domain.AiFormAction;
import com.formflow.formflow_engine.model.domain.FormConfig;
import com.formflow.formflow_engine.model.domain.FormField;
import com.formflow.formflow_engine.model.domain.GenerateFormAction;
import com.formflow.formflow_engine.model.domain.LoopFormAction;
import com.formflow.formflow_engine.model.domain.LoopType;
import com.formflow.formflow_engine.model.domain.SuggestModalFormAction;
import com.formflow.formflow_engine.model.variable.VariableCollectOptions;
import com.formflow.formflow_engine.model.variable.VariableInfo;
import com.formflow.formflow_engine.model.variable.VariableSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class VariableRegistryTest {

    private final VariableRegistry registry = new VariableRegistry();
    private FormConfig config;

    @BeforeEach
    void setUp() {
        config = new FormConfig("form");
    }

    @Test
    void collectAllVariables_shouldIncludeFieldsInternalAndReservedByDefault() {
        config.getFields().add(new FormField("f1", "title"));

        List<VariableInfo> variables = registry.collectAllVariables(config);

        assertThat(variables).filteredOn(v -> v.getSource() == VariableSource.FORM_FIELD)
                .singleElement()
                .satisfies(v -> {
                    assertThat(v.getName()).isEqualTo("title");
                    assertThat(v.getLocation().getFieldId()).isEqualTo("f1");
                    assertThat(v.getLocation().getIndex()).isZero();
                });
        assertThat(names(variables, VariableSource.INTERNAL)).contains("{{date}}", "{{clipboard}}").hasSize(9);
        assertThat(names(variables, VariableSource.SYSTEM_RESERVED))
                .containsExactly("item", "index", "total", "iteration", "currentPage", "pageSize", "totalPage");
        assertThat(variables).filteredOn(v -> v.getSource() == VariableSource.SYSTEM_RESERVED)
                .allSatisfy(v -> assertThat(v.isReserved()).isTrue());
    }

    @Test
    void collectAllVariables_shouldHonourOptions() {
        config.getFields().add(new FormField("f1", "title"));
        config.getFields().add(new FormField("f2", "  "));

        List<VariableInfo> declared = registry.collectAllVariables(config, VariableCollectOptions.declaredOnly());
        List<VariableInfo> withEmpty = registry.collectAllVariables(config, VariableCollectOptions.builder()
                .includeInternal(false)
                .includeSystemReserved(false)
                .includeEmpty(true)
                .build());

        assertThat(declared).extracting(VariableInfo::getName).containsExactly("title");
        assertThat(withEmpty).hasSize(2);
    }

    @Test
    void collectActionDerivedVariables_shouldDescribeLoopSlotsByType() {
        LoopFormAction list = new LoopFormAction("loop-1", LoopType.LIST, "g1");
        list.setItemVariableName("row");
        LoopFormAction condition = new LoopFormAction("loop-2", LoopType.CONDITION, "g2");
        LoopFormAction pages = new LoopFormAction("loop-3", LoopType.PAGINATION, "g3");
        config.getActions().addAll(List.of(list, condition, pages));

        List<VariableInfo> variables = registry.collectActionDerivedVariables(config, VariableCollectOptions.defaults());

        assertThat(namesOf(variables, "loop-1")).containsExactly("row", "index", "iteration", "total");
        assertThat(namesOf(variables, "loop-2")).containsExactly("index", "iteration");
        assertThat(namesOf(variables, "loop-3"))
                .containsExactly("item", "index", "iteration", "total", "currentPage", "pageSize", "totalPage");

        VariableInfo iteration = variables.stream()
                .filter(v -> "loop-1".equals(v.getSourceId()) && "iteration".equals(v.getName()))
                .findFirst().orElseThrow();
        assertThat(iteration.isReserved()).isTrue();
        assertThat(iteration.getLocation().getActionGroupId()).isEqualTo("g1");
        assertThat(iteration.getLocation().getPath()).isEqualTo("loopVariables.2");
        assertThat(iteration.getMeta()).containsEntry("loopType", "LIST");

        VariableInfo row = variables.get(0);
        assertThat(row.isReserved()).isFalse();
        assertThat(row.getSource()).isEqualTo(VariableSource.LOOP_VAR);
    }

    @Test
    void collectActionDerivedVariables_shouldReadOtherActionOutputs() {
        SuggestModalFormAction suggest = new SuggestModalFormAction();
        suggest.setId("s1");
        suggest.setFieldName("choice");
        AiFormAction ai = new AiFormAction();
        ai.setId("a1");
        ai.setOutputVariableName("summary");
        GenerateFormAction generate = new GenerateFormAction();
        generate.setId("g1");
        generate.setFields(new ArrayList<>(List.of(new FormField("gf1", "first"), new FormField("gf2", "second"))));
        config.getActions().addAll(List.of(suggest, ai, generate));

        List<VariableInfo> variables = registry.collectActionDerivedVariables(config, VariableCollectOptions.defaults());

        assertThat(variables).extracting(VariableInfo::getName).containsExactly("choice", "summary", "first", "second");
        assertThat(variables.get(0).getSource()).isEqualTo(VariableSource.SUGGEST_MODAL);
        assertThat(variables.get(1).getSource()).isEqualTo(VariableSource.AI_OUTPUT);
        assertThat(variables.get(3).getSource()).isEqualTo(VariableSource.FORM_FIELD);
        assertThat(variables.get(3).getLocation().getPath()).isEqualTo("actions.2.fields.1");
    }

    @Test
    void collectActionDerivedVariables_shouldEnterLoopBodiesThroughGroups() {
        AiFormAction nested = new AiFormAction();
        nested.setId("ai-in-body");
        nested.setOutputVariableName("perItem");
        config.getActions().add(new LoopFormAction("loop", LoopType.LIST, "body"));
        config.getActionGroups().add(new ActionGroup("body", List.of(nested)));

        List<VariableInfo> variables = registry.collectActionDerivedVariables(config, VariableCollectOptions.defaults());

        assertThat(variables).extracting(VariableInfo::getName).contains("perItem");
    }

    @Test
    void flattenActions_shouldVisitSelfReferencingBodyOnce() {
        LoopFormAction top = new LoopFormAction("top", LoopType.LIST, "body");
        LoopFormAction recursive = new LoopFormAction("again", LoopType.LIST, "body");
        config.getActions().add(top);
        config.getActionGroups().add(new ActionGroup("body", List.of(recursive)));

        assertThat(registry.flattenActions(config)).extracting("id").containsExactly("top", "again");
        assertThat(registry.collectActionDerivedVariables(config, VariableCollectOptions.defaults()))
                .filteredOn(v -> "again".equals(v.getSourceId()))
                .hasSize(4);
    }

    private static List<String> names(List<VariableInfo> variables, VariableSource source) {
        return variables.stream().filter(v -> v.getSource() == source).map(VariableInfo::getName).collect(Collectors.toList());
    }

    private static List<String> namesOf(List<VariableInfo> variables, String sourceId) {
        return variables.stream().filter(v -> sourceId.equals(v.getSourceId())).map(VariableInfo::getName).collect(Collectors.toList());
    }
}
