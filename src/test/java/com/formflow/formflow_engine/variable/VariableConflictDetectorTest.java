package com.formflow.formflow_engine.variable;

import com.formflow.formflow_engine.model.domain.FormConfig;
import com.formflow.formflow_engine.model.domain.FormField;
import com.formflow.formflow_engine.model.domain.LoopFormAction;
import com.formflow.formflow_engine.model.domain.LoopType;
import com.formflow.formflow_engine.model.domain.SuggestModalFormAction;
import com.formflow.formflow_engine.model.variable.ConflictInfo;
import com.formflow.formflow_engine.model.variable.ConflictType;
import com.formflow.formflow_engine.model.variable.VariableCollectOptions;
import com.formflow.formflow_engine.model.variable.VariableInfo;
import com.formflow.formflow_engine.model.variable.VariableSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VariableConflictDetectorTest {

    private final VariableRegistry registry = new VariableRegistry();
    private final VariableConflictDetector detector = new VariableConflictDetector(registry);
    private FormConfig config;

    @BeforeEach
    void setUp() {
        config = new FormConfig("form");
    }

    @Test
    void detectConflicts_shouldClassifyDuplicateFields() {
        config.getFields().add(new FormField("f1", "title"));
        config.getFields().add(new FormField("f2", " title "));
        config.getFields().add(new FormField("f3", "Title"));

        List<ConflictInfo> conflicts = detector.detectConflicts(
                registry.collectAllVariables(config, VariableCollectOptions.declaredOnly()));

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.getConflictType()).isEqualTo(ConflictType.DUPLICATE);
            assertThat(conflict.getItems()).hasSize(2);
            assertThat(conflict.getSuggestion()).isEqualTo("title_1");
            assertThat(conflict.getMessageKey()).isEqualTo("field_name_duplicate");
        });
    }

    @Test
    void detectConflicts_shouldClassifyCrossSourceClash() {
        config.getFields().add(new FormField("f1", "choice"));
        SuggestModalFormAction suggest = new SuggestModalFormAction();
        suggest.setId("s1");
        suggest.setFieldName("choice");
        config.getActions().add(suggest);

        List<ConflictInfo> conflicts = detector.detectConflicts(
                registry.collectAllVariables(config, VariableCollectOptions.declaredOnly()));

        assertThat(conflicts).singleElement()
                .extracting(ConflictInfo::getConflictType).isEqualTo(ConflictType.CROSS_SCOPE);
    }

    @Test
    void detectConflictsFromConfig_shouldFlagReservedNamesAndRepeatedLoopSlots() {
        config.getFields().add(new FormField("f1", "item"));
        config.getActions().add(loop("loop-1"));
        config.getActions().add(loop("loop-2"));

        List<ConflictInfo> conflicts = detector.detectConflictsFromConfig(config);

        assertThat(conflicts).extracting(ConflictInfo::getVariableName).contains("item", "index", "total");
        assertThat(conflicts).filteredOn(c -> c.getVariableName().equals("item"))
                .singleElement()
                .satisfies(c -> {
                    assertThat(c.getConflictType()).isEqualTo(ConflictType.RESERVED);
                    assertThat(c.getMessageKey()).isEqualTo("system_reserved_conflict");
                });
    }

    @Test
    void detectConflicts_shouldIgnoreUniqueAndBlankNames() {
        List<ConflictInfo> conflicts = detector.detectConflicts(List.of(
                VariableInfo.builder().name("a").source(VariableSource.FORM_FIELD).build(),
                VariableInfo.builder().name(" ").source(VariableSource.FORM_FIELD).build(),
                VariableInfo.builder().name(null).source(VariableSource.FORM_FIELD).build()));

        assertThat(conflicts).isEmpty();
    }

    @Test
    void checkFieldNameConflict_shouldIgnoreTheFieldItself() {
        config.getFields().add(new FormField("f1", "title"));

        assertThat(detector.checkFieldNameConflict("title", "f1", config)).isNull();

        ConflictInfo duplicate = detector.checkFieldNameConflict("title", "f2", config);
        assertThat(duplicate.getConflictType()).isEqualTo(ConflictType.DUPLICATE);
        assertThat(duplicate.getSuggestion()).isEqualTo("title_1");
    }

    @Test
    void checkFieldNameConflict_shouldReportReservedNames() {
        ConflictInfo conflict = detector.checkFieldNameConflict("pageSize", "f1", config);

        assertThat(conflict.getConflictType()).isEqualTo(ConflictType.RESERVED);
        assertThat(conflict.getMessageKey()).isEqualTo("system_reserved_conflict");
        assertThat(detector.checkFieldNameConflict("  ", "f1", config)).isNull();
    }

    @Test
    void checkLoopVariableConflict_shouldPreferSelfConflict() {
        LoopFormAction loop = loop("loop-1");
        config.getActions().add(loop);

        ConflictInfo conflict = detector.checkLoopVariableConflict("item", loop, config, List.of("item", "total"));

        assertThat(conflict.getConflictType()).isEqualTo(ConflictType.SELF_CONFLICT);
        assertThat(conflict.getMessageKey()).isEqualTo("loop_variable_self_conflict");
        assertThat(conflict.getSuggestion()).isEqualTo("item_1");
    }

    @Test
    void checkLoopVariableConflict_shouldReportSecondLoopAsCrossScope() {
        config.getActions().add(loop("loop-1"));
        LoopFormAction second = loop("loop-2");

        ConflictInfo item = detector.checkLoopVariableConflict("item", second, config, List.of("index", "total"));
        ConflictInfo index = detector.checkLoopVariableConflict("index", second, config, List.of("item", "total"));

        assertThat(item.getConflictType()).isEqualTo(ConflictType.CROSS_SCOPE);
        assertThat(item.getMessageKey()).isEqualTo("loop_variable_conflict");
        assertThat(item.getItems()).extracting(VariableInfo::getSourceId).containsOnly("loop-1");
        assertThat(index.getConflictType()).isEqualTo(ConflictType.CROSS_SCOPE);
    }

    @Test
    void checkLoopVariableConflict_shouldNeverFlagBuiltInSlots() {
        config.getActions().add(loop("loop-1"));
        LoopFormAction second = loop("loop-2");

        assertThat(detector.checkLoopVariableConflict("iteration", second, config, List.of("item", "index"))).isNull();
    }

    @Test
    void checkLoopVariableConflict_shouldIgnoreOwnSlots() {
        LoopFormAction loop = loop("loop-1");
        config.getActions().add(loop);

        assertThat(detector.checkLoopVariableConflict("item", loop, config, List.of("index", "total"))).isNull();
    }

    @Test
    void checkLoopVariableConflict_shouldReportFormFieldClash() {
        config.getFields().add(new FormField("f1", "row"));
        LoopFormAction loop = loop("loop-1");

        ConflictInfo conflict = detector.checkLoopVariableConflict("row", loop, config, List.of("index", "total"));

        assertThat(conflict.getConflictType()).isEqualTo(ConflictType.CROSS_SCOPE);
        assertThat(conflict.getItems()).extracting(VariableInfo::getSource).containsExactly(VariableSource.FORM_FIELD);
    }

    private static LoopFormAction loop(String id) {
        return new LoopFormAction(id, LoopType.LIST, id + "-body");
    }
}
