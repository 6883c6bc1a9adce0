package com.formflow.formflow_engine.executor.loop;

import com.formflow.formflow_engine.exception.LoopBreakSignal;
import com.formflow.formflow_engine.exception.LoopContinueSignal;
import com.formflow.formflow_engine.exception.LoopUsageException;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.FormState;
import com.formflow.formflow_engine.model.context.LoopContext;
import com.formflow.formflow_engine.model.domain.BreakFormAction;
import com.formflow.formflow_engine.model.domain.ContinueFormAction;
import com.formflow.formflow_engine.model.domain.FormConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoopControlActionExecutorTest {

    private final BreakActionExecutor breakExecutor = new BreakActionExecutor();
    private final ContinueActionExecutor continueExecutor = new ContinueActionExecutor();

    @Test
    void break_shouldFailOutsideLoop() {
        ActionContext context = ActionContext.create(new FormConfig("f"), new FormState());

        assertThatThrownBy(() -> breakExecutor.execute(new BreakFormAction("b1"), context))
                .isInstanceOf(LoopUsageException.class)
                .hasMessageContaining("inside a loop");
    }

    @Test
    void continue_shouldFailOutsideLoop() {
        ActionContext context = ActionContext.create(new FormConfig("f"), new FormState());

        assertThatThrownBy(() -> continueExecutor.execute(new ContinueFormAction("c1"), context))
                .isInstanceOf(LoopUsageException.class);
    }

    @Test
    void break_shouldFlagLoopContextAndSignal() {
        LoopContext loop = loopContext(true, true);
        loop.setContinueRequested(true);
        ActionContext context = ActionContext.create(new FormConfig("f"), new FormState()).forIteration(loop);

        assertThatThrownBy(() -> breakExecutor.execute(new BreakFormAction("b1"), context))
                .isInstanceOf(LoopBreakSignal.class);
        assertThat(loop.isBreakRequested()).isTrue();
        assertThat(loop.isContinueRequested()).isFalse();
        assertThat(context.getExecutionOrder()).containsExactly("b1");
    }

    @Test
    void continue_shouldFlagLoopContextAndSignal() {
        LoopContext loop = loopContext(true, true);
        ActionContext context = ActionContext.create(new FormConfig("f"), new FormState()).forIteration(loop);

        assertThatThrownBy(() -> continueExecutor.execute(new ContinueFormAction("c1"), context))
                .isInstanceOf(LoopContinueSignal.class);
        assertThat(loop.isContinueRequested()).isTrue();
        assertThat(loop.isBreakRequested()).isFalse();
    }

    @Test
    void signals_shouldRespectDisallowedFlags() {
        ActionContext context = ActionContext.create(new FormConfig("f"), new FormState())
                .forIteration(loopContext(false, false));

        assertThatThrownBy(() -> breakExecutor.execute(new BreakFormAction("b1"), context))
                .isInstanceOf(LoopUsageException.class);
        assertThatThrownBy(() -> continueExecutor.execute(new ContinueFormAction("c1"), context))
                .isInstanceOf(LoopUsageException.class);
    }

    @Test
    void signals_shouldNotCaptureStackTraces() {
        assertThat(new LoopBreakSignal().getStackTrace()).isEmpty();
        assertThat(new LoopContinueSignal().getStackTrace()).isEmpty();
    }

    private static LoopContext loopContext(boolean canBreak, boolean canContinue) {
        return LoopContext.builder()
                .variables(Map.of("item", "x"))
                .depth(1)
                .canBreak(canBreak)
                .canContinue(canContinue)
                .build();
    }
}
