package com.formflow.formflow_engine.executor.loop;

import com.formflow.formflow_engine.engine.ActionChain;
import com.formflow.formflow_engine.engine.LoopVariableScope;
import com.formflow.formflow_engine.exception.LoopBreakSignal;
import com.formflow.formflow_engine.exception.LoopCancelledException;
import com.formflow.formflow_engine.exception.LoopContinueSignal;
import com.formflow.formflow_engine.exception.LoopControlSignal;
import com.formflow.formflow_engine.exception.LoopMaxIterationException;
import com.formflow.formflow_engine.exception.LoopTimeoutException;
import com.formflow.formflow_engine.exception.LoopUsageException;
import com.formflow.formflow_engine.executor.ActionExecutor;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.ActionResult;
import com.formflow.formflow_engine.model.context.ActionStatus;
import com.formflow.formflow_engine.model.context.CancellationToken;
import com.formflow.formflow_engine.model.context.LoopContext;
import com.formflow.formflow_engine.model.context.LoopStatus;
import com.formflow.formflow_engine.model.domain.ActionGroup;
import com.formflow.formflow_engine.model.domain.ActionType;
import com.formflow.formflow_engine.model.domain.ErrorHandlingStrategy;
import com.formflow.formflow_engine.model.domain.FormAction;
import com.formflow.formflow_engine.model.domain.LoopFormAction;
import com.formflow.formflow_engine.model.domain.LoopType;
import com.formflow.formflow_engine.model.domain.PaginationConfig;
import com.formflow.formflow_engine.variable.VariableConstants;
import com.formflow.formflow_engine.variable.VariableNameValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes LOOP actions: repeats the referenced action group once per iteration with a fresh
 * scope frame ({@code item}, {@code index}, {@code total}, {@code iteration} and the configured
 * aliases) pushed for the duration of the iteration.
 * <p>
 * Failures inside an iteration go through the error handling strategy (the action group's
 * strategy wins over the loop's). The iteration guard, cancellation and usage errors are
 * always fatal.
 * <p>
 * Every iteration body runs on the calling thread. A {@code singleIterationTimeout} only arms a
 * deadline that cancels the iteration's token; the body stops at its next cancellation check and
 * the iteration then fails with {@link LoopTimeoutException}.
 */
@Slf4j
@Component
public class LoopActionExecutor implements ActionExecutor {

    private static final int DEFAULT_RETRY_COUNT = 0;
    private static final long DEFAULT_RETRY_DELAY_MS = 0L;
    private static final int DEFAULT_FIRST_PAGE = 1;

    private final LoopDataResolver dataResolver;
    private final ActionChain actionChain;
    private final TaskScheduler deadlineScheduler;
    private final int defaultMaxIterations;
    private final int maxIterationsCeiling;

    public LoopActionExecutor(LoopDataResolver dataResolver,
                              @Lazy ActionChain actionChain,
                              @Qualifier("loopDeadlineScheduler") TaskScheduler deadlineScheduler,
                              @Value("${app.loop.default-max-iterations:1000}") int defaultMaxIterations,
                              @Value("${app.loop.max-iterations-ceiling:100000}") int maxIterationsCeiling) {
        this.dataResolver = dataResolver;
        this.actionChain = actionChain;
        this.deadlineScheduler = deadlineScheduler;
        this.defaultMaxIterations = defaultMaxIterations;
        this.maxIterationsCeiling = maxIterationsCeiling;
    }

    @Override
    public ActionType supportedType() {
        return ActionType.LOOP;
    }

    @Override
    public ActionResult execute(FormAction action, ActionContext context) {
        if (!(action instanceof LoopFormAction loop)) {
            throw new LoopUsageException("Action '" + action.getId() + "' is not a loop action");
        }

        Optional<ActionGroup> group = context.getConfig() != null
                ? context.getConfig().findActionGroup(loop.getActionGroupId())
                : Optional.empty();
        if (group.isEmpty()) {
            log.warn("[LOOP] Loop '{}' references missing action group '{}', nothing to run",
                    loop.getId(), loop.getActionGroupId());
            LoopRun empty = new LoopRun();
            empty.status = LoopStatus.COMPLETED;
            return ActionResult.success(loop.getId(), ActionType.LOOP, output(empty));
        }

        LoopRun run = new LoopRun();
        run.group = group.get();
        run.strategy = resolveStrategy(loop, run.group);
        run.maxIterations = Math.min(maxIterationsCeiling,
                Math.max(1, loop.getMaxIterations() > 0 ? loop.getMaxIterations() : defaultMaxIterations));
        run.startedAt = System.currentTimeMillis();

        LoopType type = loop.getLoopType() != null ? loop.getLoopType() : LoopType.LIST;
        log.debug("[LOOP] Starting {} loop '{}' over group '{}' (strategy {}, max {})",
                type, loop.getId(), run.group.getId(), run.strategy, run.maxIterations);

        try {
            switch (type) {
                case LIST -> runList(loop, context, run);
                case COUNT -> runCount(loop, context, run);
                case CONDITION -> runCondition(loop, context, run);
                case PAGINATION -> runPagination(loop, context, run);
            }
        } catch (RuntimeException ex) {
            run.status = LoopStatus.STOPPED_BY_ERROR;
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("[LOOP] Loop '{}' stopped after {} iteration(s): {}", loop.getId(), run.iterationCount, msg);
            context.recordResult(ActionResult.builder()
                    .actionId(loop.getId())
                    .actionType(ActionType.LOOP)
                    .status(ActionStatus.FAILURE)
                    .output(output(run))
                    .errorMessage(msg)
                    .build());
            throw ex;
        }

        if (run.status != LoopStatus.BROKEN) {
            run.status = LoopStatus.COMPLETED;
        }
        log.debug("[LOOP] Loop '{}' finished {} after {} iteration(s)", loop.getId(), run.status, run.iterationCount);
        return ActionResult.success(loop.getId(), ActionType.LOOP, output(run));
    }

    private void runList(LoopFormAction loop, ActionContext context, LoopRun run) {
        List<Object> items = dataResolver.resolveIterations(loop, context);
        int total = items.size();
        for (int index = 0; index < items.size(); index++) {
            if (!runRound(loop, context, run, index, items.get(index), total, Map.of())) {
                return;
            }
        }
    }

    // The guard in runRound ends oversized ranges long before position can overflow an int index
    private void runCount(LoopFormAction loop, ActionContext context, LoopRun run) {
        int start = loop.getCountStart() != null ? loop.getCountStart() : 0;
        int end = loop.getCountEnd() != null ? loop.getCountEnd() : 0;
        int step = loop.getCountStep() != null ? loop.getCountStep() : 1;
        long count = dataResolver.countIterationTotal(start, end, step);
        Object total = count <= Integer.MAX_VALUE ? (Object) (int) count : (Object) count;

        for (long position = 0; position < count; position++) {
            int value = dataResolver.countIterationValue(start, end, step, position);
            int index = (int) Math.min(position, Integer.MAX_VALUE);
            if (!runRound(loop, context, run, index, value, total, Map.of())) {
                return;
            }
        }
    }

    private void runCondition(LoopFormAction loop, ActionContext context, LoopRun run) {
        String expression = loop.getConditionExpression();
        if (expression == null || expression.isBlank()) {
            log.warn("[LOOP] Condition loop '{}' has no condition expression, nothing to run", loop.getId());
            return;
        }
        int index = 0;
        while (dataResolver.evaluateCondition(expression, context)) {
            if (!runRound(loop, context, run, index, index, null, Map.of())) {
                return;
            }
            index++;
        }
    }

    private void runPagination(LoopFormAction loop, ActionContext context, LoopRun run) {
        PaginationConfig pagination = loop.getPaginationConfig() != null ? loop.getPaginationConfig() : new PaginationConfig();
        int pageSize = Math.abs(loop.getCountStep() != null ? loop.getCountStep() : 1);
        int maxPages = pagination.getMaxPages() != null && pagination.getMaxPages() > 0
                ? pagination.getMaxPages()
                : run.maxIterations;

        int page = loop.getCountStart() != null ? loop.getCountStart() : DEFAULT_FIRST_PAGE;
        int pageIndex = 0;
        while (true) {
            Object totalItems = isBlank(pagination.getTotalItemsVariable())
                    ? null
                    : dataResolver.lookupPath(pagination.getTotalItemsVariable().trim(), context);
            Object total = totalItems != null ? totalItems : maxPages;

            Map<String, Object> extras = new LinkedHashMap<>();
            extras.put(VariableConstants.CURRENT_PAGE_VARIABLE, page);
            extras.put(VariableConstants.PAGE_SIZE_VARIABLE, pageSize);
            extras.put(VariableConstants.TOTAL_PAGE_VARIABLE, maxPages);
            putAlias(extras, pagination.getCurrentPageVariable(), page);
            putAlias(extras, pagination.getPageSizeVariable(), pageSize);
            putAlias(extras, pagination.getTotalPageVariable(), maxPages);

            if (!runRound(loop, context, run, pageIndex, page, total, extras)) {
                return;
            }
            pageIndex++;
            if (pageIndex >= maxPages) {
                return;
            }

            long interval = pagination.getRequestInterval() != null ? pagination.getRequestInterval() : 0L;
            if (interval > 0) {
                pause(interval);
            }
            if (!dataResolver.evaluateCondition(pagination.getHasNextPageCondition(), context)) {
                return;
            }
            page++;
        }
    }

    /**
     * One iteration with its guards, frame and error policy. Returns false when the loop
     * should end because BREAK was requested.
     */
    private boolean runRound(LoopFormAction loop, ActionContext context, LoopRun run,
                             int index, Object item, Object total, Map<String, Object> extras) {
        checkGuards(loop, context, run, index);
        run.status = LoopStatus.ITERATING;
        run.iterationCount++;

        if (Boolean.TRUE.equals(loop.getShowProgress())) {
            log.info("[LOOP] {} progress {}/{}", loop.getId(), index + 1, total != null ? total : "?");
        }

        Map<String, Object> frame = buildFrame(loop, index, item, total, extras);
        LoopContext parent = context.getLoopContext();
        LoopContext iterationLoop = LoopContext.builder()
                .variables(frame)
                .depth(parent != null ? parent.getDepth() + 1 : 1)
                .canBreak(true)
                .canContinue(true)
                .parent(parent)
                .build();
        ActionContext iterationContext = context.forIteration(iterationLoop);

        LoopVariableScope scope = context.getScope();
        scope.push(frame);
        try {
            boolean keepGoing = runIteration(loop, iterationContext, run, index);
            if (!keepGoing) {
                run.status = LoopStatus.BROKEN;
            }
            return keepGoing;
        } finally {
            scope.pop();
        }
    }

    private boolean runIteration(LoopFormAction loop, ActionContext iterationContext, LoopRun run, int index) {
        int maxRetries = run.strategy == ErrorHandlingStrategy.RETRY
                ? Math.max(0, loop.getRetryCount() != null ? loop.getRetryCount() : DEFAULT_RETRY_COUNT)
                : 0;
        long retryDelay = loop.getRetryDelay() != null ? Math.max(0L, loop.getRetryDelay()) : DEFAULT_RETRY_DELAY_MS;
        int attempt = 0;

        while (true) {
            attempt++;
            LoopContext loopContext = iterationContext.getLoopContext();
            loopContext.setBreakRequested(false);
            loopContext.setContinueRequested(false);
            try {
                runBody(loop, iterationContext, run, index);
                return !loopContext.isBreakRequested();
            } catch (LoopBreakSignal signal) {
                log.debug("[LOOP] Break in '{}' at iteration {}", loop.getId(), index + 1);
                return false;
            } catch (LoopContinueSignal signal) {
                log.debug("[LOOP] Continue in '{}' at iteration {}", loop.getId(), index + 1);
                return true;
            } catch (LoopMaxIterationException | LoopCancelledException | LoopUsageException fatal) {
                throw fatal;
            } catch (RuntimeException ex) {
                String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                switch (run.strategy) {
                    case CONTINUE -> {
                        run.skippedIterations++;
                        log.warn("[LOOP] Iteration {} of '{}' failed, skipping: {}", index + 1, loop.getId(), msg);
                        return true;
                    }
                    case RETRY -> {
                        if (attempt > maxRetries) {
                            log.warn("[LOOP] Iteration {} of '{}' failed after {} attempt(s)", index + 1, loop.getId(), attempt);
                            throw ex;
                        }
                        run.retries++;
                        log.warn("[LOOP] Iteration {} of '{}' failed on attempt {}/{}. Retrying in {} ms",
                                index + 1, loop.getId(), attempt, maxRetries + 1, retryDelay);
                        if (retryDelay > 0) {
                            try {
                                Thread.sleep(retryDelay);
                            } catch (InterruptedException ie) {
                                Thread.currentThread().interrupt();
                                log.warn("[LOOP] Retry sleep interrupted for '{}', aborting further retries", loop.getId());
                                throw ex;
                            }
                        }
                    }
                    default -> throw ex;
                }
            }
        }
    }

    private void runBody(LoopFormAction loop, ActionContext iterationContext, LoopRun run, int index) {
        List<FormAction> actions = run.group.getActions();
        Long limit = loop.getSingleIterationTimeout();
        if (limit == null || limit <= 0) {
            actionChain.run(actions, iterationContext);
            return;
        }

        CancellationToken parentToken = iterationContext.getCancellation();
        CancellationToken attemptToken = parentToken != null ? parentToken.child() : new CancellationToken();
        AtomicBoolean expired = new AtomicBoolean();
        ScheduledFuture<?> deadline = deadlineScheduler.schedule(() -> {
            expired.set(true);
            attemptToken.cancel();
        }, Instant.now().plusMillis(limit));

        try {
            actionChain.run(actions, iterationContext.withCancellation(attemptToken));
        } catch (LoopControlSignal signal) {
            throw signal;
        } catch (RuntimeException ex) {
            // nested loops report the deadline as a cancellation; it is this iteration's timeout
            if (timedOut(expired, parentToken)) {
                throw iterationTimeout(loop, index, limit);
            }
            throw ex;
        } finally {
            deadline.cancel(false);
        }
        if (timedOut(expired, parentToken)) {
            throw iterationTimeout(loop, index, limit);
        }
    }

    private static boolean timedOut(AtomicBoolean expired, CancellationToken parentToken) {
        return expired.get() && (parentToken == null || !parentToken.isCancelled());
    }

    private static LoopTimeoutException iterationTimeout(LoopFormAction loop, int index, long limit) {
        return new LoopTimeoutException(
                "Iteration " + (index + 1) + " of loop '" + loop.getId() + "' exceeded " + limit + "ms", limit);
    }

    private void checkGuards(LoopFormAction loop, ActionContext context, LoopRun run, int index) {
        if (context.isCancelled()) {
            throw new LoopCancelledException();
        }
        Long timeout = loop.getTimeout();
        if (timeout != null && timeout > 0 && System.currentTimeMillis() - run.startedAt > timeout) {
            throw new LoopTimeoutException("Loop '" + loop.getId() + "' exceeded timeout of " + timeout + "ms", timeout);
        }
        if (index >= run.maxIterations) {
            throw new LoopMaxIterationException(run.maxIterations);
        }
    }

    private static Map<String, Object> buildFrame(LoopFormAction loop, int index, Object item, Object total,
                                                  Map<String, Object> extras) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(VariableConstants.DEFAULT_ITEM_VARIABLE, item);
        frame.put(VariableConstants.DEFAULT_INDEX_VARIABLE, index);
        if (total != null) frame.put(VariableConstants.DEFAULT_TOTAL_VARIABLE, total);
        frame.put(VariableConstants.ITERATION_VARIABLE, index + 1);

        frame.put(VariableNameValidator.sanitize(loop.getItemVariableName(), VariableConstants.DEFAULT_ITEM_VARIABLE), item);
        frame.put(VariableNameValidator.sanitize(loop.getIndexVariableName(), VariableConstants.DEFAULT_INDEX_VARIABLE), index);
        if (total != null) {
            frame.put(VariableNameValidator.sanitize(loop.getTotalVariableName(), VariableConstants.DEFAULT_TOTAL_VARIABLE), total);
        }
        frame.putAll(extras);
        return frame;
    }

    private static void putAlias(Map<String, Object> extras, String alias, Object value) {
        if (VariableNameValidator.isValid(alias)) {
            extras.put(alias.trim(), value);
        }
    }

    private static ErrorHandlingStrategy resolveStrategy(LoopFormAction loop, ActionGroup group) {
        if (group.getErrorHandlingStrategy() != null) return group.getErrorHandlingStrategy();
        if (loop.getErrorHandlingStrategy() != null) return loop.getErrorHandlingStrategy();
        return ErrorHandlingStrategy.STOP;
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoopCancelledException();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static Map<String, Object> output(LoopRun run) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status", run.status.name());
        output.put("iterationCount", run.iterationCount);
        output.put("skippedIterations", run.skippedIterations);
        output.put("retries", run.retries);
        return output;
    }

    // Mutable bookkeeping of one loop execution
    private static final class LoopRun {
        ActionGroup group;
        ErrorHandlingStrategy strategy = ErrorHandlingStrategy.STOP;
        int maxIterations;
        long startedAt;
        LoopStatus status = LoopStatus.PENDING;
        int iterationCount;
        int skippedIterations;
        int retries;
    }
}
