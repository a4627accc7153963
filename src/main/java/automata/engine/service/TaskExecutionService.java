package automata.engine.service;

import automata.engine.config.EngineConfig;
import automata.engine.exception.ActionException;
import automata.engine.executor.ActionExecutor;
import automata.engine.executor.ExecutionLog;
import automata.engine.integration.ConditionEvaluator;
import automata.engine.integration.NotificationKind;
import automata.engine.integration.NotificationSink;
import automata.engine.integration.ScheduleCalculator;
import automata.engine.logging.TaskLogContext;
import automata.engine.model.ExecutionStatus;
import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskExecution;
import automata.engine.model.TaskType;
import automata.engine.model.action.TaskAction;
import automata.engine.repository.TaskStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one attempt of a task and records its outcome.
 * <p>
 * The attempt gets an execution record, a condition check, the action itself
 * (bounded by the configured action timeout), the success or failure bookkeeping
 * in the store and the notifications the task asked for.
 */
public class TaskExecutionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionService.class);

    private final TaskStore store;
    private final ActionExecutor actionExecutor;
    private final ConditionEvaluator conditionEvaluator;
    private final ScheduleCalculator scheduleCalculator;
    private final NotificationSink notificationSink;
    private final Duration actionTimeout;
    private final Clock clock;
    private final ExecutorService actionPool;

    public TaskExecutionService(TaskStore store, ActionExecutor actionExecutor,
            ConditionEvaluator conditionEvaluator, ScheduleCalculator scheduleCalculator,
            NotificationSink notificationSink, EngineConfig config, Clock clock) {
        this.store = store;
        this.actionExecutor = actionExecutor;
        this.conditionEvaluator = conditionEvaluator;
        this.scheduleCalculator = scheduleCalculator;
        this.notificationSink = notificationSink;
        this.actionTimeout = config.actionTimeout();
        this.clock = clock;

        AtomicInteger threadCounter = new AtomicInteger();
        this.actionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "automata-action-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Execute one attempt of {@code task}.
     *
     * @return the completed execution, also when conditions were not met
     * @throws ActionException when the action fails or times out; the failure is already recorded
     * @throws automata.engine.exception.StoreException when the outcome cannot be persisted
     */
    public TaskExecution execute(ScheduledTask task) {
        Instant startedAt = clock.instant();
        ExecutionLog executionLog = new ExecutionLog();
        executionLog.append("Starting task execution: " + task.name());

        String executionId = store.startExecution(task.id(), startedAt, executionLog.lines());

        try (TaskLogContext ctx = TaskLogContext.forExecution(task.id(), executionId)) {
            log.info("Executing task '{}' (attempt {})", task.name(), task.runCount() + 1);

            try {
                if (task.hasConditions() && !conditionEvaluator.evaluate(task)) {
                    return skip(task, executionId, startedAt, executionLog);
                }
                executionLog.append("Executing action: " + task.action().type().wireName());
                JsonNode result = runWithTimeout(task.action(), executionLog);
                // a store error while recording the outcome counts as a failed attempt
                return succeed(task, executionId, startedAt, executionLog, result);
            } catch (RuntimeException e) {
                fail(task, executionId, startedAt, executionLog, e);
                throw e;
            }
        }
    }

    private TaskExecution succeed(ScheduledTask task, String executionId, Instant startedAt,
            ExecutionLog executionLog, JsonNode result) {
        Instant completedAt = clock.instant();
        long durationMs = Duration.between(startedAt, completedAt).toMillis();
        executionLog.append("Task completed successfully in " + durationMs + "ms");

        Instant nextRun = task.type() == TaskType.ONE_TIME ? null : scheduleCalculator.nextRun(task, completedAt);
        store.recordSuccess(task, executionId, result, executionLog.lines(), completedAt, nextRun);

        TaskExecution execution = new TaskExecution(executionId, task.id(), ExecutionStatus.COMPLETED, startedAt,
                completedAt, durationMs, result, null, executionLog.lines());

        log.info("Task '{}' completed in {} ms, next run: {}", task.name(), durationMs, nextRun);
        if (task.notificationEnabled("onSuccess")) {
            notifySafely(task, NotificationKind.SUCCESS, execution);
        }
        return execution;
    }

    private TaskExecution skip(ScheduledTask task, String executionId, Instant startedAt,
            ExecutionLog executionLog) {
        executionLog.append("Conditions not met, skipping execution");
        Instant completedAt = clock.instant();

        // one-time tasks keep their slot and are checked again on the next poll
        Instant nextRun = task.type() == TaskType.ONE_TIME
                ? task.nextRun()
                : scheduleCalculator.nextRun(task, completedAt);
        store.recordSkipped(task, executionId, executionLog.lines(), completedAt, nextRun);

        log.info("Conditions of task '{}' not met, skipped", task.name());
        return new TaskExecution(executionId, task.id(), ExecutionStatus.COMPLETED, startedAt, completedAt,
                Duration.between(startedAt, completedAt).toMillis(), null, null, executionLog.lines());
    }

    private void fail(ScheduledTask task, String executionId, Instant startedAt, ExecutionLog executionLog,
            RuntimeException error) {
        executionLog.append("Task failed: " + error.getMessage());
        Instant completedAt = clock.instant();

        try {
            store.recordFailure(task, executionId, error.getMessage(), executionLog.lines(), completedAt);
        } catch (RuntimeException storeError) {
            error.addSuppressed(storeError);
            log.error("Failed to record failure of task '{}'", task.name(), storeError);
        }

        log.warn("Task '{}' failed: {}", task.name(), error.getMessage());
        if (task.notificationEnabled("onFailure")) {
            TaskExecution execution = new TaskExecution(executionId, task.id(), ExecutionStatus.FAILED, startedAt,
                    completedAt, Duration.between(startedAt, completedAt).toMillis(), null, error.getMessage(),
                    executionLog.lines());
            notifySafely(task, NotificationKind.FAILURE, execution);
        }
    }

    /**
     * Runs the action against its own log. Its lines are merged into {@code executionLog} when
     * the action ends, or as a snapshot on timeout, so an action that ignores the interrupt
     * cannot write into an execution that was already recorded.
     */
    private JsonNode runWithTimeout(TaskAction action, ExecutionLog executionLog) {
        ExecutionLog actionLog = new ExecutionLog();
        Future<JsonNode> future = actionPool.submit(
                TaskLogContext.propagate(() -> actionExecutor.execute(action, actionLog)));
        try {
            JsonNode result = future.get(actionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            executionLog.appendAll(actionLog.lines());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            executionLog.appendAll(actionLog.lines());
            throw new ActionException("Action timed out after " + actionTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            executionLog.appendAll(actionLog.lines());
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ActionException(cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            executionLog.appendAll(actionLog.lines());
            Thread.currentThread().interrupt();
            throw new ActionException("Interrupted while executing action", e);
        }
    }

    private void notifySafely(ScheduledTask task, NotificationKind kind, TaskExecution execution) {
        try {
            notificationSink.notify(task, kind, execution);
        } catch (RuntimeException e) {
            log.warn("Notification {} for task '{}' failed: {}", kind, task.name(), e.getMessage());
        }
    }

    @Override
    public void close() {
        actionPool.shutdownNow();
    }
}
