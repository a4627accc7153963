package automata.engine.scheduler;

import automata.engine.config.EngineConfig;
import automata.engine.integration.RecurringSchedules;
import automata.engine.model.CleanupResult;
import automata.engine.model.RetryPolicy;
import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskCounts;
import automata.engine.repository.TaskStore;
import automata.engine.service.TaskExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the store for due tasks and dispatches them.
 * <p>
 * A single timer thread fires every poll interval; each tick hands a poll cycle to the
 * poll executor, so a slow cycle never delays the next one. A cycle claims up to
 * {@code batchSize} due tasks, runs them concurrently on the dispatch executor and waits
 * for all of them. Failed tasks are retried with backoff or marked failed.
 */
public class SchedulerWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerWorker.class);

    private final TaskStore store;
    private final TaskExecutionService executionService;
    private final BackoffPolicy backoff;
    private final RecurringSchedules recurringSchedules;
    private final EngineConfig config;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private volatile WorkerState state = WorkerState.STOPPED;
    private ScheduledExecutorService timer;
    private ExecutorService pollExecutor;
    private volatile ExecutorService dispatchExecutor;

    public SchedulerWorker(TaskStore store, TaskExecutionService executionService, BackoffPolicy backoff,
            RecurringSchedules recurringSchedules, EngineConfig config, Clock clock) {
        this.store = store;
        this.executionService = executionService;
        this.backoff = backoff;
        this.recurringSchedules = recurringSchedules;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Start polling. The first cycle runs immediately.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (state != WorkerState.STOPPED) {
                log.warn("Scheduler worker already running");
                return;
            }
            state = WorkerState.STARTING;

            try {
                recurringSchedules.initialize();
            } catch (RuntimeException e) {
                state = WorkerState.STOPPED;
                log.error("Scheduler worker {} failed to start", config.workerId(), e);
                throw e;
            }

            timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("automata-timer"));
            pollExecutor = Executors.newCachedThreadPool(daemonThreads("automata-poll"));
            dispatchExecutor = Executors.newCachedThreadPool(daemonThreads("automata-dispatch"));

            long intervalMs = config.pollInterval().toMillis();
            timer.scheduleAtFixedRate(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);

            state = WorkerState.RUNNING;
            log.info("Scheduler worker {} started: poll every {}ms, batch size {}",
                    config.workerId(), intervalMs, config.batchSize());
        }
    }

    /**
     * Stop polling and wait briefly for running cycles.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (state == WorkerState.STOPPED) {
                return;
            }

            if (timer != null) {
                timer.shutdownNow();
            }
            shutdownGracefully("poll", pollExecutor);
            shutdownGracefully("dispatch", dispatchExecutor);
            timer = null;
            pollExecutor = null;
            dispatchExecutor = null;

            recurringSchedules.shutdown();

            state = WorkerState.STOPPED;
            log.info("Scheduler worker {} stopped", config.workerId());
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return state == WorkerState.RUNNING;
    }

    public WorkerStatus getStatus() {
        WorkerState current = state;
        return new WorkerStatus(current == WorkerState.RUNNING, current,
                config.pollInterval().toMillis(), config.batchSize());
    }

    public TaskCounts getStats() {
        return store.getCounts(config.dueSoonWindow());
    }

    /**
     * Run one poll cycle on the calling thread: claim due tasks, run them all and
     * wait for every outcome.
     */
    public PollSummary pollAndExecute() {
        List<ScheduledTask> due;
        try {
            due = store.selectDueTasks(config.batchSize());
        } catch (RuntimeException e) {
            log.error("Failed to select due tasks", e);
            return PollSummary.EMPTY;
        }

        if (due.isEmpty()) {
            return PollSummary.EMPTY;
        }
        log.info("Dispatching {} due task(s)", due.size());

        ExecutorService dispatcher = dispatchExecutor;
        boolean ownDispatcher = dispatcher == null;
        if (ownDispatcher) {
            dispatcher = Executors.newCachedThreadPool(daemonThreads("automata-dispatch"));
        }

        try {
            List<CompletableFuture<Boolean>> outcomes = new ArrayList<>();
            for (ScheduledTask task : due) {
                try {
                    outcomes.add(CompletableFuture.supplyAsync(() -> runTask(task), dispatcher));
                } catch (RejectedExecutionException e) {
                    // claim expires and another cycle picks the task up
                    log.warn("Dispatch of task {} rejected, worker is stopping", task.id());
                }
            }

            CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).join();

            int succeeded = 0;
            for (CompletableFuture<Boolean> outcome : outcomes) {
                if (outcome.join()) {
                    succeeded++;
                }
            }
            PollSummary summary = new PollSummary(due.size(), succeeded, outcomes.size() - succeeded);
            log.info("Poll cycle finished: {} selected, {} succeeded, {} failed",
                    summary.selected(), summary.succeeded(), summary.failed());
            return summary;
        } finally {
            if (ownDispatcher) {
                dispatcher.shutdown();
            }
        }
    }

    /**
     * Delete old completed one-time tasks and trim execution history.
     */
    public CleanupResult cleanup(int olderThanDays) {
        log.info("Running cleanup (older than {} days)", olderThanDays);
        int tasksDeleted = store.pruneCompleted(olderThanDays);
        int executionsDeleted = store.pruneExecutionHistory(config.executionHistoryCap());
        log.info("Cleanup completed: {} task(s), {} execution(s) deleted", tasksDeleted, executionsDeleted);
        return new CleanupResult(tasksDeleted, executionsDeleted);
    }

    public CleanupResult cleanup() {
        return cleanup(config.retentionDays());
    }

    private void tick() {
        try {
            pollExecutor.execute(this::runPollCycle);
        } catch (RejectedExecutionException e) {
            log.debug("Poll tick skipped, worker is stopping");
        } catch (RuntimeException e) {
            log.error("Poll tick failed", e);
        }
    }

    private void runPollCycle() {
        try {
            pollAndExecute();
        } catch (Exception e) {
            log.error("Poll cycle failed", e);
        }
    }

    /**
     * @return true when the attempt succeeded
     */
    private boolean runTask(ScheduledTask task) {
        try {
            executionService.execute(task);
            return true;
        } catch (Exception e) {
            log.error("Task {} ('{}') failed: {}", task.id(), task.name(), e.getMessage());
            handleFailure(task);
            return false;
        }
    }

    private void handleFailure(ScheduledTask task) {
        try {
            RetryPolicy policy = task.retryPolicy();
            if (policy == null) {
                store.markFailed(task.id());
                log.warn("Task {} marked failed (no retry policy)", task.id());
            } else if (!policy.allowsRetry(task.runCount())) {
                store.markFailed(task.id());
                log.warn("Task {} marked failed after {} attempt(s)", task.id(), task.runCount() + 1);
            } else {
                Duration delay = backoff.delay(task.runCount(), policy.backoffMs());
                Instant retryAt = clock.instant().plus(delay);
                store.rescheduleAt(task.id(), retryAt);
                log.info("Task {} scheduled for retry {}/{} in {}ms",
                        task.id(), task.runCount() + 1, policy.maxRetries(), delay.toMillis());
            }
        } catch (RuntimeException e) {
            log.error("Failure handling for task {} failed", task.id(), e);
        }
    }

    private static void shutdownGracefully(String name, ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("{} executor forcefully stopped", name);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
