package automata.engine.service;

import automata.engine.exception.TaskNotFoundException;
import automata.engine.exception.TaskValidationException;
import automata.engine.integration.ScheduleCalculator;
import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskExecution;
import automata.engine.model.TaskStatus;
import automata.engine.repository.TaskStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Task lifecycle operations: create, inspect, pause, resume and run on demand.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskStore store;
    private final TaskExecutionService executionService;
    private final ScheduleCalculator scheduleCalculator;
    private final Clock clock;

    public TaskService(TaskStore store, TaskExecutionService executionService,
            ScheduleCalculator scheduleCalculator, Clock clock) {
        this.store = store;
        this.executionService = executionService;
        this.scheduleCalculator = scheduleCalculator;
        this.clock = clock;
    }

    /**
     * Validate and persist a new active task.
     *
     * @throws TaskValidationException if the definition is incomplete
     */
    public ScheduledTask createTask(NewTask input) {
        validate(input);

        Instant now = clock.instant();
        ScheduledTask draft = ScheduledTask.builder()
                .id(UUID.randomUUID().toString())
                .userId(input.userId())
                .name(input.name())
                .description(input.description())
                .type(input.type())
                .schedule(input.schedule())
                .trigger(input.trigger())
                .action(input.action())
                .conditions(input.conditions())
                .retryPolicy(input.retryPolicy())
                .notification(input.notification())
                .status(TaskStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Instant nextRun;
        try {
            nextRun = scheduleCalculator.nextRun(draft, now);
        } catch (IllegalArgumentException e) {
            throw new TaskValidationException(e.getMessage());
        }

        ScheduledTask task = draft.toBuilder().nextRun(nextRun).build();
        store.save(task);

        log.info("Task created: {} ({}, next run {})", task.id(), task.type().value(), nextRun);
        return task;
    }

    public ScheduledTask getTask(String taskId) {
        return store.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public List<ScheduledTask> listTasks(String userId, TaskStatus status, int limit) {
        return store.findByUser(userId, status, limit);
    }

    public void pauseTask(String taskId) {
        if (!store.updateStatus(taskId, TaskStatus.PAUSED)) {
            throw new TaskNotFoundException(taskId);
        }
        log.info("Task paused: {}", taskId);
    }

    /**
     * Reactivate a task; a missing next run is recomputed from now.
     */
    public ScheduledTask resumeTask(String taskId) {
        if (!store.updateStatus(taskId, TaskStatus.ACTIVE)) {
            throw new TaskNotFoundException(taskId);
        }

        ScheduledTask task = getTask(taskId);
        if (task.nextRun() == null) {
            Instant nextRun = scheduleCalculator.nextRun(task, clock.instant());
            if (nextRun != null) {
                store.updateNextRun(taskId, nextRun);
                task = task.toBuilder().nextRun(nextRun).build();
            }
        }

        log.info("Task resumed: {} (next run {})", taskId, task.nextRun());
        return task;
    }

    /**
     * Execute a task immediately, outside its schedule.
     *
     * @throws automata.engine.exception.ActionException if the action fails
     */
    public TaskExecution runNow(String taskId) {
        ScheduledTask task = getTask(taskId);
        log.info("Running task {} on demand", taskId);
        return executionService.execute(task);
    }

    public List<TaskExecution> getExecutions(String taskId, int limit) {
        return store.findExecutions(taskId, limit);
    }

    public List<ScheduledTask> getUpcoming(String userId, int limit) {
        return store.findUpcoming(userId, limit);
    }

    private static void validate(NewTask input) {
        if (input.name() == null || input.name().isBlank()) {
            throw new TaskValidationException("Task name is required");
        }
        if (input.type() == null) {
            throw new TaskValidationException("Task type is required");
        }
        if (input.action() == null) {
            throw new TaskValidationException("Task action is required");
        }

        JsonNode schedule = input.schedule();
        switch (input.type()) {
            case ONE_TIME:
                if (schedule == null || !schedule.hasNonNull("at")) {
                    throw new TaskValidationException("one-time tasks require schedule.at");
                }
                break;
            case RECURRING:
                if (schedule == null || !(schedule.hasNonNull("cron") || schedule.hasNonNull("intervalMs"))) {
                    throw new TaskValidationException("recurring tasks require schedule.cron or schedule.intervalMs");
                }
                if (schedule.hasNonNull("intervalMs") && schedule.get("intervalMs").asLong() <= 0) {
                    throw new TaskValidationException("schedule.intervalMs must be positive");
                }
                break;
            case TRIGGER:
                if (input.trigger() == null || input.trigger().isNull()) {
                    throw new TaskValidationException("trigger tasks require trigger configuration");
                }
                break;
            default:
                throw new TaskValidationException("Unsupported task type: " + input.type());
        }
    }
}
