package automata.engine.repository;

import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskCounts;
import automata.engine.model.TaskExecution;
import automata.engine.model.TaskStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of scheduled tasks and their execution history.
 * Every operation may throw {@link automata.engine.exception.StoreException}.
 */
public interface TaskStore {

    // ---------- definitions ----------

    /**
     * Insert a new task.
     *
     * @param task the task to save
     */
    void save(ScheduledTask task);

    Optional<ScheduledTask> findById(String taskId);

    /**
     * Tasks of one owner, newest first.
     *
     * @param userId the owner
     * @param status optional status filter, null for all
     * @param limit  maximum number of results
     */
    List<ScheduledTask> findByUser(String userId, TaskStatus status, int limit);

    /**
     * Active tasks of one owner with a next run, soonest first.
     */
    List<ScheduledTask> findUpcoming(String userId, int limit);

    boolean updateStatus(String taskId, TaskStatus status);

    boolean updateNextRun(String taskId, Instant nextRun);

    // ---------- polling ----------

    /**
     * Atomically claim up to {@code limit} due tasks: active, one-time or recurring,
     * nextRun not after now, ordered by nextRun. A task claimed by another caller
     * and not yet released or expired is skipped, never waited for.
     *
     * @param limit maximum tasks to claim
     * @return claimed tasks as they were before the attempt
     */
    List<ScheduledTask> selectDueTasks(int limit);

    /**
     * Permanently fail a task and release its claim.
     */
    boolean markFailed(String taskId);

    /**
     * Move nextRun to {@code instant} and release the claim; status is unchanged.
     */
    boolean rescheduleAt(String taskId, Instant instant);

    // ---------- execution history ----------

    /**
     * Insert a running execution record.
     *
     * @return the execution id
     */
    String startExecution(String taskId, Instant startedAt, List<String> logs);

    /**
     * In one transaction: complete the execution, bump runCount, set lastRun and
     * nextRun, complete one-time tasks and release the claim.
     */
    void recordSuccess(ScheduledTask task, String executionId, JsonNode result, List<String> logs,
            Instant completedAt, Instant nextRun);

    /**
     * In one transaction: fail the execution, bump runCount and set lastRun.
     * The claim is kept until failure handling reschedules or fails the task.
     */
    void recordFailure(ScheduledTask task, String executionId, String error, List<String> logs,
            Instant completedAt);

    /**
     * Conditions were not met: complete the execution without counting an attempt,
     * move nextRun and release the claim.
     */
    void recordSkipped(ScheduledTask task, String executionId, List<String> logs, Instant completedAt,
            Instant nextRun);

    /**
     * Executions of a task, newest first.
     */
    List<TaskExecution> findExecutions(String taskId, int limit);

    // ---------- maintenance ----------

    /**
     * Delete completed one-time tasks last updated more than {@code olderThanDays} ago.
     *
     * @return number of tasks deleted
     */
    int pruneCompleted(int olderThanDays);

    /**
     * Keep only the {@code keepPerTask} most recent executions of every task.
     *
     * @return number of executions deleted
     */
    int pruneExecutionHistory(int keepPerTask);

    TaskCounts getCounts(Duration dueWithin);
}
