package automata.engine.integration;

import automata.engine.model.ScheduledTask;

import java.time.Instant;

/**
 * Computes when a task should run next.
 */
@FunctionalInterface
public interface ScheduleCalculator {

    /**
     * @param after reference instant, normally the completion time of the last run
     * @return next run, or null when the task has no further runs
     */
    Instant nextRun(ScheduledTask task, Instant after);
}
