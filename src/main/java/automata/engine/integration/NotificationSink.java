package automata.engine.integration;

import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskExecution;

/**
 * Receives task outcome notifications requested by a task's notification settings.
 */
public interface NotificationSink {

    void notify(ScheduledTask task, NotificationKind kind, TaskExecution execution);
}
