package automata.engine.integration;

import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: writes notifications to the application log.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(ScheduledTask task, NotificationKind kind, TaskExecution execution) {
        if (kind == NotificationKind.SUCCESS) {
            log.info("Task '{}' ({}) succeeded in {} ms", task.name(), task.id(), execution.durationMs());
        } else {
            log.warn("Task '{}' ({}) failed: {}", task.name(), task.id(), execution.error());
        }
    }
}
