package automata.engine.integration;

import automata.engine.model.ScheduledTask;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * One-time tasks run at {@code schedule.at} (ISO-8601 or epoch millis);
 * recurring tasks with {@code schedule.intervalMs} run that long after the reference instant.
 * Cron schedules are left to an external calculator and yield null here.
 */
public class DefaultScheduleCalculator implements ScheduleCalculator {

    @Override
    public Instant nextRun(ScheduledTask task, Instant after) {
        JsonNode schedule = task.schedule();
        if (schedule == null) {
            return null;
        }
        switch (task.type()) {
            case ONE_TIME:
                return parseInstant(schedule.get("at"));
            case RECURRING:
                JsonNode interval = schedule.get("intervalMs");
                if (interval != null && interval.canConvertToLong() && interval.asLong() > 0) {
                    return after.plusMillis(interval.asLong());
                }
                return null;
            default:
                return null;
        }
    }

    static Instant parseInstant(JsonNode at) {
        if (at == null || at.isNull()) {
            return null;
        }
        if (at.isNumber()) {
            return Instant.ofEpochMilli(at.asLong());
        }
        try {
            return Instant.parse(at.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid schedule.at: " + at.asText(), e);
        }
    }
}
