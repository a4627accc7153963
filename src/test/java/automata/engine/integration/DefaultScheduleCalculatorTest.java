package automata.engine.integration;

import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskType;
import automata.engine.model.action.FileOperationAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DefaultScheduleCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final DefaultScheduleCalculator calculator = new DefaultScheduleCalculator();

    private static ScheduledTask task(TaskType type, JsonNode schedule) {
        return ScheduledTask.builder()
                .id("t-1")
                .userId("user-1")
                .name("calc")
                .type(type)
                .schedule(schedule)
                .action(new FileOperationAction("read", "/tmp/x"))
                .build();
    }

    @Test
    void oneTimeAcceptsIsoAndEpochMillis() {
        assertEquals(Instant.parse("2024-03-05T08:30:00Z"),
                calculator.nextRun(task(TaskType.ONE_TIME, Json.object().put("at", "2024-03-05T08:30:00Z")), NOW));
        assertEquals(Instant.ofEpochMilli(1_709_000_000_000L),
                calculator.nextRun(task(TaskType.ONE_TIME, Json.object().put("at", 1_709_000_000_000L)), NOW));
    }

    @Test
    void oneTimeIgnoresReferenceInstant() {
        ScheduledTask task = task(TaskType.ONE_TIME, Json.object().put("at", "2024-03-05T08:30:00Z"));

        assertEquals(calculator.nextRun(task, NOW), calculator.nextRun(task, NOW.plusSeconds(3600)));
    }

    @Test
    void invalidOneTimeInstantIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> calculator.nextRun(task(TaskType.ONE_TIME, Json.object().put("at", "soon")), NOW));
        assertEquals("Invalid schedule.at: soon", e.getMessage());
    }

    @Test
    void recurringIntervalCountsFromReference() {
        ScheduledTask task = task(TaskType.RECURRING, Json.object().put("intervalMs", 90_000));

        assertEquals(NOW.plusSeconds(90), calculator.nextRun(task, NOW));
    }

    @Test
    void unsupportedSchedulesYieldNull() {
        assertNull(calculator.nextRun(task(TaskType.RECURRING, Json.object().put("cron", "*/5 * * * *")), NOW));
        assertNull(calculator.nextRun(task(TaskType.RECURRING, Json.object().put("intervalMs", -5)), NOW));
        assertNull(calculator.nextRun(task(TaskType.TRIGGER, Json.object()), NOW));
        assertNull(calculator.nextRun(task(TaskType.ONE_TIME, null), NOW));
    }
}
