package automata.engine.service;

import automata.engine.config.EngineConfig;
import automata.engine.exception.TaskNotFoundException;
import automata.engine.exception.TaskValidationException;
import automata.engine.executor.ActionExecutor;
import automata.engine.integration.Collaborators;
import automata.engine.integration.ConditionEvaluator;
import automata.engine.integration.DefaultScheduleCalculator;
import automata.engine.integration.LoggingNotificationSink;
import automata.engine.model.ExecutionStatus;
import automata.engine.model.RetryPolicy;
import automata.engine.model.ScheduledTask;
import automata.engine.model.TaskExecution;
import automata.engine.model.TaskStatus;
import automata.engine.model.TaskType;
import automata.engine.model.action.FileOperationAction;
import automata.engine.model.action.TaskAction;
import automata.engine.store.Database;
import automata.engine.store.JdbcTaskStore;
import automata.engine.support.MutableClock;
import automata.engine.util.Json;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final TaskAction ACTION = new FileOperationAction("read", "/tmp/report.csv");

    private static Database db;
    private static EngineConfig config;

    private MutableClock clock;
    private JdbcTaskStore store;
    private TaskExecutionService executionService;
    private TaskService service;

    @BeforeAll
    static void setupDb() {
        config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
    }

    @AfterAll
    static void teardownDb() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_executions");
            st.execute("DELETE FROM scheduled_tasks");
            conn.commit();
        }
        clock = new MutableClock(T0);
        store = new JdbcTaskStore(db, config, clock);
        executionService = new TaskExecutionService(store, new ActionExecutor(Collaborators.none(), config, clock),
                ConditionEvaluator.ALWAYS, new DefaultScheduleCalculator(), new LoggingNotificationSink(),
                config, clock);
        service = new TaskService(store, executionService, new DefaultScheduleCalculator(), clock);
    }

    @AfterEach
    void tearDown() {
        executionService.close();
    }

    private static NewTask recurring(String name, long intervalMs) {
        return new NewTask("user-1", name, null, TaskType.RECURRING,
                Json.object().put("intervalMs", intervalMs), null, ACTION, null, null, null);
    }

    @Test
    void createOneTimeTaskSchedulesAtRequestedInstant() {
        ScheduledTask task = service.createTask(NewTask.oneTime("user-1", "nightly export",
                Json.object().put("at", "2024-03-02T03:00:00Z"), ACTION)
                .withRetryPolicy(new RetryPolicy(3, 500)));

        assertNotNull(task.id());
        assertEquals(TaskStatus.ACTIVE, task.status());
        assertEquals(Instant.parse("2024-03-02T03:00:00Z"), task.nextRun());
        assertEquals(0, task.runCount());

        ScheduledTask stored = service.getTask(task.id());
        assertEquals(task.nextRun(), stored.nextRun());
        assertEquals(new RetryPolicy(3, 500), stored.retryPolicy());
        assertEquals(T0, stored.createdAt());
    }

    @Test
    void createRecurringTaskUsesInterval() {
        ScheduledTask task = service.createTask(recurring("heartbeat", 60_000));

        assertEquals(T0.plusSeconds(60), task.nextRun());
    }

    @Test
    void cronTaskIsCreatedWithoutNextRun() {
        ScheduledTask task = service.createTask(new NewTask("user-1", "weekly", null, TaskType.RECURRING,
                Json.object().put("cron", "0 9 * * 1"), null, ACTION, null, null, null));

        assertNull(task.nextRun());
        assertEquals(TaskStatus.ACTIVE, service.getTask(task.id()).status());
    }

    @Test
    void triggerTaskRequiresTriggerConfig() {
        NewTask missing = new NewTask("user-1", "on upload", null, TaskType.TRIGGER, null, null, ACTION,
                null, null, null);
        assertThrows(TaskValidationException.class, () -> service.createTask(missing));

        ScheduledTask task = service.createTask(new NewTask("user-1", "on upload", null, TaskType.TRIGGER, null,
                Json.object().put("event", "file.uploaded"), ACTION, null, null, null));
        assertNull(task.nextRun());
    }

    @Test
    void invalidDefinitionsAreRejected() {
        assertThrows(TaskValidationException.class, () -> service.createTask(
                NewTask.oneTime("user-1", " ", Json.object().put("at", T0.toString()), ACTION)));
        assertThrows(TaskValidationException.class, () -> service.createTask(
                NewTask.oneTime("user-1", "no action", Json.object().put("at", T0.toString()), null)));
        assertThrows(TaskValidationException.class, () -> service.createTask(
                NewTask.oneTime("user-1", "no time", Json.object(), ACTION)));
        assertThrows(TaskValidationException.class, () -> service.createTask(recurring("zero", 0)));

        TaskValidationException badTime = assertThrows(TaskValidationException.class, () -> service.createTask(
                NewTask.oneTime("user-1", "bad time", Json.object().put("at", "tomorrow"), ACTION)));
        assertEquals("Invalid schedule.at: tomorrow", badTime.getMessage());

        assertTrue(service.listTasks("user-1", null, 10).isEmpty());
    }

    @Test
    void pauseAndResume() {
        ScheduledTask task = service.createTask(recurring("heartbeat", 60_000));

        service.pauseTask(task.id());
        assertEquals(TaskStatus.PAUSED, service.getTask(task.id()).status());
        assertEquals(List.of(task.id()),
                service.listTasks("user-1", TaskStatus.PAUSED, 10).stream().map(ScheduledTask::id).toList());

        ScheduledTask resumed = service.resumeTask(task.id());
        assertEquals(TaskStatus.ACTIVE, resumed.status());
        assertEquals(task.nextRun(), resumed.nextRun());
    }

    @Test
    void resumeRecomputesMissingNextRun() {
        ScheduledTask task = service.createTask(recurring("heartbeat", 60_000));
        store.updateNextRun(task.id(), null);
        service.pauseTask(task.id());
        clock.advance(Duration.ofMinutes(10));

        ScheduledTask resumed = service.resumeTask(task.id());

        assertEquals(clock.instant().plusSeconds(60), resumed.nextRun());
        assertEquals(resumed.nextRun(), service.getTask(task.id()).nextRun());
    }

    @Test
    void unknownTaskIdsAreReported() {
        assertThrows(TaskNotFoundException.class, () -> service.getTask("missing"));
        assertThrows(TaskNotFoundException.class, () -> service.pauseTask("missing"));
        assertThrows(TaskNotFoundException.class, () -> service.resumeTask("missing"));
        assertThrows(TaskNotFoundException.class, () -> service.runNow("missing"));
    }

    @Test
    void runNowExecutesOutsideSchedule() {
        ScheduledTask task = service.createTask(NewTask.oneTime("user-1", "later",
                Json.object().put("at", "2030-01-01T00:00:00Z"), ACTION));

        TaskExecution execution = service.runNow(task.id());

        assertEquals(ExecutionStatus.COMPLETED, execution.status());
        assertEquals(TaskStatus.COMPLETED, service.getTask(task.id()).status());
        assertEquals(List.of(execution.id()),
                service.getExecutions(task.id(), 10).stream().map(TaskExecution::id).toList());
    }

    @Test
    void upcomingListsActiveTasksBySoonestRun() {
        ScheduledTask later = service.createTask(recurring("later", 120_000));
        ScheduledTask sooner = service.createTask(recurring("sooner", 30_000));
        ScheduledTask foreign = service.createTask(new NewTask("user-2", "other user", null, TaskType.RECURRING,
                Json.object().put("intervalMs", 10_000), null, ACTION, null, null, null));
        ScheduledTask paused = service.createTask(recurring("paused", 5_000));
        service.pauseTask(paused.id());

        List<String> upcoming = service.getUpcoming("user-1", 10).stream().map(ScheduledTask::id).toList();

        assertEquals(sooner.id(), upcoming.get(0));
        assertTrue(upcoming.contains(later.id()));
        assertFalse(upcoming.contains(paused.id()));
        assertFalse(upcoming.contains(foreign.id()));
    }
}
