package automata.engine.config;

import automata.engine.executor.ActionExecutor;
import automata.engine.integration.Collaborators;
import automata.engine.integration.ConditionEvaluator;
import automata.engine.integration.DefaultScheduleCalculator;
import automata.engine.integration.LoggingNotificationSink;
import automata.engine.integration.NotificationSink;
import automata.engine.integration.RecurringSchedules;
import automata.engine.integration.ScheduleCalculator;
import automata.engine.repository.TaskStore;
import automata.engine.scheduler.BackoffPolicy;
import automata.engine.scheduler.SchedulerWorker;
import automata.engine.service.TaskExecutionService;
import automata.engine.service.TaskService;
import automata.engine.store.Database;
import automata.engine.store.JdbcTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the store, executors, services and worker.
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv(), collaborators);
 * deps.startWorker();
 * deps.taskService().createTask(...);
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final TaskStore taskStore;
    private final ActionExecutor actionExecutor;
    private final TaskExecutionService executionService;
    private final TaskService taskService;
    private final SchedulerWorker worker;

    private Dependencies(Builder builder) {
        this.config = builder.config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.taskStore = new JdbcTaskStore(database, config, builder.clock);

        // Execution
        this.actionExecutor = new ActionExecutor(builder.collaborators, config, builder.clock);
        this.executionService = new TaskExecutionService(taskStore, actionExecutor, builder.conditionEvaluator,
                builder.scheduleCalculator, builder.notificationSink, config, builder.clock);

        // Services
        this.taskService = new TaskService(taskStore, executionService, builder.scheduleCalculator,
                builder.clock);
        this.worker = new SchedulerWorker(taskStore, executionService, new BackoffPolicy(config.maxBackoff()),
                builder.recurringSchedules, config, builder.clock);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(EngineConfig config, Collaborators collaborators) {
        return builder(config).collaborators(collaborators).build();
    }

    public static Builder builder(EngineConfig config) {
        return new Builder(config);
    }

    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public ActionExecutor actionExecutor() {
        return actionExecutor;
    }

    public TaskExecutionService executionService() {
        return executionService;
    }

    public TaskService taskService() {
        return taskService;
    }

    public SchedulerWorker worker() {
        return worker;
    }

    public void startWorker() {
        worker.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            worker.stop();
        } catch (Exception e) {
            log.warn("Error stopping worker: {}", e.getMessage());
        }

        executionService.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }

    public static final class Builder {
        private final EngineConfig config;
        private Collaborators collaborators = Collaborators.none();
        private ConditionEvaluator conditionEvaluator = ConditionEvaluator.ALWAYS;
        private ScheduleCalculator scheduleCalculator = new DefaultScheduleCalculator();
        private NotificationSink notificationSink = new LoggingNotificationSink();
        private RecurringSchedules recurringSchedules = RecurringSchedules.NOOP;
        private Clock clock = Clock.systemUTC();

        private Builder(EngineConfig config) {
            this.config = config;
        }

        public Builder collaborators(Collaborators collaborators) {
            this.collaborators = collaborators;
            return this;
        }

        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = conditionEvaluator;
            return this;
        }

        public Builder scheduleCalculator(ScheduleCalculator scheduleCalculator) {
            this.scheduleCalculator = scheduleCalculator;
            return this;
        }

        public Builder notificationSink(NotificationSink notificationSink) {
            this.notificationSink = notificationSink;
            return this;
        }

        public Builder recurringSchedules(RecurringSchedules recurringSchedules) {
            this.recurringSchedules = recurringSchedules;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Dependencies build() {
            return new Dependencies(this);
        }
    }
}
