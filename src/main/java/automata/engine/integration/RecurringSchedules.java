package automata.engine.integration;

/**
 * Hooks into an external recurring-schedule registry (cron jobs and the like),
 * started and stopped together with the worker.
 */
public interface RecurringSchedules {

    RecurringSchedules NOOP = new RecurringSchedules() {
        @Override
        public void initialize() {
        }

        @Override
        public void shutdown() {
        }
    };

    void initialize();

    void shutdown();
}
