package automata.engine.model;

/**
 * Kind of scheduled task.
 */
public enum TaskType {
    /** Runs once at schedule.at */
    ONE_TIME("one-time"),
    /** Runs repeatedly; next run supplied by a ScheduleCalculator */
    RECURRING("recurring"),
    /** Runs on external trigger, never selected by the poller */
    TRIGGER("trigger");

    private final String value;

    TaskType(String value) {
        this.value = value;
    }

    /** Persisted form, e.g. "one-time". */
    public String value() {
        return value;
    }

    public static TaskType fromValue(String value) {
        for (TaskType t : values()) {
            if (t.value.equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + value);
    }
}
