package automata.engine.model;

/**
 * Scheduled task status.
 */
public enum TaskStatus {
    /** Eligible for dispatch once due */
    ACTIVE("active"),
    /** Paused by user, never dispatched */
    PAUSED("paused"),
    /** One-time task that ran successfully */
    COMPLETED("completed"),
    /** Terminal failure: no retry policy or retries exhausted */
    FAILED("failed");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static TaskStatus fromValue(String value) {
        for (TaskStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
