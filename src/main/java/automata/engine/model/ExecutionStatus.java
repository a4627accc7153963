package automata.engine.model;

public enum ExecutionStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ExecutionStatus fromValue(String value) {
        for (ExecutionStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
