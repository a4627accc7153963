package automata.engine.integration;

public enum NotificationKind {
    SUCCESS,
    FAILURE
}
