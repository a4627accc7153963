package automata.engine.model;

public record CleanupResult(int tasksDeleted, int executionsDeleted) {
}
