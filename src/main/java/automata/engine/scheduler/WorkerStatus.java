package automata.engine.scheduler;

/**
 * Snapshot of the worker's lifecycle and settings.
 */
public record WorkerStatus(boolean running, WorkerState state, long pollIntervalMs, int batchSize) {
}
