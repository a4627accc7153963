package automata.engine.scheduler;

public enum WorkerState {
    STOPPED,
    STARTING,
    RUNNING
}
