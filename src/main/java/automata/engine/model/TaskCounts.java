package automata.engine.model;

/**
 * Aggregate task statistics.
 */
public record TaskCounts(long active, long paused, long completed, long failed, long dueSoon) {

    public long total() {
        return active + paused + completed + failed;
    }
}
