package automata.engine.scheduler;

/**
 * Outcome counts of one poll cycle.
 */
public record PollSummary(int selected, int succeeded, int failed) {

    public static final PollSummary EMPTY = new PollSummary(0, 0, 0);
}
