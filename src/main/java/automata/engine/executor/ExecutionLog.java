package automata.engine.executor;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable progress lines of one execution, persisted with the execution record.
 * Append-only and thread-safe.
 */
public final class ExecutionLog {

    private final List<String> lines = new ArrayList<>();

    public synchronized void append(String line) {
        lines.add(line);
    }

    public synchronized void appendAll(List<String> more) {
        lines.addAll(more);
    }

    /** Copy of the lines appended so far. */
    public synchronized List<String> lines() {
        return List.copyOf(lines);
    }

    public synchronized int size() {
        return lines.size();
    }

    public synchronized boolean contains(String line) {
        return lines.contains(line);
    }

    @Override
    public synchronized String toString() {
        return String.join("\n", lines);
    }
}
