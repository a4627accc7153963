package automata.engine.scheduler;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with up to 30% positive jitter:
 * {@code min(backoffMs * 2^runCount * (1 + jitter), maxBackoff)}.
 */
public final class BackoffPolicy {

    static final double MAX_JITTER = 0.3;

    private final long maxBackoffMs;
    private final DoubleSupplier jitter;

    public BackoffPolicy(Duration maxBackoff) {
        this(maxBackoff, () -> ThreadLocalRandom.current().nextDouble(0.0, MAX_JITTER));
    }

    /**
     * @param jitter source of jitter values in [0, 0.3)
     */
    public BackoffPolicy(Duration maxBackoff, DoubleSupplier jitter) {
        if (maxBackoff.isNegative() || maxBackoff.isZero()) {
            throw new IllegalArgumentException("maxBackoff must be positive");
        }
        this.maxBackoffMs = maxBackoff.toMillis();
        this.jitter = jitter;
    }

    /**
     * Delay before the next attempt.
     *
     * @param runCount  attempts made before the failed one
     * @param backoffMs base delay from the task's retry policy
     */
    public Duration delay(int runCount, long backoffMs) {
        if (runCount < 0) {
            throw new IllegalArgumentException("runCount must be >= 0");
        }
        double j = Math.min(Math.max(jitter.getAsDouble(), 0.0), MAX_JITTER);
        double delayMs = backoffMs * Math.pow(2, runCount) * (1 + j);
        return Duration.ofMillis((long) Math.min(delayMs, maxBackoffMs));
    }

    public long maxBackoffMs() {
        return maxBackoffMs;
    }
}
