package automata.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retry configuration of a task.
 *
 * @param maxRetries attempts allowed beyond the first failure, {@code >= 0}
 * @param backoffMs  base delay for exponential backoff, {@code > 0}
 */
public record RetryPolicy(
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("backoffMs") long backoffMs) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (backoffMs <= 0) {
            throw new IllegalArgumentException("backoffMs must be > 0");
        }
    }

    /** True while another attempt is allowed after {@code runCount} attempts. */
    public boolean allowsRetry(int runCount) {
        return runCount < maxRetries;
    }
}
