package automata.engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Append-only history record of one attempt.
 *
 * @param result     JSON result on success, null otherwise
 * @param error      error message on failure, null otherwise
 * @param durationMs null while running
 */
public record TaskExecution(
        String id,
        String taskId,
        ExecutionStatus status,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        JsonNode result,
        String error,
        List<String> logs) {

    public TaskExecution {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(status, "status is required");
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.COMPLETED;
    }
}
