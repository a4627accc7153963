package automata.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * MDC helper: puts the task and execution ids on the current thread for the
 * lifetime of the context.
 *
 * <pre>
 * try (TaskLogContext ctx = TaskLogContext.forExecution(taskId, executionId)) {
 *     log.info("Running action");
 * }
 * </pre>
 */
public final class TaskLogContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String EXECUTION_ID = "executionId";

    private TaskLogContext() {
    }

    public static TaskLogContext forExecution(String taskId, String executionId) {
        MDC.put(TASK_ID, taskId);
        if (executionId != null) {
            MDC.put(EXECUTION_ID, executionId);
        }
        return new TaskLogContext();
    }

    /**
     * Carries the caller's MDC over to the thread that runs {@code callable}.
     */
    public static <T> Callable<T> propagate(Callable<T> callable) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                return callable.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(EXECUTION_ID);
    }
}
