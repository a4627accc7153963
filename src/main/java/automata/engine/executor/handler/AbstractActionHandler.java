package automata.engine.executor.handler;

import automata.engine.exception.ActionException;
import automata.engine.executor.ExecutionLog;
import automata.engine.model.action.TaskAction;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Template for one action variant: logs a start line, runs the side effect and,
 * on failure, logs a failure line before re-throwing as an {@link ActionException}.
 *
 * @param <A> handled action type
 */
public abstract class AbstractActionHandler<A extends TaskAction> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    public final JsonNode handle(A action, ExecutionLog executionLog) {
        executionLog.append(startMessage(action));
        try {
            return run(action, executionLog);
        } catch (ActionException e) {
            executionLog.append(failurePrefix() + ": " + e.getMessage());
            log.debug("{} action failed: {}", action.type(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            executionLog.append(failurePrefix() + ": " + e.getMessage());
            log.debug("{} action failed", action.type(), e);
            throw new ActionException(e.getMessage(), e);
        }
    }

    /** First log line, e.g. "Sending email to x...". */
    protected abstract String startMessage(A action);

    /** Prefix of the failure line, e.g. "Email send failed". */
    protected abstract String failurePrefix();

    protected abstract JsonNode run(A action, ExecutionLog executionLog);
}
