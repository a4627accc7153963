package automata.engine.exception;

import automata.engine.model.action.ActionType;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * A step of a chain action failed; the remaining steps were not run.
 */
public class ChainStepException extends ActionException {

    private final int failedStep;
    private final ActionType failedType;
    private final ArrayNode completedResults;

    public ChainStepException(int failedStep, int chainLength, ActionType failedType,
            ArrayNode completedResults, Throwable cause) {
        super("Chain step " + failedStep + "/" + chainLength + " (" + failedType.wireName() + ") failed: "
                + cause.getMessage(), cause);
        this.failedStep = failedStep;
        this.failedType = failedType;
        this.completedResults = completedResults;
    }

    /** 1-based index of the step that threw. */
    public int failedStep() {
        return failedStep;
    }

    public ActionType failedType() {
        return failedType;
    }

    /** Results of the steps that finished before the failure. */
    public ArrayNode completedResults() {
        return completedResults;
    }
}
