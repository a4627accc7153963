package automata.engine.executor.handler;

import automata.engine.exception.ActionException;
import automata.engine.exception.ChainStepException;
import automata.engine.executor.ActionExecutor;
import automata.engine.executor.ExecutionLog;
import automata.engine.model.action.ChainAction;
import automata.engine.model.action.TaskAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Runs chain steps strictly in order through the executor; the first failing step ends the chain.
 */
public class ChainHandler extends AbstractActionHandler<ChainAction> {

    private final ActionExecutor executor;

    public ChainHandler(ActionExecutor executor) {
        this.executor = executor;
    }

    @Override
    protected String startMessage(ChainAction action) {
        return "Executing task chain (" + action.tasks().size() + " tasks)...";
    }

    @Override
    protected String failurePrefix() {
        return "Task chain failed";
    }

    @Override
    protected JsonNode run(ChainAction action, ExecutionLog executionLog) {
        List<TaskAction> steps = action.tasks();
        ArrayNode results = Json.array();

        for (int i = 0; i < steps.size(); i++) {
            TaskAction step = steps.get(i);
            int stepNumber = i + 1;
            executionLog.append("Chain step " + stepNumber + "/" + steps.size() + ": " + step.type().wireName());

            JsonNode stepResult;
            try {
                stepResult = executor.execute(step, executionLog);
            } catch (ActionException e) {
                throw new ChainStepException(stepNumber, steps.size(), step.type(), results.deepCopy(), e);
            }

            ObjectNode entry = results.addObject();
            entry.put("step", stepNumber);
            entry.put("type", step.type().wireName());
            entry.set("result", stepResult);
        }

        executionLog.append("Task chain completed successfully");

        ObjectNode result = Json.object();
        result.put("chainLength", steps.size());
        result.set("results", results);
        return result;
    }
}
