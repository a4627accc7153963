package automata.engine.executor.handler;

import automata.engine.executor.ExecutionLog;
import automata.engine.model.action.FileOperationAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Acknowledges the operation without touching the filesystem; no file service is wired yet.
 */
public class FileOperationHandler extends AbstractActionHandler<FileOperationAction> {

    @Override
    protected String startMessage(FileOperationAction action) {
        return "File operation: " + action.operation() + " on " + action.path() + "...";
    }

    @Override
    protected String failurePrefix() {
        return "File operation failed";
    }

    @Override
    protected JsonNode run(FileOperationAction action, ExecutionLog executionLog) {
        executionLog.append("File operation completed");

        ObjectNode result = Json.object();
        result.put("operation", action.operation());
        result.put("path", action.path());
        result.put("success", true);
        return result;
    }
}
