package automata.engine.executor.handler;

import automata.engine.exception.MissingDependencyException;
import automata.engine.executor.ExecutionLog;
import automata.engine.integration.WorkspaceClient;
import automata.engine.model.action.GoogleWorkspaceAction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public class GoogleWorkspaceHandler extends AbstractActionHandler<GoogleWorkspaceAction> {

    private final WorkspaceClient client;

    public GoogleWorkspaceHandler(WorkspaceClient client) {
        this.client = client;
    }

    @Override
    protected String startMessage(GoogleWorkspaceAction action) {
        return "Google Workspace: " + action.service() + "." + action.action() + "...";
    }

    @Override
    protected String failurePrefix() {
        return "Google Workspace action failed";
    }

    @Override
    protected JsonNode run(GoogleWorkspaceAction action, ExecutionLog executionLog) {
        if (client == null) {
            throw new MissingDependencyException("Google Workspace client");
        }
        JsonNode result = client.execute(action.service(), action.action(), action.params());
        executionLog.append("Google Workspace action completed");
        return result != null ? result : NullNode.getInstance();
    }
}
