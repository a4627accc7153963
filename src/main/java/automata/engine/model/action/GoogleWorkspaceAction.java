package automata.engine.model.action;

import com.fasterxml.jackson.databind.JsonNode;

public record GoogleWorkspaceAction(String service, String action, JsonNode params) implements TaskAction {

    @Override
    public ActionType type() {
        return ActionType.GOOGLE_WORKSPACE;
    }
}
