package automata.engine.model.action;

import com.fasterxml.jackson.databind.JsonNode;

public record GenerateReportAction(JsonNode config) implements TaskAction {

    @Override
    public ActionType type() {
        return ActionType.GENERATE_REPORT;
    }
}
