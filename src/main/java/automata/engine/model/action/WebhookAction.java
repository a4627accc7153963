package automata.engine.model.action;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outbound HTTP call. A non-2xx response fails the action.
 */
public record WebhookAction(String url, String method, Map<String, String> headers, JsonNode body)
        implements TaskAction {

    public WebhookAction {
        method = (method == null || method.isBlank()) ? "POST" : method.toUpperCase();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    @Override
    public ActionType type() {
        return ActionType.WEBHOOK;
    }
}
