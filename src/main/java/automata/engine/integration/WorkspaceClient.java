package automata.engine.integration;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Google Workspace gateway; service/action/params are forwarded untouched.
 */
public interface WorkspaceClient {

    JsonNode execute(String service, String action, JsonNode params);
}
