package automata.engine.executor.handler;

import automata.engine.exception.MissingDependencyException;
import automata.engine.executor.ExecutionLog;
import automata.engine.integration.Completion;
import automata.engine.integration.LlmClient;
import automata.engine.model.action.AiPromptAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class AiPromptHandler extends AbstractActionHandler<AiPromptAction> {

    static final String NON_TEXT_RESPONSE = "Non-text response received";

    private final LlmClient llm;
    private final String defaultModel;

    public AiPromptHandler(LlmClient llm, String defaultModel) {
        this.llm = llm;
        this.defaultModel = defaultModel;
    }

    @Override
    protected String startMessage(AiPromptAction action) {
        return "Executing AI prompt...";
    }

    @Override
    protected String failurePrefix() {
        return "AI prompt failed";
    }

    @Override
    protected JsonNode run(AiPromptAction action, ExecutionLog executionLog) {
        if (llm == null) {
            throw new MissingDependencyException("LLM client");
        }
        String model = (action.model() == null || action.model().isBlank()) ? defaultModel : action.model();

        Completion completion = llm.complete(action.prompt(), model);
        String text = completion.text() != null ? completion.text() : NON_TEXT_RESPONSE;

        executionLog.append("AI response received (" + text.length() + " chars)");

        ObjectNode result = Json.object();
        result.put("response", text);
        result.put("model", model);
        result.set("usage", completion.usage());
        return result;
    }
}
