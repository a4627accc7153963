package automata.engine.integration;

/**
 * Language model used by the ai-prompt and generate-report actions.
 */
public interface LlmClient {

    /**
     * Send one user prompt.
     *
     * @param prompt the prompt text
     * @param model  model identifier, never null
     * @return the completion; its text is null when the model answered with non-text content
     */
    Completion complete(String prompt, String model);
}
