package automata.engine.model.action;

/**
 * @param model optional; the configured default model is used when null
 */
public record AiPromptAction(String prompt, String model) implements TaskAction {

    @Override
    public ActionType type() {
        return ActionType.AI_PROMPT;
    }
}
