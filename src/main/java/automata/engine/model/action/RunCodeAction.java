package automata.engine.model.action;

public record RunCodeAction(String language, String code) implements TaskAction {

    @Override
    public ActionType type() {
        return ActionType.RUN_CODE;
    }
}
