package automata.engine.model.action;

public record FileOperationAction(String operation, String path) implements TaskAction {

    @Override
    public ActionType type() {
        return ActionType.FILE_OPERATION;
    }
}
