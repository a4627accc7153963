package automata.engine.model.action;

import java.util.List;

/**
 * Runs nested actions one after another, stopping at the first failure.
 */
public record ChainAction(List<TaskAction> tasks) implements TaskAction {

    public ChainAction {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static ChainAction of(TaskAction... steps) {
        return new ChainAction(List.of(steps));
    }

    @Override
    public ActionType type() {
        return ActionType.CHAIN;
    }
}
