package automata.engine.model.action;

public record SendEmailAction(String to, String subject, String body) implements TaskAction {

    @Override
    public ActionType type() {
        return ActionType.SEND_EMAIL;
    }
}
