package automata.engine.executor.handler;

import automata.engine.exception.MissingDependencyException;
import automata.engine.executor.ExecutionLog;
import automata.engine.integration.EmailSender;
import automata.engine.model.action.SendEmailAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class SendEmailHandler extends AbstractActionHandler<SendEmailAction> {

    private final EmailSender emailSender;

    public SendEmailHandler(EmailSender emailSender) {
        this.emailSender = emailSender;
    }

    @Override
    protected String startMessage(SendEmailAction action) {
        return "Sending email to " + action.to() + "...";
    }

    @Override
    protected String failurePrefix() {
        return "Email send failed";
    }

    @Override
    protected JsonNode run(SendEmailAction action, ExecutionLog executionLog) {
        if (emailSender == null) {
            throw new MissingDependencyException("Email sender");
        }
        emailSender.send(action.to(), action.subject(), action.body());
        executionLog.append("Email sent successfully");

        ObjectNode result = Json.object();
        result.put("sent", true);
        result.put("to", action.to());
        result.put("subject", action.subject());
        return result;
    }
}
