package automata.engine.integration;

public interface EmailSender {

    void send(String to, String subject, String body);
}
