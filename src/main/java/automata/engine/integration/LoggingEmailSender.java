package automata.engine.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulated SMTP delivery: accepts every message and logs it.
 */
public class LoggingEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public void send(String to, String subject, String body) {
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("Recipient is required");
        }
        log.info("Email to {} | subject: {} | {} chars", to, subject, body == null ? 0 : body.length());
    }
}
