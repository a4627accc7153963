package automata.engine.exception;

/**
 * Task definition rejected before it was stored.
 */
public class TaskValidationException extends RuntimeException {

    public TaskValidationException(String message) {
        super(message);
    }
}
