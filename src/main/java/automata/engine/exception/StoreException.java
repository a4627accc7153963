package automata.engine.exception;

/**
 * Durable store unreachable or a write failed. Callers treat it as transient.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
