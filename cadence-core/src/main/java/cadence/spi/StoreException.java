package cadence.spi;

/**
 * Unchecked exception signalling that a store could not complete an operation
 * (persistence unavailable, constraint violated, driver error).
 *
 * <p>The processor records it per definition and leaves the definition due for the next
 * tick; the dispatcher propagates it from {@code announce} only when the notification
 * itself could not be persisted.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
