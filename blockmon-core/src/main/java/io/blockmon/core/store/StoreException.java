package io.blockmon.core.store;

/**
 * Failure inside a {@link FingerprintStore}: a database error, a malformed
 * response, a rejected request.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
