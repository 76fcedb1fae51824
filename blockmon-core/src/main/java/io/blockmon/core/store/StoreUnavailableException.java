package io.blockmon.core.store;

/**
 * The store could not be reached after all retries. Callers are expected to
 * fall back to the embedded store rather than fail the run.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
