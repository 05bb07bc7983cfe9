package com.shortlink.exception;

/**
 * The shared counter store (Redis) could not be reached or timed out.
 * Swallowed on the redirect path, deferred to the next pass on the reconciliation path.
 */
public class CounterStoreUnavailableException extends RuntimeException {

    public CounterStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
