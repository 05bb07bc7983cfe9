package com.shortlink.exception;

/**
 * The durable link store (relational database) could not be reached or timed out.
 */
public class DurableStoreUnavailableException extends RuntimeException {

    public DurableStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
