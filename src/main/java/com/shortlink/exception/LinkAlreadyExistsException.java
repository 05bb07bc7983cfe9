package com.shortlink.exception;

/**
 * Raised when a link is created under a code that is already taken.
 */
public class LinkAlreadyExistsException extends RuntimeException {

    private final String code;

    public LinkAlreadyExistsException(String code) {
        super("Short link already exists: " + code);
        this.code = code;
    }

    public LinkAlreadyExistsException(String code, Throwable cause) {
        super("Short link already exists: " + code, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
