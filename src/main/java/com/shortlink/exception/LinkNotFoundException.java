package com.shortlink.exception;

/**
 * Raised when a short code has no durable link. Callers at the HTTP boundary map it to 404.
 */
public class LinkNotFoundException extends RuntimeException {

    private final String code;

    public LinkNotFoundException(String code) {
        super("Short link not found: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
