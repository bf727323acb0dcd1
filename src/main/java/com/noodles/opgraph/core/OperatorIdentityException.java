package com.noodles.opgraph.core;

/**
 * Raised when an operator path is malformed or collides with another
 * operator. The offending construction is rejected, never coerced.
 */
public class OperatorIdentityException extends IllegalArgumentException {
    private final String path;

    public OperatorIdentityException(String message, String path) {
        super(message + ": '" + path + "'");
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
