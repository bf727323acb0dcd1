package com.noodles.opgraph.io;

/**
 * A project document could not be read into a {@link GraphDefinition}:
 * unreadable file, malformed JSON, or a structurally invalid graph.
 */
public class ProjectFormatException extends RuntimeException {

    public ProjectFormatException(String message) {
        super(message);
    }

    public ProjectFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
