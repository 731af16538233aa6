package com.pitwall.analytics.parse;

/**
 * Raised when a captured payload cannot be read as structured JSON.
 */
public class MalformedEventException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String eventType;

    public MalformedEventException(String eventType, String message, Throwable cause) {
        super(message, cause);
        this.eventType = eventType;
    }

    public String eventType() {
        return eventType;
    }
}
