package org.forcecom.restapi.freemarker.exception;

/**
 * Failure while creating or evaluating a FreeMarker endpoint template, or while
 * exposing a value to one.
 */
public class FreeMarkerException extends RuntimeException {

    /**
     * Constructs a new FreeMarkerException with message and cause.
     *
     * @param message Error description for context and debugging.
     * @param cause   The underlying reason or stack-trace root.
     */
    public FreeMarkerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new FreeMarkerException with a message only.
     *
     * @param message Reason for the exception.
     */
    public FreeMarkerException(String message) {
        super(message);
    }
}
