package org.forcecom.restapi.rest.exception;

/**
 * Base type for every failure raised by the Force.com client.
 * <p>
 * All subtypes are fatal for the call that raised them: a paginated query that
 * fails on any page surfaces exactly one {@code ForceComException} and no partial result.
 * </p>
 */
public class ForceComException extends RuntimeException {

    /**
     * Constructs a new ForceComException with a message.
     *
     * @param message Reason for the exception.
     */
    public ForceComException(String message) {
        super(message);
    }

    /**
     * Constructs a new ForceComException with message and cause.
     *
     * @param message Error description for context and debugging.
     * @param cause   The underlying reason.
     */
    public ForceComException(String message, Throwable cause) {
        super(message, cause);
    }
}
