package org.forcecom.restapi.freemarker.exception;

/**
 * A template compiled but could not be rendered, e.g. a referenced variable is missing.
 * <p>
 * Extends {@link FreeMarkerException} for unified Freemarker exception handling.
 * </p>
 */
public class FreeMarkerFormatException extends FreeMarkerException {

    /**
     * Constructs a new FreeMarkerFormatException with message and cause.
     *
     * @param message Human-readable error description.
     * @param cause   The underlying cause of the formatting error.
     */
    public FreeMarkerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
