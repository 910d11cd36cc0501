package org.forcecom.restapi.rest.exception;

/**
 * Response body could not be decoded: not well-formed XML or JSON, or a field
 * required to proceed is missing.
 */
public class DecodeException extends ForceComException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
