package org.forcecom.restapi.rest.exception;

/**
 * The OAuth token endpoint refused the login; the message is the
 * {@code error_description} returned by Force.com.
 */
public class AuthenticationException extends ForceComException {

    public AuthenticationException(String message) {
        super(message);
    }
}
