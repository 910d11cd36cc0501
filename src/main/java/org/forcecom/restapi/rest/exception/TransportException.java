package org.forcecom.restapi.rest.exception;

import lombok.Getter;

/**
 * Network or HTTP level failure while talking to Force.com.
 * <p>
 * Raised for connection errors, TLS handshake failures and non-2xx responses
 * whose body does not carry a service error payload.
 * </p>
 */
public class TransportException extends ForceComException {

    /** HTTP status code of the failed response, or -1 when no response was received. */
    @Getter
    private final int statusCode;

    TransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Wraps an I/O failure that happened before any response was received.
     *
     * @param url   Request URL.
     * @param cause The original I/O exception.
     * @return A new TransportException without status code.
     */
    public static TransportException buildTransportException(String url, Throwable cause) {
        return new TransportException("Request to " + url + " failed: " + cause.getMessage(), -1, cause);
    }

    /**
     * Reports an unsuccessful HTTP status.
     *
     * @param url        Request URL.
     * @param statusCode HTTP status code.
     * @param cause      The original exception, may be null.
     * @return A new TransportException carrying the status code.
     */
    public static TransportException buildTransportException(String url, int statusCode, Throwable cause) {
        return new TransportException("Request to " + url + " failed, status code (" + statusCode + ")", statusCode, cause);
    }
}
