package org.forcecom.restapi.rest.service;

import lombok.Getter;

import java.io.IOException;

/**
 * Non-2xx HTTP response. Keeps the body so callers can look for a service error payload in it.
 */
@Getter
public class HttpStatusException extends IOException {

    private final int statusCode;
    private final String responseBody;

    public HttpStatusException(int statusCode, String responseBody) {
        super("Request Failed, status code (" + statusCode + ")");
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
}
