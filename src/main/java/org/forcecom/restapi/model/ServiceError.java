package org.forcecom.restapi.model;

import lombok.Value;

/**
 * {@code errorCode}/{@code message} pair taken from the {@code Error} node of a rejected request,
 * e.g. {@code INVALID_SESSION_ID} / {@code Session expired or invalid}.
 */
@Value
public class ServiceError {
    String errorCode;
    String message;
}
