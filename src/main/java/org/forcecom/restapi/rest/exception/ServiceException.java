package org.forcecom.restapi.rest.exception;

import lombok.Getter;
import org.forcecom.restapi.model.ServiceError;

/**
 * Force.com explicitly rejected a request and returned an {@code Error} payload.
 * <p>
 * The error code and message are passed through verbatim; the exception message
 * reads {@code "<errorCode>: <message>"}.
 * </p>
 */
@Getter
public class ServiceException extends ForceComException {

    /** Error reported by the service. */
    private final ServiceError error;

    /** HTTP status of the response that carried the error, or -1 if it came with a 2xx status. */
    private final int statusCode;

    public ServiceException(ServiceError error) {
        this(error, -1);
    }

    public ServiceException(ServiceError error, int statusCode) {
        super(error.getErrorCode() + ": " + error.getMessage());
        this.error = error;
        this.statusCode = statusCode;
    }

    public String getErrorCode() {
        return error.getErrorCode();
    }
}
