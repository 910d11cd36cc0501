package org.forcecom.restapi.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Body of a {@code /services/oauth2/token} response. Successful responses fill
 * {@code accessToken} and {@code instanceUrl}; rejected ones fill {@code error}
 * and usually {@code errorDescription}.
 */
@Value
@Builder
public class OAuthTokenResponse {

    @ToString.Exclude
    String accessToken;

    String instanceUrl;

    String error;

    String errorDescription;

    public boolean isError() {
        return error != null || errorDescription != null;
    }
}
