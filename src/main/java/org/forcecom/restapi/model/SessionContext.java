package org.forcecom.restapi.model;

import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Authorized connection to one Force.com instance.
 * <p>
 * Produced once by {@link org.forcecom.restapi.rest.service.OAuthAuthenticator} (or built
 * directly from an existing token) and only ever read by query calls, so one instance can be
 * shared between threads.
 * </p>
 */
@Value
public class SessionContext {

    /** Bearer access token. */
    @NonNull
    @ToString.Exclude
    String credential;

    /** Absolute instance URL, e.g. {@code https://na1.salesforce.com/}. */
    @NonNull
    String baseUrl;

    /** REST API version, e.g. {@code "35.0"}. */
    @NonNull
    String apiVersion;
}
