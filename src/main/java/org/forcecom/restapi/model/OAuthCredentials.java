package org.forcecom.restapi.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Inputs of the OAuth username-password flow. {@code consumerKey} and {@code consumerSecret}
 * are the connected app's client id and secret.
 */
@Value
@Builder
public class OAuthCredentials {

    @NonNull
    String username;

    @NonNull
    @ToString.Exclude
    String password;

    @NonNull
    String consumerKey;

    @NonNull
    @ToString.Exclude
    String consumerSecret;

    @Builder.Default
    String grantType = "password";
}
