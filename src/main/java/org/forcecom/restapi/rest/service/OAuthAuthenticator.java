package org.forcecom.restapi.rest.service;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.forcecom.restapi.model.ClientSettings;
import org.forcecom.restapi.model.OAuthCredentials;
import org.forcecom.restapi.model.OAuthTokenResponse;
import org.forcecom.restapi.model.SessionContext;
import org.forcecom.restapi.rest.exception.AuthenticationException;
import org.forcecom.restapi.rest.exception.DecodeException;
import org.forcecom.restapi.rest.exception.TransportException;
import org.forcecom.restapi.rest.parser.JsonTokenResponseParser;
import org.forcecom.restapi.rest.parser.ResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Signs in to Force.com with the OAuth 2.0 username-password flow and returns the
 * resulting {@link SessionContext}.
 */
public class OAuthAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(OAuthAuthenticator.class);

    static final double MIN_API_VERSION = 20.0;

    private final ClientSettings settings;
    private final HttpRequestBuilder httpRequestBuilder;
    private final HttpRequestExecutor httpRequestExecutor;
    private final ResponseParser<OAuthTokenResponse> tokenParser = new JsonTokenResponseParser();

    public OAuthAuthenticator(ClientSettings settings, HttpRequestBuilder httpRequestBuilder,
                              HttpRequestExecutor httpRequestExecutor) {
        this.settings = settings;
        this.httpRequestBuilder = httpRequestBuilder;
        this.httpRequestExecutor = httpRequestExecutor;
    }

    /**
     * Requests an access token for the configured login URL and API version.
     *
     * @param credentials User and connected app credentials
     * @return Session bound to the returned instance URL
     * @throws IllegalArgumentException If the configured API version is below 20.0
     * @throws AuthenticationException  If Force.com rejects the credentials
     * @throws TransportException       On I/O failure or an unexpected HTTP status
     * @throws DecodeException          If the token response is malformed
     */
    public SessionContext login(OAuthCredentials credentials) {
        String apiVersion = settings.getApiVersion();
        Preconditions.checkArgument(parseApiVersion(apiVersion) >= MIN_API_VERSION,
                "The earliest supported API version is 20.0");

        HttpPost request = httpRequestBuilder.buildTokenRequest(settings.getLoginUrl(), credentials);
        String url = HttpRequestExecutor.describeUri(request);

        String body;
        try {
            body = httpRequestExecutor.executeRequest(request);
        } catch (HttpStatusException e) {
            // Rejected logins come back as 400 with a JSON error body
            OAuthTokenResponse rejected = parseQuietly(e.getResponseBody());
            if (rejected != null && rejected.isError()) {
                throw new AuthenticationException(describeError(rejected));
            }
            throw TransportException.buildTransportException(url, e.getStatusCode(), e);
        } catch (IOException e) {
            throw TransportException.buildTransportException(url, e);
        }

        OAuthTokenResponse token;
        try {
            token = tokenParser.parse(body);
        } catch (ResponseParser.ParseException e) {
            throw new DecodeException("Invalid OAuth token response from " + url, e);
        }
        if (token.isError()) {
            throw new AuthenticationException(describeError(token));
        }
        if (StringUtils.isAnyEmpty(token.getAccessToken(), token.getInstanceUrl())) {
            throw new DecodeException("OAuth token response from " + url + " lacks access_token or instance_url");
        }

        logger.info("Signed in to {} as {} (API v{})", token.getInstanceUrl(), credentials.getUsername(), apiVersion);
        return new SessionContext(token.getAccessToken(), StringUtils.appendIfMissing(token.getInstanceUrl(), "/"), apiVersion);
    }

    private OAuthTokenResponse parseQuietly(String body) {
        if (StringUtils.isBlank(body)) {
            return null;
        }
        try {
            return tokenParser.parse(body);
        } catch (ResponseParser.ParseException e) {
            logger.debug("Error response is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static String describeError(OAuthTokenResponse response) {
        return response.getErrorDescription() != null ? response.getErrorDescription() : response.getError();
    }

    private static double parseApiVersion(String apiVersion) {
        Preconditions.checkArgument(apiVersion != null, "API version is not set");
        try {
            return Double.parseDouble(apiVersion);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid API version: " + apiVersion, e);
        }
    }
}
