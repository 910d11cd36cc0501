package org.forcecom.restapi.rest.service;

import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.forcecom.restapi.model.ClientSettings;
import org.forcecom.restapi.model.OAuthCredentials;
import org.forcecom.restapi.model.SessionContext;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builds HTTP requests for Force.com REST API communication.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Join instance URL and continuation references without doubled separators</li>
 *   <li>Create authorized GET requests for query pages</li>
 *   <li>Create the OAuth password-grant POST</li>
 *   <li>Configure request timeouts</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * HttpRequestBuilder builder = new HttpRequestBuilder(settings);
 * HttpGet request = builder.buildQueryRequest(session, "/services/data/v35.0/query/01gD0000002HU6KIAW-2000");
 * }</pre>
 */
public class HttpRequestBuilder {

    static final String TOKEN_PATH = "/services/oauth2/token";

    private final ClientSettings settings;

    public HttpRequestBuilder(ClientSettings settings) {
        this.settings = settings;
    }

    /**
     * Builds the GET request for one query page.
     *
     * @param session      Authorized session
     * @param continuation Endpoint path or server-issued continuation reference
     * @return Request carrying bearer token and XML accept header
     */
    public HttpGet buildQueryRequest(SessionContext session, String continuation) {
        HttpGet request = new HttpGet(resolveUrl(session.getBaseUrl(), continuation));
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + session.getCredential());
        request.setHeader(HttpHeaders.ACCEPT, "application/xml");
        configureTimeouts(request);
        return request;
    }

    /**
     * Builds the OAuth username-password token request.
     *
     * @param loginUrl    Login host, e.g. {@code https://login.salesforce.com}
     * @param credentials Connected app and user credentials
     * @return Form-encoded POST to the token endpoint
     */
    public HttpPost buildTokenRequest(String loginUrl, OAuthCredentials credentials) {
        HttpPost request = new HttpPost(StringUtils.removeEnd(loginUrl, "/") + TOKEN_PATH);
        List<NameValuePair> form = List.of(
                new BasicNameValuePair("grant_type", credentials.getGrantType()),
                new BasicNameValuePair("client_id", credentials.getConsumerKey()),
                new BasicNameValuePair("client_secret", credentials.getConsumerSecret()),
                new BasicNameValuePair("username", credentials.getUsername()),
                new BasicNameValuePair("password", credentials.getPassword()));
        request.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));
        request.setHeader(HttpHeaders.ACCEPT, "application/json");
        configureTimeouts(request);
        return request;
    }

    /**
     * Joins the instance URL and a path. One leading {@code /} is stripped from the path
     * and one trailing {@code /} is ensured on the base.
     *
     * @param baseUrl Instance URL
     * @param path    Relative path, with or without leading separator
     * @return Absolute URL
     */
    public static String resolveUrl(String baseUrl, String path) {
        return StringUtils.appendIfMissing(baseUrl, "/") + StringUtils.removeStart(path, "/");
    }

    private void configureTimeouts(HttpUriRequestBase request) {
        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(settings.getConnectionTimeout(), TimeUnit.SECONDS)
                .setResponseTimeout(settings.getResponseTimeout(), TimeUnit.SECONDS)
                .build());
    }
}
