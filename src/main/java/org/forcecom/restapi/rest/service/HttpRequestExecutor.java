package org.forcecom.restapi.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.ssl.SSLContexts;
import org.forcecom.restapi.model.ClientSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Executes HTTP requests and handles responses for Force.com REST API communication.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute HTTP requests (GET, POST)</li>
 *   <li>Log request/response details for debugging</li>
 *   <li>Validate response status codes</li>
 *   <li>Extract response body as string</li>
 * </ul>
 *
 * <p><b>Success criteria:</b> HTTP status codes 200-299. Any other status raises
 * {@link HttpStatusException} with the response body attached.</p>
 *
 * <p>With {@code debug} enabled every request URL and raw response body is logged at INFO;
 * otherwise they are logged at DEBUG when that level is enabled.</p>
 *
 * <p><b>Note:</b> One HttpClient per executor; close the executor to release its connections.</p>
 */
public class HttpRequestExecutor implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private final CloseableHttpClient httpClient;
    private final boolean debug;

    public HttpRequestExecutor(ClientSettings settings) {
        this(createHttpClient(settings.isVerifyCertificates()), settings.isDebug());
    }

    HttpRequestExecutor(CloseableHttpClient httpClient, boolean debug) {
        this.httpClient = httpClient;
        this.debug = debug;
    }

    /**
     * Executes an HTTP request and returns the response body as string.
     *
     * @param request Configured HTTP request to execute
     * @return Response body as UTF-8 string
     * @throws HttpStatusException If the response status is not 2xx
     * @throws IOException If request execution fails or the response has no entity
     */
    public String executeRequest(HttpUriRequestBase request) throws IOException {
        if (debug) {
            logger.info("{} {}", request.getMethod(), describeUri(request));
        } else if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return httpClient.execute(request, response -> {
            int statusCode = response.getCode();

            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }

            HttpEntity entity = response.getEntity();
            String responseBody = "";
            if (entity != null) {
                try (InputStream is = entity.getContent()) {
                    responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }
            }

            if (debug) {
                logger.info("{}", responseBody);
            } else if (logger.isDebugEnabled()) {
                logger.debug("Response Body:");
                logger.debug("{}", responseBody);
            }

            if (!isSuccessfulResponse(statusCode)) {
                throw new HttpStatusException(statusCode, responseBody);
            }
            if (entity == null) {
                throw new IOException("Empty response entity");
            }
            return responseBody;
        });
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    /**
     * Creates the HTTP client. Without certificate verification every server certificate
     * is trusted and host names are not checked.
     *
     * @param verifyCertificates Whether to validate server certificates
     * @return New HttpClient
     * @throws IllegalStateException If the trust-all SSL context cannot be created
     */
    static CloseableHttpClient createHttpClient(boolean verifyCertificates) {
        if (verifyCertificates) {
            return HttpClients.createSystem();
        }
        logger.warn("Certificate verification is disabled, server identity will not be checked");
        try {
            SSLContext sslContext = SSLContexts.custom()
                    .loadTrustMaterial(TrustAllStrategy.INSTANCE)
                    .build();
            return HttpClients.custom()
                    .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                            .setSSLSocketFactory(SSLConnectionSocketFactoryBuilder.create()
                                    .setSslContext(sslContext)
                                    .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                                    .build())
                            .build())
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not create trust-all SSL context", e);
        }
    }

    /**
     * Returns the absolute request URI for messages and logs.
     *
     * @param request HTTP request
     * @return Absolute URI, or the request path if it cannot be resolved
     */
    public static String describeUri(HttpUriRequestBase request) {
        try {
            return request.getUri().toString();
        } catch (URISyntaxException e) {
            return request.getRequestUri();
        }
    }

    /**
     * Checks if HTTP status code indicates success (200-299).
     *
     * @param statusCode HTTP status code
     * @return true if successful, false otherwise
     */
    private boolean isSuccessfulResponse(int statusCode) {
        return (statusCode - 200 >= 0) && (statusCode - 200 < 100);
    }

    /**
     * Logs HTTP request details for debugging. The authorization header value is masked
     * and request bodies are not logged, since the token request body holds credentials.
     *
     * @param request HTTP request to log
     */
    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", describeUri(request));
        logger.debug("Headers:");
        for (var header : request.getHeaders()) {
            String value = HttpHeaders.AUTHORIZATION.equalsIgnoreCase(header.getName()) ? "Bearer ****" : header.getValue();
            logger.debug("  {}: {}", header.getName(), value);
        }
    }

    /**
     * Logs HTTP response details for debugging.
     *
     * @param response HTTP response
     * @param statusCode HTTP status code
     */
    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        for (var header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
