package org.forcecom.restapi.rest.config;

/**
 * Keys understood by {@link org.forcecom.restapi.model.ClientSettings#from(ClientConfiguration)}.
 */
public final class ClientConfigurationKeys {

    private ClientConfigurationKeys() {
    }

    private static final String PREFIX = "forcecom.";

    /** Login host for the OAuth token endpoint; use {@code https://test.salesforce.com} for sandboxes. */
    public static final String LOGIN_URL = PREFIX + "loginUrl";
    public static final String DEFAULT_LOGIN_URL = "https://login.salesforce.com";

    public static final String API_VERSION = PREFIX + "apiVersion";
    public static final String DEFAULT_API_VERSION = "35.0";

    /** When false, server certificates and host names are not verified. */
    public static final String VERIFY_CERTIFICATES = PREFIX + "verifyCertificates";

    /** Logs every request URL and raw response body at INFO level. */
    public static final String DEBUG = PREFIX + "debug";

    /** Seconds to wait for a connection from the pool. */
    public static final String CONNECTION_TIMEOUT = PREFIX + "connectionTimeout";
    public static final int DEFAULT_CONNECTION_TIMEOUT = 30;

    /** Seconds to wait for a response. */
    public static final String RESPONSE_TIMEOUT = PREFIX + "responseTimeout";
    public static final int DEFAULT_RESPONSE_TIMEOUT = 120;

    /** Charset field values are re-encoded to; defaults to the platform charset. */
    public static final String TARGET_ENCODING = PREFIX + "targetEncoding";
}
