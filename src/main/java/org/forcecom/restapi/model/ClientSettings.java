package org.forcecom.restapi.model;

import lombok.Data;
import org.forcecom.restapi.rest.config.ClientConfiguration;

import java.nio.charset.Charset;

import static org.forcecom.restapi.rest.config.ClientConfigurationKeys.*;

@Data
public class ClientSettings {
    private String loginUrl = DEFAULT_LOGIN_URL;
    private String apiVersion = DEFAULT_API_VERSION;

    // false trusts any certificate and host name
    private boolean verifyCertificates = true;
    private boolean debug;

    private int connectionTimeout = DEFAULT_CONNECTION_TIMEOUT; // seconds
    private int responseTimeout = DEFAULT_RESPONSE_TIMEOUT;     // seconds

    private Charset targetEncoding = Charset.defaultCharset();

    /**
     * Reads settings from a configuration source, falling back to defaults for absent keys.
     *
     * @param configuration Configuration source
     * @return Populated settings
     */
    public static ClientSettings from(ClientConfiguration configuration) {
        ClientSettings settings = new ClientSettings();
        settings.setLoginUrl(configuration.get(LOGIN_URL, DEFAULT_LOGIN_URL));
        settings.setApiVersion(configuration.get(API_VERSION, DEFAULT_API_VERSION));
        settings.setVerifyCertificates(configuration.getBoolean(VERIFY_CERTIFICATES, true));
        settings.setDebug(configuration.getBoolean(DEBUG, false));
        settings.setConnectionTimeout(configuration.getInt(CONNECTION_TIMEOUT, DEFAULT_CONNECTION_TIMEOUT));
        settings.setResponseTimeout(configuration.getInt(RESPONSE_TIMEOUT, DEFAULT_RESPONSE_TIMEOUT));
        if (configuration.has(TARGET_ENCODING)) {
            settings.setTargetEncoding(Charset.forName(configuration.get(TARGET_ENCODING).trim()));
        }
        return settings;
    }
}
