package org.forcecom.restapi.tests.base;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.matching.UrlPattern;
import org.forcecom.restapi.model.ClientSettings;
import org.forcecom.restapi.model.SessionContext;
import org.forcecom.restapi.rest.ForceComClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Base class for tests against a WireMock stand-in for a Force.com instance.
 * Uses only static XML/JSON responses from files.
 *
 * Tests verify:
 * 1. Client forms correct HTTP requests (using WireMock.verify())
 * 2. Client decodes static responses correctly
 * 3. Client surfaces failures as the right exception
 */
public abstract class BaseTest {

    protected static final String ACCESS_TOKEN = "00D50000000IZ3Z!TEST_ACCESS_TOKEN";
    protected static final String API_VERSION = "35.0";

    protected static WireMockServer wireMockServer;
    protected ForceComClient client;

    /**
     * Returns the test resource directory name (e.g., "PaginationTest")
     */
    protected abstract String getTestResourceDirectory();

    @BeforeEach
    public void setupWireMock() {
        if (wireMockServer == null) {
            wireMockServer = new WireMockServer(
                WireMockConfiguration.wireMockConfig().dynamicPort().dynamicHttpsPort()
            );
            wireMockServer.start();
            System.out.println("[BaseTest] WireMock server started on port: " + wireMockServer.port());
        }
        // Reset WireMock before each test to ensure isolation
        configureFor("localhost", wireMockServer.port());
        wireMockServer.resetAll();
    }

    /**
     * Override to change client settings. Defaults point the login URL at WireMock.
     */
    protected ClientSettings getClientSettings() {
        ClientSettings settings = new ClientSettings();
        settings.setLoginUrl(getBaseUrl());
        settings.setApiVersion(API_VERSION);
        settings.setResponseTimeout(10);
        return settings;
    }

    protected ForceComClient setupClient() {
        client = new ForceComClient(getClientSettings());
        return client;
    }

    protected String getBaseUrl() {
        return "http://localhost:" + wireMockServer.port();
    }

    /**
     * Session for the WireMock instance, as the authenticator would return it.
     */
    protected SessionContext getSession() {
        return new SessionContext(ACCESS_TOKEN, getBaseUrl() + "/", API_VERSION);
    }

    /**
     * Setup a static XML response for a GET endpoint
     * @param urlPattern Request URL pattern
     * @param responseFile XML file name in test resources (e.g., "accounts-page1.xml")
     */
    protected void setupStaticXmlResponse(UrlPattern urlPattern, String responseFile) throws IOException {
        setupStaticXmlResponse(urlPattern, 200, responseFile);
    }

    protected void setupStaticXmlResponse(UrlPattern urlPattern, int status, String responseFile) throws IOException {
        String responseBody = loadStaticResponse(responseFile);

        wireMockServer.stubFor(get(urlPattern)
            .willReturn(aResponse()
                .withStatus(status)
                .withHeader("Content-Type", "application/xml;charset=UTF-8")
                .withBody(responseBody)));

        System.out.println("[BaseTest] Configured static XML response for endpoint: " + urlPattern +
            " from file: " + responseFile);
    }

    /**
     * Setup a static JSON response for a POST endpoint
     * @param endpoint REST endpoint (e.g., "/services/oauth2/token")
     * @param status HTTP status to answer with
     * @param responseFile JSON file name in test resources
     */
    protected void setupStaticJsonResponse(String endpoint, int status, String responseFile) throws IOException {
        String responseBody = loadStaticResponse(responseFile);

        wireMockServer.stubFor(post(urlEqualTo(endpoint))
            .willReturn(aResponse()
                .withStatus(status)
                .withHeader("Content-Type", "application/json;charset=UTF-8")
                .withBody(responseBody)));

        System.out.println("[BaseTest] Configured static JSON response for endpoint: " + endpoint +
            " from file: " + responseFile);
    }

    /**
     * Load static response file from test resources
     */
    protected String loadStaticResponse(String responseFile) throws IOException {
        Path responsePath = Paths.get("src", "test", "resources", "rest",
            getTestResourceDirectory(), "responses", responseFile);

        if (!Files.exists(responsePath)) {
            throw new IOException("Static response file not found: " + responsePath.toAbsolutePath());
        }

        return Files.readString(responsePath);
    }

    @AfterEach
    public void tearDown() {
        if (client != null) {
            try {
                client.close();
            } catch (IOException e) {
                System.err.println("[BaseTest] Error closing client: " + e.getMessage());
            }
            client = null;
        }
    }

    @AfterAll
    public static void tearDownWiremock() {
        if (wireMockServer != null) {
            wireMockServer.stop();
            System.out.println("[BaseTest] WireMock server stopped");
            wireMockServer = null;
        }
    }

    protected WireMockServer getWireMockServer() {
        return wireMockServer;
    }
}
