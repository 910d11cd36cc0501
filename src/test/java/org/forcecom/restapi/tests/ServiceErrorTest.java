package org.forcecom.restapi.tests;

import org.forcecom.restapi.model.SessionContext;
import org.forcecom.restapi.rest.QueryResult;
import org.forcecom.restapi.rest.exception.DecodeException;
import org.forcecom.restapi.rest.exception.ServiceException;
import org.forcecom.restapi.rest.exception.TransportException;
import org.forcecom.restapi.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Failure handling tests.
 *
 * This test demonstrates:
 * 1. Error payloads abort the whole paginated fetch before any further request
 * 2. An error takes precedence over records and continuation in the same response
 * 3. Non-XML and truncated bodies surface as transport and decode failures
 */
public class ServiceErrorTest extends BaseTest {

    private static final String QUERY_PATH = "/services/data/v35.0/query/";
    private static final String PAGE2_PATH = "/services/data/v35.0/query/01gD0000002HU6KIAW-2";

    @Override
    protected String getTestResourceDirectory() {
        return "ServiceErrorTest";
    }

    @Test
    @DisplayName("Error payload: INVALID_SESSION_ID fails with ServiceException, no further requests")
    public void testFailFastOnServiceError() throws Exception {
        setupStaticXmlResponse(urlPathEqualTo(QUERY_PATH), "invalid-session.xml");
        setupClient();

        ServiceException e = assertThrows(ServiceException.class,
            () -> client.query(getSession(), "SELECT Id FROM Account"));

        assertEquals("INVALID_SESSION_ID", e.getErrorCode());
        assertEquals("Session expired", e.getError().getMessage());
        assertEquals("INVALID_SESSION_ID: Session expired", e.getMessage());
        assertEquals(-1, e.getStatusCode());
        verify(1, anyRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("Error and nextRecordsUrl in one response: ServiceException, next page never requested")
    public void testErrorTakesPrecedenceOverContinuation() throws Exception {
        setupStaticXmlResponse(urlPathEqualTo(QUERY_PATH), "error-with-next.xml");
        setupClient();

        ServiceException e = assertThrows(ServiceException.class,
            () -> client.query(getSession(), "SELECT Id FROM Account"));

        assertEquals("QUERY_TIMEOUT", e.getErrorCode());
        verify(0, getRequestedFor(urlEqualTo(PAGE2_PATH)));
        verify(1, anyRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("Error on page 2 aborts the chain; page 1 records are not returned")
    public void testErrorOnLaterPageDiscardsEarlierPages() throws Exception {
        setupStaticXmlResponse(urlPathEqualTo(QUERY_PATH), "accounts-page1.xml");
        setupStaticXmlResponse(urlEqualTo(PAGE2_PATH), "invalid-session.xml");
        setupClient();

        assertThrows(ServiceException.class,
            () -> client.query(getSession(), "SELECT Id, Name FROM Account"));

        verify(2, anyRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("401 with XML error body surfaces as ServiceException carrying the status")
    public void testUnauthorizedWithErrorBody() throws Exception {
        setupStaticXmlResponse(urlPathEqualTo(QUERY_PATH), 401, "invalid-session.xml");
        setupClient();

        ServiceException e = assertThrows(ServiceException.class,
            () -> client.query(getSession(), "SELECT Id FROM Account"));

        assertEquals("INVALID_SESSION_ID", e.getErrorCode());
        assertEquals(401, e.getStatusCode());
    }

    @Test
    @DisplayName("400 MALFORMED_QUERY surfaces the code and message verbatim")
    public void testMalformedQuery() throws Exception {
        setupStaticXmlResponse(urlPathEqualTo(QUERY_PATH), 400, "malformed-query.xml");
        setupClient();

        ServiceException e = assertThrows(ServiceException.class,
            () -> client.query(getSession(), "SELECT Id FORM Account"));

        assertEquals("MALFORMED_QUERY: unexpected token: FORM", e.getMessage());
        assertEquals(400, e.getStatusCode());
    }

    @Test
    @DisplayName("500 with non-XML body surfaces as TransportException with status code")
    public void testServerErrorWithoutPayload() throws Exception {
        getWireMockServer().stubFor(get(urlPathEqualTo(QUERY_PATH))
            .willReturn(aResponse()
                .withStatus(500)
                .withHeader("Content-Type", "text/html")
                .withBody("<html><body>Internal Server Error</body>")));
        setupClient();

        TransportException e = assertThrows(TransportException.class,
            () -> client.query(getSession(), "SELECT Id FROM Account"));

        assertEquals(500, e.getStatusCode());
    }

    @Test
    @DisplayName("Truncated XML body surfaces as DecodeException")
    public void testTruncatedBody() throws Exception {
        setupStaticXmlResponse(urlPathEqualTo(QUERY_PATH), "truncated.xml");
        setupClient();

        assertThrows(DecodeException.class,
            () -> client.query(getSession(), "SELECT Id FROM Account"));
    }

    @Test
    @DisplayName("Connection refused surfaces as TransportException without status code")
    public void testConnectionFailure() throws Exception {
        setupClient();
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        SessionContext unreachable = new SessionContext(ACCESS_TOKEN, "http://localhost:" + closedPort + "/", API_VERSION);

        TransportException e = assertThrows(TransportException.class,
            () -> client.query(unreachable, "SELECT Id FROM Account"));

        assertEquals(-1, e.getStatusCode());
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("Error node with empty message is not an error; records are decoded")
    public void testPartialErrorNodeIsIgnored() throws Exception {
        setupStaticXmlResponse(urlPathEqualTo(QUERY_PATH), "partial-error.xml");
        setupClient();

        QueryResult result = client.query(getSession(), "SELECT Name FROM Account");

        assertEquals(1, result.size());
        assertEquals("Acme Corporation", result.get(0).get("Name"));
    }
}
