package org.forcecom.restapi.rest.parser;

import org.forcecom.restapi.model.OAuthTokenResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JsonTokenResponseParserTest {

    private final JsonTokenResponseParser parser = new JsonTokenResponseParser();

    @Test
    public void testSuccessResponse() throws Exception {
        OAuthTokenResponse response = parser.parse(
            "{\"access_token\":\"00D!abc\",\"instance_url\":\"https://eu1.salesforce.com\",\"token_type\":\"Bearer\"}");

        assertFalse(response.isError());
        assertEquals("00D!abc", response.getAccessToken());
        assertEquals("https://eu1.salesforce.com", response.getInstanceUrl());
        assertFalse(response.toString().contains("00D!abc"));
    }

    @Test
    public void testErrorResponse() throws Exception {
        OAuthTokenResponse response = parser.parse("{\"error\":\"invalid_client_id\",\"error_description\":\"client identifier invalid\"}");

        assertTrue(response.isError());
        assertEquals("client identifier invalid", response.getErrorDescription());
        assertNull(response.getAccessToken());
    }

    @Test
    public void testInvalidJson() {
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse("<html>Bad Gateway</html>"));
    }
}
