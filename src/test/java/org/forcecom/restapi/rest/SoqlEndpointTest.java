package org.forcecom.restapi.rest;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SoqlEndpointTest {

    @Test
    public void testQueryPath() {
        assertEquals("services/data/v35.0/query/?q=SELECT%20Id%20FROM%20Account",
            SoqlEndpoint.QUERY.path("35.0", "SELECT Id FROM Account"));
    }

    @Test
    public void testQueryAllPath() {
        assertEquals("services/data/v41.0/queryAll/?q=SELECT%20Id%20FROM%20Account",
            SoqlEndpoint.QUERY_ALL.path("41.0", "SELECT Id FROM Account"));
    }

    @Test
    public void testReservedCharactersAreEscaped() {
        String path = SoqlEndpoint.QUERY.path("35.0", "SELECT Id FROM Account WHERE Name = 'A&B' AND Rating > 3");

        assertFalse(path.substring(path.indexOf("?q=") + 3).contains("&"));
        assertTrue(path.contains("%3D"));
        assertTrue(path.contains("%26"));
        assertTrue(path.contains("%3E"));
    }

    @Test
    public void testNonAsciiIsUtf8Encoded() {
        assertTrue(SoqlEndpoint.QUERY.path("35.0", "SELECT Id FROM Account WHERE Name = 'Café'").contains("Caf%C3%A9"));
    }
}
