package in.greenhouse.infrastructure.gateway;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GatewayRestApiTest {

    @Test
    void classify_mapsStatusCodesToErrorTaxonomy() {
        assertInstanceOf(GatewayAuthenticationException.class, GatewayRestApi.classify("feeds/x", 401, ""));
        assertInstanceOf(GatewayAuthenticationException.class, GatewayRestApi.classify("feeds/x", 403, null));
        assertInstanceOf(GatewayNotFoundException.class, GatewayRestApi.classify("feeds/x", 404, "not found"));
        assertInstanceOf(GatewayTransientException.class, GatewayRestApi.classify("feeds/x", 429, "slow down"));
        assertInstanceOf(GatewayTransientException.class, GatewayRestApi.classify("feeds/x", 502, ""));
    }

    @Test
    void classify_otherClientErrorsArePlainGatewayErrors() {
        GatewayException e = GatewayRestApi.classify("feeds/x", 422, "bad value");

        assertEquals(GatewayException.class, e.getClass());
        assertEquals("feeds/x", e.getResource());
        assertTrue(e.getMessage().contains("422"), "Message should carry the status: " + e.getMessage());
    }
}
