package in.greenhouse.infrastructure.gateway;

import in.greenhouse.domain.feed.FeedBinding;
import in.greenhouse.domain.feed.FeedReading;
import in.greenhouse.domain.feed.PublishResult;
import in.greenhouse.domain.feed.TransportKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GatewayClient.
 *
 * Tests:
 * - Pub/sub preferred, REST fallback on failure or unavailability
 * - Feed auto-creation on not-found
 * - Read fallbacks and actuator value parsing
 */
@ExtendWith(MockitoExtension.class)
class GatewayClientTest {

    @Mock
    private GatewayRestApi rest;

    @Mock
    private MqttGatewayTransport mqtt;

    private GatewayClient client;

    @BeforeEach
    void setUp() {
        lenient().when(rest.kind()).thenReturn(TransportKind.REST);
        lenient().when(rest.isAvailable()).thenReturn(true);
        lenient().when(mqtt.kind()).thenReturn(TransportKind.PUBSUB);

        RetryPolicy retry = RetryPolicy.builder()
            .delay(Duration.ZERO)
            .maxAttempts(2)
            .sleeper(d -> {})
            .build();
        client = new GatewayClient(rest, mqtt, retry, null);
    }

    // ═══════════════════════════════════════════════════════════════
    // Publish
    // ═══════════════════════════════════════════════════════════════

    @Test
    void publish_usesPubSubWhenAvailable() {
        when(mqtt.isAvailable()).thenReturn(true);

        PublishResult result = client.publish("soil-moisture", "41.2");

        assertTrue(result.success());
        assertEquals(TransportKind.PUBSUB, result.transport());
        assertEquals(1, result.attempts());
        verify(mqtt).send("soil-moisture", "41.2");
        verify(rest, never()).send(anyString(), anyString());
    }

    @Test
    void publish_fallsBackToRestWhenPubSubFails() {
        when(mqtt.isAvailable()).thenReturn(true);
        doThrow(new GatewayTransientException("soil-moisture", "broker gone"))
            .when(mqtt).send("soil-moisture", "41.2");

        PublishResult result = client.publish("soil-moisture", "41.2");

        assertTrue(result.success(), "REST should serve the publish");
        assertEquals(TransportKind.REST, result.transport());
        assertEquals(2, result.attempts());
        verify(rest).send("soil-moisture", "41.2");
    }

    @Test
    void publish_skipsUnavailablePubSub() {
        when(mqtt.isAvailable()).thenReturn(false);

        PublishResult result = client.publish("water-pump-control", true);

        assertEquals(TransportKind.REST, result.transport());
        assertEquals(1, result.attempts(), "Unavailable transports are not counted as attempts");
        verify(mqtt, never()).send(anyString(), anyString());
        verify(rest).send("water-pump-control", "1");
    }

    @Test
    void publish_reportsFailureWhenAllTransportsFail() {
        when(mqtt.isAvailable()).thenReturn(true);
        doThrow(new GatewayTransientException("f", "down")).when(mqtt).send(anyString(), anyString());
        doThrow(new GatewayTransientException("f", "HTTP 503")).when(rest).send(anyString(), anyString());

        PublishResult result = client.publish("f", "1");

        assertFalse(result.success());
        assertEquals(TransportKind.NONE, result.transport());
        assertEquals("[f] HTTP 503", result.error());
        verify(rest, times(2)).send("f", "1");
    }

    // ═══════════════════════════════════════════════════════════════
    // Provisioning
    // ═══════════════════════════════════════════════════════════════

    @Test
    void ensureFeed_createsGroupAndFeedWhenMissing() {
        FeedBinding binding = FeedBinding.inGroup("soil-moisture", "soil_moisture", "farm-sensors");
        when(rest.getFeed("soil-moisture")).thenThrow(new GatewayNotFoundException("feeds/soil-moisture", "HTTP 404"));
        when(rest.getGroup("farm-sensors")).thenThrow(new GatewayNotFoundException("groups/farm-sensors", "HTTP 404"));

        client.ensureFeed(binding);
        client.ensureFeed(binding);

        verify(rest).createGroup("farm-sensors", "farm-sensors");
        verify(rest).createFeed(binding);
        verify(rest, times(1)).getFeed("soil-moisture");
    }

    @Test
    void ensureFeed_authenticationFailureIsRethrown() {
        when(rest.getFeed("x")).thenThrow(new GatewayAuthenticationException("feeds/x", "HTTP 401"));

        assertThrows(GatewayAuthenticationException.class, () -> client.ensureFeed(FeedBinding.of("x")));
        verify(rest, never()).createFeed(any());
    }

    @Test
    void initializeFeeds_countsOnlyProvisionedFeeds() {
        when(rest.getFeed("a")).thenReturn(null);
        when(rest.getFeed("b")).thenThrow(new GatewayException("feeds/b", "HTTP 422"));

        int ok = client.initializeFeeds(List.of(FeedBinding.of("a"), FeedBinding.of("b")));

        assertEquals(1, ok);
    }

    // ═══════════════════════════════════════════════════════════════
    // Reads
    // ═══════════════════════════════════════════════════════════════

    @Test
    void getLatest_fallsBackToRangeRead() {
        FeedReading reading = new FeedReading("1", "soil-moisture", "33", Instant.parse("2024-05-01T10:00:00Z"));
        when(rest.lastData("soil-moisture")).thenThrow(new GatewayException("feeds/soil-moisture", "HTTP 400"));
        when(rest.listData("soil-moisture", 1)).thenReturn(List.of(reading));

        assertEquals(Optional.of(reading), client.getLatest("soil-moisture"));
    }

    @Test
    void getLatest_notFoundIsEmpty() {
        when(rest.lastData("light")).thenThrow(new GatewayNotFoundException("feeds/light", "HTTP 404"));

        assertTrue(client.getLatest("light").isEmpty());
        verify(rest, never()).listData(anyString(), eq(1));
    }

    @Test
    void getHistory_missingFeedIsCreatedAndEmpty() {
        when(rest.listData("temperature", 50))
            .thenThrow(new GatewayNotFoundException("feeds/temperature", "HTTP 404"));
        when(rest.getFeed("temperature")).thenThrow(new GatewayNotFoundException("feeds/temperature", "HTTP 404"));

        List<FeedReading> history = client.getHistory("temperature", 50);

        assertTrue(history.isEmpty());
        verify(rest).createFeed(FeedBinding.of("temperature"));
    }

    @Test
    void getActuatorState_parsesLatestValue() {
        when(rest.lastData("water-pump-control"))
            .thenReturn(new FeedReading("9", "water-pump-control", "ON", Instant.now()));

        assertEquals(Optional.of(true), client.getActuatorState("water-pump-control"));
    }

    @Test
    void parseActuatorValue_acceptsCommonSpellings() {
        assertEquals(Optional.of(true), GatewayClient.parseActuatorValue("1"));
        assertEquals(Optional.of(true), GatewayClient.parseActuatorValue(" yes "));
        assertEquals(Optional.of(false), GatewayClient.parseActuatorValue("off"));
        assertEquals(Optional.of(false), GatewayClient.parseActuatorValue("FALSE"));
        assertTrue(GatewayClient.parseActuatorValue("maybe").isEmpty());
        assertTrue(GatewayClient.parseActuatorValue(null).isEmpty());
    }

    @Test
    void connect_pubSubOutageIsTolerated() {
        doThrow(new GatewayTransientException("broker", "refused")).when(mqtt).connect();

        assertDoesNotThrow(() -> client.connect());
    }
}
