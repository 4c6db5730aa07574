package in.greenhouse.infrastructure.gateway;

import in.greenhouse.application.port.output.FeedGateway;
import in.greenhouse.domain.feed.FeedBinding;
import in.greenhouse.domain.feed.FeedMessageHandler;
import in.greenhouse.domain.feed.FeedReading;
import in.greenhouse.domain.feed.PublishResult;
import in.greenhouse.infrastructure.metrics.IrrigationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dual-transport client for the IoT feed gateway.
 *
 * Writes go through the transports in priority order (pub/sub first, REST second);
 * the first one that accepts the value serves the call. Provisioning and reads use the
 * REST API with a fixed-delay {@link RetryPolicy}.
 *
 * Error policy:
 * - authentication failures are logged at ERROR and not retried
 * - not-found on a feed triggers creation
 * - transient failures are retried, then surfaced as an empty / false result
 *
 * Writes are at-least-once: a pub/sub send that fails after reaching the broker is
 * repeated over REST.
 */
public class GatewayClient implements FeedGateway {
    private static final Logger log = LoggerFactory.getLogger(GatewayClient.class);

    private final GatewayRestApi rest;
    private final MqttGatewayTransport pubsub;
    private final List<GatewayTransport> transports;
    private final RetryPolicy retryPolicy;
    private final IrrigationMetrics metrics;

    private final Set<String> provisionedFeeds = ConcurrentHashMap.newKeySet();
    private final Set<String> provisionedGroups = ConcurrentHashMap.newKeySet();

    public GatewayClient(GatewayRestApi rest, MqttGatewayTransport pubsub,
                         RetryPolicy retryPolicy, IrrigationMetrics metrics) {
        this.rest = rest;
        this.pubsub = pubsub;
        this.transports = pubsub != null ? List.of(pubsub, rest) : List.of(rest);
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    /**
     * Open the pub/sub channel. The client keeps working over REST if this fails,
     * except for rejected credentials which are rethrown.
     */
    public void connect() {
        if (pubsub == null) {
            log.info("[GATEWAY] No pub/sub transport configured, using REST only");
            return;
        }
        try {
            pubsub.connect();
        } catch (GatewayAuthenticationException e) {
            log.error("[GATEWAY] Authentication rejected by pub/sub broker: {}", e.getMessage());
            throw e;
        } catch (GatewayException e) {
            log.warn("[GATEWAY] Pub/sub unavailable, falling back to REST: {}", e.getMessage());
        }
    }

    public void close() {
        if (pubsub != null) {
            pubsub.disconnect();
        }
    }

    /**
     * Provision every binding; failures other than authentication are logged and skipped.
     *
     * @return number of feeds confirmed
     */
    public int initializeFeeds(List<FeedBinding> bindings) {
        int ok = 0;
        for (FeedBinding binding : bindings) {
            try {
                ensureFeed(binding);
                ok++;
            } catch (GatewayAuthenticationException e) {
                throw e;
            } catch (GatewayException e) {
                log.error("[GATEWAY] Could not provision feed {}: {}", binding.key(), e.getMessage());
            }
        }
        log.info("[GATEWAY] Feeds ready: {}/{}", ok, bindings.size());
        return ok;
    }

    // ═══════════════════════════════════════════════════════════════
    // Provisioning
    // ═══════════════════════════════════════════════════════════════

    @Override
    public FeedBinding ensureFeed(FeedBinding binding) {
        if (provisionedFeeds.contains(binding.key())) {
            return binding;
        }
        try {
            retryPolicy.execute("getFeed:" + binding.key(), () -> rest.getFeed(binding.key()));
            log.debug("[GATEWAY] Feed {} exists", binding.key());
        } catch (GatewayNotFoundException e) {
            if (binding.hasGroup()) {
                ensureGroup(binding.groupKey(), binding.groupKey());
            }
            retryPolicy.execute("createFeed:" + binding.key(), () -> rest.createFeed(binding));
            log.info("[GATEWAY] Created feed {}", binding.key());
        } catch (GatewayAuthenticationException e) {
            log.error("[GATEWAY] Authentication failed while checking feed {}: {}", binding.key(), e.getMessage());
            throw e;
        }
        provisionedFeeds.add(binding.key());
        return binding;
    }

    public void ensureGroup(String groupKey, String name) {
        if (provisionedGroups.contains(groupKey)) {
            return;
        }
        try {
            retryPolicy.execute("getGroup:" + groupKey, () -> rest.getGroup(groupKey));
        } catch (GatewayNotFoundException e) {
            retryPolicy.execute("createGroup:" + groupKey, () -> rest.createGroup(groupKey, name));
            log.info("[GATEWAY] Created group {}", groupKey);
        }
        provisionedGroups.add(groupKey);
    }

    // ═══════════════════════════════════════════════════════════════
    // Writes
    // ═══════════════════════════════════════════════════════════════

    @Override
    public PublishResult publish(String feedKey, String value) {
        int attempts = 0;
        String lastError = null;
        for (GatewayTransport transport : transports) {
            if (!transport.isAvailable()) {
                log.debug("[GATEWAY] {} unavailable for {}", transport.kind(), feedKey);
                continue;
            }
            attempts++;
            try {
                if (transport == rest) {
                    retryPolicy.run("publish:" + feedKey, () -> transport.send(feedKey, value));
                } else {
                    transport.send(feedKey, value);
                }
                recordPublish(transport, true);
                log.debug("[GATEWAY] Published {}={} via {}", feedKey, value, transport.kind());
                return PublishResult.servedBy(transport.kind(), attempts);
            } catch (GatewayAuthenticationException e) {
                recordPublish(transport, false);
                lastError = e.getMessage();
                log.error("[GATEWAY] {} rejected credentials publishing to {}: {}",
                    transport.kind(), feedKey, e.getMessage());
            } catch (GatewayException e) {
                recordPublish(transport, false);
                lastError = e.getMessage();
                log.warn("[GATEWAY] {} publish to {} failed: {}", transport.kind(), feedKey, e.getMessage());
            }
        }
        log.error("[GATEWAY] Publish to {} failed on all transports", feedKey);
        return PublishResult.failed(attempts, lastError);
    }

    private void recordPublish(GatewayTransport transport, boolean success) {
        if (metrics != null) {
            metrics.recordPublish(transport.kind(), success);
        }
    }

    @Override
    public boolean setActuator(String feedKey, boolean on) {
        try {
            ensureFeed(FeedBinding.of(feedKey));
        } catch (GatewayException e) {
            log.error("[GATEWAY] Cannot prepare actuator feed {}: {}", feedKey, e.getMessage());
            return false;
        }
        PublishResult result = publish(feedKey, on);
        if (result.success()) {
            log.info("[GATEWAY] Actuator {} set {} via {}", feedKey, on ? "ON" : "OFF", result.transport());
        }
        return result.success();
    }

    // ═══════════════════════════════════════════════════════════════
    // Reads
    // ═══════════════════════════════════════════════════════════════

    @Override
    public Optional<FeedReading> getLatest(String feedKey) {
        try {
            FeedReading last = retryPolicy.execute("lastData:" + feedKey, () -> rest.lastData(feedKey));
            return Optional.ofNullable(last);
        } catch (GatewayNotFoundException e) {
            log.debug("[GATEWAY] No data for {}: {}", feedKey, e.getMessage());
            return Optional.empty();
        } catch (GatewayAuthenticationException e) {
            log.error("[GATEWAY] Authentication failed reading {}: {}", feedKey, e.getMessage());
            return Optional.empty();
        } catch (GatewayException e) {
            log.warn("[GATEWAY] Latest read for {} failed, trying range read: {}", feedKey, e.getMessage());
        }
        try {
            List<FeedReading> one = rest.listData(feedKey, 1);
            return one.isEmpty() ? Optional.empty() : Optional.ofNullable(one.get(0));
        } catch (GatewayException e) {
            log.error("[GATEWAY] Range read fallback for {} failed: {}", feedKey, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<FeedReading> getHistory(String feedKey, int limit) {
        try {
            return retryPolicy.execute("listData:" + feedKey, () -> rest.listData(feedKey, limit));
        } catch (GatewayNotFoundException e) {
            log.info("[GATEWAY] Feed {} missing, creating it", feedKey);
            try {
                ensureFeed(FeedBinding.of(feedKey));
            } catch (GatewayException ex) {
                log.error("[GATEWAY] Auto-create of {} failed: {}", feedKey, ex.getMessage());
            }
            return List.of();
        } catch (GatewayException e) {
            log.error("[GATEWAY] History read for {} failed: {}", feedKey, e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<Boolean> getActuatorState(String feedKey) {
        return getLatest(feedKey).map(FeedReading::value).flatMap(GatewayClient::parseActuatorValue);
    }

    /**
     * 1/ON/TRUE/YES is on, 0/OFF/FALSE/NO is off, anything else unknown.
     */
    static Optional<Boolean> parseActuatorValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "1":
            case "ON":
            case "TRUE":
            case "YES":
                return Optional.of(Boolean.TRUE);
            case "0":
            case "OFF":
            case "FALSE":
            case "NO":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Subscriptions
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void registerHandler(String feedKey, FeedMessageHandler handler) {
        if (pubsub == null) {
            log.warn("[GATEWAY] No pub/sub transport; handler for {} will never fire", feedKey);
            return;
        }
        pubsub.subscribe(feedKey, handler);
    }
}
