package in.greenhouse.infrastructure.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.greenhouse.config.GatewayConfig;
import in.greenhouse.domain.feed.FeedBinding;
import in.greenhouse.domain.feed.FeedReading;
import in.greenhouse.domain.feed.TransportKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Request/response channel to the gateway's REST API.
 *
 * Endpoints (relative to the configured base URL):
 * <pre>
 * GET  /{user}/feeds/{key}                 feed lookup
 * POST /{user}/feeds                       create feed
 * POST /{user}/groups/{group}/feeds        create feed inside a group
 * GET  /{user}/groups/{group}              group lookup
 * POST /{user}/groups                      create group
 * POST /{user}/feeds/{key}/data            write a value
 * GET  /{user}/feeds/{key}/data/last       latest value (single item read)
 * GET  /{user}/feeds/{key}/data?limit=N    newest first range read
 * </pre>
 *
 * Status mapping: 401/403 authentication, 404 not found, 429 and 5xx transient.
 */
public class GatewayRestApi implements GatewayTransport {
    private static final Logger log = LoggerFactory.getLogger(GatewayRestApi.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final GatewayConfig config;

    public GatewayRestApi(GatewayConfig config) {
        this(config, HttpClient.newBuilder()
            .connectTimeout(config.requestTimeout())
            .build());
    }

    public GatewayRestApi(GatewayConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.REST;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void send(String feedKey, String value) {
        createData(feedKey, value);
    }

    // ═══════════════════════════════════════════════════════════════
    // Feeds and groups
    // ═══════════════════════════════════════════════════════════════

    public JsonNode getFeed(String feedKey) {
        return sendJson(feedKey, request("/feeds/" + encode(feedKey)).GET().build());
    }

    public JsonNode createFeed(FeedBinding binding) {
        ObjectNode feed = objectMapper.createObjectNode();
        feed.put("name", binding.name());
        feed.put("key", binding.key());
        feed.put("description", binding.description());
        ObjectNode body = objectMapper.createObjectNode();
        body.set("feed", feed);

        String path = binding.hasGroup()
            ? "/groups/" + encode(binding.groupKey()) + "/feeds"
            : "/feeds";
        log.info("[REST] Creating feed '{}' ({})", binding.key(), binding.hasGroup() ? binding.groupKey() : "no group");
        return sendJson(binding.key(), post(path, body));
    }

    public JsonNode getGroup(String groupKey) {
        return sendJson(groupKey, request("/groups/" + encode(groupKey)).GET().build());
    }

    public JsonNode createGroup(String groupKey, String name) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", name);
        body.put("key", groupKey);
        log.info("[REST] Creating group '{}'", groupKey);
        return sendJson(groupKey, post("/groups", body));
    }

    // ═══════════════════════════════════════════════════════════════
    // Data
    // ═══════════════════════════════════════════════════════════════

    public FeedReading createData(String feedKey, String value) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("value", value);
        JsonNode node = sendJson(feedKey, post("/feeds/" + encode(feedKey) + "/data", body));
        return toReading(feedKey, node);
    }

    /**
     * Single-item read; avoids the range endpoint's pagination artifacts.
     */
    public FeedReading lastData(String feedKey) {
        JsonNode node = sendJson(feedKey, request("/feeds/" + encode(feedKey) + "/data/last").GET().build());
        if (node == null || node.isNull() || node.isMissingNode() || !node.has("value")) {
            return null;
        }
        return toReading(feedKey, node);
    }

    public List<FeedReading> listData(String feedKey, int limit) {
        JsonNode node = sendJson(feedKey,
            request("/feeds/" + encode(feedKey) + "/data?limit=" + limit).GET().build());
        List<FeedReading> readings = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                readings.add(toReading(feedKey, item));
            }
        }
        return readings;
    }

    // ═══════════════════════════════════════════════════════════════
    // HTTP plumbing
    // ═══════════════════════════════════════════════════════════════

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(config.restBaseUrl() + "/" + encode(config.username()) + path))
            .timeout(config.requestTimeout())
            .header("X-AIO-Key", config.apiKey())
            .header("Accept", "application/json");
    }

    private HttpRequest post(String path, JsonNode body) {
        return request(path)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();
    }

    private JsonNode sendJson(String resource, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GatewayTransientException(resource, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayTransientException(resource, "Interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            String body = response.body();
            if (body == null || body.isBlank()) {
                return null;
            }
            try {
                return objectMapper.readTree(body);
            } catch (IOException e) {
                throw new GatewayException(resource, "Unparseable response body", e);
            }
        }

        log.debug("[REST] {} {} -> HTTP {}", request.method(), request.uri(), status);
        throw classify(resource, status, response.body());
    }

    static GatewayException classify(String resource, int status, String body) {
        String detail = "HTTP " + status + (body == null || body.isBlank() ? "" : ": " + body);
        if (status == 401 || status == 403) {
            return new GatewayAuthenticationException(resource, detail);
        }
        if (status == 404) {
            return new GatewayNotFoundException(resource, detail);
        }
        if (status == 429 || status >= 500) {
            return new GatewayTransientException(resource, detail);
        }
        return new GatewayException(resource, detail);
    }

    private static FeedReading toReading(String feedKey, JsonNode node) {
        if (node == null) {
            return null;
        }
        String id = node.hasNonNull("id") ? node.get("id").asText() : null;
        String value = node.hasNonNull("value") ? node.get("value").asText() : null;
        Instant createdAt = null;
        if (node.hasNonNull("created_at")) {
            try {
                createdAt = Instant.parse(node.get("created_at").asText());
            } catch (DateTimeParseException e) {
                log.debug("[REST] Unparseable created_at '{}' on feed {}", node.get("created_at").asText(), feedKey);
            }
        }
        return new FeedReading(id, feedKey, value, createdAt);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
