package in.greenhouse.config;

import in.greenhouse.domain.feed.FeedKeys;
import in.greenhouse.util.Env;

import java.time.Duration;

/**
 * Connection settings for the IoT feed gateway.
 */
public record GatewayConfig(
    String username,
    String apiKey,
    String restBaseUrl,
    String mqttServerUri,
    String groupKey,
    int maxRetries,
    Duration retryDelay,
    Duration requestTimeout
) {
    public GatewayConfig {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
    }

    public static GatewayConfig fromEnv() {
        return new GatewayConfig(
            Env.get("GATEWAY_USERNAME", ""),
            Env.get("GATEWAY_KEY", ""),
            Env.get("GATEWAY_REST_URL", "https://io.adafruit.com/api/v2"),
            Env.get("GATEWAY_MQTT_URI", "tcp://io.adafruit.com:1883"),
            Env.get("GATEWAY_GROUP_KEY", FeedKeys.GROUP),
            Env.getInt("GATEWAY_MAX_RETRIES", 3),
            Duration.ofMillis(Env.getLong("GATEWAY_RETRY_DELAY_MS", 1000)),
            Duration.ofSeconds(Env.getInt("GATEWAY_TIMEOUT_SECONDS", 10))
        );
    }

    /**
     * Pub/sub topic for a feed: {username}/feeds/{feedKey}.
     */
    public String topicFor(String feedKey) {
        return username + "/feeds/" + feedKey;
    }
}
