package in.greenhouse.config;

import in.greenhouse.domain.feed.FeedKeys;
import in.greenhouse.util.Env;

/**
 * Safety limits and physical constants for the water pump.
 */
public record PumpConfig(
    String feedKey,
    long maxRuntimeSeconds,
    long minIntervalSeconds,
    double waterRateLitersPerSecond,
    int historyLength
) {
    public PumpConfig {
        if (maxRuntimeSeconds <= 0) {
            throw new IllegalArgumentException("maxRuntimeSeconds must be positive");
        }
        if (minIntervalSeconds < 0) {
            throw new IllegalArgumentException("minIntervalSeconds must not be negative");
        }
        if (waterRateLitersPerSecond < 0) {
            throw new IllegalArgumentException("waterRateLitersPerSecond must not be negative");
        }
    }

    public static PumpConfig defaults() {
        return new PumpConfig(FeedKeys.WATER_PUMP, 1800, 3600, 0.5, 50);
    }

    public static PumpConfig fromEnv() {
        PumpConfig d = defaults();
        return new PumpConfig(
            Env.get("PUMP_FEED_KEY", d.feedKey()),
            Env.getLong("PUMP_MAX_RUNTIME_SECONDS", d.maxRuntimeSeconds()),
            Env.getLong("PUMP_MIN_INTERVAL_SECONDS", d.minIntervalSeconds()),
            Env.getDouble("PUMP_WATER_RATE_LPS", d.waterRateLitersPerSecond()),
            Env.getInt("PUMP_HISTORY_LENGTH", d.historyLength())
        );
    }
}
