package in.greenhouse.service.sensor;

import in.greenhouse.application.port.output.FastCache;
import in.greenhouse.application.port.output.FeedGateway;
import in.greenhouse.domain.feed.FeedReading;
import in.greenhouse.domain.sensor.EnvironmentSnapshot;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorType;
import in.greenhouse.infrastructure.json.IrrigationJson;
import in.greenhouse.service.analysis.EnvironmentAnalyzer;
import in.greenhouse.service.analysis.SoilMoistureAnalyzer;
import in.greenhouse.service.pump.MoistureProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the latest sensor readings from the gateway into an {@link EnvironmentSnapshot}.
 *
 * The newest snapshot is cached under {@link #SNAPSHOT_KEY} for the snapshot TTL. Readers
 * asking for a snapshot get the cached one while it is younger than the TTL and trigger a
 * fresh collection otherwise.
 */
public final class EnvironmentDataService implements MoistureProbe {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentDataService.class);

    public static final String SNAPSHOT_KEY = "environment:snapshot:latest";

    private static final int TREND_HISTORY_POINTS = 100;

    private final FeedGateway gateway;
    private final FastCache cache;
    private final EnvironmentAnalyzer analyzer;
    private final Clock clock;
    private final Duration snapshotTtl;
    private final Duration staleThreshold;

    private volatile EnvironmentSnapshot lastSnapshot;

    public EnvironmentDataService(FeedGateway gateway, FastCache cache, EnvironmentAnalyzer analyzer,
                                  Clock clock, Duration snapshotTtl, Duration staleThreshold) {
        this.gateway = gateway;
        this.cache = cache;
        this.analyzer = analyzer;
        this.clock = clock;
        this.snapshotTtl = snapshotTtl;
        this.staleThreshold = staleThreshold;
    }

    /**
     * Read every sensor feed now and cache the result.
     * Feeds without a numeric latest value are left out of the snapshot.
     */
    public EnvironmentSnapshot collect() {
        Instant now = clock.instant();
        Map<SensorType, SensorReading> readings = new EnumMap<>(SensorType.class);

        for (SensorType type : SensorType.values()) {
            String feedKey = type.defaultFeedKey();
            Optional<FeedReading> latest = gateway.getLatest(feedKey);
            if (latest.isEmpty()) {
                log.debug("[SENSOR] No data on feed {}", feedKey);
                continue;
            }
            toReading(type, latest.get(), now).ifPresent(r -> readings.put(type, r));
        }

        EnvironmentSnapshot snapshot = new EnvironmentSnapshot(now, readings);
        lastSnapshot = snapshot;
        try {
            cache.setWithTtl(SNAPSHOT_KEY, IrrigationJson.write(IrrigationJson.toJson(snapshot)), snapshotTtl);
        } catch (RuntimeException e) {
            log.error("[SENSOR] Failed to cache snapshot: {}", e.getMessage());
        }

        log.info("[SENSOR] Collected {} readings, overall status {}",
            readings.size(), snapshot.overallStatus().code());
        return snapshot;
    }

    /**
     * Cached snapshot while it is fresh, otherwise a new collection when collectIfNeeded is set.
     * Without collection a stale snapshot is still returned, and an empty one when nothing is known.
     */
    public EnvironmentSnapshot getSnapshot(boolean collectIfNeeded) {
        Instant now = clock.instant();
        Optional<EnvironmentSnapshot> cached = cachedSnapshot();
        if (cached.isPresent() && !cached.get().isStale(now, snapshotTtl)) {
            return cached.get();
        }
        if (collectIfNeeded) {
            return collect();
        }
        return cached.orElseGet(() -> new EnvironmentSnapshot(now, Map.of()));
    }

    /**
     * Soil moisture from the current snapshot, empty when missing or older than the stale threshold.
     */
    @Override
    public Optional<Double> currentMoisture() {
        EnvironmentSnapshot snapshot = getSnapshot(true);
        return snapshot.freshSoilMoisture(clock.instant(), staleThreshold).map(SensorReading::value);
    }

    /**
     * Drying trend of the soil over the given window, from the soil feed history.
     */
    public SoilMoistureAnalyzer.Trend moistureTrend(Duration window) {
        Instant now = clock.instant();
        List<SensorReading> readings = new ArrayList<>();
        for (FeedReading point : gateway.getHistory(SensorType.SOIL_MOISTURE.defaultFeedKey(), TREND_HISTORY_POINTS)) {
            toReading(SensorType.SOIL_MOISTURE, point, now).ifPresent(readings::add);
        }
        return analyzer.soilAnalyzer().analyzeTrend(readings, now, window);
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }

    private Optional<EnvironmentSnapshot> cachedSnapshot() {
        try {
            Optional<String> json = cache.get(SNAPSHOT_KEY);
            if (json.isPresent()) {
                return Optional.of(IrrigationJson.environmentSnapshot(IrrigationJson.read(json.get())));
            }
        } catch (RuntimeException e) {
            log.warn("[SENSOR] Could not read cached snapshot: {}", e.getMessage());
        }
        return Optional.ofNullable(lastSnapshot);
    }

    private Optional<SensorReading> toReading(SensorType type, FeedReading point, Instant now) {
        Double value = point.numericValue();
        if (value == null) {
            log.warn("[SENSOR] Ignoring non-numeric value '{}' on feed {}", point.value(), point.feedKey());
            return Optional.empty();
        }
        Instant timestamp = point.createdAt() != null ? point.createdAt() : now;
        return Optional.of(new SensorReading(
            type,
            value,
            point.value(),
            type.unit(),
            timestamp,
            analyzer.statusOf(type, value),
            type.defaultFeedKey()
        ));
    }
}
