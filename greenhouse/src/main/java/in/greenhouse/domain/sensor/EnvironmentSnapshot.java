package in.greenhouse.domain.sensor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest reading per sensor at one point in time.
 */
public record EnvironmentSnapshot(
    Instant timestamp,
    Map<SensorType, SensorReading> readings
) {
    public EnvironmentSnapshot {
        EnumMap<SensorType, SensorReading> copy = new EnumMap<>(SensorType.class);
        if (readings != null) {
            copy.putAll(readings);
        }
        readings = Collections.unmodifiableMap(copy);
    }

    public Optional<SensorReading> reading(SensorType type) {
        return Optional.ofNullable(readings.get(type));
    }

    /**
     * Worst status across readings, UNKNOWN when there are none.
     */
    public SensorStatus overallStatus() {
        if (readings.isEmpty()) {
            return SensorStatus.UNKNOWN;
        }
        SensorStatus overall = SensorStatus.UNKNOWN;
        for (SensorReading reading : readings.values()) {
            overall = overall.worse(reading.status());
        }
        return overall;
    }

    public boolean isStale(Instant now, Duration maxAge) {
        return timestamp == null || Duration.between(timestamp, now).compareTo(maxAge) > 0;
    }

    /**
     * Soil moisture reading that is not older than maxAge.
     */
    public Optional<SensorReading> freshSoilMoisture(Instant now, Duration maxAge) {
        return reading(SensorType.SOIL_MOISTURE).filter(r -> !r.isStale(now, maxAge));
    }
}
