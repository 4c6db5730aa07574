package in.greenhouse.domain.sensor;

import java.time.Duration;
import java.time.Instant;

public record SensorReading(
    SensorType type,
    double value,
    String rawValue,
    String unit,
    Instant timestamp,
    SensorStatus status,
    String feedKey
) {
    public boolean isStale(Instant now, Duration maxAge) {
        return timestamp == null || Duration.between(timestamp, now).compareTo(maxAge) > 0;
    }
}
