package in.greenhouse.domain.pump;

import java.time.Instant;
import java.util.Map;

/**
 * One completed watering run. Append-only.
 */
public record IrrigationEvent(
    Instant startTime,
    Instant endTime,
    double durationSeconds,
    double waterLiters,
    TriggerSource source,
    Map<String, String> details,
    Double moistureBefore,
    Double moistureAfter
) {
    public IrrigationEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
