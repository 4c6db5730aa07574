package in.greenhouse.domain.decision;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of one decision loop tick.
 *
 * @param sensorValues sensor code to value at decision time
 */
public record Decision(
    Instant timestamp,
    boolean needsWater,
    Urgency urgency,
    String reason,
    WaterAmount waterAmount,
    boolean aiOverride,
    Map<String, Double> sensorValues,
    String environmentStatus,
    ActionTaken actionTaken
) {
    public Decision {
        sensorValues = sensorValues == null ? Map.of() : Map.copyOf(sensorValues);
    }
}
