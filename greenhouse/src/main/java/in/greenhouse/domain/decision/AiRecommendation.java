package in.greenhouse.domain.decision;

import java.time.Instant;
import java.util.List;

/**
 * Recommendation supplied by the external AI collaborator.
 *
 * @param confidence in [0, 1]
 */
public record AiRecommendation(
    boolean shouldIrrigate,
    double durationMinutes,
    String reason,
    double confidence,
    List<String> zones,
    String source,
    Priority priority,
    Instant timestamp
) {
    public AiRecommendation {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
        zones = zones == null ? List.of() : List.copyOf(zones);
        priority = priority == null ? Priority.NORMAL : priority;
    }

    public long durationSeconds() {
        return Math.round(durationMinutes * 60);
    }

    public AiRecommendation withOrigin(String source, Priority priority, Instant timestamp) {
        return new AiRecommendation(shouldIrrigate, durationMinutes, reason, confidence, zones,
            source, priority, timestamp);
    }
}
