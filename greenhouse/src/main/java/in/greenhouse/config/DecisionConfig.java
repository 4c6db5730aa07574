package in.greenhouse.config;

import in.greenhouse.domain.common.ValidationException;
import in.greenhouse.domain.decision.WaterAmount;
import in.greenhouse.util.Env;

/**
 * Tunables for the autonomous decision loop. Replaced as a whole on update.
 */
public record DecisionConfig(
    boolean enabled,
    long minDecisionIntervalSeconds,
    long lightDurationSeconds,
    long normalDurationSeconds,
    long heavyDurationSeconds,
    double aiMinConfidence
) {
    public static final long MIN_DECISION_INTERVAL_FLOOR = 60;

    public static DecisionConfig defaults() {
        return new DecisionConfig(false, 3600, 60, 180, 300, 0.7);
    }

    public static DecisionConfig fromEnv() {
        DecisionConfig d = defaults();
        return new DecisionConfig(
            Env.getBool("AUTO_IRRIGATION_ENABLED", d.enabled()),
            Env.getLong("DECISION_MIN_INTERVAL_SECONDS", d.minDecisionIntervalSeconds()),
            Env.getLong("DURATION_LIGHT_SECONDS", d.lightDurationSeconds()),
            Env.getLong("DURATION_NORMAL_SECONDS", d.normalDurationSeconds()),
            Env.getLong("DURATION_HEAVY_SECONDS", d.heavyDurationSeconds()),
            Env.getDouble("AI_MIN_CONFIDENCE", d.aiMinConfidence())
        );
    }

    /**
     * @throws ValidationException on the first invalid field
     */
    public DecisionConfig validate() {
        if (minDecisionIntervalSeconds < MIN_DECISION_INTERVAL_FLOOR) {
            throw new ValidationException("min_decision_interval",
                "must be at least " + MIN_DECISION_INTERVAL_FLOOR + " seconds");
        }
        if (lightDurationSeconds <= 0 || normalDurationSeconds <= 0 || heavyDurationSeconds <= 0) {
            throw new ValidationException("durations", "must be positive");
        }
        if (aiMinConfidence < 0.0 || aiMinConfidence > 1.0) {
            throw new ValidationException("ai_min_confidence", "must be within [0, 1]");
        }
        return this;
    }

    public DecisionConfig withEnabled(boolean value) {
        return new DecisionConfig(value, minDecisionIntervalSeconds,
            lightDurationSeconds, normalDurationSeconds, heavyDurationSeconds, aiMinConfidence);
    }

    /**
     * Run length for a volume class: heavy, moderate maps to normal, anything else to light.
     */
    public long durationFor(WaterAmount amount) {
        switch (amount) {
            case HEAVY:
                return heavyDurationSeconds;
            case MODERATE:
                return normalDurationSeconds;
            default:
                return lightDurationSeconds;
        }
    }
}
