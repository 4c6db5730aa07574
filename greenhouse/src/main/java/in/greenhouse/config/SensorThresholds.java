package in.greenhouse.config;

import in.greenhouse.util.Env;

/**
 * Acceptable and optimal range for one sensor.
 *
 * @param warningMargin fraction of (max - min) inside each bound that counts as WARNING
 */
public record SensorThresholds(
    double min,
    double max,
    double optimalMin,
    double optimalMax,
    double warningMargin
) {
    public static final double DEFAULT_WARNING_MARGIN = 0.15;

    public SensorThresholds {
        if (min >= max) {
            throw new IllegalArgumentException("min must be below max");
        }
        if (optimalMin > optimalMax) {
            throw new IllegalArgumentException("optimalMin must not exceed optimalMax");
        }
    }

    public static SensorThresholds soilMoisture() {
        return new SensorThresholds(20, 90, 40, 70, DEFAULT_WARNING_MARGIN);
    }

    public static SensorThresholds temperature() {
        return new SensorThresholds(10, 40, 18, 30, DEFAULT_WARNING_MARGIN);
    }

    public static SensorThresholds humidity() {
        return new SensorThresholds(30, 90, 40, 70, DEFAULT_WARNING_MARGIN);
    }

    public static SensorThresholds light() {
        return new SensorThresholds(200, 10000, 1000, 7000, DEFAULT_WARNING_MARGIN);
    }

    /**
     * Reads {prefix}_MIN, {prefix}_MAX, {prefix}_OPTIMAL_MIN, {prefix}_OPTIMAL_MAX.
     */
    public static SensorThresholds fromEnv(String prefix, SensorThresholds defaults) {
        return new SensorThresholds(
            Env.getDouble(prefix + "_MIN", defaults.min()),
            Env.getDouble(prefix + "_MAX", defaults.max()),
            Env.getDouble(prefix + "_OPTIMAL_MIN", defaults.optimalMin()),
            Env.getDouble(prefix + "_OPTIMAL_MAX", defaults.optimalMax()),
            defaults.warningMargin()
        );
    }

    public double range() {
        return max - min;
    }
}
