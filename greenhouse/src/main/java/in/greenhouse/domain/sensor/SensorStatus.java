package in.greenhouse.domain.sensor;

/**
 * Health of a sensor reading relative to its thresholds. Declared from best to worst.
 */
public enum SensorStatus {
    NORMAL,
    WARNING,
    CRITICAL,
    UNKNOWN;

    public String code() {
        return name().toLowerCase();
    }

    /**
     * The worse of two statuses; UNKNOWN never outranks a known status.
     */
    public SensorStatus worse(SensorStatus other) {
        if (other == null || other == UNKNOWN) return this;
        if (this == UNKNOWN) return other;
        return other.ordinal() > ordinal() ? other : this;
    }
}
