package in.greenhouse.domain.decision;

/**
 * Watering volume class. NONE when no water is needed.
 */
public enum WaterAmount {
    NONE,
    LIGHT,
    MODERATE,
    HEAVY;

    public String code() {
        return name().toLowerCase();
    }

    public static WaterAmount fromCode(String code) {
        return code == null ? NONE : valueOf(code.toUpperCase());
    }

    /**
     * Volume class for an externally recommended run length.
     */
    public static WaterAmount forDurationMinutes(double minutes) {
        if (minutes > 15) return HEAVY;
        if (minutes > 5) return MODERATE;
        return LIGHT;
    }
}
