package in.greenhouse.domain.decision;

/**
 * Severity scale shared by soil dryness risk and temperature stress.
 */
public enum RiskLevel {
    NONE,
    MEDIUM,
    HIGH,
    EXTREME;

    public String code() {
        return name().toLowerCase();
    }

    public boolean atLeast(RiskLevel other) {
        return ordinal() >= other.ordinal();
    }
}
