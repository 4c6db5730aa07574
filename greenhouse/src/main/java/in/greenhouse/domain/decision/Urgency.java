package in.greenhouse.domain.decision;

public enum Urgency {
    NONE,
    MEDIUM,
    HIGH;

    public String code() {
        return name().toLowerCase();
    }

    public static Urgency fromCode(String code) {
        return code == null ? NONE : valueOf(code.toUpperCase());
    }
}
