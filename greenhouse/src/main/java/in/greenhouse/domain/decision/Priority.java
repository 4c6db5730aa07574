package in.greenhouse.domain.decision;

public enum Priority {
    LOW,
    NORMAL,
    HIGH;

    public String code() {
        return name().toLowerCase();
    }

    /**
     * Unknown or missing values map to NORMAL; "medium" is accepted as NORMAL.
     */
    public static Priority fromCode(String code) {
        if (code == null) return NORMAL;
        switch (code.trim().toLowerCase()) {
            case "high":
                return HIGH;
            case "low":
                return LOW;
            default:
                return NORMAL;
        }
    }
}
