package in.greenhouse.domain.pump;

/**
 * What caused a pump transition.
 */
public enum TriggerSource {
    MANUAL("manual"),
    SCHEDULE("schedule"),
    AUTO("auto"),
    SYNC("sync"),
    AI_RECOMMENDATION("ai_recommendation"),
    SYSTEM("system");

    private final String code;

    TriggerSource(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TriggerSource fromCode(String code) {
        if (code != null) {
            for (TriggerSource source : values()) {
                if (source.code.equalsIgnoreCase(code)) {
                    return source;
                }
            }
        }
        return MANUAL;
    }
}
