package in.greenhouse.domain.common;

/**
 * Machine-readable reason codes returned to callers when an operation is refused
 * by policy rather than by a mechanical failure.
 */
public enum ReasonCode {
    ALREADY_RUNNING("already_running"),
    MIN_INTERVAL_NOT_MET("min_interval_not_met"),
    ALREADY_OFF("already_off"),
    GATEWAY_COMMAND_FAILED("gateway_command_failed"),
    AUTO_IRRIGATION_DISABLED("auto_irrigation_disabled"),
    PUMP_ALREADY_RUNNING("pump_already_running"),
    NO_SOIL_MOISTURE_DATA("no_soil_moisture_data"),
    AI_RECOMMENDATIONS_DISABLED("ai_recommendations_disabled"),
    SOURCE_NOT_ALLOWED("source_not_allowed"),
    INVALID_ACTION("invalid_action");

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
