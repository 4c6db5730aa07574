package in.greenhouse.domain.pump;

/**
 * Reconciled pump state plus values derived at read time.
 *
 * @param gatewayOn last actuator state read from the gateway, null when unreadable
 */
public record PumpStatus(
    PumpState state,
    double currentRuntimeSeconds,
    double currentWaterUsed,
    long remainingSeconds,
    Boolean gatewayOn,
    boolean stateSynced
) {
    public boolean isOn() {
        return state.on();
    }
}
