package in.greenhouse.domain.pump;

import in.greenhouse.domain.common.ReasonCode;

import java.time.Instant;

/**
 * Outcome of a turnOn / turnOff request.
 *
 * Policy refusals carry a {@link ReasonCode}; mechanical failures carry GATEWAY_COMMAND_FAILED.
 */
public record PumpCommandResult(
    boolean success,
    ReasonCode reason,
    String message,
    Instant startTime,
    Instant scheduledStopTime,
    long durationSeconds,
    double runDurationSeconds,
    double waterUsed,
    Instant stopTime,
    long remainingWaitSeconds
) {
    public static PumpCommandResult started(Instant start, Instant stopAt, long durationSeconds) {
        return new PumpCommandResult(true, null,
            "Pump turned ON for " + durationSeconds + " seconds",
            start, stopAt, durationSeconds, 0.0, 0.0, null, 0L);
    }

    public static PumpCommandResult stopped(Instant stopTime, double runDurationSeconds, double waterUsed) {
        return new PumpCommandResult(true, null,
            String.format("Pump turned OFF after %.1f seconds", runDurationSeconds),
            null, null, 0L, runDurationSeconds, waterUsed, stopTime, 0L);
    }

    public static PumpCommandResult refused(ReasonCode reason, String message) {
        return new PumpCommandResult(false, reason, message, null, null, 0L, 0.0, 0.0, null, 0L);
    }

    public static PumpCommandResult cooldown(long remainingWaitSeconds) {
        return new PumpCommandResult(false, ReasonCode.MIN_INTERVAL_NOT_MET,
            "Minimum interval between runs not met, wait " + remainingWaitSeconds + " seconds",
            null, null, 0L, 0.0, 0.0, null, Math.max(0L, remainingWaitSeconds));
    }

    public static PumpCommandResult failed(String message) {
        return refused(ReasonCode.GATEWAY_COMMAND_FAILED, message);
    }

    public boolean isRefusal() {
        return !success && reason != null && reason != ReasonCode.GATEWAY_COMMAND_FAILED;
    }
}
