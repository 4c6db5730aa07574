package in.greenhouse.domain.pump;

import java.time.Instant;

/**
 * Logical state of the physical water pump.
 *
 * Immutable; every transition produces a new instance which the controller persists.
 *
 * @param startedBy what started the current run, null while OFF
 */
public record PumpState(
    boolean on,
    Instant startTime,
    Instant scheduledStopTime,
    Instant lastOnTime,
    Instant lastOffTime,
    double totalRuntimeSeconds,
    double totalWaterUsed,
    TriggerSource startedBy
) {
    public static PumpState initial() {
        return new PumpState(false, null, null, null, null, 0.0, 0.0, null);
    }

    public PumpState started(Instant now, Instant stopAt, TriggerSource source) {
        return new PumpState(true, now, stopAt, now, lastOffTime, totalRuntimeSeconds, totalWaterUsed, source);
    }

    /**
     * ON as reported by the gateway without a local command. Keeps a known start time.
     */
    public PumpState adoptedOn(Instant now, Instant stopAt) {
        Instant start = startTime != null ? startTime : now;
        return new PumpState(true, start, stopAt, now, lastOffTime, totalRuntimeSeconds, totalWaterUsed,
            TriggerSource.SYNC);
    }

    public PumpState stopped(Instant now, double runtimeSeconds, double waterLiters) {
        return new PumpState(false, null, null, lastOnTime, now,
            totalRuntimeSeconds + runtimeSeconds, totalWaterUsed + waterLiters, null);
    }
}
