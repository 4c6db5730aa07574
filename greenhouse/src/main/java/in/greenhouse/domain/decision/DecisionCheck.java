package in.greenhouse.domain.decision;

import in.greenhouse.domain.common.ReasonCode;

/**
 * Whether the decision loop may decide now, and why not.
 */
public record DecisionCheck(
    boolean allowed,
    ReasonCode reason,
    long timeRemainingSeconds
) {
    public static DecisionCheck allow() {
        return new DecisionCheck(true, null, 0L);
    }

    public static DecisionCheck deny(ReasonCode reason) {
        return new DecisionCheck(false, reason, 0L);
    }

    public static DecisionCheck cooldown(long remainingSeconds) {
        return new DecisionCheck(false, ReasonCode.MIN_INTERVAL_NOT_MET, Math.max(0L, remainingSeconds));
    }
}
