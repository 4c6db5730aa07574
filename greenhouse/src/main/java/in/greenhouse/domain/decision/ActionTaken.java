package in.greenhouse.domain.decision;

public record ActionTaken(
    String action,
    long durationSeconds,
    boolean success,
    String message
) {
    public static final String IRRIGATION_STARTED = "irrigation_started";
    public static final String NO_ACTION = "no_action";

    public static ActionTaken none(String message) {
        return new ActionTaken(NO_ACTION, 0L, true, message);
    }
}
