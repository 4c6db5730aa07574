package in.greenhouse.domain.schedule;

import java.util.List;

/**
 * Caller input for creating or patching a schedule. Null fields are "not provided".
 *
 * @param startTime HH:MM text, validated by the scheduler
 */
public record ScheduleDraft(
    String name,
    List<String> days,
    String startTime,
    Integer durationSeconds,
    Boolean active
) {
    public static ScheduleDraft of(String name, List<String> days, String startTime, int durationSeconds) {
        return new ScheduleDraft(name, days, startTime, durationSeconds, null);
    }
}
