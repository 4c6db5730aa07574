package in.greenhouse.domain.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Time-of-day / day-of-week watering rule.
 *
 * @param days lowercase weekday names, e.g. "monday"
 */
public record ScheduleEntry(
    String id,
    String name,
    List<String> days,
    LocalTime startTime,
    int durationSeconds,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {
    public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public ScheduleEntry {
        days = days == null ? List.of() : List.copyOf(days);
    }

    /**
     * True when this entry fires on the given weekday at the given minute.
     */
    public boolean matches(DayOfWeek day, LocalTime minute) {
        String dayName = day.name().toLowerCase(Locale.ROOT);
        return days.contains(dayName)
            && startTime != null
            && startTime.getHour() == minute.getHour()
            && startTime.getMinute() == minute.getMinute();
    }

    public String startTimeText() {
        return startTime == null ? null : startTime.format(TIME_FORMAT);
    }
}
