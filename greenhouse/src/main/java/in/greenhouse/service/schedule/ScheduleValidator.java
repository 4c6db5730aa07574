package in.greenhouse.service.schedule;

import in.greenhouse.domain.common.ValidationException;
import in.greenhouse.domain.schedule.ScheduleDraft;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field rules for schedule entries.
 */
final class ScheduleValidator {

    static final List<String> WEEKDAYS = List.of(
        "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday");

    private static final Pattern TIME = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    private ScheduleValidator() {}

    /**
     * All fields must be present and valid.
     */
    static void validateComplete(ScheduleDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new ValidationException("name", "Missing required field");
        }
        if (draft.days() == null) {
            throw new ValidationException("days", "Missing required field");
        }
        if (draft.startTime() == null) {
            throw new ValidationException("start_time", "Missing required field");
        }
        if (draft.durationSeconds() == null) {
            throw new ValidationException("duration", "Missing required field");
        }
        normalizeDays(draft.days());
        parseTime(draft.startTime());
        validateDuration(draft.durationSeconds());
    }

    /**
     * Lowercase, de-duplicated weekday names in input order.
     */
    static List<String> normalizeDays(List<String> days) {
        if (days.isEmpty()) {
            throw new ValidationException("days", "At least one day is required");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String day : days) {
            String d = day == null ? "" : day.trim().toLowerCase(Locale.ROOT);
            if (!WEEKDAYS.contains(d)) {
                throw new ValidationException("days", "Invalid day: " + day);
            }
            normalized.add(d);
        }
        return new ArrayList<>(normalized);
    }

    static LocalTime parseTime(String text) {
        if (text == null || !TIME.matcher(text.trim()).matches()) {
            throw new ValidationException("start_time", "Invalid time format, expected HH:MM: " + text);
        }
        String t = text.trim();
        return LocalTime.of(Integer.parseInt(t.substring(0, 2)), Integer.parseInt(t.substring(3, 5)));
    }

    static void validateDuration(Integer duration) {
        if (duration == null || duration <= 0) {
            throw new ValidationException("duration", "Duration must be a positive number of seconds");
        }
    }
}
