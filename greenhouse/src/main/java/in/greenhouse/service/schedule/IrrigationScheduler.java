package in.greenhouse.service.schedule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.greenhouse.application.port.output.DurableStore;
import in.greenhouse.application.port.output.FastCache;
import in.greenhouse.domain.common.ValidationException;
import in.greenhouse.domain.pump.PumpCommandResult;
import in.greenhouse.domain.pump.TriggerSource;
import in.greenhouse.domain.schedule.ScheduleDraft;
import in.greenhouse.domain.schedule.ScheduleEntry;
import in.greenhouse.infrastructure.json.IrrigationJson;
import in.greenhouse.infrastructure.metrics.IrrigationMetrics;
import in.greenhouse.service.common.PeriodicTask;
import in.greenhouse.service.pump.PumpController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Time-of-day / day-of-week irrigation schedules.
 *
 * Entries are kept in insertion order, loaded at construction from the fast cache or,
 * on a cold cache, from the durable store (and written back to the cache). Every
 * successful mutation re-persists the whole collection to both.
 *
 * {@link #checkSchedules()} runs on its own periodic worker and starts the pump for at
 * most one matching entry per tick. Each tick covers every minute since the previous
 * tick (up to {@link #MAX_CATCH_UP_MINUTES}), so a late tick still sees the minute it
 * overran.
 */
public final class IrrigationScheduler {
    private static final Logger log = LoggerFactory.getLogger(IrrigationScheduler.class);

    public static final String CACHE_KEY = "schedule:schedules";
    public static final String STORE_PATH = "schedules";
    public static final int MAX_CATCH_UP_MINUTES = 5;

    private final PumpController pump;
    private final FastCache cache;
    private final DurableStore store;
    private final Clock clock;
    private final IrrigationMetrics metrics;
    private final PeriodicTask worker;

    private final List<ScheduleEntry> schedules = new CopyOnWriteArrayList<>();
    private volatile LocalDateTime lastCheckedMinute;

    public IrrigationScheduler(PumpController pump, FastCache cache, DurableStore store,
                               Clock clock, Duration checkInterval, IrrigationMetrics metrics) {
        this.pump = pump;
        this.cache = cache;
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
        this.worker = new PeriodicTask("irrigation-scheduler", checkInterval, Duration.ZERO,
            this::checkSchedules, e -> {
                if (metrics != null) {
                    metrics.recordTaskFailure("scheduler");
                }
            });
        load();
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    public boolean start() {
        lastCheckedMinute = null;
        return worker.start();
    }

    public boolean stop() {
        return worker.stop();
    }

    public boolean isRunning() {
        return worker.isRunning();
    }

    // ═══════════════════════════════════════════════════════════════
    // Tick
    // ═══════════════════════════════════════════════════════════════

    /**
     * Honour due pump stops, then fire the first entry (in stored order) whose weekday and
     * start minute fall in the window since the previous tick.
     *
     * @return the entry that was fired, empty when none matched or the pump was running
     */
    public Optional<ScheduleEntry> checkSchedules() {
        pump.checkScheduledActions();

        LocalDateTime nowMinute = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        List<LocalDateTime> window = minutesToCheck(nowMinute);
        lastCheckedMinute = nowMinute;

        if (pump.isRunning()) {
            log.debug("[SCHEDULER] Pump already running, skipping schedule check");
            return Optional.empty();
        }

        for (ScheduleEntry entry : schedules) {
            if (!entry.active() || !matchesAny(entry, window)) {
                continue;
            }
            int duration = entry.durationSeconds() > 0
                ? entry.durationSeconds()
                : (int) PumpController.DEFAULT_DURATION_SECONDS;
            log.info("[SCHEDULER] Schedule '{}' ({}) due, starting pump for {}s", entry.name(), entry.id(), duration);

            PumpCommandResult result = pump.turnOn(duration, TriggerSource.SCHEDULE, fireDetails(entry));
            if (result.success()) {
                if (metrics != null) {
                    metrics.recordScheduleFire();
                }
            } else {
                log.warn("[SCHEDULER] Schedule '{}' did not start the pump: {} ({})",
                    entry.name(), result.message(), result.reason());
            }
            return Optional.of(entry);
        }
        return Optional.empty();
    }

    /**
     * Minutes after the last checked one up to now. The current minute is always included,
     * so a repeated tick within the same minute checks it again.
     */
    private List<LocalDateTime> minutesToCheck(LocalDateTime nowMinute) {
        LocalDateTime last = lastCheckedMinute;
        LocalDateTime from = nowMinute;
        if (last != null && last.isBefore(nowMinute)) {
            from = last.plusMinutes(1);
            LocalDateTime oldest = nowMinute.minusMinutes(MAX_CATCH_UP_MINUTES - 1L);
            if (from.isBefore(oldest)) {
                log.warn("[SCHEDULER] {} minutes since last check, only the last {} are checked",
                    ChronoUnit.MINUTES.between(last, nowMinute), MAX_CATCH_UP_MINUTES);
                from = oldest;
            }
        }
        List<LocalDateTime> minutes = new ArrayList<>();
        for (LocalDateTime m = from; !m.isAfter(nowMinute); m = m.plusMinutes(1)) {
            minutes.add(m);
        }
        return minutes;
    }

    private static boolean matchesAny(ScheduleEntry entry, List<LocalDateTime> minutes) {
        for (LocalDateTime minute : minutes) {
            if (entry.matches(minute.getDayOfWeek(), minute.toLocalTime())) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, String> fireDetails(ScheduleEntry entry) {
        Map<String, String> details = new LinkedHashMap<>();
        if (entry.id() != null) {
            details.put("schedule_id", entry.id());
        }
        if (entry.name() != null) {
            details.put("schedule_name", entry.name());
        }
        return details;
    }

    // ═══════════════════════════════════════════════════════════════
    // CRUD
    // ═══════════════════════════════════════════════════════════════

    public List<ScheduleEntry> list() {
        return List.copyOf(schedules);
    }

    public Optional<ScheduleEntry> get(String id) {
        return schedules.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    /**
     * @throws ValidationException when any field is missing or invalid
     */
    public synchronized ScheduleEntry add(ScheduleDraft draft) {
        ScheduleValidator.validateComplete(draft);

        Instant now = clock.instant();
        ScheduleEntry entry = new ScheduleEntry(
            nextId(now),
            draft.name().trim(),
            ScheduleValidator.normalizeDays(draft.days()),
            ScheduleValidator.parseTime(draft.startTime()),
            draft.durationSeconds(),
            draft.active() == null || draft.active(),
            now,
            null
        );
        schedules.add(entry);
        save();
        log.info("[SCHEDULER] Added schedule '{}' ({})", entry.name(), entry.id());
        return entry;
    }

    /**
     * Apply the provided fields of the draft to an existing entry.
     *
     * @return the updated entry, empty when no entry has this id
     * @throws ValidationException when a provided field is invalid
     */
    public synchronized Optional<ScheduleEntry> update(String id, ScheduleDraft draft) {
        int index = indexOf(id);
        if (index < 0) {
            return Optional.empty();
        }
        ScheduleEntry current = schedules.get(index);

        String name = current.name();
        if (draft.name() != null) {
            if (draft.name().isBlank()) {
                throw new ValidationException("name", "Name must not be blank");
            }
            name = draft.name().trim();
        }
        List<String> days = draft.days() != null ? ScheduleValidator.normalizeDays(draft.days()) : current.days();
        LocalTime start = draft.startTime() != null ? ScheduleValidator.parseTime(draft.startTime()) : current.startTime();
        int duration = current.durationSeconds();
        if (draft.durationSeconds() != null) {
            ScheduleValidator.validateDuration(draft.durationSeconds());
            duration = draft.durationSeconds();
        }
        boolean active = draft.active() != null ? draft.active() : current.active();

        ScheduleEntry updated = new ScheduleEntry(id, name, days, start, duration, active,
            current.createdAt(), clock.instant());
        schedules.set(index, updated);
        save();
        log.info("[SCHEDULER] Updated schedule '{}' ({})", updated.name(), id);
        return Optional.of(updated);
    }

    /**
     * @return false when no entry has this id
     */
    public synchronized boolean delete(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        ScheduleEntry removed = schedules.remove(index);
        save();
        log.info("[SCHEDULER] Deleted schedule '{}' ({})", removed.name(), id);
        return true;
    }

    private int indexOf(String id) {
        for (int i = 0; i < schedules.size(); i++) {
            if (schedules.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private String nextId(Instant now) {
        int suffix = schedules.size();
        String id = "schedule_" + now.getEpochSecond() + "_" + suffix;
        while (indexOf(id) >= 0) {
            suffix++;
            id = "schedule_" + now.getEpochSecond() + "_" + suffix;
        }
        return id;
    }

    // ═══════════════════════════════════════════════════════════════
    // Persistence
    // ═══════════════════════════════════════════════════════════════

    private void load() {
        try {
            Optional<String> cached = cache.get(CACHE_KEY);
            if (cached.isPresent()) {
                schedules.addAll(IrrigationJson.schedulesFromArray(IrrigationJson.read(cached.get())));
                log.info("[SCHEDULER] Loaded {} schedules from cache", schedules.size());
                return;
            }
        } catch (RuntimeException e) {
            log.warn("[SCHEDULER] Could not read cached schedules: {}", e.getMessage());
        }

        try {
            Optional<JsonNode> stored = store.get(STORE_PATH);
            if (stored.isPresent() && stored.get().isObject()) {
                List<ScheduleEntry> loaded = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> fields = stored.get().fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    loaded.add(IrrigationJson.scheduleEntry(field.getKey(), field.getValue()));
                }
                schedules.addAll(loaded);
                log.info("[SCHEDULER] Loaded {} schedules from durable store", loaded.size());
                writeCache();
            }
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Could not load schedules from durable store: {}", e.getMessage());
        }
    }

    private void save() {
        writeCache();
        ObjectNode byId = IrrigationJson.mapper().createObjectNode();
        for (ScheduleEntry entry : schedules) {
            byId.set(entry.id(), IrrigationJson.toJsonWithoutId(entry));
        }
        try {
            store.set(STORE_PATH, byId);
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Failed to store schedules: {}", e.getMessage());
        }
    }

    private void writeCache() {
        try {
            cache.set(CACHE_KEY, IrrigationJson.write(IrrigationJson.schedulesToJson(schedules)));
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Failed to cache schedules: {}", e.getMessage());
        }
    }
}
