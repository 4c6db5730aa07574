package in.greenhouse.service.schedule;

import in.greenhouse.config.PumpConfig;
import in.greenhouse.domain.common.ValidationException;
import in.greenhouse.domain.pump.IrrigationEvent;
import in.greenhouse.domain.pump.TriggerSource;
import in.greenhouse.domain.schedule.ScheduleDraft;
import in.greenhouse.domain.schedule.ScheduleEntry;
import in.greenhouse.service.pump.PumpController;
import in.greenhouse.support.FakeFeedGateway;
import in.greenhouse.support.InMemoryDurableStore;
import in.greenhouse.support.InMemoryFastCache;
import in.greenhouse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IrrigationScheduler.
 *
 * Tests:
 * - CRUD with validation and persistence to cache and durable store
 * - Firing on weekday + minute match, at most one entry per tick
 * - Scheduled stop handled on the tick
 */
class IrrigationSchedulerTest {

    // Monday
    private static final Instant MONDAY_0600 = Instant.parse("2024-06-03T06:00:00Z");

    private MutableClock clock;
    private FakeFeedGateway gateway;
    private InMemoryFastCache cache;
    private InMemoryDurableStore store;
    private PumpController pump;
    private IrrigationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MONDAY_0600.minusSeconds(3600));
        gateway = new FakeFeedGateway(clock);
        cache = new InMemoryFastCache();
        store = new InMemoryDurableStore(clock);
        pump = new PumpController(gateway, cache, store,
            new PumpConfig("water-pump-control", 1800, 0, 0.5, 50), clock);
        scheduler = newScheduler();
    }

    private IrrigationScheduler newScheduler() {
        return new IrrigationScheduler(pump, cache, store, clock, Duration.ofSeconds(60), null);
    }

    // ═══════════════════════════════════════════════════════════════
    // CRUD
    // ═══════════════════════════════════════════════════════════════

    @Test
    void add_normalizesAndPersists() {
        ScheduleEntry entry = scheduler.add(
            ScheduleDraft.of("  Morning  ", List.of("Monday", "WEDNESDAY", "monday"), "06:00", 600));

        assertEquals("Morning", entry.name());
        assertEquals(List.of("monday", "wednesday"), entry.days(), "Lowercased and de-duplicated");
        assertEquals(LocalTime.of(6, 0), entry.startTime());
        assertTrue(entry.active(), "Active by default");
        assertTrue(entry.id().startsWith("schedule_"));

        assertTrue(cache.contains(IrrigationScheduler.CACHE_KEY));
        assertEquals("Morning", store.snapshot().path("schedules").path(entry.id()).path("name").asText());
    }

    @Test
    void add_rejectsInvalidInput() {
        assertField("name", () -> scheduler.add(ScheduleDraft.of(" ", List.of("monday"), "06:00", 60)));
        assertField("days", () -> scheduler.add(ScheduleDraft.of("a", List.of(), "06:00", 60)));
        assertField("days", () -> scheduler.add(ScheduleDraft.of("a", List.of("funday"), "06:00", 60)));
        assertField("start_time", () -> scheduler.add(ScheduleDraft.of("a", List.of("monday"), "6:00", 60)));
        assertField("start_time", () -> scheduler.add(ScheduleDraft.of("a", List.of("monday"), "24:00", 60)));
        assertField("duration", () -> scheduler.add(ScheduleDraft.of("a", List.of("monday"), "06:00", 0)));
        assertField("duration", () -> scheduler.add(new ScheduleDraft("a", List.of("monday"), "06:00", null, null)));

        assertTrue(scheduler.list().isEmpty(), "Rejected input must not create entries");
    }

    private static void assertField(String field, Runnable call) {
        ValidationException e = assertThrows(ValidationException.class, call::run);
        assertEquals(field, e.getField());
    }

    @Test
    void update_appliesOnlyProvidedFields() {
        ScheduleEntry entry = scheduler.add(ScheduleDraft.of("Morning", List.of("monday"), "06:00", 600));
        clock.advanceSeconds(10);

        Optional<ScheduleEntry> updated = scheduler.update(entry.id(),
            new ScheduleDraft(null, null, "07:30", null, false));

        assertTrue(updated.isPresent());
        assertEquals("Morning", updated.get().name());
        assertEquals(LocalTime.of(7, 30), updated.get().startTime());
        assertEquals(600, updated.get().durationSeconds());
        assertFalse(updated.get().active());
        assertEquals(entry.createdAt(), updated.get().createdAt());
        assertEquals(clock.instant(), updated.get().updatedAt());
    }

    @Test
    void update_invalidFieldLeavesEntryUnchanged() {
        ScheduleEntry entry = scheduler.add(ScheduleDraft.of("Morning", List.of("monday"), "06:00", 600));

        assertThrows(ValidationException.class,
            () -> scheduler.update(entry.id(), new ScheduleDraft(null, null, null, -5, null)));

        assertEquals(entry, scheduler.get(entry.id()).orElseThrow());
    }

    @Test
    void updateAndDelete_unknownId() {
        assertTrue(scheduler.update("schedule_missing", new ScheduleDraft("x", null, null, null, null)).isEmpty());
        assertFalse(scheduler.delete("schedule_missing"));
    }

    @Test
    void delete_removesEverywhere() {
        ScheduleEntry a = scheduler.add(ScheduleDraft.of("A", List.of("monday"), "06:00", 60));
        ScheduleEntry b = scheduler.add(ScheduleDraft.of("B", List.of("monday"), "07:00", 60));
        assertNotEquals(a.id(), b.id(), "Ids are unique within the same second");

        assertTrue(scheduler.delete(a.id()));

        assertEquals(List.of(b), scheduler.list());
        assertTrue(store.snapshot().path("schedules").path(a.id()).isMissingNode());
    }

    @Test
    void testSchedulesReloadedFromStoreOnColdCache() {
        scheduler.add(ScheduleDraft.of("A", List.of("monday"), "06:00", 60));
        cache.clear();

        IrrigationScheduler reloaded = newScheduler();

        assertEquals(1, reloaded.list().size());
        assertEquals("A", reloaded.list().get(0).name());
        assertTrue(cache.contains(IrrigationScheduler.CACHE_KEY), "Cache is warmed after a store load");
    }

    // ═══════════════════════════════════════════════════════════════
    // Tick
    // ═══════════════════════════════════════════════════════════════

    @Test
    void checkSchedules_firesMatchingEntry() {
        ScheduleEntry entry = scheduler.add(ScheduleDraft.of("Morning", List.of("monday"), "06:00", 600));
        clock.set(MONDAY_0600.plusSeconds(25));

        Optional<ScheduleEntry> fired = scheduler.checkSchedules();

        assertEquals(Optional.of(entry), fired);
        assertTrue(pump.currentState().on());
        assertEquals(TriggerSource.SCHEDULE, pump.currentState().startedBy());
        assertEquals(MONDAY_0600.plusSeconds(625), pump.currentState().scheduledStopTime());
    }

    @Test
    void checkSchedules_ignoresOtherDaysTimesAndInactive() {
        scheduler.add(ScheduleDraft.of("Tuesday", List.of("tuesday"), "06:00", 600));
        scheduler.add(ScheduleDraft.of("Later", List.of("monday"), "06:01", 600));
        scheduler.add(new ScheduleDraft("Paused", List.of("monday"), "06:00", 600, false));
        clock.set(MONDAY_0600);

        assertTrue(scheduler.checkSchedules().isEmpty());
        assertTrue(gateway.commands().isEmpty());
    }

    @Test
    void checkSchedules_firesAtMostOneEntryPerTick() {
        ScheduleEntry first = scheduler.add(ScheduleDraft.of("First", List.of("monday"), "06:00", 120));
        scheduler.add(ScheduleDraft.of("Second", List.of("monday"), "06:00", 900));
        clock.set(MONDAY_0600);

        assertEquals(Optional.of(first), scheduler.checkSchedules());
        assertEquals(1, gateway.commands().size());

        clock.advanceSeconds(30);
        assertTrue(scheduler.checkSchedules().isEmpty(), "Pump running, nothing else fires");
        assertEquals(1, gateway.commands().size());
    }

    @Test
    void checkSchedules_lateTickStillFiresOverrunMinute() {
        ScheduleEntry entry = scheduler.add(ScheduleDraft.of("Morning", List.of("monday"), "06:00", 600));
        clock.set(MONDAY_0600.minusSeconds(30));
        assertTrue(scheduler.checkSchedules().isEmpty(), "05:59 tick");

        // Next tick lands at 06:01:01, the 06:00 minute was never observed
        clock.advanceSeconds(91);
        Optional<ScheduleEntry> fired = scheduler.checkSchedules();

        assertEquals(Optional.of(entry), fired);
        assertTrue(pump.currentState().on());
        assertEquals(1, gateway.commands().size());
    }

    @Test
    void checkSchedules_minuteIsNotFiredAgainOnLaterTicks() {
        scheduler.add(ScheduleDraft.of("Short", List.of("monday"), "06:00", 30));
        clock.set(MONDAY_0600.plusSeconds(10));
        assertTrue(scheduler.checkSchedules().isPresent());

        clock.advanceSeconds(61);
        assertTrue(scheduler.checkSchedules().isEmpty(), "Pump stopped at 06:00:40, 06:00 already handled");
        assertFalse(pump.currentState().on());
    }

    @Test
    void checkSchedules_catchUpIsBounded() {
        scheduler.add(ScheduleDraft.of("Morning", List.of("monday"), "06:00", 600));
        clock.set(MONDAY_0600.minusSeconds(60));
        scheduler.checkSchedules();

        clock.set(MONDAY_0600.plusSeconds(60L * IrrigationScheduler.MAX_CATCH_UP_MINUTES));
        assertTrue(scheduler.checkSchedules().isEmpty(), "Missed minute is outside the catch-up window");
        assertTrue(gateway.commands().isEmpty());
    }

    @Test
    void checkSchedules_firesCachedEntryWithoutName() {
        cache.set(IrrigationScheduler.CACHE_KEY,
            "[{\"id\":\"schedule_1_0\",\"days\":[\"monday\"],\"start_time\":\"06:00\",\"duration\":120}]");
        IrrigationScheduler fromCache = newScheduler();
        clock.set(MONDAY_0600);

        Optional<ScheduleEntry> fired = fromCache.checkSchedules();

        assertTrue(fired.isPresent());
        assertEquals("schedule_1_0", fired.get().name(), "Missing name falls back to the id");
        assertTrue(pump.currentState().on());
    }

    @Test
    void checkSchedules_stopsPumpWhenDue() {
        scheduler.add(ScheduleDraft.of("Short", List.of("monday"), "06:00", 30));
        clock.set(MONDAY_0600);
        scheduler.checkSchedules();

        clock.advanceSeconds(90);
        scheduler.checkSchedules();

        assertFalse(pump.currentState().on());
        List<IrrigationEvent> history = pump.getIrrigationHistory(5);
        assertEquals(1, history.size());
        assertEquals(TriggerSource.SCHEDULE, history.get(0).source());
        assertEquals(Map.of("reason", "scheduled_stop", "started_by", "schedule"), history.get(0).details());
    }

    @Test
    void testStartStopLifecycle() {
        assertTrue(scheduler.start());
        assertFalse(scheduler.start(), "Second start is a no-op");
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.stop());
        assertFalse(scheduler.isRunning());
    }
}
