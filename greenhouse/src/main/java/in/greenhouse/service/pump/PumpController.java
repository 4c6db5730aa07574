package in.greenhouse.service.pump;

import com.fasterxml.jackson.databind.JsonNode;
import in.greenhouse.application.port.output.DurableStore;
import in.greenhouse.application.port.output.FastCache;
import in.greenhouse.application.port.output.FeedGateway;
import in.greenhouse.config.PumpConfig;
import in.greenhouse.domain.common.ReasonCode;
import in.greenhouse.domain.pump.IrrigationEvent;
import in.greenhouse.domain.pump.IrrigationStatistics;
import in.greenhouse.domain.pump.PumpCommandResult;
import in.greenhouse.domain.pump.PumpState;
import in.greenhouse.domain.pump.PumpStatus;
import in.greenhouse.domain.pump.TriggerSource;
import in.greenhouse.infrastructure.json.IrrigationJson;
import in.greenhouse.infrastructure.metrics.IrrigationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Exclusive owner of the water pump's logical state.
 *
 * State machine:
 * <pre>
 * OFF --turnOn (safety check passes)--> ON
 * ON  --turnOff | scheduled stop | gateway reports OFF--> OFF
 * </pre>
 *
 * Every operation first reconciles the local state with the actuator state the gateway
 * reports. Drift is corrected with the same accounting as an explicit start or stop.
 * Safety refusals come back as {@link PumpCommandResult} values, never as exceptions.
 *
 * State is mirrored to the fast cache (pump:state) and the durable store (pump/state)
 * after every transition. Each transition to OFF appends exactly one irrigation event.
 *
 * When a stop timer is supplied, every run arms a one-shot stop at its scheduled stop
 * time, so max runtime holds even if no scheduler tick arrives. Transitions are
 * serialized on the instance because the timer thread is a second writer.
 *
 * One instance per physical pump, created by the composition root.
 */
public final class PumpController {
    private static final Logger log = LoggerFactory.getLogger(PumpController.class);

    public static final String STATE_KEY = "pump:state";
    public static final String HISTORY_KEY = "pump:history";
    public static final String STATE_PATH = "pump/state";
    public static final String EVENTS_PATH = "irrigation_events";

    public static final long DEFAULT_DURATION_SECONDS = 300;

    private final FeedGateway gateway;
    private final FastCache cache;
    private final DurableStore store;
    private final PumpConfig config;
    private final Clock clock;
    private final MoistureProbe moistureProbe;
    private final IrrigationMetrics metrics;
    private final ScheduledExecutorService stopTimer;

    private volatile PumpState state;
    private ScheduledFuture<?> pendingStop;
    private volatile Boolean lastGatewayState;
    private volatile Double moistureAtStart;

    public PumpController(FeedGateway gateway, FastCache cache, DurableStore store,
                          PumpConfig config, Clock clock) {
        this(gateway, cache, store, config, clock, MoistureProbe.none(), null);
    }

    public PumpController(FeedGateway gateway, FastCache cache, DurableStore store,
                          PumpConfig config, Clock clock,
                          MoistureProbe moistureProbe, IrrigationMetrics metrics) {
        this(gateway, cache, store, config, clock, moistureProbe, metrics, null);
    }

    /**
     * @param stopTimer executor for one-shot timed stops, null to rely on
     *                  {@link #checkScheduledActions()} callers only
     */
    public PumpController(FeedGateway gateway, FastCache cache, DurableStore store,
                          PumpConfig config, Clock clock,
                          MoistureProbe moistureProbe, IrrigationMetrics metrics,
                          ScheduledExecutorService stopTimer) {
        this.gateway = gateway;
        this.cache = cache;
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.moistureProbe = moistureProbe;
        this.metrics = metrics;
        this.stopTimer = stopTimer;
        this.state = restoreState();
        if (state.on() && state.scheduledStopTime() != null) {
            armStopTimer(state.scheduledStopTime());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Commands
    // ═══════════════════════════════════════════════════════════════

    /**
     * Start the pump for durationSeconds, clamped to the configured max runtime.
     * Non-positive durations use {@link #DEFAULT_DURATION_SECONDS}.
     */
    public synchronized PumpCommandResult turnOn(long durationSeconds, TriggerSource source, Map<String, String> details) {
        reconcile();
        Instant now = clock.instant();
        PumpState current = state;

        if (current.on()) {
            log.info("[PUMP] turnOn from {} refused: already running", source.code());
            return refuse(PumpCommandResult.refused(ReasonCode.ALREADY_RUNNING, "Water pump is already running"));
        }

        long remaining = cooldownRemainingSeconds(current, now);
        if (remaining > 0) {
            log.info("[PUMP] turnOn from {} refused: min interval not met, {}s remaining", source.code(), remaining);
            return refuse(PumpCommandResult.cooldown(remaining));
        }

        long duration = durationSeconds > 0 ? durationSeconds : DEFAULT_DURATION_SECONDS;
        if (duration > config.maxRuntimeSeconds()) {
            log.warn("[PUMP] Requested {}s exceeds max runtime, clamping to {}s", duration, config.maxRuntimeSeconds());
            duration = config.maxRuntimeSeconds();
        }

        if (!gateway.setActuator(config.feedKey(), true)) {
            log.error("[PUMP] Gateway did not accept ON command");
            return refuse(PumpCommandResult.failed("Failed to send ON command to gateway"));
        }

        Instant stopAt = now.plusSeconds(duration);
        state = current.started(now, stopAt, source);
        lastGatewayState = Boolean.TRUE;
        moistureAtStart = moistureProbe.currentMoisture().orElse(null);
        persistState();
        armStopTimer(stopAt);

        if (metrics != null) {
            metrics.recordActivation(source);
        }
        log.info("[PUMP] ON for {}s (source={}, details={}), scheduled stop at {}",
            duration, source.code(), details == null ? Map.of() : details, stopAt);
        return PumpCommandResult.started(now, stopAt, duration);
    }

    /**
     * Stop the pump, record the run as an irrigation event.
     */
    public synchronized PumpCommandResult turnOff(TriggerSource source, Map<String, String> details) {
        reconcile();
        if (!state.on()) {
            return PumpCommandResult.refused(ReasonCode.ALREADY_OFF, "Water pump is already OFF");
        }

        if (!gateway.setActuator(config.feedKey(), false)) {
            log.error("[PUMP] Gateway did not accept OFF command");
            return refuse(PumpCommandResult.failed("Failed to send OFF command to gateway"));
        }
        lastGatewayState = Boolean.FALSE;

        Instant now = clock.instant();
        IrrigationEvent event = finishRun(now, source, details);
        log.info("[PUMP] OFF after {}s, {} L used (source={})",
            String.format("%.1f", event.durationSeconds()), String.format("%.2f", event.waterLiters()), source.code());
        return PumpCommandResult.stopped(now, event.durationSeconds(), event.waterLiters());
    }

    /**
     * Stop the pump when its scheduled stop time has passed.
     *
     * @return the stop result, empty when nothing was due
     */
    public synchronized Optional<PumpCommandResult> checkScheduledActions() {
        PumpState current = state;
        if (!current.on() || current.scheduledStopTime() == null) {
            return Optional.empty();
        }
        if (clock.instant().isBefore(current.scheduledStopTime())) {
            return Optional.empty();
        }
        log.info("[PUMP] Scheduled stop time {} reached", current.scheduledStopTime());
        return Optional.of(turnOff(TriggerSource.SCHEDULE, Map.of("reason", "scheduled_stop")));
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════

    public synchronized PumpStatus getStatus() {
        reconcile();
        PumpState current = state;
        Instant now = clock.instant();

        double runtime = 0.0;
        long remaining = 0L;
        if (current.on() && current.startTime() != null) {
            runtime = Math.max(0.0, Duration.between(current.startTime(), now).toMillis() / 1000.0);
        }
        if (current.on() && current.scheduledStopTime() != null) {
            long remainingMillis = Duration.between(now, current.scheduledStopTime()).toMillis();
            remaining = Math.max(0L, (remainingMillis + 999) / 1000);
        }
        Boolean gatewayOn = lastGatewayState;
        boolean synced = gatewayOn != null && gatewayOn == current.on();
        return new PumpStatus(current, runtime, runtime * config.waterRateLitersPerSecond(),
            remaining, gatewayOn, synced);
    }

    /**
     * Reconciled ON flag.
     */
    public synchronized boolean isRunning() {
        reconcile();
        return state.on();
    }

    /**
     * Local state without contacting the gateway.
     */
    public PumpState currentState() {
        return state;
    }

    /**
     * Most recent events first; cache first, durable store when the cache has none.
     */
    public List<IrrigationEvent> getIrrigationHistory(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<IrrigationEvent> events = new ArrayList<>();
        try {
            for (String json : cache.listRange(HISTORY_KEY, 0, limit - 1)) {
                events.add(IrrigationJson.irrigationEvent(IrrigationJson.read(json)));
            }
        } catch (RuntimeException e) {
            log.warn("[PUMP] Cache history unavailable: {}", e.getMessage());
            events.clear();
        }
        if (!events.isEmpty()) {
            return events;
        }

        try {
            Optional<JsonNode> stored = store.get(EVENTS_PATH);
            if (stored.isPresent()) {
                List<String> keys = new ArrayList<>();
                stored.get().fieldNames().forEachRemaining(keys::add);
                keys.sort(Comparator.reverseOrder());
                for (String key : keys) {
                    if (events.size() >= limit) break;
                    events.add(IrrigationJson.irrigationEvent(stored.get().get(key)));
                }
            }
        } catch (RuntimeException e) {
            log.error("[PUMP] Durable history unavailable: {}", e.getMessage());
        }
        return events;
    }

    public IrrigationStatistics calculateStatistics() {
        PumpState current = state;
        List<IrrigationEvent> events = getIrrigationHistory(config.historyLength());
        Instant dayAgo = clock.instant().minus(Duration.ofHours(24));

        int recentCount = 0;
        double recentRuntime = 0.0;
        double recentWater = 0.0;
        double sumDuration = 0.0;
        double sumWater = 0.0;
        for (IrrigationEvent e : events) {
            sumDuration += e.durationSeconds();
            sumWater += e.waterLiters();
            if (e.endTime() != null && e.endTime().isAfter(dayAgo)) {
                recentCount++;
                recentRuntime += e.durationSeconds();
                recentWater += e.waterLiters();
            }
        }
        int n = events.size();
        return new IrrigationStatistics(
            current.totalRuntimeSeconds(),
            current.totalWaterUsed(),
            recentCount,
            recentRuntime,
            recentWater,
            n == 0 ? 0.0 : sumDuration / n,
            n == 0 ? 0.0 : sumWater / n,
            n
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // Reconciliation
    // ═══════════════════════════════════════════════════════════════

    /**
     * Align local state with the gateway. No-op when they agree or the gateway is unreadable.
     */
    synchronized void reconcile() {
        Optional<Boolean> reported = gateway.getActuatorState(config.feedKey());
        if (reported.isEmpty()) {
            lastGatewayState = null;
            log.debug("[PUMP] Gateway state unknown, keeping local state");
            return;
        }
        boolean gatewayOn = reported.get();
        lastGatewayState = gatewayOn;
        PumpState current = state;

        if (gatewayOn && !current.on()) {
            Instant now = clock.instant();
            Instant start = current.startTime() != null ? current.startTime() : now;
            log.warn("[PUMP] Sync drift: gateway reports ON while local state is OFF; adopting ON");
            state = current.adoptedOn(now, start.plusSeconds(config.maxRuntimeSeconds()));
            moistureAtStart = moistureProbe.currentMoisture().orElse(null);
            persistState();
            armStopTimer(state.scheduledStopTime());
            if (metrics != null) {
                metrics.recordActivation(TriggerSource.SYNC);
            }
        } else if (!gatewayOn && current.on()) {
            log.warn("[PUMP] Sync drift: gateway reports OFF while local state is ON; closing run");
            finishRun(clock.instant(), TriggerSource.SYNC, Map.of("reason", "gateway_reported_off"));
        }
    }

    private IrrigationEvent finishRun(Instant now, TriggerSource source, Map<String, String> details) {
        PumpState current = state;
        double runtime = 0.0;
        if (current.startTime() != null) {
            runtime = Math.max(0.0, Duration.between(current.startTime(), now).toMillis() / 1000.0);
        }
        double water = runtime * config.waterRateLitersPerSecond();

        Map<String, String> eventDetails = new HashMap<>();
        if (details != null) {
            eventDetails.putAll(details);
        }
        if (current.startedBy() != null) {
            eventDetails.put("started_by", current.startedBy().code());
        }
        IrrigationEvent event = new IrrigationEvent(
            current.startTime() != null ? current.startTime() : now,
            now, runtime, water, source, eventDetails,
            moistureAtStart, moistureProbe.currentMoisture().orElse(null));

        state = current.stopped(now, runtime, water);
        moistureAtStart = null;
        cancelStopTimer();
        recordEvent(event);
        persistState();
        if (metrics != null) {
            metrics.recordStop(water);
        }
        return event;
    }

    // ═══════════════════════════════════════════════════════════════
    // Stop timer
    // ═══════════════════════════════════════════════════════════════

    private void armStopTimer(Instant stopAt) {
        if (stopTimer == null) {
            return;
        }
        cancelStopTimer();
        long delayMillis = Math.max(0L, (Duration.between(clock.instant(), stopAt).toNanos() + 999_999L) / 1_000_000L);
        pendingStop = stopTimer.schedule(this::runTimedStop, delayMillis, TimeUnit.MILLISECONDS);
        log.debug("[PUMP] Stop timer armed for {} ({} ms)", stopAt, delayMillis);
    }

    private void cancelStopTimer() {
        if (pendingStop != null) {
            pendingStop.cancel(false);
            pendingStop = null;
        }
    }

    private synchronized void runTimedStop() {
        try {
            Optional<PumpCommandResult> result = checkScheduledActions();
            if (result.isPresent()) {
                if (!result.get().success()) {
                    log.warn("[PUMP] Timed stop not applied: {} ({})", result.get().message(), result.get().reason());
                }
            } else if (state.on() && state.scheduledStopTime() != null) {
                // Woke before the wall clock reached the stop time
                armStopTimer(state.scheduledStopTime());
            }
        } catch (RuntimeException e) {
            log.error("[PUMP] Timed stop failed: {}", e.getMessage(), e);
        }
    }

    private long cooldownRemainingSeconds(PumpState current, Instant now) {
        if (current.lastOffTime() == null) {
            return 0L;
        }
        long elapsedMillis = Duration.between(current.lastOffTime(), now).toMillis();
        long remainingMillis = config.minIntervalSeconds() * 1000L - elapsedMillis;
        return remainingMillis <= 0 ? 0L : (remainingMillis + 999) / 1000;
    }

    private PumpCommandResult refuse(PumpCommandResult result) {
        if (metrics != null && result.reason() != null) {
            metrics.recordRefusal(result.reason());
        }
        return result;
    }

    // ═══════════════════════════════════════════════════════════════
    // Persistence
    // ═══════════════════════════════════════════════════════════════

    private void persistState() {
        JsonNode json = IrrigationJson.toJson(state);
        try {
            cache.set(STATE_KEY, IrrigationJson.write(json));
        } catch (RuntimeException e) {
            log.error("[PUMP] Failed to cache state: {}", e.getMessage());
        }
        try {
            store.set(STATE_PATH, json);
        } catch (RuntimeException e) {
            log.error("[PUMP] Failed to store state: {}", e.getMessage());
        }
    }

    private void recordEvent(IrrigationEvent event) {
        JsonNode json = IrrigationJson.toJson(event);
        try {
            cache.listPush(HISTORY_KEY, IrrigationJson.write(json));
            cache.listTrim(HISTORY_KEY, 0, config.historyLength() - 1);
        } catch (RuntimeException e) {
            log.error("[PUMP] Failed to cache irrigation event: {}", e.getMessage());
        }
        try {
            store.push(EVENTS_PATH, json);
        } catch (RuntimeException e) {
            log.error("[PUMP] Failed to store irrigation event: {}", e.getMessage());
        }
    }

    private PumpState restoreState() {
        try {
            Optional<String> cached = cache.get(STATE_KEY);
            if (cached.isPresent()) {
                log.info("[PUMP] State restored from cache");
                return IrrigationJson.pumpState(IrrigationJson.read(cached.get()));
            }
        } catch (RuntimeException e) {
            log.warn("[PUMP] Could not read cached state: {}", e.getMessage());
        }
        try {
            Optional<JsonNode> stored = store.get(STATE_PATH);
            if (stored.isPresent()) {
                log.info("[PUMP] State restored from durable store");
                return IrrigationJson.pumpState(stored.get());
            }
        } catch (RuntimeException e) {
            log.warn("[PUMP] Could not read stored state: {}", e.getMessage());
        }
        return PumpState.initial();
    }
}
