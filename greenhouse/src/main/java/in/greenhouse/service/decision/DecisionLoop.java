package in.greenhouse.service.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.greenhouse.application.port.output.DurableStore;
import in.greenhouse.application.port.output.FastCache;
import in.greenhouse.config.DecisionConfig;
import in.greenhouse.domain.common.ReasonCode;
import in.greenhouse.domain.decision.ActionTaken;
import in.greenhouse.domain.decision.AiRecommendation;
import in.greenhouse.domain.decision.Decision;
import in.greenhouse.domain.decision.DecisionCheck;
import in.greenhouse.domain.decision.Recommendation;
import in.greenhouse.domain.decision.WaterAmount;
import in.greenhouse.domain.pump.PumpCommandResult;
import in.greenhouse.domain.pump.TriggerSource;
import in.greenhouse.domain.sensor.EnvironmentSnapshot;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.infrastructure.json.IrrigationJson;
import in.greenhouse.infrastructure.metrics.IrrigationMetrics;
import in.greenhouse.service.analysis.EnvironmentAnalyzer;
import in.greenhouse.service.common.PeriodicTask;
import in.greenhouse.service.pump.PumpController;
import in.greenhouse.service.sensor.EnvironmentDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Autonomous irrigation.
 *
 * Each tick:
 * 1. checks preconditions (enabled, pump idle, min interval since the last decision, soil data)
 * 2. analyzes the environment snapshot into a rule-based recommendation
 * 3. lets a queued AI recommendation override it when its confidence clears the configured minimum
 * 4. starts the pump with source AUTO when water is needed
 * 5. persists the decision, including "no action" outcomes
 *
 * A refused precondition produces no decision record.
 */
public final class DecisionLoop {
    private static final Logger log = LoggerFactory.getLogger(DecisionLoop.class);

    public static final String LAST_KEY = "decision:last";
    public static final String HISTORY_KEY = "decision:history";
    public static final String LAST_PATH = "last_decision";
    public static final String HISTORY_PATH = "decision_history";
    public static final String CONFIG_PATH = "config/decision";

    public static final int HISTORY_LENGTH = 100;

    private final PumpController pump;
    private final EnvironmentDataService environment;
    private final EnvironmentAnalyzer analyzer;
    private final RecommendationQueue recommendations;
    private final FastCache cache;
    private final DurableStore store;
    private final Clock clock;
    private final IrrigationMetrics metrics;
    private final PeriodicTask worker;

    private volatile DecisionConfig config;

    public DecisionLoop(PumpController pump, EnvironmentDataService environment, EnvironmentAnalyzer analyzer,
                        RecommendationQueue recommendations, FastCache cache, DurableStore store,
                        DecisionConfig defaults, Clock clock, Duration interval, IrrigationMetrics metrics) {
        this.pump = pump;
        this.environment = environment;
        this.analyzer = analyzer;
        this.recommendations = recommendations;
        this.cache = cache;
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
        this.config = loadConfig(defaults);
        this.worker = new PeriodicTask("decision-loop", interval, interval,
            this::makeDecision, e -> {
                if (metrics != null) {
                    metrics.recordTaskFailure("decision-loop");
                }
            });
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    public boolean start() {
        return worker.start();
    }

    public boolean stop() {
        return worker.stop();
    }

    public boolean isRunning() {
        return worker.isRunning();
    }

    // ═══════════════════════════════════════════════════════════════
    // Decision
    // ═══════════════════════════════════════════════════════════════

    /**
     * Preconditions in order: enabled, pump not running, min interval since the last decision,
     * fresh soil moisture available.
     */
    public DecisionCheck canMakeDecision() {
        DecisionConfig current = config;
        if (!current.enabled()) {
            return DecisionCheck.deny(ReasonCode.AUTO_IRRIGATION_DISABLED);
        }
        if (pump.isRunning()) {
            return DecisionCheck.deny(ReasonCode.PUMP_ALREADY_RUNNING);
        }

        Optional<Decision> last = getLastDecision();
        if (last.isPresent() && last.get().timestamp() != null) {
            long elapsedMillis = Duration.between(last.get().timestamp(), clock.instant()).toMillis();
            long intervalMillis = current.minDecisionIntervalSeconds() * 1000L;
            if (elapsedMillis < intervalMillis) {
                long remaining = (intervalMillis - elapsedMillis + 999) / 1000;
                return DecisionCheck.cooldown(remaining);
            }
        }

        if (environment.currentMoisture().isEmpty()) {
            return DecisionCheck.deny(ReasonCode.NO_SOIL_MOISTURE_DATA);
        }
        return DecisionCheck.allow();
    }

    /**
     * Run one decision now.
     */
    public DecisionOutcome makeDecision() {
        DecisionCheck check = canMakeDecision();
        if (!check.allowed()) {
            log.debug("[DECISION] Skipped: {} ({}s remaining)", check.reason(), check.timeRemainingSeconds());
            return DecisionOutcome.skipped(check);
        }

        DecisionConfig current = config;
        Instant now = clock.instant();
        EnvironmentSnapshot snapshot = environment.getSnapshot(true);
        Recommendation recommendation = analyzer.analyze(snapshot).recommendation();
        recommendation = applyAiOverride(recommendation, current);

        ActionTaken action;
        if (recommendation.needsWater()) {
            WaterAmount amount = recommendation.waterAmount();
            long duration = current.durationFor(amount);

            Map<String, String> details = new LinkedHashMap<>();
            details.put("decision_timestamp", now.toString());
            details.put("urgency", recommendation.urgency().code());
            details.put("reason", recommendation.reason());

            PumpCommandResult result = pump.turnOn(duration, TriggerSource.AUTO, details);
            action = new ActionTaken(ActionTaken.IRRIGATION_STARTED, duration, result.success(), result.message());
            log.info("[DECISION] WATER for {}s ({}, reason: {}) -> {}",
                duration, amount.code(), recommendation.reason(), result.success() ? "started" : result.message());
        } else {
            action = ActionTaken.none("No irrigation needed");
            log.info("[DECISION] No water needed");
        }

        Decision decision = new Decision(
            now,
            recommendation.needsWater(),
            recommendation.urgency(),
            recommendation.reason(),
            recommendation.waterAmount(),
            recommendation.aiOverride(),
            sensorValues(snapshot),
            snapshot.overallStatus().code(),
            action
        );
        save(decision);
        if (metrics != null) {
            metrics.recordDecision(action.action());
        }
        return DecisionOutcome.of(decision);
    }

    private Recommendation applyAiOverride(Recommendation base, DecisionConfig current) {
        Optional<AiRecommendation> queued = recommendations.take();
        if (queued.isEmpty()) {
            return base;
        }
        AiRecommendation ai = queued.get();
        if (ai.confidence() < current.aiMinConfidence()) {
            log.info("[DECISION] AI recommendation from {} ignored: confidence {} below {}",
                ai.source(), ai.confidence(), current.aiMinConfidence());
            return base;
        }

        String reason = (ai.reason() != null && !ai.reason().isEmpty() ? ai.reason() : base.reason())
            + " (AI recommended)";
        WaterAmount amount = WaterAmount.forDurationMinutes(ai.durationMinutes());
        log.info("[DECISION] Using AI recommendation: irrigate={}, duration={}min", ai.shouldIrrigate(), ai.durationMinutes());
        return base.withAiOverride(ai.shouldIrrigate(), ai.shouldIrrigate() ? amount : WaterAmount.NONE, reason);
    }

    private static Map<String, Double> sensorValues(EnvironmentSnapshot snapshot) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (SensorReading reading : snapshot.readings().values()) {
            values.put(reading.type().code(), reading.value());
        }
        return values;
    }

    // ═══════════════════════════════════════════════════════════════
    // Configuration
    // ═══════════════════════════════════════════════════════════════

    public DecisionConfig getConfiguration() {
        return config;
    }

    /**
     * Replace the configuration.
     *
     * @throws in.greenhouse.domain.common.ValidationException when the new configuration is invalid
     */
    public DecisionConfig updateConfiguration(DecisionConfig update) {
        config = update.validate();
        persistConfig();
        log.info("[DECISION] Configuration updated: {}", config);
        return config;
    }

    public DecisionConfig enable(boolean enabled) {
        config = config.withEnabled(enabled);
        persistConfig();
        log.info("[DECISION] Auto irrigation {}", enabled ? "enabled" : "disabled");
        return config;
    }

    private DecisionConfig loadConfig(DecisionConfig defaults) {
        try {
            Optional<JsonNode> stored = store.get(CONFIG_PATH);
            if (stored.isPresent() && stored.get().isObject()) {
                return IrrigationJson.decisionConfig(stored.get(), defaults).validate();
            }
        } catch (RuntimeException e) {
            log.warn("[DECISION] Using default configuration, stored one unusable: {}", e.getMessage());
        }
        return defaults;
    }

    private void persistConfig() {
        try {
            store.set(CONFIG_PATH, IrrigationJson.toJson(config));
        } catch (RuntimeException e) {
            log.error("[DECISION] Failed to store configuration: {}", e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // History
    // ═══════════════════════════════════════════════════════════════

    /**
     * Last decision from the cache, else the durable store (re-caching it).
     */
    public Optional<Decision> getLastDecision() {
        try {
            Optional<String> cached = cache.get(LAST_KEY);
            if (cached.isPresent()) {
                return Optional.of(IrrigationJson.decision(IrrigationJson.read(cached.get())));
            }
        } catch (RuntimeException e) {
            log.warn("[DECISION] Could not read cached last decision: {}", e.getMessage());
        }
        try {
            Optional<JsonNode> stored = store.get(LAST_PATH);
            if (stored.isPresent() && stored.get().isObject()) {
                cache.set(LAST_KEY, IrrigationJson.write(stored.get()));
                return Optional.of(IrrigationJson.decision(stored.get()));
            }
        } catch (RuntimeException e) {
            log.error("[DECISION] Could not read stored last decision: {}", e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Newest first.
     */
    public List<Decision> getDecisionHistory(int limit) {
        List<Decision> history = new ArrayList<>();
        if (limit <= 0) {
            return history;
        }
        try {
            for (String json : cache.listRange(HISTORY_KEY, 0, limit - 1)) {
                history.add(IrrigationJson.decision(IrrigationJson.read(json)));
            }
            if (!history.isEmpty()) {
                return history;
            }
        } catch (RuntimeException e) {
            log.warn("[DECISION] Cache history unavailable: {}", e.getMessage());
            history.clear();
        }

        try {
            Optional<JsonNode> stored = store.get(HISTORY_PATH);
            if (stored.isPresent() && stored.get().isObject()) {
                // push keys are time ordered
                List<String> keys = new ArrayList<>();
                stored.get().fieldNames().forEachRemaining(keys::add);
                keys.sort((a, b) -> b.compareTo(a));
                for (String key : keys) {
                    if (history.size() >= limit) {
                        break;
                    }
                    history.add(IrrigationJson.decision(stored.get().get(key)));
                }
            }
        } catch (RuntimeException e) {
            log.error("[DECISION] Durable history unavailable: {}", e.getMessage());
        }
        return history;
    }

    private void save(Decision decision) {
        ObjectNode json = IrrigationJson.toJson(decision);
        String text = IrrigationJson.write(json);
        try {
            cache.set(LAST_KEY, text);
            cache.listPush(HISTORY_KEY, text);
            cache.listTrim(HISTORY_KEY, 0, HISTORY_LENGTH - 1);
        } catch (RuntimeException e) {
            log.error("[DECISION] Failed to cache decision: {}", e.getMessage());
        }
        try {
            store.set(LAST_PATH, json);
            store.push(HISTORY_PATH, json);
        } catch (RuntimeException e) {
            log.error("[DECISION] Failed to store decision: {}", e.getMessage());
        }
    }

    /**
     * Result of one decision attempt: either the precondition that refused it, or the decision.
     */
    public record DecisionOutcome(DecisionCheck check, Decision decision) {
        static DecisionOutcome skipped(DecisionCheck check) {
            return new DecisionOutcome(check, null);
        }

        static DecisionOutcome of(Decision decision) {
            return new DecisionOutcome(DecisionCheck.allow(), decision);
        }

        public boolean decided() {
            return decision != null;
        }
    }
}
