package in.greenhouse.service.decision;

import in.greenhouse.config.DecisionConfig;
import in.greenhouse.config.PumpConfig;
import in.greenhouse.domain.common.ReasonCode;
import in.greenhouse.domain.common.ValidationException;
import in.greenhouse.domain.decision.ActionTaken;
import in.greenhouse.domain.decision.AiRecommendation;
import in.greenhouse.domain.decision.Decision;
import in.greenhouse.domain.decision.DecisionCheck;
import in.greenhouse.domain.decision.Priority;
import in.greenhouse.domain.decision.Urgency;
import in.greenhouse.domain.decision.WaterAmount;
import in.greenhouse.domain.pump.TriggerSource;
import in.greenhouse.domain.sensor.SensorType;
import in.greenhouse.service.analysis.EnvironmentAnalyzer;
import in.greenhouse.service.pump.PumpController;
import in.greenhouse.service.sensor.EnvironmentDataService;
import in.greenhouse.support.FakeFeedGateway;
import in.greenhouse.support.InMemoryDurableStore;
import in.greenhouse.support.InMemoryFastCache;
import in.greenhouse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DecisionLoop.
 *
 * Tests:
 * - Precondition order and refusal codes
 * - Rule based decisions start the pump with the configured duration
 * - AI override arbitration
 * - Decision persistence and configuration updates
 */
class DecisionLoopTest {

    private static final Instant T0 = Instant.parse("2024-06-03T09:00:00Z");
    private static final String SOIL = SensorType.SOIL_MOISTURE.defaultFeedKey();
    private static final DecisionConfig ENABLED = new DecisionConfig(true, 3600, 60, 180, 300, 0.7);

    private MutableClock clock;
    private FakeFeedGateway gateway;
    private InMemoryFastCache cache;
    private InMemoryDurableStore store;
    private PumpController pump;
    private EnvironmentDataService environment;
    private RecommendationQueue queue;
    private DecisionLoop loop;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        gateway = new FakeFeedGateway(clock);
        cache = new InMemoryFastCache();
        store = new InMemoryDurableStore(clock);
        EnvironmentAnalyzer analyzer = new EnvironmentAnalyzer();
        environment = new EnvironmentDataService(gateway, cache, analyzer, clock,
            Duration.ofMinutes(2), Duration.ofMinutes(30));
        pump = new PumpController(gateway, cache, store,
            new PumpConfig("water-pump-control", 1800, 0, 0.5, 50), clock, environment, null);
        queue = new RecommendationQueue(cache);
        loop = newLoop(ENABLED);
    }

    private DecisionLoop newLoop(DecisionConfig defaults) {
        return new DecisionLoop(pump, environment, new EnvironmentAnalyzer(), queue, cache, store,
            defaults, clock, Duration.ofMinutes(15), null);
    }

    private static AiRecommendation ai(boolean irrigate, double minutes, String reason, double confidence) {
        return new AiRecommendation(irrigate, minutes, reason, confidence, List.of(), "weather-ai",
            Priority.NORMAL, T0);
    }

    // ═══════════════════════════════════════════════════════════════
    // Preconditions
    // ═══════════════════════════════════════════════════════════════

    @Test
    void canMakeDecision_disabledComesFirst() {
        loop = newLoop(DecisionConfig.defaults());

        DecisionCheck check = loop.canMakeDecision();

        assertFalse(check.allowed());
        assertEquals(ReasonCode.AUTO_IRRIGATION_DISABLED, check.reason());
        assertFalse(loop.makeDecision().decided());
        assertTrue(loop.getLastDecision().isEmpty(), "Refusals are not recorded");
    }

    @Test
    void canMakeDecision_pumpRunning() {
        gateway.addReading(SOIL, "15");
        pump.turnOn(600, TriggerSource.MANUAL, Map.of());

        DecisionLoop.DecisionOutcome outcome = loop.makeDecision();

        assertFalse(outcome.decided());
        assertEquals(ReasonCode.PUMP_ALREADY_RUNNING, outcome.check().reason());
        assertEquals(1, gateway.commands().size(), "No extra command while the pump runs");
    }

    @Test
    void canMakeDecision_requiresFreshSoilMoisture() {
        assertEquals(ReasonCode.NO_SOIL_MOISTURE_DATA, loop.canMakeDecision().reason());

        gateway.addReading(SOIL, "15", T0.minus(Duration.ofHours(2)));
        assertEquals(ReasonCode.NO_SOIL_MOISTURE_DATA, loop.canMakeDecision().reason(),
            "A two hour old reading is stale");
    }

    @Test
    void canMakeDecision_minIntervalSinceLastDecision() {
        gateway.addReading(SOIL, "55");
        assertTrue(loop.makeDecision().decided());

        clock.advance(Duration.ofMinutes(10));
        gateway.addReading(SOIL, "55");
        DecisionCheck check = loop.canMakeDecision();

        assertEquals(ReasonCode.MIN_INTERVAL_NOT_MET, check.reason());
        assertEquals(3000, check.timeRemainingSeconds());

        clock.advance(Duration.ofMinutes(50));
        gateway.addReading(SOIL, "55");
        assertTrue(loop.canMakeDecision().allowed());
    }

    // ═══════════════════════════════════════════════════════════════
    // Decisions
    // ═══════════════════════════════════════════════════════════════

    @Test
    void makeDecision_drySoilStartsHeavyRun() {
        gateway.addReading(SOIL, "15");

        Decision decision = loop.makeDecision().decision();

        assertTrue(decision.needsWater());
        assertEquals(Urgency.HIGH, decision.urgency());
        assertEquals(WaterAmount.HEAVY, decision.waterAmount());
        assertFalse(decision.aiOverride());
        assertEquals(15.0, decision.sensorValues().get("soil_moisture"), 1e-9);
        assertEquals(ActionTaken.IRRIGATION_STARTED, decision.actionTaken().action());
        assertEquals(300, decision.actionTaken().durationSeconds());
        assertTrue(decision.actionTaken().success());

        assertTrue(pump.currentState().on());
        assertEquals(TriggerSource.AUTO, pump.currentState().startedBy());
        assertEquals(T0.plusSeconds(300), pump.currentState().scheduledStopTime());
    }

    @Test
    void makeDecision_moistSoilRecordsNoAction() {
        gateway.addReading(SOIL, "55");

        Decision decision = loop.makeDecision().decision();

        assertFalse(decision.needsWater());
        assertEquals(WaterAmount.NONE, decision.waterAmount());
        assertEquals(ActionTaken.NO_ACTION, decision.actionTaken().action());
        assertTrue(gateway.commands().isEmpty());
        assertEquals(decision, loop.getLastDecision().orElseThrow());
    }

    @Test
    void makeDecision_confidentAiOverridesRules() {
        gateway.addReading(SOIL, "55");
        queue.offer(ai(true, 20, "heat wave expected", 0.9));

        Decision decision = loop.makeDecision().decision();

        assertTrue(decision.aiOverride());
        assertTrue(decision.needsWater());
        assertEquals(WaterAmount.HEAVY, decision.waterAmount(), "20 minutes maps to heavy");
        assertEquals("heat wave expected (AI recommended)", decision.reason());
        assertEquals(300, decision.actionTaken().durationSeconds());
        assertTrue(pump.currentState().on());
        assertTrue(queue.take().isEmpty(), "Recommendation consumed");
    }

    @Test
    void makeDecision_aiCanVetoWatering() {
        gateway.addReading(SOIL, "15");
        queue.offer(ai(false, 0, null, 0.95));

        Decision decision = loop.makeDecision().decision();

        assertTrue(decision.aiOverride());
        assertFalse(decision.needsWater());
        assertEquals(WaterAmount.NONE, decision.waterAmount());
        assertEquals("soil_too_dry (AI recommended)", decision.reason());
        assertFalse(pump.currentState().on());
    }

    @Test
    void makeDecision_lowConfidenceAiIgnored() {
        gateway.addReading(SOIL, "55");
        queue.offer(ai(true, 10, "maybe", 0.5));

        Decision decision = loop.makeDecision().decision();

        assertFalse(decision.aiOverride());
        assertFalse(decision.needsWater());
        assertTrue(queue.take().isEmpty(), "Ignored recommendation is still consumed");
    }

    @Test
    void testDecisionHistoryNewestFirstWithStoreFallback() {
        gateway.addReading(SOIL, "55");
        loop.makeDecision();
        clock.advance(Duration.ofHours(2));
        gateway.addReading(SOIL, "15");
        loop.makeDecision();

        List<Decision> history = loop.getDecisionHistory(10);
        assertEquals(2, history.size());
        assertTrue(history.get(0).needsWater(), "Newest first");

        cache.clear();
        List<Decision> stored = loop.getDecisionHistory(10);
        assertEquals(2, stored.size());
        assertTrue(stored.get(0).needsWater());
        assertTrue(loop.getLastDecision().orElseThrow().needsWater());
        assertTrue(cache.contains(DecisionLoop.LAST_KEY), "Last decision re-cached");
    }

    // ═══════════════════════════════════════════════════════════════
    // Configuration
    // ═══════════════════════════════════════════════════════════════

    @Test
    void updateConfiguration_rejectsInvalidAndKeepsCurrent() {
        DecisionConfig invalid = new DecisionConfig(true, 30, 60, 180, 300, 0.7);

        ValidationException e = assertThrows(ValidationException.class, () -> loop.updateConfiguration(invalid));

        assertEquals("min_decision_interval", e.getField());
        assertEquals(ENABLED, loop.getConfiguration());
    }

    @Test
    void testConfigurationPersistsAcrossRestart() {
        loop.updateConfiguration(new DecisionConfig(true, 900, 30, 90, 240, 0.8));
        loop.enable(false);

        DecisionLoop restarted = newLoop(ENABLED);

        assertEquals(new DecisionConfig(false, 900, 30, 90, 240, 0.8), restarted.getConfiguration());
    }

    @Test
    void testStartStopLifecycle() {
        assertTrue(loop.start());
        assertTrue(loop.isRunning());
        assertTrue(loop.stop());
        assertFalse(loop.isRunning());
    }
}
