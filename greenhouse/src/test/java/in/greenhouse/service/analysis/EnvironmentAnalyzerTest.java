package in.greenhouse.service.analysis;

import in.greenhouse.config.SensorThresholds;
import in.greenhouse.domain.decision.Recommendation;
import in.greenhouse.domain.decision.Urgency;
import in.greenhouse.domain.decision.WaterAmount;
import in.greenhouse.domain.sensor.EnvironmentSnapshot;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorStatus;
import in.greenhouse.domain.sensor.SensorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EnvironmentAnalyzer.
 *
 * Tests:
 * - Soil dryness drives urgency and amount
 * - Heat triggers watering only when soil does not
 * - Dry air leaves an urgent need unchanged
 * - Action items per sensor
 */
class EnvironmentAnalyzerTest {

    private static final Instant NOON = Instant.parse("2024-06-03T12:00:00Z");

    private EnvironmentAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new EnvironmentAnalyzer(
            new SoilMoistureAnalyzer(),
            new TemperatureAnalyzer(),
            new HumidityAnalyzer(),
            new LightAnalyzer(SensorThresholds.light(), ZoneOffset.UTC));
    }

    private EnvironmentSnapshot snapshot(Map<SensorType, Double> values) {
        Map<SensorType, SensorReading> readings = new EnumMap<>(SensorType.class);
        values.forEach((type, value) -> readings.put(type, new SensorReading(type, value, String.valueOf(value),
            type.unit(), NOON, analyzer.statusOf(type, value), type.defaultFeedKey())));
        return new EnvironmentSnapshot(NOON, readings);
    }

    private static List<String> actions(EnvironmentAnalyzer.EnvironmentAnalysis analysis) {
        return analysis.actionItems().stream().map(EnvironmentAnalyzer.ActionItem::action).collect(Collectors.toList());
    }

    @Test
    void testVeryDrySoilIsHighUrgency() {
        EnvironmentAnalyzer.EnvironmentAnalysis analysis = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 15.0,
            SensorType.HUMIDITY, 55.0)));

        Recommendation rec = analysis.recommendation();
        assertTrue(rec.needsWater());
        assertEquals(Urgency.HIGH, rec.urgency());
        assertEquals("soil_too_dry", rec.reason());
        assertEquals(WaterAmount.HEAVY, rec.waterAmount());
        assertFalse(rec.aiOverride());
        assertEquals(SensorStatus.CRITICAL, analysis.overallStatus());

        assertEquals(List.of("water_plants"), actions(analysis));
        assertEquals("high", analysis.actionItems().get(0).priority());
        assertEquals(List.of("water_plants"), rec.actionItems());
    }

    @Test
    void testSomewhatDrySoilIsModerate() {
        Recommendation rec = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 38.0,
            SensorType.HUMIDITY, 55.0))).recommendation();

        assertEquals(Urgency.MEDIUM, rec.urgency());
        assertEquals("soil_somewhat_dry", rec.reason());
        assertEquals(WaterAmount.MODERATE, rec.waterAmount());
    }

    @Test
    void testDryAirKeepsSomewhatDrySoilModerate() {
        Recommendation rec = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 38.0,
            SensorType.HUMIDITY, 35.0))).recommendation();

        assertEquals(Urgency.MEDIUM, rec.urgency());
        assertEquals("soil_somewhat_dry", rec.reason());
        assertEquals(WaterAmount.MODERATE, rec.waterAmount());
    }

    @Test
    void testDryAirKeepsHeatRecommendationModerate() {
        Recommendation rec = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 55.0,
            SensorType.TEMPERATURE, 38.0,
            SensorType.HUMIDITY, 35.0))).recommendation();

        assertTrue(rec.needsWater());
        assertEquals(Urgency.MEDIUM, rec.urgency());
        assertEquals("high_temperature", rec.reason());
        assertEquals(WaterAmount.MODERATE, rec.waterAmount());
    }

    @Test
    void testDryAirDoesNotChangeHighUrgency() {
        Recommendation rec = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 30.0,
            SensorType.HUMIDITY, 35.0))).recommendation();

        assertEquals(Urgency.HIGH, rec.urgency());
        assertEquals("soil_too_dry", rec.reason());
    }

    @Test
    void testHeatTriggersWateringWhenSoilIsFine() {
        EnvironmentAnalyzer.EnvironmentAnalysis analysis = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 55.0,
            SensorType.TEMPERATURE, 38.0)));

        Recommendation rec = analysis.recommendation();
        assertTrue(rec.needsWater());
        assertEquals(Urgency.MEDIUM, rec.urgency());
        assertEquals("high_temperature", rec.reason());
        assertEquals(WaterAmount.MODERATE, rec.waterAmount());
        assertEquals(List.of("reduce_temperature"), actions(analysis));
    }

    @Test
    void testComfortableConditionsNeedNothing() {
        EnvironmentAnalyzer.EnvironmentAnalysis analysis = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 55.0,
            SensorType.TEMPERATURE, 24.0,
            SensorType.HUMIDITY, 55.0,
            SensorType.LIGHT, 3000.0)));

        Recommendation rec = analysis.recommendation();
        assertFalse(rec.needsWater());
        assertEquals(Urgency.NONE, rec.urgency());
        assertEquals(WaterAmount.NONE, rec.waterAmount());
        assertTrue(analysis.actionItems().isEmpty());
        assertEquals(SensorStatus.NORMAL, analysis.overallStatus());
    }

    @Test
    void testHumidAndDarkProduceActionItems() {
        EnvironmentAnalyzer.EnvironmentAnalysis analysis = analyzer.analyze(snapshot(Map.of(
            SensorType.SOIL_MOISTURE, 55.0,
            SensorType.HUMIDITY, 80.0,
            SensorType.LIGHT, 100.0,
            SensorType.TEMPERATURE, 8.0)));

        assertEquals(List.of("increase_temperature", "improve_air_circulation", "increase_light"), actions(analysis));
        assertFalse(analysis.recommendation().needsWater(), "Cold does not call for water");
    }

    @Test
    void testEmptySnapshot() {
        EnvironmentAnalyzer.EnvironmentAnalysis analysis = analyzer.analyze(new EnvironmentSnapshot(NOON, Map.of()));

        assertEquals(SensorStatus.UNKNOWN, analysis.overallStatus());
        assertNull(analysis.soilMoisture());
        assertFalse(analysis.recommendation().needsWater());
    }
}
