package in.greenhouse.service.analysis;

import in.greenhouse.domain.decision.RiskLevel;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorStatus;
import in.greenhouse.domain.sensor.SensorType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SoilMoistureAnalyzer with the default 20-90 % range, optimal 40-70 %.
 */
class SoilMoistureAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-06-03T12:00:00Z");

    private final SoilMoistureAnalyzer analyzer = new SoilMoistureAnalyzer();

    private static SensorReading reading(double value, Instant at) {
        return new SensorReading(SensorType.SOIL_MOISTURE, value, String.valueOf(value), "%", at,
            SensorStatus.UNKNOWN, "soil-moisture");
    }

    @Test
    void testBelowMinimumNeedsWaterImmediately() {
        SoilMoistureAnalyzer.Analysis result = analyzer.analyze(reading(15, NOW));

        assertEquals(SensorStatus.CRITICAL, result.status());
        assertEquals("critically_low", result.description());
        assertTrue(result.needsWater());
        assertEquals(RiskLevel.EXTREME, result.riskLevel());
        assertEquals("water_immediately", result.recommendation());
        assertEquals("%", result.unit());
    }

    @Test
    void testWarningBandNearMinimum() {
        SoilMoistureAnalyzer.Analysis result = analyzer.analyze(reading(30, NOW));

        assertEquals(SensorStatus.WARNING, result.status(), "30 is inside the 10.5 margin above 20");
        assertEquals("warning_low", result.description());
        assertEquals(RiskLevel.HIGH, result.riskLevel());
        assertEquals("water_soon", result.recommendation());
    }

    @Test
    void testSlightlyBelowOptimal() {
        SoilMoistureAnalyzer.Analysis result = analyzer.analyze(reading(38, NOW));

        assertEquals(SensorStatus.NORMAL, result.status());
        assertEquals("normal_low", result.description());
        assertTrue(result.needsWater());
        assertEquals(RiskLevel.MEDIUM, result.riskLevel());
        assertEquals("monitor", result.recommendation());
    }

    @Test
    void testOptimalAndWetValues() {
        SoilMoistureAnalyzer.Analysis optimal = analyzer.analyze(reading(55, NOW));
        assertEquals("optimal", optimal.description());
        assertFalse(optimal.needsWater());
        assertEquals(RiskLevel.NONE, optimal.riskLevel());
        assertEquals("optimal", optimal.recommendation());

        SoilMoistureAnalyzer.Analysis wet = analyzer.analyze(reading(80, NOW));
        assertEquals(SensorStatus.WARNING, wet.status());
        assertEquals("warning_high", wet.description());
        assertEquals(RiskLevel.MEDIUM, wet.riskLevel());
        assertEquals("no_water_needed", wet.recommendation());

        SoilMoistureAnalyzer.Analysis flooded = analyzer.analyze(reading(95, NOW));
        assertEquals(SensorStatus.CRITICAL, flooded.status());
        assertEquals(RiskLevel.HIGH, flooded.riskLevel());
        assertEquals("stop_watering", flooded.recommendation());
    }

    // ═══════════════════════════════════════════════════════════════
    // Trend
    // ═══════════════════════════════════════════════════════════════

    @Test
    void analyzeTrend_fastDryingSoonNeedsWater() {
        SoilMoistureAnalyzer.Trend trend = analyzer.analyzeTrend(List.of(
            reading(30, NOW),
            reading(40, NOW.minus(Duration.ofHours(2)))
        ), NOW, Duration.ofHours(24));

        assertEquals("decreasing", trend.direction());
        assertEquals(-5.0, trend.rateOfChange(), 1e-9);
        assertEquals(2.0, trend.hoursUntilDry(), 1e-9);
        assertEquals("water_soon", trend.recommendation());
    }

    @Test
    void analyzeTrend_stableBelowOptimal() {
        SoilMoistureAnalyzer.Trend trend = analyzer.analyzeTrend(List.of(
            reading(36.0, NOW.minus(Duration.ofHours(2))),
            reading(36.1, NOW.minus(Duration.ofHours(1))),
            reading(36.2, NOW)
        ), NOW, Duration.ofHours(24));

        assertEquals("stable", trend.direction());
        assertNull(trend.hoursUntilDry());
        assertEquals("consider_watering", trend.recommendation());
    }

    @Test
    void analyzeTrend_rising() {
        SoilMoistureAnalyzer.Trend trend = analyzer.analyzeTrend(List.of(
            reading(60, NOW.minus(Duration.ofHours(4))),
            reading(80, NOW)
        ), NOW, Duration.ofHours(24));

        assertEquals("increasing", trend.direction());
        assertEquals(5.0, trend.rateOfChange(), 1e-9);
        assertEquals("reduce_watering", trend.recommendation());
    }

    @Test
    void analyzeTrend_unknownWithoutEnoughData() {
        assertEquals("unknown", analyzer.analyzeTrend(List.of(), NOW, Duration.ofHours(24)).direction());

        SoilMoistureAnalyzer.Trend shortSpan = analyzer.analyzeTrend(List.of(
            reading(50, NOW.minus(Duration.ofMinutes(30))),
            reading(45, NOW)
        ), NOW, Duration.ofHours(24));
        assertEquals("unknown", shortSpan.direction(), "Less than an hour of data");
        assertEquals("collect_more_data", shortSpan.recommendation());

        SoilMoistureAnalyzer.Trend outsideWindow = analyzer.analyzeTrend(List.of(
            reading(70, NOW.minus(Duration.ofHours(30))),
            reading(45, NOW)
        ), NOW, Duration.ofHours(24));
        assertEquals("unknown", outsideWindow.direction(), "Readings outside the window are ignored");
    }
}
