package in.greenhouse.service.analysis;

import in.greenhouse.config.SensorThresholds;
import in.greenhouse.domain.decision.RiskLevel;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Soil moisture analysis: watering need, dryness risk and drying trend.
 */
public final class SoilMoistureAnalyzer extends ThresholdEvaluator {
    /** Band around the optimal range that separates medium from high risk. */
    private static final double RISK_BAND = 5.0;

    /** Below this rate (%/h) the trend counts as stable. */
    private static final double STABLE_RATE = 0.5;

    private static final Duration MIN_TREND_SPAN = Duration.ofHours(1);

    public SoilMoistureAnalyzer() {
        this(SensorThresholds.soilMoisture());
    }

    public SoilMoistureAnalyzer(SensorThresholds thresholds) {
        super(thresholds);
    }

    public Analysis analyze(SensorReading reading) {
        double value = reading.value();
        return new Analysis(
            value,
            reading.unit(),
            evaluateStatus(value),
            describeRange(value),
            belowOptimal(value),
            riskLevel(value),
            wateringRecommendation(value)
        );
    }

    public RiskLevel riskLevel(double value) {
        if (value < thresholds.min()) return RiskLevel.EXTREME;
        if (value < thresholds.optimalMin() - RISK_BAND) return RiskLevel.HIGH;
        if (value < thresholds.optimalMin()) return RiskLevel.MEDIUM;
        if (value > thresholds.max()) return RiskLevel.HIGH;
        if (value > thresholds.optimalMax() + RISK_BAND) return RiskLevel.MEDIUM;
        return RiskLevel.NONE;
    }

    public String wateringRecommendation(double value) {
        if (value < thresholds.min()) return "water_immediately";
        if (value < thresholds.optimalMin() - RISK_BAND) return "water_soon";
        if (value < thresholds.optimalMin()) return "monitor";
        if (value > thresholds.max()) return "stop_watering";
        if (value > thresholds.optimalMax()) return "no_water_needed";
        return "optimal";
    }

    /**
     * Trend over the readings that fall inside {@code window} before {@code now}.
     * Needs at least two readings spanning an hour, otherwise the trend is unknown.
     */
    public Trend analyzeTrend(List<SensorReading> readings, Instant now, Duration window) {
        if (readings == null || readings.isEmpty()) {
            return Trend.unknown();
        }

        Instant cutoff = now.minus(window);
        List<SensorReading> recent = new ArrayList<>();
        for (SensorReading reading : readings) {
            if (reading.timestamp() != null && !reading.timestamp().isBefore(cutoff)) {
                recent.add(reading);
            }
        }
        recent.sort(Comparator.comparing(SensorReading::timestamp));

        if (recent.size() < 2) {
            return Trend.unknown();
        }

        SensorReading first = recent.get(0);
        SensorReading last = recent.get(recent.size() - 1);
        Duration span = Duration.between(first.timestamp(), last.timestamp());
        if (span.compareTo(MIN_TREND_SPAN) < 0) {
            return Trend.unknown();
        }

        double hours = span.toMillis() / 3_600_000.0;
        double rate = (last.value() - first.value()) / hours;

        String direction;
        if (Math.abs(rate) < STABLE_RATE) {
            direction = "stable";
        } else {
            direction = rate < 0 ? "decreasing" : "increasing";
        }

        Double hoursUntilDry = null;
        if (rate < 0) {
            double toMin = last.value() - thresholds.min();
            if (toMin > 0) {
                hoursUntilDry = toMin / Math.abs(rate);
            }
        }

        return new Trend(direction, rate, hoursUntilDry,
            trendRecommendation(direction, last.value(), hoursUntilDry));
    }

    private String trendRecommendation(String direction, double current, Double hoursUntilDry) {
        if (current < thresholds.min()) {
            return "water_immediately";
        }
        switch (direction) {
            case "decreasing":
                if (hoursUntilDry != null && hoursUntilDry < 3) return "water_soon";
                if (hoursUntilDry != null && hoursUntilDry < 12) return "schedule_watering";
                if (belowOptimal(current)) return "monitor_closely";
                return "normal_monitoring";
            case "stable":
                if (belowOptimal(current)) return "consider_watering";
                if (aboveOptimal(current)) return "monitor_for_excess";
                return "maintain_current_conditions";
            default:
                if (current > thresholds.max()) return "stop_watering";
                if (aboveOptimal(current)) return "reduce_watering";
                return "normal_monitoring";
        }
    }

    public record Analysis(
        double value,
        String unit,
        SensorStatus status,
        String description,
        boolean needsWater,
        RiskLevel riskLevel,
        String recommendation
    ) {}

    /**
     * @param rateOfChange percentage points per hour, negative while drying
     * @param hoursUntilDry null unless the soil is drying and still above min
     */
    public record Trend(
        String direction,
        double rateOfChange,
        Double hoursUntilDry,
        String recommendation
    ) {
        static Trend unknown() {
            return new Trend("unknown", 0.0, null, "collect_more_data");
        }
    }
}
