package in.greenhouse.service.analysis;

import in.greenhouse.config.SensorThresholds;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorStatus;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Light level classification, checked against the range expected for the local time of day.
 */
public final class LightAnalyzer extends ThresholdEvaluator {
    private final ZoneId zone;

    public LightAnalyzer() {
        this(SensorThresholds.light(), ZoneId.systemDefault());
    }

    public LightAnalyzer(SensorThresholds thresholds, ZoneId zone) {
        super(thresholds);
        this.zone = zone;
    }

    public Analysis analyze(SensorReading reading) {
        double value = reading.value();
        String timeOfDay = timeOfDay(reading.timestamp());
        double[] expected = expectedRange(timeOfDay);
        return new Analysis(
            value,
            reading.unit(),
            evaluateStatus(value),
            describeRange(value),
            timeOfDay,
            value >= expected[0] && value <= expected[1],
            lightCondition(value),
            plantImpact(value)
        );
    }

    String timeOfDay(Instant timestamp) {
        if (timestamp == null) {
            return "unknown";
        }
        int hour = timestamp.atZone(zone).getHour();
        if (hour >= 5 && hour < 10) return "morning";
        if (hour >= 10 && hour < 16) return "afternoon";
        if (hour >= 16 && hour < 20) return "evening";
        return "night";
    }

    private static double[] expectedRange(String timeOfDay) {
        switch (timeOfDay) {
            case "morning":
                return new double[] {500, 5000};
            case "afternoon":
                return new double[] {1000, 10000};
            case "evening":
                return new double[] {200, 3000};
            case "night":
                return new double[] {0, 200};
            default:
                return new double[] {0, Double.MAX_VALUE};
        }
    }

    public String lightCondition(double value) {
        if (value < 50) return "dark";
        if (value < 200) return "dim";
        if (value < 1000) return "moderate";
        if (value < 5000) return "bright";
        if (value < 10000) return "very_bright";
        return "intense";
    }

    public String plantImpact(double value) {
        if (value < 50) return "insufficient_for_growth";
        if (value < 200) return "minimal_growth";
        if (value < 1000) return "slow_growth";
        if (value < 5000) return "good_growth";
        if (value < 10000) return "optimal_growth";
        return "potential_light_stress";
    }

    public record Analysis(
        double value,
        String unit,
        SensorStatus status,
        String description,
        String timeOfDay,
        boolean inExpectedRange,
        String lightCondition,
        String plantImpact
    ) {}
}
