package in.greenhouse.service.analysis;

import in.greenhouse.config.SensorThresholds;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorStatus;

/**
 * Air humidity comfort and fungal disease risk.
 */
public final class HumidityAnalyzer extends ThresholdEvaluator {

    public HumidityAnalyzer() {
        this(SensorThresholds.humidity());
    }

    public HumidityAnalyzer(SensorThresholds thresholds) {
        super(thresholds);
    }

    public Analysis analyze(SensorReading reading) {
        double value = reading.value();
        return new Analysis(
            value,
            reading.unit(),
            evaluateStatus(value),
            describeRange(value),
            condition(value),
            diseaseRisk(value)
        );
    }

    public String condition(double value) {
        if (value < thresholds.min()) return "very_dry";
        if (belowOptimal(value)) return "dry";
        if (value > thresholds.max()) return "very_humid";
        if (aboveOptimal(value)) return "humid";
        return "comfortable";
    }

    // Fixed percentages, independent of the configured thresholds.
    public String diseaseRisk(double value) {
        if (value > 85) return "severe";
        if (value > 75) return "high";
        if (value > 65) return "medium";
        return "low";
    }

    public record Analysis(
        double value,
        String unit,
        SensorStatus status,
        String description,
        String condition,
        String diseaseRisk
    ) {
        public boolean isDry() {
            return "dry".equals(condition) || "very_dry".equals(condition);
        }

        public boolean highDiseaseRisk() {
            return "severe".equals(diseaseRisk) || "high".equals(diseaseRisk);
        }
    }
}
