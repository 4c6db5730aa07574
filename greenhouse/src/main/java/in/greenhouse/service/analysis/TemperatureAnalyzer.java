package in.greenhouse.service.analysis;

import in.greenhouse.config.SensorThresholds;
import in.greenhouse.domain.decision.RiskLevel;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorStatus;

/**
 * Plant heat and cold stress from air temperature.
 */
public final class TemperatureAnalyzer extends ThresholdEvaluator {
    private static final double STRESS_BAND = 3.0;

    public TemperatureAnalyzer() {
        this(SensorThresholds.temperature());
    }

    public TemperatureAnalyzer(SensorThresholds thresholds) {
        super(thresholds);
    }

    public Analysis analyze(SensorReading reading) {
        double value = reading.value();
        return new Analysis(
            value,
            reading.unit(),
            evaluateStatus(value),
            describeRange(value),
            stressLevel(value),
            growthCondition(value)
        );
    }

    public RiskLevel stressLevel(double value) {
        if (value < thresholds.min() || value > thresholds.max()) return RiskLevel.EXTREME;
        if (value < thresholds.optimalMin() - STRESS_BAND) return RiskLevel.HIGH;
        if (value > thresholds.optimalMax() + STRESS_BAND) return RiskLevel.HIGH;
        if (belowOptimal(value) || aboveOptimal(value)) return RiskLevel.MEDIUM;
        return RiskLevel.NONE;
    }

    public String growthCondition(double value) {
        if (value < thresholds.min()) return "growth_halted";
        if (value < thresholds.optimalMin() - STRESS_BAND) return "slow_growth";
        if (belowOptimal(value)) return "reduced_growth";
        if (value > thresholds.max()) return "heat_damage";
        if (value > thresholds.optimalMax() + STRESS_BAND) return "stressed_growth";
        if (aboveOptimal(value)) return "suboptimal_growth";
        return "optimal_growth";
    }

    public record Analysis(
        double value,
        String unit,
        SensorStatus status,
        String description,
        RiskLevel stressLevel,
        String growthCondition
    ) {}
}
