package in.greenhouse.service.analysis;

import in.greenhouse.config.SensorThresholds;
import in.greenhouse.domain.sensor.SensorStatus;

/**
 * Status and range classification shared by every sensor analyzer.
 *
 * Status rules (margin = warningMargin * (max - min)):
 * - below min or above max: CRITICAL
 * - within the margin inside either bound: WARNING
 * - otherwise NORMAL
 */
public abstract class ThresholdEvaluator {
    protected final SensorThresholds thresholds;

    protected ThresholdEvaluator(SensorThresholds thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds required");
        }
        this.thresholds = thresholds;
    }

    public SensorThresholds thresholds() {
        return thresholds;
    }

    public SensorStatus evaluateStatus(double value) {
        if (value < thresholds.min() || value > thresholds.max()) {
            return SensorStatus.CRITICAL;
        }
        double margin = thresholds.range() * thresholds.warningMargin();
        if (value < thresholds.min() + margin || value > thresholds.max() - margin) {
            return SensorStatus.WARNING;
        }
        return SensorStatus.NORMAL;
    }

    /**
     * One of critically_low, critically_high, warning_low, warning_high, normal_low, normal_high, optimal.
     */
    public String describeRange(double value) {
        double min = thresholds.min();
        double range = thresholds.range();
        switch (evaluateStatus(value)) {
            case CRITICAL:
                return value < min ? "critically_low" : "critically_high";
            case WARNING:
                return value < min + range / 2 ? "warning_low" : "warning_high";
            default:
                if (value < min + range / 3) return "normal_low";
                if (value > min + 2 * range / 3) return "normal_high";
                return "optimal";
        }
    }

    protected boolean belowOptimal(double value) {
        return value < thresholds.optimalMin();
    }

    protected boolean aboveOptimal(double value) {
        return value > thresholds.optimalMax();
    }
}
