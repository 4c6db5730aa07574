package in.greenhouse.service.analysis;

import in.greenhouse.domain.decision.Recommendation;
import in.greenhouse.domain.decision.RiskLevel;
import in.greenhouse.domain.decision.Urgency;
import in.greenhouse.domain.decision.WaterAmount;
import in.greenhouse.domain.sensor.EnvironmentSnapshot;
import in.greenhouse.domain.sensor.SensorStatus;
import in.greenhouse.domain.sensor.SensorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every sensor analyzer over a snapshot and folds the results into one
 * irrigation recommendation plus a list of suggested operator actions.
 */
public final class EnvironmentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentAnalyzer.class);

    private static final double HOT_FOR_WATERING = 30.0;
    private static final double TOO_HOT = 35.0;
    private static final double TOO_COLD = 15.0;
    private static final double TOO_DARK = 200.0;

    private final SoilMoistureAnalyzer soil;
    private final TemperatureAnalyzer temperature;
    private final HumidityAnalyzer humidity;
    private final LightAnalyzer light;

    public EnvironmentAnalyzer() {
        this(new SoilMoistureAnalyzer(), new TemperatureAnalyzer(), new HumidityAnalyzer(), new LightAnalyzer());
    }

    public EnvironmentAnalyzer(
        SoilMoistureAnalyzer soil,
        TemperatureAnalyzer temperature,
        HumidityAnalyzer humidity,
        LightAnalyzer light
    ) {
        this.soil = soil;
        this.temperature = temperature;
        this.humidity = humidity;
        this.light = light;
    }

    public SoilMoistureAnalyzer soilAnalyzer() {
        return soil;
    }

    /**
     * Threshold status of a raw value for the given sensor.
     */
    public SensorStatus statusOf(SensorType type, double value) {
        switch (type) {
            case SOIL_MOISTURE:
                return soil.evaluateStatus(value);
            case TEMPERATURE:
                return temperature.evaluateStatus(value);
            case HUMIDITY:
                return humidity.evaluateStatus(value);
            case LIGHT:
                return light.evaluateStatus(value);
            default:
                return SensorStatus.UNKNOWN;
        }
    }

    public EnvironmentAnalysis analyze(EnvironmentSnapshot snapshot) {
        SoilMoistureAnalyzer.Analysis soilResult = snapshot.reading(SensorType.SOIL_MOISTURE)
            .map(soil::analyze).orElse(null);
        TemperatureAnalyzer.Analysis tempResult = snapshot.reading(SensorType.TEMPERATURE)
            .map(temperature::analyze).orElse(null);
        HumidityAnalyzer.Analysis humidityResult = snapshot.reading(SensorType.HUMIDITY)
            .map(humidity::analyze).orElse(null);
        LightAnalyzer.Analysis lightResult = snapshot.reading(SensorType.LIGHT)
            .map(light::analyze).orElse(null);

        List<ActionItem> actions = actionItems(soilResult, tempResult, humidityResult, lightResult);
        Recommendation recommendation = recommend(soilResult, tempResult, humidityResult, actions);

        log.debug("[ANALYSIS] status={} needsWater={} urgency={} reason={}",
            snapshot.overallStatus().code(), recommendation.needsWater(),
            recommendation.urgency().code(), recommendation.reason());

        return new EnvironmentAnalysis(
            snapshot.timestamp(),
            snapshot.overallStatus(),
            soilResult,
            tempResult,
            humidityResult,
            lightResult,
            recommendation,
            actions
        );
    }

    private Recommendation recommend(
        SoilMoistureAnalyzer.Analysis soilResult,
        TemperatureAnalyzer.Analysis tempResult,
        HumidityAnalyzer.Analysis humidityResult,
        List<ActionItem> actions
    ) {
        boolean needsWater = false;
        Urgency urgency = Urgency.NONE;
        String reason = "";

        if (soilResult != null && soilResult.needsWater()) {
            needsWater = true;
            if (soilResult.riskLevel().atLeast(RiskLevel.HIGH)) {
                urgency = Urgency.HIGH;
                reason = "soil_too_dry";
            } else if (soilResult.riskLevel() == RiskLevel.MEDIUM) {
                urgency = Urgency.MEDIUM;
                reason = "soil_somewhat_dry";
            }
        }

        // Heat stress only matters when the soil alone did not call for water.
        if (!needsWater && tempResult != null && isAlarming(tempResult.status())
            && tempResult.stressLevel().atLeast(RiskLevel.HIGH)
            && tempResult.value() > HOT_FOR_WATERING) {
            needsWater = true;
            urgency = Urgency.MEDIUM;
            reason = "high_temperature";
        }

        // Dry air only escalates a need that carries no urgency of its own.
        if (needsWater && urgency == Urgency.NONE && humidityResult != null && humidityResult.isDry()) {
            urgency = Urgency.HIGH;
            reason = reason + "_with_dry_air";
        }

        WaterAmount amount = WaterAmount.NONE;
        if (needsWater) {
            switch (urgency) {
                case HIGH:
                    amount = WaterAmount.HEAVY;
                    break;
                case MEDIUM:
                    amount = WaterAmount.MODERATE;
                    break;
                default:
                    amount = WaterAmount.LIGHT;
            }
        }

        List<String> codes = new ArrayList<>();
        for (ActionItem item : actions) {
            codes.add(item.action());
        }
        return new Recommendation(needsWater, urgency, reason, amount, codes, false);
    }

    private List<ActionItem> actionItems(
        SoilMoistureAnalyzer.Analysis soilResult,
        TemperatureAnalyzer.Analysis tempResult,
        HumidityAnalyzer.Analysis humidityResult,
        LightAnalyzer.Analysis lightResult
    ) {
        List<ActionItem> items = new ArrayList<>();

        if (soilResult != null && soilResult.needsWater()) {
            String priority = soilResult.riskLevel().atLeast(RiskLevel.HIGH) ? "high" : "medium";
            items.add(new ActionItem("water_plants", priority,
                "Soil moisture is low (" + format(soilResult.value(), soilResult.unit()) + ")"));
        }

        if (tempResult != null && isAlarming(tempResult.status())) {
            if (tempResult.value() > TOO_HOT) {
                items.add(new ActionItem("reduce_temperature", "high",
                    "Temperature is too high (" + format(tempResult.value(), tempResult.unit()) + ")"));
            } else if (tempResult.value() < TOO_COLD) {
                items.add(new ActionItem("increase_temperature", "high",
                    "Temperature is too low (" + format(tempResult.value(), tempResult.unit()) + ")"));
            }
        }

        if (humidityResult != null && humidityResult.highDiseaseRisk()) {
            items.add(new ActionItem("improve_air_circulation", "medium",
                "High humidity may cause diseases (" + format(humidityResult.value(), humidityResult.unit()) + ")"));
        }

        if (lightResult != null && isAlarming(lightResult.status()) && lightResult.value() < TOO_DARK) {
            items.add(new ActionItem("increase_light", "medium",
                "Light level is too low (" + format(lightResult.value(), lightResult.unit()) + ")"));
        }

        return items;
    }

    private static boolean isAlarming(SensorStatus status) {
        return status == SensorStatus.CRITICAL || status == SensorStatus.WARNING;
    }

    private static String format(double value, String unit) {
        return value + (unit == null ? "" : unit);
    }

    public record ActionItem(String action, String priority, String details) {}

    public record EnvironmentAnalysis(
        Instant timestamp,
        SensorStatus overallStatus,
        SoilMoistureAnalyzer.Analysis soilMoisture,
        TemperatureAnalyzer.Analysis temperature,
        HumidityAnalyzer.Analysis humidity,
        LightAnalyzer.Analysis light,
        Recommendation recommendation,
        List<ActionItem> actionItems
    ) {
        public EnvironmentAnalysis {
            actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
        }
    }
}
