package in.greenhouse.domain.decision;

import java.util.List;

/**
 * Watering recommendation, either rule based or after arbitration with an AI recommendation.
 */
public record Recommendation(
    boolean needsWater,
    Urgency urgency,
    String reason,
    WaterAmount waterAmount,
    List<String> actionItems,
    boolean aiOverride
) {
    public Recommendation {
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }

    public Recommendation withAiOverride(boolean needsWater, WaterAmount waterAmount, String reason) {
        return new Recommendation(needsWater, urgency, reason, waterAmount, actionItems, true);
    }
}
