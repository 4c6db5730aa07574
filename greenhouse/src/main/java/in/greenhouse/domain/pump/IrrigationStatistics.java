package in.greenhouse.domain.pump;

/**
 * Aggregates over recorded irrigation events.
 */
public record IrrigationStatistics(
    double totalRuntimeSeconds,
    double totalWaterUsed,
    int eventsLast24h,
    double runtimeLast24hSeconds,
    double waterLast24h,
    double averageDurationSeconds,
    double averageWaterPerEvent,
    int eventsConsidered
) {}
