package in.greenhouse.config;

import in.greenhouse.util.Env;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration for the irrigation service, assembled once in the composition root.
 */
public record IrrigationConfig(
    GatewayConfig gateway,
    PumpConfig pump,
    DecisionConfig decision,
    Duration scheduleCheckInterval,
    Duration decisionInterval,
    Duration snapshotTtl,
    Duration staleThreshold,
    boolean aiRecommendationsEnabled,
    List<String> allowedSources,
    String redisHost,
    int redisPort,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbPoolSize,
    int monitoringPort
) {
    public IrrigationConfig {
        allowedSources = allowedSources == null ? List.of("all") : List.copyOf(allowedSources);
    }

    public static IrrigationConfig fromEnv() {
        return new IrrigationConfig(
            GatewayConfig.fromEnv(),
            PumpConfig.fromEnv(),
            DecisionConfig.fromEnv(),
            Duration.ofSeconds(Env.getLong("SCHEDULE_CHECK_INTERVAL_SECONDS", 60)),
            Duration.ofSeconds(Env.getLong("AUTO_DECISION_INTERVAL_SECONDS", 900)),
            Duration.ofSeconds(Env.getLong("SNAPSHOT_TTL_SECONDS", 120)),
            Duration.ofSeconds(Env.getLong("STALE_THRESHOLD_SECONDS", 300)),
            Env.getBool("AI_RECOMMENDATIONS_ENABLED", true),
            Env.getList("AI_ALLOWED_SOURCES", List.of("all")),
            Env.get("REDIS_HOST", "localhost"),
            Env.getInt("REDIS_PORT", 6379),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/greenhouse"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 5),
            Env.getInt("MONITORING_PORT", 9090)
        );
    }

    public boolean isSourceAllowed(String source) {
        if (allowedSources.contains("all")) {
            return true;
        }
        return source != null && allowedSources.contains(source);
    }
}
