package in.greenhouse.application.service;

import in.greenhouse.config.DecisionConfig;
import in.greenhouse.config.IrrigationConfig;
import in.greenhouse.domain.common.ReasonCode;
import in.greenhouse.domain.decision.AiRecommendation;
import in.greenhouse.domain.decision.Decision;
import in.greenhouse.domain.decision.Priority;
import in.greenhouse.domain.pump.PumpCommandResult;
import in.greenhouse.domain.pump.PumpStatus;
import in.greenhouse.domain.pump.TriggerSource;
import in.greenhouse.service.decision.DecisionLoop;
import in.greenhouse.service.decision.RecommendationQueue;
import in.greenhouse.service.pump.PumpController;
import in.greenhouse.service.schedule.IrrigationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Single entry point over the pump, the scheduler and the decision loop.
 *
 * Owns the lifecycle of both background workers and routes external AI recommendations:
 * high priority ones act on the pump at once, everything else waits for the next decision tick.
 */
public final class IrrigationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(IrrigationOrchestrator.class);

    private final PumpController pump;
    private final IrrigationScheduler scheduler;
    private final DecisionLoop decisionLoop;
    private final RecommendationQueue recommendations;
    private final IrrigationConfig config;
    private final Clock clock;

    private volatile boolean running;

    public IrrigationOrchestrator(PumpController pump, IrrigationScheduler scheduler, DecisionLoop decisionLoop,
                                  RecommendationQueue recommendations, IrrigationConfig config, Clock clock) {
        this.pump = pump;
        this.scheduler = scheduler;
        this.decisionLoop = decisionLoop;
        this.recommendations = recommendations;
        this.config = config;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    /**
     * Start both workers independently. A worker that was already running counts as started.
     */
    public LifecycleResult start() {
        boolean schedulerOk = scheduler.start() || scheduler.isRunning();
        boolean decisionOk = decisionLoop.start() || decisionLoop.isRunning();
        running = schedulerOk || decisionOk;

        if (schedulerOk && decisionOk) {
            log.info("[ORCHESTRATOR] Irrigation system started");
        } else {
            log.error("[ORCHESTRATOR] Partial start: scheduler={}, decisionLoop={}", schedulerOk, decisionOk);
        }
        return new LifecycleResult(schedulerOk, decisionOk, null);
    }

    /**
     * Stop both workers, then force the pump OFF when it is still running.
     */
    public LifecycleResult stop() {
        boolean schedulerOk = scheduler.stop() || !scheduler.isRunning();
        boolean decisionOk = decisionLoop.stop() || !decisionLoop.isRunning();

        PumpCommandResult shutdown = null;
        if (pump.isRunning()) {
            shutdown = pump.turnOff(TriggerSource.SYSTEM, Map.of("reason", "system_shutdown"));
            if (!shutdown.success()) {
                log.error("[ORCHESTRATOR] Pump could not be stopped on shutdown: {}", shutdown.message());
            }
        }
        running = false;

        log.info("[ORCHESTRATOR] Irrigation system stopped (scheduler={}, decisionLoop={})", schedulerOk, decisionOk);
        return new LifecycleResult(schedulerOk, decisionOk, shutdown);
    }

    public boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════
    // AI recommendations
    // ═══════════════════════════════════════════════════════════════

    public IngestResult ingestRecommendation(String source, Priority priority,
                                             AiRecommendation recommendation, Instant timestamp) {
        log.info("[ORCHESTRATOR] Recommendation from {} (priority={}): irrigate={}, {} min",
            source, priority.code(), recommendation.shouldIrrigate(), recommendation.durationMinutes());

        if (!config.aiRecommendationsEnabled()) {
            return IngestResult.refused(ReasonCode.AI_RECOMMENDATIONS_DISABLED, "AI recommendations are disabled");
        }
        if (!config.isSourceAllowed(source)) {
            return IngestResult.refused(ReasonCode.SOURCE_NOT_ALLOWED, "Source '" + source + "' is not allowed");
        }

        if (!recommendation.shouldIrrigate() || recommendation.durationMinutes() <= 0) {
            return new IngestResult(true, true, IngestResult.ACTION_NONE, null,
                "Recommendation received but no irrigation action needed", null);
        }

        AiRecommendation stamped = recommendation.withOrigin(source, priority,
            timestamp != null ? timestamp : clock.instant());

        if (priority == Priority.HIGH) {
            PumpCommandResult result = pump.turnOn(stamped.durationSeconds(), TriggerSource.AI_RECOMMENDATION,
                Map.of("ai_source", source == null ? "unknown" : source,
                    "reason", stamped.reason() == null ? "" : stamped.reason()));
            return new IngestResult(result.success(), true, IngestResult.ACTION_IMMEDIATE, result.reason(),
                "Applied high priority AI recommendation: " + result.message(), result);
        }

        recommendations.offer(stamped);
        return new IngestResult(true, true, IngestResult.ACTION_QUEUED, null,
            "Recommendation queued for next decision cycle", null);
    }

    // ═══════════════════════════════════════════════════════════════
    // Manual control and status
    // ═══════════════════════════════════════════════════════════════

    /**
     * @param action "on" or "off"
     * @param durationSeconds run length for "on", null or non-positive for the default
     */
    public PumpCommandResult manuallyControlPump(String action, Long durationSeconds) {
        String normalized = action == null ? "" : action.trim().toLowerCase();
        switch (normalized) {
            case "on":
                return pump.turnOn(durationSeconds == null ? 0L : durationSeconds, TriggerSource.MANUAL, Map.of());
            case "off":
                return pump.turnOff(TriggerSource.MANUAL, Map.of());
            default:
                log.warn("[ORCHESTRATOR] Invalid pump action '{}'", action);
                return PumpCommandResult.refused(ReasonCode.INVALID_ACTION, "Invalid action: " + action);
        }
    }

    public SystemStatus getSystemStatus() {
        return new SystemStatus(
            clock.instant(),
            running,
            pump.getStatus(),
            scheduler.isRunning(),
            scheduler.list().size(),
            decisionLoop.isRunning(),
            decisionLoop.getConfiguration(),
            decisionLoop.getLastDecision().orElse(null)
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // Results
    // ═══════════════════════════════════════════════════════════════

    /**
     * @param pumpShutdown result of the forced stop, null when the pump was already off
     */
    public record LifecycleResult(boolean scheduler, boolean decisionLoop, PumpCommandResult pumpShutdown) {
        public boolean success() {
            return scheduler && decisionLoop && (pumpShutdown == null || pumpShutdown.success());
        }
    }

    public record IngestResult(
        boolean success,
        boolean accepted,
        String actionTaken,
        ReasonCode reason,
        String message,
        PumpCommandResult pumpResult
    ) {
        public static final String ACTION_NONE = "none";
        public static final String ACTION_QUEUED = "queued";
        public static final String ACTION_IMMEDIATE = "immediate_irrigation";

        static IngestResult refused(ReasonCode reason, String message) {
            return new IngestResult(false, false, ACTION_NONE, reason, message, null);
        }
    }

    public record SystemStatus(
        Instant timestamp,
        boolean running,
        PumpStatus pump,
        boolean schedulerRunning,
        int scheduleCount,
        boolean decisionLoopRunning,
        DecisionConfig decisionConfig,
        Decision lastDecision
    ) {}
}
