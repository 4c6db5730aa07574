package in.greenhouse.service.decision;

import in.greenhouse.application.port.output.FastCache;
import in.greenhouse.domain.decision.AiRecommendation;
import in.greenhouse.infrastructure.json.IrrigationJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Single-slot hand-off of an AI recommendation to the next decision tick.
 * A newer recommendation replaces the queued one; reading consumes it.
 */
public final class RecommendationQueue {
    private static final Logger log = LoggerFactory.getLogger(RecommendationQueue.class);

    public static final String KEY = "decision:ai_recommendation";

    private final FastCache cache;

    public RecommendationQueue(FastCache cache) {
        this.cache = cache;
    }

    public void offer(AiRecommendation recommendation) {
        cache.set(KEY, IrrigationJson.write(IrrigationJson.toJson(recommendation)));
        log.info("[AI] Queued recommendation from {} (irrigate={}, {} min, confidence {})",
            recommendation.source(), recommendation.shouldIrrigate(),
            recommendation.durationMinutes(), recommendation.confidence());
    }

    /**
     * Queued recommendation, removed from the queue. Unreadable entries are dropped.
     */
    public Optional<AiRecommendation> take() {
        Optional<String> json;
        try {
            json = cache.get(KEY);
        } catch (RuntimeException e) {
            log.warn("[AI] Could not read queued recommendation: {}", e.getMessage());
            return Optional.empty();
        }
        if (json.isEmpty()) {
            return Optional.empty();
        }

        try {
            cache.delete(KEY);
        } catch (RuntimeException e) {
            log.error("[AI] Could not consume queued recommendation: {}", e.getMessage());
        }

        try {
            return Optional.of(IrrigationJson.aiRecommendation(IrrigationJson.read(json.get())));
        } catch (RuntimeException e) {
            log.warn("[AI] Dropping malformed queued recommendation: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
