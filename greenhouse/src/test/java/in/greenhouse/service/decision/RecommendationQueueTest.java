package in.greenhouse.service.decision;

import in.greenhouse.domain.decision.AiRecommendation;
import in.greenhouse.domain.decision.Priority;
import in.greenhouse.support.InMemoryFastCache;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationQueueTest {

    private final InMemoryFastCache cache = new InMemoryFastCache();
    private final RecommendationQueue queue = new RecommendationQueue(cache);

    private static AiRecommendation recommendation(double minutes, String source) {
        return new AiRecommendation(true, minutes, "dry spell", 0.8, List.of("zone-a"),
            source, Priority.NORMAL, Instant.parse("2024-06-03T09:00:00Z"));
    }

    @Test
    void take_consumesQueuedRecommendation() {
        queue.offer(recommendation(10, "weather-ai"));

        Optional<AiRecommendation> taken = queue.take();

        assertTrue(taken.isPresent());
        assertEquals(10.0, taken.get().durationMinutes(), 1e-9);
        assertEquals("weather-ai", taken.get().source());
        assertTrue(queue.take().isEmpty(), "A recommendation is consumed once");
    }

    @Test
    void offer_replacesPendingRecommendation() {
        queue.offer(recommendation(10, "first"));
        queue.offer(recommendation(25, "second"));

        assertEquals("second", queue.take().orElseThrow().source());
    }

    @Test
    void take_dropsMalformedEntry() {
        cache.set(RecommendationQueue.KEY, "{not json");

        assertTrue(queue.take().isEmpty());
        assertFalse(cache.contains(RecommendationQueue.KEY));
    }

    @Test
    void take_cacheOutageIsEmpty() {
        cache.setFailing(true);

        assertTrue(queue.take().isEmpty());
    }
}
