package in.greenhouse.application.port.output;

import in.greenhouse.domain.feed.FeedBinding;
import in.greenhouse.domain.feed.FeedMessageHandler;
import in.greenhouse.domain.feed.FeedReading;
import in.greenhouse.domain.feed.PublishResult;

import java.util.List;
import java.util.Optional;

/**
 * Port for the remote IoT feed platform.
 */
public interface FeedGateway {

    /** Check-then-create; idempotent. */
    FeedBinding ensureFeed(FeedBinding binding);

    /** Publish a value; never throws for transport failures. */
    PublishResult publish(String feedKey, String value);

    default PublishResult publish(String feedKey, boolean value) {
        return publish(feedKey, value ? "1" : "0");
    }

    /** Most recent data point, empty when the feed has none or cannot be read. */
    Optional<FeedReading> getLatest(String feedKey);

    /** Newest first, at most limit points. */
    List<FeedReading> getHistory(String feedKey, int limit);

    /** Subscribe to inbound messages on a feed. */
    void registerHandler(String feedKey, FeedMessageHandler handler);

    /** Parsed ON/OFF state of an actuator feed, empty when unknown. */
    Optional<Boolean> getActuatorState(String feedKey);

    /** Ensure the actuator feed exists and publish 1 / 0. */
    boolean setActuator(String feedKey, boolean on);
}
