package in.greenhouse.domain.feed;

/**
 * Callback for inbound pub/sub feed messages. Runs on the receive thread and must not block.
 */
@FunctionalInterface
public interface FeedMessageHandler {
    void onMessage(String feedKey, String payload);
}
