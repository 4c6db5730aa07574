package in.greenhouse.domain.feed;

/**
 * Transport that carried a gateway call.
 */
public enum TransportKind {
    PUBSUB,
    REST,
    NONE
}
