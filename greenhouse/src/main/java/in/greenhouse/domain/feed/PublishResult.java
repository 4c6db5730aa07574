package in.greenhouse.domain.feed;

/**
 * Uniform publish outcome regardless of which transport served it.
 *
 * @param attempts transports tried, including the one that succeeded
 */
public record PublishResult(
    boolean success,
    TransportKind transport,
    int attempts,
    String error
) {
    public static PublishResult servedBy(TransportKind transport, int attempts) {
        return new PublishResult(true, transport, attempts, null);
    }

    public static PublishResult failed(int attempts, String error) {
        return new PublishResult(false, TransportKind.NONE, attempts, error);
    }
}
