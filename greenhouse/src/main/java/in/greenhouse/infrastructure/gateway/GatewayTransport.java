package in.greenhouse.infrastructure.gateway;

import in.greenhouse.domain.feed.TransportKind;

/**
 * One way of delivering a value to a gateway feed.
 *
 * {@link GatewayClient} holds the transports in priority order and falls through
 * to the next one when a transport is unavailable or its send fails.
 */
public interface GatewayTransport {

    TransportKind kind();

    /**
     * Whether a send is worth attempting right now.
     */
    boolean isAvailable();

    /**
     * Deliver value to feedKey.
     *
     * @throws GatewayException on failure
     */
    void send(String feedKey, String value);
}
