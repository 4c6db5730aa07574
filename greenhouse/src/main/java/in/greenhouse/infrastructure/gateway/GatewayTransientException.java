package in.greenhouse.infrastructure.gateway;

/**
 * Rate limited, unavailable or network failure. Retried by {@link RetryPolicy}.
 */
public class GatewayTransientException extends GatewayException {

    public GatewayTransientException(String resource, String message) {
        super(resource, message);
    }

    public GatewayTransientException(String resource, String message, Throwable cause) {
        super(resource, message, cause);
    }
}
