package in.greenhouse.infrastructure.gateway;

/**
 * Credentials rejected by the gateway. Fatal: never retried.
 */
public class GatewayAuthenticationException extends GatewayException {

    public GatewayAuthenticationException(String resource, String message) {
        super(resource, message);
    }

    public GatewayAuthenticationException(String resource, String message, Throwable cause) {
        super(resource, message, cause);
    }
}
