package in.greenhouse.infrastructure.gateway;

/**
 * Base class for failures talking to the IoT gateway.
 */
public class GatewayException extends RuntimeException {

    private final String resource;

    public GatewayException(String resource, String message) {
        super(String.format("[%s] %s", resource, message));
        this.resource = resource;
    }

    public GatewayException(String resource, String message, Throwable cause) {
        super(String.format("[%s] %s", resource, message), cause);
        this.resource = resource;
    }

    /**
     * Feed key, group key or topic the failing call addressed.
     */
    public String getResource() {
        return resource;
    }
}
