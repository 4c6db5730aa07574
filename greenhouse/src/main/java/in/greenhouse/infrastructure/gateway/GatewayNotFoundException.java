package in.greenhouse.infrastructure.gateway;

/**
 * Feed or group does not exist on the gateway. Callers provision it and carry on.
 */
public class GatewayNotFoundException extends GatewayException {

    public GatewayNotFoundException(String resource, String message) {
        super(resource, message);
    }
}
