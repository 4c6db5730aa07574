package in.greenhouse.domain.feed;

/**
 * Default gateway feed keys for the greenhouse installation.
 */
public final class FeedKeys {
    public static final String GROUP = "farm-sensors";

    public static final String LIGHT = "light-sensor";
    public static final String TEMPERATURE = "dht20-temperature";
    public static final String HUMIDITY = "dht20-humidity";
    public static final String SOIL_MOISTURE = "soil-moisture";

    public static final String WATER_PUMP = "water-pump-control";

    private FeedKeys() {}
}
