package in.greenhouse.domain.sensor;

import in.greenhouse.domain.feed.FeedKeys;

/**
 * Sensor kinds installed in the greenhouse and the feed each one reports on.
 */
public enum SensorType {
    LIGHT("light", FeedKeys.LIGHT, "lux"),
    TEMPERATURE("temperature", FeedKeys.TEMPERATURE, "°C"),
    HUMIDITY("humidity", FeedKeys.HUMIDITY, "%"),
    SOIL_MOISTURE("soil_moisture", FeedKeys.SOIL_MOISTURE, "%");

    private final String code;
    private final String defaultFeedKey;
    private final String unit;

    SensorType(String code, String defaultFeedKey, String unit) {
        this.code = code;
        this.defaultFeedKey = defaultFeedKey;
        this.unit = unit;
    }

    public String code() {
        return code;
    }

    public String defaultFeedKey() {
        return defaultFeedKey;
    }

    public String unit() {
        return unit;
    }

    public static SensorType fromCode(String code) {
        for (SensorType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown sensor type: " + code);
    }
}
