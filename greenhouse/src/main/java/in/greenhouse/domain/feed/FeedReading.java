package in.greenhouse.domain.feed;

import java.time.Instant;

/**
 * One data point read from a gateway feed. Value is kept as the raw string the gateway returned.
 */
public record FeedReading(
    String id,
    String feedKey,
    String value,
    Instant createdAt
) {
    /**
     * Numeric view of the value, or null when it is not a number.
     */
    public Double numericValue() {
        if (value == null) return null;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
