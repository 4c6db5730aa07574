package in.greenhouse.domain.feed;

import java.util.Objects;

/**
 * Logical name bound to a gateway feed key, optionally inside a group.
 */
public record FeedBinding(
    String key,
    String name,
    String description,
    String groupKey
) {
    public FeedBinding {
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Feed key must not be blank");
        }
        if (name == null || name.isBlank()) {
            name = key;
        }
        if (description == null || description.isBlank()) {
            description = "Auto-created feed for " + key;
        }
    }

    public static FeedBinding of(String key) {
        return new FeedBinding(key, key, null, null);
    }

    public static FeedBinding inGroup(String key, String name, String groupKey) {
        return new FeedBinding(key, name, null, groupKey);
    }

    public boolean hasGroup() {
        return groupKey != null && !groupKey.isBlank();
    }
}
