package in.greenhouse.infrastructure.cache;

/**
 * Fast cache unreachable or rejected a command.
 */
public class CacheException extends RuntimeException {

    private final String key;

    public CacheException(String key, String message, Throwable cause) {
        super(String.format("[%s] %s", key, message), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
