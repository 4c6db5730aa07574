package in.greenhouse.infrastructure.store;

/**
 * Durable store read or write failed.
 */
public class StoreException extends RuntimeException {

    private final String path;

    public StoreException(String path, String message, Throwable cause) {
        super(String.format("[%s] %s", path, message), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
