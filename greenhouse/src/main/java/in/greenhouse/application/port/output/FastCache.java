package in.greenhouse.application.port.output;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value cache shared across processes. Values are JSON strings.
 */
public interface FastCache {

    Optional<String> get(String key);

    void set(String key, String value);

    void setWithTtl(String key, String value, Duration ttl);

    void delete(String key);

    void expire(String key, Duration ttl);

    /** Prepend to a list (newest first). */
    void listPush(String key, String value);

    /** Keep only elements start..stop inclusive. */
    void listTrim(String key, long start, long stop);

    /** Elements start..stop inclusive; -1 means the end. */
    List<String> listRange(String key, long start, long stop);
}
