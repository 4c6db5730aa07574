package in.greenhouse.application.port.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Hierarchical JSON store addressed by slash-separated paths, e.g. "schedules/abc".
 */
public interface DurableStore {

    /** Replace the subtree at path. */
    void set(String path, JsonNode value);

    /** Subtree at path, empty when nothing is stored there. */
    Optional<JsonNode> get(String path);

    /** Merge the given children into the object at path. */
    void update(String path, ObjectNode children);

    /** Append under path with a generated, time-ordered key. Returns the key. */
    String push(String path, JsonNode value);

    /** Remove the subtree at path. */
    void delete(String path);
}
