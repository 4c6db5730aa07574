package in.greenhouse.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Path helpers for the hierarchical JSON store.
 */
public final class JsonTree {

    private JsonTree() {}

    /**
     * "/a//b/" becomes [a, b]. Blank paths are rejected.
     */
    public static List<String> segments(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Path must not be null");
        }
        List<String> parts = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Path must name at least one key: '" + path + "'");
        }
        return parts;
    }

    public static String normalize(String path) {
        return String.join("/", segments(path));
    }

    /**
     * Segments of child below ancestor; both normalized, ancestor must be a proper prefix.
     */
    public static List<String> relative(String ancestor, String child) {
        List<String> a = segments(ancestor);
        List<String> c = segments(child);
        if (c.size() <= a.size() || !c.subList(0, a.size()).equals(a)) {
            throw new IllegalArgumentException(child + " is not below " + ancestor);
        }
        return c.subList(a.size(), c.size());
    }

    public static Optional<JsonNode> navigate(JsonNode root, List<String> segments) {
        JsonNode current = root;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return Optional.empty();
            }
            current = current.get(segment);
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    /**
     * Set value at segments below root, creating intermediate objects and replacing
     * non-object intermediates.
     */
    public static void put(ObjectNode root, List<String> segments, JsonNode value) {
        ObjectNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode next = parent.get(segments.get(i));
            if (next == null || !next.isObject()) {
                next = parent.putObject(segments.get(i));
            }
            parent = (ObjectNode) next;
        }
        String leaf = segments.get(segments.size() - 1);
        if (value == null || value.isNull()) {
            parent.remove(leaf);
        } else {
            parent.set(leaf, value.deepCopy());
        }
    }

    public static void remove(ObjectNode root, List<String> segments) {
        put(root, segments, null);
    }

    public static ObjectNode emptyObject() {
        return JsonNodeFactory.instance.objectNode();
    }
}
