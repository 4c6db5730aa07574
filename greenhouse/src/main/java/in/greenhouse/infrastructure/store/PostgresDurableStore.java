package in.greenhouse.infrastructure.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.greenhouse.application.port.output.DurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of the hierarchical {@link DurableStore}.
 *
 * Each row stores a whole JSON subtree at a normalized path. Writes below an existing
 * row rewrite that row's JSON; writes above existing rows replace them. Reads either
 * navigate into the covering row or assemble the descendant rows into an object.
 */
public final class PostgresDurableStore implements DurableStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresDurableStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SELECT_COVERING =
        "SELECT path, value FROM durable_nodes " +
        "WHERE path = ? OR left(?, length(path) + 1) = path || '/' " +
        "ORDER BY length(path) DESC LIMIT 1";
    private static final String SELECT_DESCENDANTS =
        "SELECT path, value FROM durable_nodes WHERE left(path, length(?) + 1) = ? || '/' ORDER BY path";
    private static final String DELETE_SUBTREE =
        "DELETE FROM durable_nodes WHERE path = ? OR left(path, length(?) + 1) = ? || '/'";
    private static final String UPSERT =
        "INSERT INTO durable_nodes (path, value, updated_at) VALUES (?, ?::jsonb, NOW()) " +
        "ON CONFLICT (path) DO UPDATE SET value = EXCLUDED.value, updated_at = NOW()";

    private final DataSource dataSource;
    private final PushKeyGenerator keyGenerator;

    public PostgresDurableStore(DataSource dataSource) {
        this(dataSource, new PushKeyGenerator());
    }

    public PostgresDurableStore(DataSource dataSource, PushKeyGenerator keyGenerator) {
        this.dataSource = dataSource;
        this.keyGenerator = keyGenerator;
    }

    @Override
    public void set(String path, JsonNode value) {
        String normalized = JsonTree.normalize(path);
        inTransaction(normalized, conn -> write(conn, normalized, value));
    }

    @Override
    public Optional<JsonNode> get(String path) {
        String normalized = JsonTree.normalize(path);
        try (Connection conn = dataSource.getConnection()) {
            Optional<StoredNode> covering = findCovering(conn, normalized);
            if (covering.isPresent()) {
                StoredNode node = covering.get();
                if (node.path().equals(normalized)) {
                    return Optional.of(node.value());
                }
                return JsonTree.navigate(node.value(), JsonTree.relative(node.path(), normalized));
            }

            List<StoredNode> descendants = findDescendants(conn, normalized);
            if (descendants.isEmpty()) {
                return Optional.empty();
            }
            ObjectNode assembled = JsonTree.emptyObject();
            for (StoredNode d : descendants) {
                JsonTree.put(assembled, JsonTree.relative(normalized, d.path()), d.value());
            }
            return Optional.of(assembled);
        } catch (SQLException e) {
            log.error("[STORE] Read of {} failed: {}", normalized, e.getMessage());
            throw new StoreException(normalized, "Read failed", e);
        }
    }

    @Override
    public void update(String path, ObjectNode children) {
        String normalized = JsonTree.normalize(path);
        inTransaction(normalized, conn -> {
            Iterator<Map.Entry<String, JsonNode>> fields = children.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                write(conn, normalized + "/" + JsonTree.normalize(field.getKey()), field.getValue());
            }
        });
    }

    @Override
    public String push(String path, JsonNode value) {
        String key = keyGenerator.next();
        set(JsonTree.normalize(path) + "/" + key, value);
        return key;
    }

    @Override
    public void delete(String path) {
        String normalized = JsonTree.normalize(path);
        inTransaction(normalized, conn -> write(conn, normalized, null));
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    /**
     * Write (or with null, remove) the subtree at path keeping rows non-nested.
     */
    private void write(Connection conn, String path, JsonNode value) throws SQLException {
        Optional<StoredNode> covering = findCovering(conn, path);
        if (covering.isPresent() && !covering.get().path().equals(path)) {
            StoredNode ancestor = covering.get();
            ObjectNode root = ancestor.value().isObject()
                ? (ObjectNode) ancestor.value()
                : JsonTree.emptyObject();
            JsonTree.put(root, JsonTree.relative(ancestor.path(), path), value);
            upsert(conn, ancestor.path(), root);
            return;
        }

        try (PreparedStatement ps = conn.prepareStatement(DELETE_SUBTREE)) {
            ps.setString(1, path);
            ps.setString(2, path);
            ps.setString(3, path);
            ps.executeUpdate();
        }
        if (value != null && !value.isNull()) {
            upsert(conn, path, value);
        }
    }

    private void upsert(Connection conn, String path, JsonNode value) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT)) {
            ps.setString(1, path);
            ps.setString(2, toJson(path, value));
            ps.executeUpdate();
        }
    }

    private Optional<StoredNode> findCovering(Connection conn, String path) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_COVERING)) {
            ps.setString(1, path);
            ps.setString(2, path);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    private List<StoredNode> findDescendants(Connection conn, String path) throws SQLException {
        List<StoredNode> nodes = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_DESCENDANTS)) {
            ps.setString(1, path);
            ps.setString(2, path);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    nodes.add(mapRow(rs));
                }
            }
        }
        return nodes;
    }

    private StoredNode mapRow(ResultSet rs) throws SQLException {
        String path = rs.getString("path");
        try {
            return new StoredNode(path, MAPPER.readTree(rs.getString("value")));
        } catch (JsonProcessingException e) {
            throw new StoreException(path, "Stored value is not valid JSON", e);
        }
    }

    private static String toJson(String path, JsonNode value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException(path, "Value cannot be serialized", e);
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run(Connection conn) throws SQLException;
    }

    private void inTransaction(String path, SqlWork work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                work.run(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("[STORE] Write of {} failed: {}", path, e.getMessage());
            throw new StoreException(path, "Write failed", e);
        }
    }

    private record StoredNode(String path, JsonNode value) {}
}
