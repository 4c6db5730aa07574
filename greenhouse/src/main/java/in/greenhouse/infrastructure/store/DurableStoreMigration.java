package in.greenhouse.infrastructure.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the durable node table on startup.
 *
 * durable_nodes holds one JSON subtree per row. Rows never nest: no stored path is an
 * ancestor of another stored path.
 */
public final class DurableStoreMigration {
    private static final Logger log = LoggerFactory.getLogger(DurableStoreMigration.class);

    static final String TABLE = "durable_nodes";

    private final DataSource dataSource;

    public DurableStoreMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[STORE MIGRATION] Checking {} table", TABLE);

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, TABLE)) {
                log.info("[STORE MIGRATION] {} already exists", TABLE);
                return;
            }
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("""
                    CREATE TABLE durable_nodes (
                        path TEXT PRIMARY KEY,
                        value JSONB NOT NULL,
                        updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                    )
                    """);
            }
            log.info("[STORE MIGRATION] ✓ {} created", TABLE);
        } catch (SQLException e) {
            log.error("[STORE MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new StoreException(TABLE, "Durable store migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
