package io.meshgraph.storage;

import io.meshgraph.config.MeshGraphConfig;
import io.meshgraph.error.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "meshgraph.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final MeshGraphConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(MeshGraphConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.connectionProperties = sqlite.toProperties();
    }

    public MeshGraphConfig config() {
        return config;
    }

    /**
     * Creates directories, schema and pragmas. Safe to call on every startup.
     *
     * @throws StorageUnavailableException when the store cannot be opened or migrated
     */
    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Opens an already existing store without creating it. Used by read-side commands
     * that must fail when the collector never produced a database.
     */
    public void requireExisting() {
        if (!Files.isRegularFile(config.dbFile())) {
            throw new StorageUnavailableException("Store does not exist: " + config.dbFile());
        }
        init();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.artifactsDir());
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to initialize directories under " + config.rootDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS nodes (
                        node_id INTEGER NOT NULL PRIMARY KEY,
                        long_name TEXT,
                        short_name TEXT,
                        hardware INTEGER,
                        role TEXT,
                        last_seen_ms INTEGER,
                        latitude REAL,
                        longitude REAL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        msg_id INTEGER NOT NULL PRIMARY KEY,
                        topic TEXT,
                        sender_id INTEGER NOT NULL,
                        receiver_id INTEGER NOT NULL,
                        physical_sender_id INTEGER NOT NULL,
                        msg_type TEXT,
                        rssi REAL,
                        snr REAL,
                        hop_count INTEGER,
                        timestamp_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS neighbors (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        reporter_id INTEGER NOT NULL,
                        neighbor_id INTEGER NOT NULL,
                        snr REAL,
                        timestamp_ms INTEGER NOT NULL,
                        UNIQUE(reporter_id, neighbor_id, timestamp_ms)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS traceroutes (
                        traceroute_id INTEGER NOT NULL PRIMARY KEY,
                        origin_id INTEGER NOT NULL,
                        hops TEXT NOT NULL,
                        timestamp_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_time ON messages(timestamp_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_neighbors_time ON neighbors(timestamp_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_traceroutes_time ON traceroutes(timestamp_ms)");
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to initialize SQLite schema at " + config.dbFile(), e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20250301_001_sender_time_indexes",
                "Index sender columns used by the hourly series",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_messages_sender_time ON messages(sender_id, timestamp_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_messages_physical_time ON messages(physical_sender_id, timestamp_ms)"
                )
        ));
        steps.add(new MigrationStep(
                "20250301_002_nodes_last_seen",
                "Index node last-seen for retention sweeps",
                List.of("CREATE INDEX IF NOT EXISTS idx_nodes_last_seen ON nodes(last_seen_ms)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to apply SQLite pragmas at " + config.dbFile(), e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new StorageUnavailableException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new StorageUnavailableException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
