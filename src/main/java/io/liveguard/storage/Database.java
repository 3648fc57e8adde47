package io.liveguard.storage;

import io.liveguard.config.LiveGuardConfig;
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
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "liveguard.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5000;
    private final LiveGuardConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(LiveGuardConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        // claim reads then updates; take the write lock at BEGIN so two claimers cannot interleave
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS clusters (
                        cluster_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL DEFAULT '',
                        public_key TEXT,
                        key_version INTEGER NOT NULL DEFAULT 1,
                        grace_window_seconds INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS servers (
                        server_id TEXT PRIMARY KEY,
                        cluster_id TEXT NOT NULL,
                        name TEXT NOT NULL DEFAULT '',
                        data_consent INTEGER NOT NULL DEFAULT 1,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(cluster_id) REFERENCES clusters(cluster_id)
                    )
                    """);
            ensureServerColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS heartbeats (
                        server_id TEXT NOT NULL,
                        heartbeat_id TEXT NOT NULL UNIQUE,
                        key_version INTEGER NOT NULL,
                        agent_timestamp_ms INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        map_name TEXT,
                        players_current INTEGER,
                        players_capacity INTEGER,
                        agent_version TEXT,
                        signature TEXT NOT NULL,
                        payload TEXT,
                        received_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(server_id, heartbeat_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS heartbeat_jobs (
                        job_id TEXT PRIMARY KEY,
                        server_id TEXT NOT NULL,
                        enqueued_at_ms INTEGER NOT NULL,
                        processed_at_ms INTEGER,
                        claimed_at_ms INTEGER,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        last_error TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS servers_derived (
                        server_id TEXT PRIMARY KEY,
                        effective_status TEXT,
                        confidence TEXT,
                        uptime_percent REAL,
                        quality_score REAL,
                        anomaly_players_spike INTEGER NOT NULL DEFAULT 0,
                        anomaly_last_detected_at_ms INTEGER,
                        players_current INTEGER,
                        players_capacity INTEGER,
                        last_heartbeat_at_ms INTEGER,
                        last_seen_at_ms INTEGER,
                        ranking_score REAL,
                        ranking_updated_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ingest_rejections (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        server_id TEXT,
                        event_type TEXT NOT NULL,
                        rejection_reason TEXT NOT NULL,
                        agent_version TEXT,
                        metadata TEXT NOT NULL DEFAULT '{}',
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_servers_cluster ON servers(cluster_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_heartbeats_server_received ON heartbeats(server_id, received_at_ms DESC)");
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS uq_heartbeat_jobs_pending_server
                    ON heartbeat_jobs(server_id) WHERE processed_at_ms IS NULL
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_heartbeat_jobs_pending ON heartbeat_jobs(processed_at_ms, enqueued_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_ingest_rejections_time ON ingest_rejections(occurred_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_ingest_rejections_reason ON ingest_rejections(rejection_reason, occurred_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureServerColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(servers)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("data_consent")) {
                st.execute("ALTER TABLE servers ADD COLUMN data_consent INTEGER NOT NULL DEFAULT 1");
            }
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
                "20260301_001_derived_ranking",
                "Index derived rows by ranking score for directory ordering",
                List.of("CREATE INDEX IF NOT EXISTS idx_servers_derived_ranking ON servers_derived(ranking_score DESC)")
        ));
        steps.add(new MigrationStep(
                "20260301_002_anomaly_lookup",
                "Index derived rows by anomaly flag",
                List.of("CREATE INDEX IF NOT EXISTS idx_servers_derived_anomaly ON servers_derived(anomaly_players_spike)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
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
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
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
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms FROM schema_migrations ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(String version, String description, String checksum, long appliedAtMs) {
    }
}
