package io.liveguard.storage;

import io.liveguard.model.ClusterKey;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Administrative cluster and server rows. Only the lookups the ingest path needs, plus the
 * registration and rotation calls the CLI drives.
 */
public final class SqliteServerDirectory implements ClusterDirectory, EligibilityPolicy {
    private final Database database;
    private final Clock clock;

    public SqliteServerDirectory(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public void registerCluster(String clusterId, String name, String publicKey, Integer graceWindowSeconds) {
        String sql = """
                INSERT INTO clusters(cluster_id, name, public_key, key_version, grace_window_seconds, created_at_ms, updated_at_ms)
                VALUES(?,?,?,1,?,?,?)
                """;
        long nowMs = clock.millis();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, clusterId);
            ps.setString(2, name == null ? "" : name);
            ps.setString(3, publicKey);
            SqlValues.setNullableInt(ps, 4, graceWindowSeconds);
            ps.setLong(5, nowMs);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register cluster " + clusterId, e);
        }
    }

    /**
     * Installs a new public key and bumps {@code key_version}; returns the new version.
     */
    public int rotateClusterKey(String clusterId, String newPublicKey) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement upd = c.prepareStatement(
                    "UPDATE clusters SET public_key=?, key_version=key_version+1, updated_at_ms=? WHERE cluster_id=?");
                 PreparedStatement sel = c.prepareStatement("SELECT key_version FROM clusters WHERE cluster_id=?")) {
                upd.setString(1, newPublicKey);
                upd.setLong(2, clock.millis());
                upd.setString(3, clusterId);
                if (upd.executeUpdate() != 1) {
                    throw new IllegalArgumentException("Unknown cluster: " + clusterId);
                }
                sel.setString(1, clusterId);
                int version;
                try (ResultSet rs = sel.executeQuery()) {
                    rs.next();
                    version = rs.getInt(1);
                }
                c.commit();
                return version;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to rotate key for cluster " + clusterId, e);
        }
    }

    public void registerServer(String serverId, String clusterId, String name) {
        String sql = """
                INSERT INTO servers(server_id, cluster_id, name, data_consent, created_at_ms, updated_at_ms)
                VALUES(?,?,?,1,?,?)
                """;
        long nowMs = clock.millis();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, serverId);
            ps.setString(2, clusterId);
            ps.setString(3, name == null ? "" : name);
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register server " + serverId, e);
        }
    }

    public boolean setConsent(String serverId, boolean granted) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE servers SET data_consent=?, updated_at_ms=? WHERE server_id=?")) {
            ps.setInt(1, granted ? 1 : 0);
            ps.setLong(2, clock.millis());
            ps.setString(3, serverId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update consent for server " + serverId, e);
        }
    }

    @Override
    public Optional<ClusterKey> clusterForServer(String serverId) {
        String sql = """
                SELECT c.cluster_id, c.public_key, c.key_version, c.grace_window_seconds
                FROM servers s JOIN clusters c ON c.cluster_id = s.cluster_id
                WHERE s.server_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, serverId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ClusterKey(
                        rs.getString("cluster_id"),
                        rs.getString("public_key"),
                        rs.getInt("key_version"),
                        SqlValues.nullableInt(rs, "grace_window_seconds")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load cluster for server " + serverId, e);
        }
    }

    /**
     * Heartbeats are allowed while the server's consent flag is set. Unknown data types are
     * denied.
     */
    @Override
    public boolean allowed(String serverId, String dataType, Map<String, Object> context) {
        if (!HEARTBEAT.equals(dataType)) {
            return false;
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT data_consent FROM servers WHERE server_id=?")) {
            ps.setString(1, serverId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read consent for server " + serverId, e);
        }
    }

    public List<String> serverIds() {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT server_id FROM servers ORDER BY server_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list servers", e);
        }
    }
}
