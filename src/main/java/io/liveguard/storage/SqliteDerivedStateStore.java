package io.liveguard.storage;

import io.liveguard.model.AnomalyState;
import io.liveguard.model.Confidence;
import io.liveguard.model.DerivedState;
import io.liveguard.model.FastPathUpdate;
import io.liveguard.model.ServerSnapshot;
import io.liveguard.model.ServerStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code servers_derived} rows. The worker write and the ingest fast-path write touch
 * disjoint column sets apart from the player counts.
 */
public final class SqliteDerivedStateStore implements DerivedStateStore, FastPathWriter {
    private static final String SNAPSHOT_COLUMNS = """
            server_id, effective_status, confidence, uptime_percent, quality_score,
            anomaly_players_spike, anomaly_last_detected_at_ms, players_current, players_capacity,
            last_heartbeat_at_ms, last_seen_at_ms, ranking_score
            """;

    private final Database database;
    private final Clock clock;

    public SqliteDerivedStateStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public AnomalyState currentAnomalyState(String serverId) {
        String sql = "SELECT anomaly_players_spike, anomaly_last_detected_at_ms FROM servers_derived WHERE server_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, serverId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return AnomalyState.none();
                }
                return new AnomalyState(
                        rs.getInt("anomaly_players_spike") == 1,
                        SqlValues.nullableInstant(rs, "anomaly_last_detected_at_ms")
                );
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load anomaly state for server " + serverId, e);
        }
    }

    @Override
    public void writeDerived(String serverId, DerivedState s) {
        String sql = """
                INSERT INTO servers_derived(
                    server_id, effective_status, confidence, uptime_percent, quality_score,
                    anomaly_players_spike, anomaly_last_detected_at_ms, players_current, players_capacity,
                    last_heartbeat_at_ms, updated_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(server_id) DO UPDATE SET
                    effective_status=excluded.effective_status,
                    confidence=excluded.confidence,
                    uptime_percent=excluded.uptime_percent,
                    quality_score=excluded.quality_score,
                    anomaly_players_spike=excluded.anomaly_players_spike,
                    anomaly_last_detected_at_ms=excluded.anomaly_last_detected_at_ms,
                    players_current=excluded.players_current,
                    players_capacity=excluded.players_capacity,
                    last_heartbeat_at_ms=excluded.last_heartbeat_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, serverId);
            ps.setString(2, s.effectiveStatus().wire());
            ps.setString(3, s.confidence().wire());
            SqlValues.setNullableDouble(ps, 4, s.uptimePercent());
            SqlValues.setNullableDouble(ps, 5, s.qualityScore());
            ps.setInt(6, s.anomalyPlayersSpike() ? 1 : 0);
            SqlValues.setNullableInstant(ps, 7, s.anomalyLastDetectedAt());
            SqlValues.setNullableInt(ps, 8, s.playersCurrent());
            SqlValues.setNullableInt(ps, 9, s.playersCapacity());
            SqlValues.setNullableInstant(ps, 10, s.lastHeartbeatAt());
            ps.setLong(11, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write derived state for server " + serverId, e);
        }
    }

    @Override
    public void writeFastPath(String serverId, FastPathUpdate u) {
        String sql = """
                INSERT INTO servers_derived(server_id, players_current, players_capacity, last_seen_at_ms, updated_at_ms)
                VALUES(?,?,?,?,?)
                ON CONFLICT(server_id) DO UPDATE SET
                    players_current=excluded.players_current,
                    players_capacity=excluded.players_capacity,
                    last_seen_at_ms=excluded.last_seen_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, serverId);
            SqlValues.setNullableInt(ps, 2, u.playersCurrent());
            SqlValues.setNullableInt(ps, 3, u.playersCapacity());
            SqlValues.setNullableInstant(ps, 4, u.lastSeenAt());
            ps.setLong(5, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write fast-path update for server " + serverId, e);
        }
    }

    @Override
    public Optional<ServerSnapshot> snapshot(String serverId) {
        String sql = "SELECT " + SNAPSHOT_COLUMNS + " FROM servers_derived WHERE server_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, serverId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readSnapshot(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load derived state for server " + serverId, e);
        }
    }

    @Override
    public List<ServerSnapshot> snapshots() {
        String sql = "SELECT " + SNAPSHOT_COLUMNS + " FROM servers_derived ORDER BY server_id";
        List<ServerSnapshot> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readSnapshot(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list derived state", e);
        }
    }

    @Override
    public void writeRankingScore(String serverId, double score) {
        String sql = "UPDATE servers_derived SET ranking_score=?, ranking_updated_at_ms=? WHERE server_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setDouble(1, score);
            ps.setLong(2, clock.millis());
            ps.setString(3, serverId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write ranking score for server " + serverId, e);
        }
    }

    private ServerSnapshot readSnapshot(ResultSet rs) throws SQLException {
        String status = rs.getString("effective_status");
        String confidence = rs.getString("confidence");
        return new ServerSnapshot(
                rs.getString("server_id"),
                status == null ? null : ServerStatus.fromWire(status),
                confidence == null ? null : Confidence.fromWire(confidence),
                SqlValues.nullableDouble(rs, "uptime_percent"),
                SqlValues.nullableDouble(rs, "quality_score"),
                rs.getInt("anomaly_players_spike") == 1,
                SqlValues.nullableInstant(rs, "anomaly_last_detected_at_ms"),
                SqlValues.nullableInt(rs, "players_current"),
                SqlValues.nullableInt(rs, "players_capacity"),
                SqlValues.nullableInstant(rs, "last_heartbeat_at_ms"),
                SqlValues.nullableInstant(rs, "last_seen_at_ms"),
                SqlValues.nullableDouble(rs, "ranking_score")
        );
    }
}
