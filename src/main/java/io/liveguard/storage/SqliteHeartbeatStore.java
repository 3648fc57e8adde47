package io.liveguard.storage;

import io.liveguard.model.AgentStatus;
import io.liveguard.model.Heartbeat;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SqliteHeartbeatStore implements HeartbeatStore {
    private final Database database;

    public SqliteHeartbeatStore(Database database) {
        this.database = database;
    }

    @Override
    public InsertOutcome insert(Heartbeat hb) {
        String sql = """
                INSERT INTO heartbeats(
                    server_id, heartbeat_id, key_version, agent_timestamp_ms, status, map_name,
                    players_current, players_capacity, agent_version, signature, payload, received_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT DO NOTHING
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, hb.serverId());
            ps.setString(2, hb.heartbeatId());
            ps.setInt(3, hb.keyVersion());
            ps.setLong(4, hb.agentTimestamp().toEpochMilli());
            ps.setString(5, hb.status().wire());
            ps.setString(6, hb.mapName());
            SqlValues.setNullableInt(ps, 7, hb.playersCurrent());
            SqlValues.setNullableInt(ps, 8, hb.playersCapacity());
            ps.setString(9, hb.agentVersion());
            ps.setString(10, hb.signature());
            ps.setString(11, hb.debugPayload());
            ps.setLong(12, hb.receivedAt().toEpochMilli());
            if (ps.executeUpdate() == 1) {
                return InsertOutcome.INSERTED;
            }
            String owner = ownerOf(c, hb.heartbeatId());
            if (owner == null || owner.equals(hb.serverId())) {
                return InsertOutcome.REPLAY;
            }
            throw new HeartbeatIntegrityException(hb.heartbeatId(), hb.serverId(), owner);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert heartbeat " + hb.heartbeatId(), e);
        }
    }

    @Override
    public List<Heartbeat> recent(String serverId, int limit) {
        String sql = """
                SELECT server_id, heartbeat_id, key_version, agent_timestamp_ms, status, map_name,
                       players_current, players_capacity, agent_version, signature, payload, received_at_ms
                FROM heartbeats
                WHERE server_id=?
                ORDER BY received_at_ms DESC, heartbeat_id DESC
                LIMIT ?
                """;
        List<Heartbeat> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, serverId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Heartbeat(
                            rs.getString("server_id"),
                            rs.getString("heartbeat_id"),
                            rs.getInt("key_version"),
                            Instant.ofEpochMilli(rs.getLong("agent_timestamp_ms")),
                            AgentStatus.fromWire(rs.getString("status")),
                            rs.getString("map_name"),
                            SqlValues.nullableInt(rs, "players_current"),
                            SqlValues.nullableInt(rs, "players_capacity"),
                            rs.getString("agent_version"),
                            rs.getString("signature"),
                            rs.getString("payload"),
                            Instant.ofEpochMilli(rs.getLong("received_at_ms"))
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load heartbeats for server " + serverId, e);
        }
    }

    @Override
    public long count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM heartbeats");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count heartbeats", e);
        }
    }

    private String ownerOf(Connection c, String heartbeatId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT server_id FROM heartbeats WHERE heartbeat_id=?")) {
            ps.setString(1, heartbeatId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }
}
