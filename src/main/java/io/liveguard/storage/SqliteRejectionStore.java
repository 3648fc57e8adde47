package io.liveguard.storage;

import io.liveguard.model.Rejection;
import io.liveguard.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SqliteRejectionStore implements RejectionRecorder {
    private final Database database;

    public SqliteRejectionStore(Database database) {
        this.database = database;
    }

    @Override
    public void record(Rejection r) {
        String sql = """
                INSERT INTO ingest_rejections(server_id, event_type, rejection_reason, agent_version, metadata, occurred_at_ms)
                VALUES(?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, r.serverId());
            ps.setString(2, Rejection.EVENT_TYPE);
            ps.setString(3, r.reason().code());
            ps.setString(4, r.agentVersion());
            ps.setString(5, Jsons.toCompactJson(r.metadata()));
            ps.setLong(6, r.occurredAt().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record ingest rejection", e);
        }
    }

    /**
     * Rejection counts grouped by reason code since {@code since}, most frequent first.
     */
    public Map<String, Integer> countsByReason(Instant since) {
        String sql = """
                SELECT rejection_reason, COUNT(*) AS n
                FROM ingest_rejections
                WHERE occurred_at_ms >= ?
                GROUP BY rejection_reason
                ORDER BY n DESC, rejection_reason ASC
                """;
        Map<String, Integer> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, since.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("rejection_reason"), rs.getInt("n"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to summarize ingest rejections", e);
        }
    }
}
