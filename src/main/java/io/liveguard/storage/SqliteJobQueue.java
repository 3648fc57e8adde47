package io.liveguard.storage;

import io.liveguard.model.Job;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Heartbeat job queue on SQLite. A partial unique index keeps one pending row per server,
 * so enqueue is a single upsert.
 *
 * <p>{@code claimed_at_ms} is stamped on every claim. With a positive lease, claimed jobs are
 * invisible to other claims until the lease runs out; with lease 0 the column is only used to
 * notice a refresh that raced with processing, in which case {@link #markProcessed} keeps the
 * job pending.
 */
public final class SqliteJobQueue implements JobQueue {
    private final Database database;
    private final Clock clock;
    private final long claimLeaseMs;

    public SqliteJobQueue(Database database, Clock clock, long claimLeaseMs) {
        this.database = database;
        this.clock = clock;
        this.claimLeaseMs = Math.max(0L, claimLeaseMs);
    }

    @Override
    public void enqueue(String serverId) {
        String sql = """
                INSERT INTO heartbeat_jobs(job_id, server_id, enqueued_at_ms, attempts)
                VALUES(?,?,?,0)
                ON CONFLICT(server_id) WHERE processed_at_ms IS NULL
                DO UPDATE SET enqueued_at_ms=excluded.enqueued_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, "job_" + UUID.randomUUID());
            ps.setString(2, serverId);
            ps.setLong(3, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enqueue heartbeat job for server " + serverId, e);
        }
    }

    @Override
    public List<Job> claim(int batchSize) {
        long nowMs = clock.millis();
        String select = """
                SELECT job_id, server_id, enqueued_at_ms, processed_at_ms, attempts, last_error
                FROM heartbeat_jobs
                WHERE processed_at_ms IS NULL
                  AND (? = 0 OR claimed_at_ms IS NULL OR claimed_at_ms <= ?)
                ORDER BY enqueued_at_ms ASC, job_id ASC
                LIMIT ?
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(select);
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE heartbeat_jobs SET attempts=attempts+1, claimed_at_ms=? WHERE job_id=?")) {
                sel.setLong(1, claimLeaseMs);
                sel.setLong(2, nowMs - claimLeaseMs);
                sel.setInt(3, Math.max(1, batchSize));
                List<Job> claimed = new ArrayList<>();
                try (ResultSet rs = sel.executeQuery()) {
                    while (rs.next()) {
                        claimed.add(new Job(
                                rs.getString("job_id"),
                                rs.getString("server_id"),
                                Instant.ofEpochMilli(rs.getLong("enqueued_at_ms")),
                                null,
                                rs.getInt("attempts") + 1,
                                rs.getString("last_error")
                        ));
                    }
                }
                for (Job job : claimed) {
                    upd.setLong(1, nowMs);
                    upd.setString(2, job.jobId());
                    upd.addBatch();
                }
                if (!claimed.isEmpty()) {
                    upd.executeBatch();
                }
                c.commit();
                return claimed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim heartbeat jobs", e);
        }
    }

    @Override
    public void markProcessed(String jobId, Instant at) {
        String sql = """
                UPDATE heartbeat_jobs
                SET processed_at_ms = CASE
                        WHEN claimed_at_ms IS NOT NULL AND enqueued_at_ms > claimed_at_ms THEN NULL
                        ELSE ?
                    END,
                    claimed_at_ms = NULL
                WHERE job_id=? AND processed_at_ms IS NULL
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, at.toEpochMilli());
            ps.setString(2, jobId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark heartbeat job processed: " + jobId, e);
        }
    }

    @Override
    public void markFailed(String jobId, String error, int attempts) {
        String sql = "UPDATE heartbeat_jobs SET last_error=?, attempts=?, claimed_at_ms=NULL WHERE job_id=? AND processed_at_ms IS NULL";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, error);
            ps.setInt(2, attempts);
            ps.setString(3, jobId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark heartbeat job failed: " + jobId, e);
        }
    }

    @Override
    public int pendingCount() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM heartbeat_jobs WHERE processed_at_ms IS NULL");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count pending heartbeat jobs", e);
        }
    }

    public List<Job> list(int limit) {
        String sql = """
                SELECT job_id, server_id, enqueued_at_ms, processed_at_ms, attempts, last_error
                FROM heartbeat_jobs
                ORDER BY enqueued_at_ms DESC, job_id DESC
                LIMIT ?
                """;
        List<Job> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Job(
                            rs.getString("job_id"),
                            rs.getString("server_id"),
                            Instant.ofEpochMilli(rs.getLong("enqueued_at_ms")),
                            SqlValues.nullableInstant(rs, "processed_at_ms"),
                            rs.getInt("attempts"),
                            rs.getString("last_error")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list heartbeat jobs", e);
        }
    }
}
