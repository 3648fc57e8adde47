package io.liveguard.engine;

import io.liveguard.model.Heartbeat;
import io.liveguard.model.ServerStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Online/offline from the age of the newest server-received heartbeat. Agent timestamps are
 * never consulted.
 */
public final class StatusEngine {
    private StatusEngine() {
    }

    public static Result compute(List<Heartbeat> heartbeats, int graceSeconds, Instant now) {
        if (heartbeats == null || heartbeats.isEmpty()) {
            return new Result(ServerStatus.UNKNOWN, null);
        }
        Instant lastSeen = HeartbeatHistory.latestReceivedAt(heartbeats);
        Duration age = Duration.between(lastSeen, now);
        ServerStatus status = age.compareTo(Duration.ofSeconds(graceSeconds)) <= 0
                ? ServerStatus.ONLINE
                : ServerStatus.OFFLINE;
        return new Result(status, lastSeen);
    }

    public record Result(ServerStatus status, Instant lastSeenAt) {
    }
}
