package io.liveguard.model;

import java.time.Instant;

/**
 * Read view of a server's derived row. Fields the worker has not written yet are null.
 */
public record ServerSnapshot(
        String serverId,
        ServerStatus effectiveStatus,
        Confidence confidence,
        Double uptimePercent,
        Double qualityScore,
        boolean anomalyPlayersSpike,
        Instant anomalyLastDetectedAt,
        Integer playersCurrent,
        Integer playersCapacity,
        Instant lastHeartbeatAt,
        Instant lastSeenAt,
        Double rankingScore
) {
}
