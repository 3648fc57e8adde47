package io.liveguard.model;

import java.time.Instant;

/**
 * Worker-owned derived fields for one server, written as a single record per job.
 */
public record DerivedState(
        ServerStatus effectiveStatus,
        Confidence confidence,
        Double uptimePercent,
        Double qualityScore,
        boolean anomalyPlayersSpike,
        Instant anomalyLastDetectedAt,
        Integer playersCurrent,
        Integer playersCapacity,
        Instant lastHeartbeatAt
) {
}
