package io.liveguard.model;

import java.time.Instant;

/**
 * Non-authoritative fields the ingest path may write right after accepting a heartbeat.
 * Deliberately has no slot for status, confidence, uptime, quality or anomaly.
 */
public record FastPathUpdate(
        Instant lastSeenAt,
        Integer playersCurrent,
        Integer playersCapacity
) {
}
