package io.liveguard.model;

import java.time.Instant;

/**
 * Durable unit of worker input, keyed by server. Pending while {@code processedAt} is null.
 */
public record Job(
        String jobId,
        String serverId,
        Instant enqueuedAt,
        Instant processedAt,
        int attempts,
        String lastError
) {
    public boolean pending() {
        return processedAt == null;
    }
}
