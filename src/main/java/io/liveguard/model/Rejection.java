package io.liveguard.model;

import java.time.Instant;
import java.util.Map;

/**
 * One refused heartbeat. Carries ids and a reason only; never the signature, key or payload.
 */
public record Rejection(
        String serverId,
        RejectionReason reason,
        String agentVersion,
        Map<String, Object> metadata,
        Instant occurredAt
) {
    public static final String EVENT_TYPE = "server.heartbeat.v1";

    public Rejection {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
