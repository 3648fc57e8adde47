package io.liveguard.model;

import java.time.Instant;

/**
 * One accepted heartbeat as stored. {@code receivedAt} is assigned by the server and is
 * the only clock the engines trust; {@code agentTimestamp} is kept for audit.
 */
public record Heartbeat(
        String serverId,
        String heartbeatId,
        int keyVersion,
        Instant agentTimestamp,
        AgentStatus status,
        String mapName,
        Integer playersCurrent,
        Integer playersCapacity,
        String agentVersion,
        String signature,
        String debugPayload,
        Instant receivedAt
) {
}
