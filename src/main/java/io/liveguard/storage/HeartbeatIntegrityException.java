package io.liveguard.storage;

/**
 * A heartbeat id arrived under a server other than the one that first used it. This is
 * protocol misuse and is never folded into ordinary replay handling.
 */
public final class HeartbeatIntegrityException extends RuntimeException {
    private final String heartbeatId;
    private final String serverId;
    private final String existingServerId;

    public HeartbeatIntegrityException(String heartbeatId, String serverId, String existingServerId) {
        super("heartbeat_id " + heartbeatId + " submitted by server " + serverId
                + " is already recorded for server " + existingServerId);
        this.heartbeatId = heartbeatId;
        this.serverId = serverId;
        this.existingServerId = existingServerId;
    }

    public String heartbeatId() {
        return heartbeatId;
    }

    public String serverId() {
        return serverId;
    }

    public String existingServerId() {
        return existingServerId;
    }
}
