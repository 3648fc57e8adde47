package io.liveguard.model;

/**
 * Status an agent claims for its server in a heartbeat.
 */
public enum AgentStatus {
    ONLINE("online"),
    OFFLINE("offline");

    private final String wire;

    AgentStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    /**
     * Strict wire lookup; returns {@code null} for anything that is not an exact lower-case value.
     */
    public static AgentStatus fromWire(String raw) {
        if (raw == null) {
            return null;
        }
        for (AgentStatus value : values()) {
            if (value.wire.equals(raw)) {
                return value;
            }
        }
        return null;
    }
}
