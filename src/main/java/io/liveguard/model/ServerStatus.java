package io.liveguard.model;

public enum ServerStatus {
    ONLINE("online"),
    OFFLINE("offline"),
    UNKNOWN("unknown");

    private final String wire;

    ServerStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static ServerStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (ServerStatus value : values()) {
            if (value.wire.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown server status: " + raw);
    }
}
