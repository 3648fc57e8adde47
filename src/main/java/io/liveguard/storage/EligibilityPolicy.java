package io.liveguard.storage;

import java.util.Map;

@FunctionalInterface
public interface EligibilityPolicy {
    String HEARTBEAT = "heartbeat";

    /** Whether data of {@code dataType} may be stored for the server right now. */
    boolean allowed(String serverId, String dataType, Map<String, Object> context);

    static EligibilityPolicy allowAll() {
        return (serverId, dataType, context) -> true;
    }
}
