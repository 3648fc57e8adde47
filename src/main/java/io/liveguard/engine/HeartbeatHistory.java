package io.liveguard.engine;

import io.liveguard.model.Heartbeat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Helpers shared by the engines. Engines never assume the caller sorted its input.
 */
final class HeartbeatHistory {
    static final Comparator<Heartbeat> NEWEST_FIRST = Comparator
            .comparing(Heartbeat::receivedAt)
            .thenComparing(Heartbeat::heartbeatId)
            .reversed();

    private HeartbeatHistory() {
    }

    static Instant latestReceivedAt(List<Heartbeat> heartbeats) {
        Instant latest = null;
        for (Heartbeat hb : heartbeats) {
            if (latest == null || hb.receivedAt().isAfter(latest)) {
                latest = hb.receivedAt();
            }
        }
        return latest;
    }

    static List<Heartbeat> newestFirst(List<Heartbeat> heartbeats) {
        List<Heartbeat> sorted = new ArrayList<>(heartbeats);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
