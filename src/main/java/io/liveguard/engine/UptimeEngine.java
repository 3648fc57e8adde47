package io.liveguard.engine;

import io.liveguard.model.Heartbeat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rolling-window uptime. Each heartbeat covers {@code [receivedAt, receivedAt + grace]};
 * covered time is the union of those intervals clipped to the window.
 */
public final class UptimeEngine {
    private UptimeEngine() {
    }

    /**
     * @return percentage in {@code [0, 100]}, or null when no heartbeat was received inside
     * {@code [now - windowHours, now]}
     */
    public static Double compute(List<Heartbeat> heartbeats, int graceSeconds, int windowHours, Instant now) {
        if (heartbeats == null || heartbeats.isEmpty()) {
            return null;
        }
        Instant windowStart = now.minus(Duration.ofHours(windowHours));
        long windowMs = Duration.between(windowStart, now).toMillis();
        if (windowMs <= 0) {
            return null;
        }
        List<long[]> intervals = new ArrayList<>();
        boolean anyInWindow = false;
        for (Heartbeat hb : heartbeats) {
            Instant received = hb.receivedAt();
            if (received.isBefore(windowStart) || received.isAfter(now)) {
                continue;
            }
            anyInWindow = true;
            long start = received.toEpochMilli();
            long end = Math.min(received.plusSeconds(graceSeconds).toEpochMilli(), now.toEpochMilli());
            if (start < end) {
                intervals.add(new long[]{start, end});
            }
        }
        if (!anyInWindow) {
            return null;
        }
        intervals.sort(Comparator.<long[]>comparingLong(i -> i[0]).thenComparingLong(i -> i[1]));
        long covered = 0L;
        long[] current = null;
        for (long[] interval : intervals) {
            if (current == null) {
                current = interval.clone();
            } else if (interval[0] <= current[1]) {
                current[1] = Math.max(current[1], interval[1]);
            } else {
                covered += current[1] - current[0];
                current = interval.clone();
            }
        }
        if (current != null) {
            covered += current[1] - current[0];
        }
        return HeartbeatHistory.clamp(100.0 * covered / windowMs, 0.0, 100.0);
    }
}
