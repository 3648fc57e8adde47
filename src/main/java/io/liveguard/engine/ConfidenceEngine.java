package io.liveguard.engine;

import io.liveguard.model.Confidence;
import io.liveguard.model.Heartbeat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Red/yellow/green trust tier. Green needs freshness and at least
 * {@value #MIN_SAMPLES_FOR_GREEN} samples at the same time, so a single heartbeat after an
 * outage can only reach yellow.
 */
public final class ConfidenceEngine {
    public static final int MIN_SAMPLES_FOR_GREEN = 3;

    private ConfidenceEngine() {
    }

    public static Confidence compute(List<Heartbeat> heartbeats, int graceSeconds, Instant now) {
        if (heartbeats == null || heartbeats.isEmpty()) {
            return Confidence.RED;
        }
        Duration age = Duration.between(HeartbeatHistory.latestReceivedAt(heartbeats), now);
        Duration grace = Duration.ofSeconds(graceSeconds);
        if (age.compareTo(grace.multipliedBy(2)) > 0) {
            return Confidence.RED;
        }
        if (heartbeats.size() < MIN_SAMPLES_FOR_GREEN) {
            return Confidence.YELLOW;
        }
        if (age.compareTo(grace) <= 0) {
            return Confidence.GREEN;
        }
        return Confidence.YELLOW;
    }
}
