package io.liveguard.engine;

import io.liveguard.model.Confidence;

public final class QualityEngine {
    static final double UPTIME_WEIGHT = 0.6;
    static final double FILL_WEIGHT = 0.3;
    static final double CONFIDENCE_WEIGHT = 0.1;
    static final int DEFAULT_CAPACITY = 70;

    private QualityEngine() {
    }

    /**
     * {@code 0.6 * uptime + 0.3 * fill% + 0.1 * confidence%}, clamped to {@code [0, 100]}.
     * Null when uptime is unknown.
     */
    public static Double compute(Double uptimePercent, Integer playersCurrent, Integer playersCapacity, Confidence confidence) {
        if (uptimePercent == null) {
            return null;
        }
        double uptime = HeartbeatHistory.clamp(uptimePercent, 0.0, 100.0);
        double multiplier = confidence == null ? Confidence.RED.multiplier() : confidence.multiplier();
        double score = UPTIME_WEIGHT * uptime
                + FILL_WEIGHT * 100.0 * fillRatio(playersCurrent, playersCapacity)
                + CONFIDENCE_WEIGHT * 100.0 * multiplier;
        return HeartbeatHistory.clamp(score, 0.0, 100.0);
    }

    static double fillRatio(Integer playersCurrent, Integer playersCapacity) {
        int players = playersCurrent == null ? 0 : Math.max(0, playersCurrent);
        if (playersCapacity != null && playersCapacity > 0) {
            return Math.min(1.0, (double) players / playersCapacity);
        }
        if (players > 0) {
            return Math.min(1.0, (double) players / DEFAULT_CAPACITY);
        }
        return 0.0;
    }
}
