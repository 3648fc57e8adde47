package io.liveguard.engine;

import io.liveguard.model.ServerSnapshot;

/**
 * Directory ordering score, computed from a derived snapshot only.
 */
public final class RankingEngine {
    static final double QUALITY_WEIGHT = 0.5;
    static final double UPTIME_WEIGHT = 0.3;
    static final double ACTIVITY_WEIGHT = 0.2;
    static final int PLAYERS_CAP = 50;
    static final int DEFAULT_CAPACITY = 70;
    static final double UPTIME_DIMINISHING_THRESHOLD = 95.0;
    public static final double ANOMALY_PENALTY = 20.0;

    private RankingEngine() {
    }

    public static double compute(ServerSnapshot snapshot) {
        return compute(
                snapshot.qualityScore(),
                snapshot.uptimePercent(),
                snapshot.playersCurrent(),
                snapshot.playersCapacity(),
                snapshot.anomalyPlayersSpike()
        );
    }

    public static double compute(Double qualityScore, Double uptimePercent, Integer playersCurrent,
                                 Integer playersCapacity, boolean anomaly) {
        double score = 0.0;
        if (qualityScore != null) {
            score += QUALITY_WEIGHT * HeartbeatHistory.clamp(qualityScore, 0.0, 100.0);
        }
        if (uptimePercent != null) {
            score += UPTIME_WEIGHT * effectiveUptime(HeartbeatHistory.clamp(uptimePercent, 0.0, 100.0));
        }
        if (playersCurrent != null && playersCurrent > 0) {
            int capped = Math.min(playersCurrent, PLAYERS_CAP);
            int capacity = playersCapacity != null && playersCapacity > 0 ? playersCapacity : DEFAULT_CAPACITY;
            score += ACTIVITY_WEIGHT * 100.0 * Math.min(1.0, (double) capped / capacity);
        }
        if (anomaly) {
            score -= ANOMALY_PENALTY;
        }
        return Math.max(0.0, score);
    }

    // above the threshold the remaining 5 points are earned logarithmically
    static double effectiveUptime(double uptime) {
        if (uptime <= UPTIME_DIMINISHING_THRESHOLD) {
            return uptime;
        }
        double excess = uptime - UPTIME_DIMINISHING_THRESHOLD;
        return UPTIME_DIMINISHING_THRESHOLD + Math.log1p(excess) / Math.log(6.0) * 5.0;
    }
}
