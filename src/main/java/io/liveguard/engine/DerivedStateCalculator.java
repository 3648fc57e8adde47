package io.liveguard.engine;

import io.liveguard.model.AnomalyState;
import io.liveguard.model.Confidence;
import io.liveguard.model.DerivedState;
import io.liveguard.model.Heartbeat;

import java.time.Instant;
import java.util.List;

/**
 * Runs status, confidence, uptime, anomaly and quality over one server's history and
 * assembles the single derived record the worker writes.
 */
public final class DerivedStateCalculator {
    private DerivedStateCalculator() {
    }

    public static DerivedState compute(
            List<Heartbeat> history,
            int graceSeconds,
            int uptimeWindowHours,
            int anomalyDecayMinutes,
            AnomalyState previousAnomaly,
            Instant now
    ) {
        List<Heartbeat> newestFirst = HeartbeatHistory.newestFirst(history == null ? List.of() : history);
        StatusEngine.Result status = StatusEngine.compute(newestFirst, graceSeconds, now);
        Confidence confidence = ConfidenceEngine.compute(newestFirst, graceSeconds, now);
        Double uptime = UptimeEngine.compute(newestFirst, graceSeconds, uptimeWindowHours, now);
        AnomalyState anomaly = AnomalyEngine.evaluate(newestFirst, previousAnomaly, anomalyDecayMinutes, now);

        Heartbeat latest = newestFirst.isEmpty() ? null : newestFirst.get(0);
        Integer playersCurrent = latest == null ? null : latest.playersCurrent();
        Integer playersCapacity = latest == null ? null : latest.playersCapacity();
        Double quality = QualityEngine.compute(uptime, playersCurrent, playersCapacity, confidence);

        return new DerivedState(
                status.status(),
                confidence,
                uptime,
                quality,
                anomaly.flagged(),
                anomaly.lastDetectedAt(),
                playersCurrent,
                playersCapacity,
                status.lastSeenAt()
        );
    }
}
