package io.liveguard.engine;

import io.liveguard.model.AnomalyState;
import io.liveguard.model.Heartbeat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Player-count spike detector with hysteresis.
 *
 * <p>Consecutive triples (newest, middle, oldest by receive time) are checked for:
 * <ul>
 *     <li>a round trip 0, &ge;50, 0 inside 60 seconds;</li>
 *     <li>a jump from a non-empty server of more than half the capacity inside 60 seconds;</li>
 *     <li>a drop from &ge;30 to 0 inside 10 seconds.</li>
 * </ul>
 * A match only counts while it is younger than the decay period; once every match in the
 * history has aged out, a previously raised flag clears.
 */
public final class AnomalyEngine {
    static final int ROUND_TRIP_MIN_PLAYERS = 50;
    static final Duration ROUND_TRIP_WINDOW = Duration.ofSeconds(60);
    static final double JUMP_CAPACITY_PERCENT = 50.0;
    static final Duration JUMP_WINDOW = Duration.ofSeconds(60);
    static final int DROP_MIN_PLAYERS = 30;
    static final Duration DROP_WINDOW = Duration.ofSeconds(10);
    static final int DEFAULT_CAPACITY = 70;

    private AnomalyEngine() {
    }

    public static AnomalyState evaluate(List<Heartbeat> heartbeats, AnomalyState previous, int decayMinutes, Instant now) {
        AnomalyState prior = previous == null ? AnomalyState.none() : previous;
        Duration decay = Duration.ofMinutes(decayMinutes);

        Instant detectedAt = heartbeats == null ? null : latestSpike(HeartbeatHistory.newestFirst(heartbeats));
        if (detectedAt != null && now.isBefore(detectedAt.plus(decay))) {
            return new AnomalyState(true, detectedAt);
        }
        if (prior.flagged() && prior.lastDetectedAt() != null && !now.isBefore(prior.lastDetectedAt().plus(decay))) {
            return AnomalyState.none();
        }
        if (prior.flagged()) {
            return new AnomalyState(true, prior.lastDetectedAt());
        }
        return AnomalyState.none();
    }

    private static Instant latestSpike(List<Heartbeat> newestFirst) {
        for (int i = 0; i + 2 < newestFirst.size(); i++) {
            Heartbeat newest = newestFirst.get(i);
            Heartbeat middle = newestFirst.get(i + 1);
            Heartbeat oldest = newestFirst.get(i + 2);
            if (newest.playersCurrent() == null || middle.playersCurrent() == null || oldest.playersCurrent() == null) {
                continue;
            }
            if (isSpike(newest, middle, oldest)) {
                return newest.receivedAt();
            }
        }
        return null;
    }

    static boolean isSpike(Heartbeat newest, Heartbeat middle, Heartbeat oldest) {
        int pNewest = newest.playersCurrent();
        int pMiddle = middle.playersCurrent();
        int pOldest = oldest.playersCurrent();
        Duration total = Duration.between(oldest.receivedAt(), newest.receivedAt());
        Duration lastStep = Duration.between(middle.receivedAt(), newest.receivedAt());

        if (pOldest == 0 && pMiddle >= ROUND_TRIP_MIN_PLAYERS && pNewest == 0
                && total.compareTo(ROUND_TRIP_WINDOW) < 0) {
            return true;
        }
        if (pMiddle > 0 && pNewest > pMiddle && lastStep.compareTo(JUMP_WINDOW) < 0) {
            Integer cap = newest.playersCapacity();
            int capacity = cap == null || cap <= 0 ? DEFAULT_CAPACITY : cap;
            double percent = (pNewest - pMiddle) * 100.0 / capacity;
            if (percent > JUMP_CAPACITY_PERCENT) {
                return true;
            }
        }
        return pMiddle >= DROP_MIN_PLAYERS && pNewest == 0 && lastStep.compareTo(DROP_WINDOW) < 0;
    }
}
