package io.liveguard.engine;

import io.liveguard.model.AnomalyState;
import io.liveguard.model.Heartbeat;
import io.liveguard.testing.TestHeartbeats;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.liveguard.testing.TestHeartbeats.NOW;

final class AnomalyEngineTest {
    @Test
    void roundTripWithinAMinuteIsFlagged() {
        List<Heartbeat> history = triple(0, 70, 0, 20, 20, 70);

        AnomalyState state = AnomalyEngine.evaluate(history, AnomalyState.none(), 30, NOW);

        Assertions.assertTrue(state.flagged());
        Assertions.assertEquals(NOW, state.lastDetectedAt());
    }

    @Test
    void slowRoundTripIsNotFlagged() {
        List<Heartbeat> history = triple(0, 70, 0, 40, 40, 70);

        Assertions.assertFalse(AnomalyEngine.evaluate(history, AnomalyState.none(), 30, NOW).flagged());
    }

    @Test
    void jumpOfMoreThanHalfCapacityIsFlagged() {
        Assertions.assertTrue(AnomalyEngine.evaluate(triple(5, 5, 40, 30, 30, 64), AnomalyState.none(), 30, NOW).flagged());
        Assertions.assertFalse(AnomalyEngine.evaluate(triple(5, 5, 30, 30, 30, 64), AnomalyState.none(), 30, NOW).flagged());
    }

    @Test
    void jumpFromEmptyServerIsNotFlagged() {
        Assertions.assertFalse(AnomalyEngine.evaluate(triple(0, 0, 60, 30, 30, 64), AnomalyState.none(), 30, NOW).flagged());
    }

    @Test
    void jumpUsesDefaultCapacityWhenUnknown() {
        Assertions.assertTrue(AnomalyEngine.evaluate(triple(1, 1, 40, 30, 30, null), AnomalyState.none(), 30, NOW).flagged());
        Assertions.assertFalse(AnomalyEngine.evaluate(triple(1, 1, 30, 30, 30, null), AnomalyState.none(), 30, NOW).flagged());
    }

    @Test
    void suddenDropIsFlaggedOnlyWhenFast() {
        Assertions.assertTrue(AnomalyEngine.evaluate(triple(30, 30, 0, 60, 5, 64), AnomalyState.none(), 30, NOW).flagged());
        Assertions.assertFalse(AnomalyEngine.evaluate(triple(30, 30, 0, 60, 15, 64), AnomalyState.none(), 30, NOW).flagged());
    }

    @Test
    void fewerThanThreeHeartbeatsNeverTrigger() {
        List<Heartbeat> two = List.of(
                TestHeartbeats.stored("srv-1", "hb-1", NOW.minusSeconds(5), 40, 40),
                TestHeartbeats.stored("srv-1", "hb-2", NOW, 0, 40)
        );
        Assertions.assertFalse(AnomalyEngine.evaluate(two, AnomalyState.none(), 30, NOW).flagged());
    }

    @Test
    void flagHoldsUntilDecayElapsesThenClears() {
        Instant detectedAt = NOW;
        List<Heartbeat> history = triple(0, 70, 0, 20, 20, 70);
        AnomalyState flagged = AnomalyEngine.evaluate(history, AnomalyState.none(), 30, detectedAt);
        Assertions.assertTrue(flagged.flagged());

        Instant justBefore = detectedAt.plus(Duration.ofMinutes(30)).minusMillis(1);
        Instant justAfter = detectedAt.plus(Duration.ofMinutes(30)).plusMillis(1);

        Assertions.assertTrue(AnomalyEngine.evaluate(history, flagged, 30, justBefore).flagged());
        Assertions.assertFalse(AnomalyEngine.evaluate(history, flagged, 30, justAfter).flagged());
        Assertions.assertTrue(AnomalyEngine.evaluate(List.of(), flagged, 30, justBefore).flagged());
        Assertions.assertFalse(AnomalyEngine.evaluate(List.of(), flagged, 30, justAfter).flagged());
    }

    @Test
    void newTriggerResetsDetectionTime() {
        AnomalyState previous = new AnomalyState(true, NOW.minus(Duration.ofMinutes(29)));
        List<Heartbeat> fresh = triple(0, 60, 0, 20, 20, 70);

        AnomalyState state = AnomalyEngine.evaluate(fresh, previous, 30, NOW);

        Assertions.assertTrue(state.flagged());
        Assertions.assertEquals(NOW, state.lastDetectedAt());
    }

    /**
     * Oldest, middle, newest player counts; gaps in seconds between oldest and middle and
     * between middle and newest, newest received at {@link TestHeartbeats#NOW}.
     */
    private static List<Heartbeat> triple(int oldest, int middle, int newest, long firstGap, long secondGap, Integer capacity) {
        Instant newestAt = NOW;
        Instant middleAt = newestAt.minusSeconds(secondGap);
        Instant oldestAt = middleAt.minusSeconds(firstGap);
        return List.of(
                TestHeartbeats.stored("srv-1", "hb-a", oldestAt, oldest, capacity),
                TestHeartbeats.stored("srv-1", "hb-c", newestAt, newest, capacity),
                TestHeartbeats.stored("srv-1", "hb-b", middleAt, middle, capacity)
        );
    }
}
