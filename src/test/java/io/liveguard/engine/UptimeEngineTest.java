package io.liveguard.engine;

import io.liveguard.model.Heartbeat;
import io.liveguard.testing.TestHeartbeats;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static io.liveguard.testing.TestHeartbeats.NOW;

final class UptimeEngineTest {
    @Test
    void nullWhenNoHeartbeatInWindow() {
        Assertions.assertNull(UptimeEngine.compute(List.of(), 600, 24, NOW));
        List<Heartbeat> old = List.of(TestHeartbeats.stored("hb-1", NOW.minus(Duration.ofHours(25))));
        Assertions.assertNull(UptimeEngine.compute(old, 600, 24, NOW));
    }

    @Test
    void singleHeartbeatCoversGraceWindow() {
        List<Heartbeat> one = List.of(TestHeartbeats.stored("hb-1", NOW.minus(Duration.ofHours(2))));

        Double uptime = UptimeEngine.compute(one, 600, 24, NOW);

        Assertions.assertEquals(100.0 * 600 / (24 * 3600), uptime, 1e-9);
    }

    @Test
    void overlappingIntervalsAreMergedNotDoubleCounted() {
        List<Heartbeat> overlapping = List.of(
                TestHeartbeats.stored("hb-1", NOW.minus(Duration.ofHours(2))),
                TestHeartbeats.stored("hb-2", NOW.minus(Duration.ofHours(2)).plusSeconds(300))
        );

        Double uptime = UptimeEngine.compute(overlapping, 600, 24, NOW);

        Assertions.assertEquals(100.0 * 900 / (24 * 3600), uptime, 1e-9);
    }

    @Test
    void coverageIsClippedAtNow() {
        List<Heartbeat> recent = List.of(TestHeartbeats.stored("hb-1", NOW.minusSeconds(100)));

        Assertions.assertEquals(100.0 * 100 / (24 * 3600), UptimeEngine.compute(recent, 600, 24, NOW), 1e-9);
    }

    @Test
    void heartbeatsReceivedAfterNowAreIgnored() {
        List<Heartbeat> future = List.of(TestHeartbeats.stored("hb-1", NOW.plusSeconds(30)));
        Assertions.assertNull(UptimeEngine.compute(future, 600, 24, NOW));
    }

    @Test
    void continuousReportingReachesFullUptimeAndNeverExceedsIt() {
        List<Heartbeat> dense = new ArrayList<>();
        for (int i = 0; i <= 24 * 12 + 2; i++) {
            dense.add(TestHeartbeats.stored(String.format("hb-%04d", i), NOW.minusSeconds(300L * i)));
        }

        Double uptime = UptimeEngine.compute(dense, 600, 24, NOW);

        Assertions.assertEquals(100.0, uptime, 1e-9);
    }

    @Test
    void resultStaysInBoundsAndIgnoresRetrievalOrder() {
        Random random = new Random(42L);
        for (int round = 0; round < 50; round++) {
            List<Heartbeat> history = new ArrayList<>();
            int count = 1 + random.nextInt(40);
            for (int i = 0; i < count; i++) {
                long offset = random.nextInt(30 * 3600);
                history.add(TestHeartbeats.stored("hb-" + round + "-" + i, NOW.minusSeconds(offset)));
            }
            Double forward = UptimeEngine.compute(history, 600, 24, NOW);
            List<Heartbeat> shuffled = new ArrayList<>(history);
            Collections.shuffle(shuffled, random);
            Double reshuffled = UptimeEngine.compute(shuffled, 600, 24, NOW);

            if (forward == null) {
                Assertions.assertNull(reshuffled);
            } else {
                Assertions.assertEquals(forward.doubleValue(), reshuffled.doubleValue());
                Assertions.assertTrue(forward >= 0.0 && forward <= 100.0, "uptime out of bounds: " + forward);
            }
        }
    }
}
