package io.liveguard.worker;

import io.liveguard.engine.RankingEngine;
import io.liveguard.model.Confidence;
import io.liveguard.model.DerivedState;
import io.liveguard.model.FastPathUpdate;
import io.liveguard.model.ServerStatus;
import io.liveguard.testing.InMemoryDerivedStateStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static io.liveguard.testing.TestHeartbeats.NOW;

final class RankingRefresherTest {
    @Test
    void scoresEverySnapshotAndPenalizesAnomalies() {
        InMemoryDerivedStateStore derived = new InMemoryDerivedStateStore();
        derived.writeDerived("srv-clean", new DerivedState(ServerStatus.ONLINE, Confidence.GREEN, 90.0, 80.0,
                false, null, 25, 50, NOW));
        derived.writeDerived("srv-spiky", new DerivedState(ServerStatus.ONLINE, Confidence.GREEN, 90.0, 80.0,
                true, NOW, 25, 50, NOW));
        derived.writeFastPath("srv-new", new FastPathUpdate(NOW, 4, 16));

        RankingRefresher.RankingOutcome outcome = new RankingRefresher(derived).refreshAll();

        Assertions.assertEquals(3, outcome.updated());
        Assertions.assertEquals(0, outcome.failed());
        double clean = derived.snapshot("srv-clean").orElseThrow().rankingScore();
        double spiky = derived.snapshot("srv-spiky").orElseThrow().rankingScore();
        Assertions.assertEquals(RankingEngine.ANOMALY_PENALTY, clean - spiky, 1e-9);
        Assertions.assertNotNull(derived.snapshot("srv-new").orElseThrow().rankingScore());
    }
}
