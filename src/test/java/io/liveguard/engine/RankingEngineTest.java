package io.liveguard.engine;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RankingEngineTest {
    @Test
    void combinesQualityUptimeAndActivity() {
        double score = RankingEngine.compute(80.0, 90.0, 25, 50, false);
        Assertions.assertEquals(0.5 * 80.0 + 0.3 * 90.0 + 0.2 * 50.0, score, 1e-9);
    }

    @Test
    void anomalyCostsExactlyTheFixedPenalty() {
        double clean = RankingEngine.compute(80.0, 90.0, 25, 50, false);
        double flagged = RankingEngine.compute(80.0, 90.0, 25, 50, true);
        Assertions.assertEquals(RankingEngine.ANOMALY_PENALTY, clean - flagged, 1e-9);
    }

    @Test
    void neverNegative() {
        Assertions.assertEquals(0.0, RankingEngine.compute(10.0, 5.0, 0, 10, true), 1e-9);
        Assertions.assertEquals(0.0, RankingEngine.compute(null, null, null, null, false), 1e-9);
    }

    @Test
    void uptimeAboveNinetyFiveHasDiminishingReturns() {
        Assertions.assertEquals(95.0, RankingEngine.effectiveUptime(95.0), 1e-9);
        Assertions.assertEquals(90.0, RankingEngine.effectiveUptime(90.0), 1e-9);
        Assertions.assertEquals(100.0, RankingEngine.effectiveUptime(100.0), 1e-9);
        double gainLow = RankingEngine.effectiveUptime(96.0) - RankingEngine.effectiveUptime(95.0);
        double gainHigh = RankingEngine.effectiveUptime(100.0) - RankingEngine.effectiveUptime(99.0);
        Assertions.assertTrue(gainLow > gainHigh);
    }

    @Test
    void headcountIsCapped() {
        double fifty = RankingEngine.compute(null, null, 50, 200, false);
        double thousand = RankingEngine.compute(null, null, 1000, 200, false);
        Assertions.assertEquals(fifty, thousand, 1e-9);
        Assertions.assertEquals(0.2 * 100.0 * 50 / 70.0, RankingEngine.compute(null, null, 60, null, false), 1e-9);
    }
}
