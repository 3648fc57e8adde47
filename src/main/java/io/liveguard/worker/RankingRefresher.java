package io.liveguard.worker;

import io.liveguard.engine.RankingEngine;
import io.liveguard.model.ServerSnapshot;
import io.liveguard.storage.DerivedStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes {@code ranking_score} for every derived row. Reads snapshots only.
 */
public final class RankingRefresher {
    private static final Logger log = LoggerFactory.getLogger(RankingRefresher.class);

    private final DerivedStateStore derived;

    public RankingRefresher(DerivedStateStore derived) {
        this.derived = derived;
    }

    public RankingOutcome refreshAll() {
        int updated = 0;
        int failed = 0;
        for (ServerSnapshot snapshot : derived.snapshots()) {
            try {
                derived.writeRankingScore(snapshot.serverId(), RankingEngine.compute(snapshot));
                updated++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Ranking update failed for server {}", snapshot.serverId(), e);
            }
        }
        log.debug("Ranking pass updated {} servers, {} failed", updated, failed);
        return new RankingOutcome(updated, failed);
    }

    public record RankingOutcome(int updated, int failed) {
    }
}
