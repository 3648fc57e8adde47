package io.liveguard.storage;

import io.liveguard.model.AnomalyState;
import io.liveguard.model.DerivedState;
import io.liveguard.model.ServerSnapshot;

import java.util.List;
import java.util.Optional;

public interface DerivedStateStore {
    AnomalyState currentAnomalyState(String serverId);

    /** Replaces every worker-owned field of the server in one write. */
    void writeDerived(String serverId, DerivedState state);

    Optional<ServerSnapshot> snapshot(String serverId);

    List<ServerSnapshot> snapshots();

    void writeRankingScore(String serverId, double score);
}
