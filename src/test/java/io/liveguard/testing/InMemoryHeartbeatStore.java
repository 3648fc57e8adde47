package io.liveguard.testing;

import io.liveguard.model.Heartbeat;
import io.liveguard.storage.HeartbeatIntegrityException;
import io.liveguard.storage.HeartbeatStore;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyed by heartbeat id so that {@code putIfAbsent} gives the same single-step
 * insert-or-conflict the SQLite unique index does.
 */
public final class InMemoryHeartbeatStore implements HeartbeatStore {
    private final Map<String, Heartbeat> byHeartbeatId = new ConcurrentHashMap<>();
    private final Set<String> failingServers = ConcurrentHashMap.newKeySet();

    @Override
    public InsertOutcome insert(Heartbeat heartbeat) {
        Heartbeat existing = byHeartbeatId.putIfAbsent(heartbeat.heartbeatId(), heartbeat);
        if (existing == null) {
            return InsertOutcome.INSERTED;
        }
        if (existing.serverId().equals(heartbeat.serverId())) {
            return InsertOutcome.REPLAY;
        }
        throw new HeartbeatIntegrityException(heartbeat.heartbeatId(), heartbeat.serverId(), existing.serverId());
    }

    @Override
    public List<Heartbeat> recent(String serverId, int limit) {
        if (failingServers.contains(serverId)) {
            throw new IllegalStateException("history unavailable for " + serverId);
        }
        return byHeartbeatId.values().stream()
                .filter(hb -> hb.serverId().equals(serverId))
                .sorted((a, b) -> {
                    int cmp = b.receivedAt().compareTo(a.receivedAt());
                    return cmp != 0 ? cmp : b.heartbeatId().compareTo(a.heartbeatId());
                })
                .limit(limit)
                .toList();
    }

    @Override
    public long count() {
        return byHeartbeatId.size();
    }

    public void add(Heartbeat... heartbeats) {
        for (Heartbeat hb : heartbeats) {
            insert(hb);
        }
    }

    public void failHistoryFor(String serverId) {
        failingServers.add(serverId);
    }

    public Set<String> serverIds() {
        Set<String> out = new HashSet<>();
        byHeartbeatId.values().forEach(hb -> out.add(hb.serverId()));
        return out;
    }
}
