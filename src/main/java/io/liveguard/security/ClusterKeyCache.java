package io.liveguard.security;

import io.liveguard.model.ClusterKey;
import io.liveguard.storage.ClusterDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-scoped cache of cluster key material keyed by server id. Entries expire after a
 * fixed TTL; when a refresh fails the last good entry keeps being served.
 */
public final class ClusterKeyCache {
    private static final Logger log = LoggerFactory.getLogger(ClusterKeyCache.class);

    private final ClusterDirectory directory;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public ClusterKeyCache(ClusterDirectory directory, Duration ttl, Clock clock) {
        this.directory = directory;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<ClusterKey> get(String serverId) {
        Entry cached = entries.get(serverId);
        Instant now = clock.instant();
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return Optional.of(cached.key());
        }
        return load(serverId, cached, now);
    }

    /**
     * Bypasses the TTL once, used when an agent presents a key version newer than the cached
     * one (the cluster was probably rotated since the entry was loaded).
     */
    public Optional<ClusterKey> refresh(String serverId) {
        return load(serverId, entries.get(serverId), clock.instant());
    }

    public void invalidate(String serverId) {
        entries.remove(serverId);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private Optional<ClusterKey> load(String serverId, Entry previous, Instant now) {
        Optional<ClusterKey> fresh;
        try {
            fresh = directory.clusterForServer(serverId);
        } catch (RuntimeException e) {
            if (previous != null) {
                log.warn("Cluster key refresh failed for server {}, serving cached key version {}",
                        serverId, previous.key().keyVersion(), e);
                return Optional.of(previous.key());
            }
            throw e;
        }
        if (fresh.isPresent()) {
            entries.put(serverId, new Entry(fresh.get(), now.plus(ttl)));
        } else {
            entries.remove(serverId);
        }
        return fresh;
    }

    private record Entry(ClusterKey key, Instant expiresAt) {
    }
}
