package io.liveguard.storage;

import io.liveguard.model.Heartbeat;

import java.util.List;

/**
 * Append-only heartbeat log. Replay detection lives here: {@link #insert} must be a single
 * atomic insert-or-conflict, never a lookup followed by a write.
 */
public interface HeartbeatStore {
    /**
     * @throws HeartbeatIntegrityException when the heartbeat id is already stored for a
     *                                     different server
     */
    InsertOutcome insert(Heartbeat heartbeat);

    /**
     * Newest first by server receive time, ties broken by heartbeat id descending.
     */
    List<Heartbeat> recent(String serverId, int limit);

    long count();

    enum InsertOutcome {
        INSERTED,
        REPLAY
    }
}
