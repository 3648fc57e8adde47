package io.liveguard.storage;

import io.liveguard.model.Job;

import java.time.Instant;
import java.util.List;

/**
 * At-least-once queue with at most one pending job per server.
 */
public interface JobQueue {
    /** Refreshes the pending job for the server if there is one, otherwise creates it. */
    void enqueue(String serverId);

    /** Oldest pending jobs first; {@code attempts} is incremented as part of the claim. */
    List<Job> claim(int batchSize);

    void markProcessed(String jobId, Instant at);

    void markFailed(String jobId, String error, int attempts);

    int pendingCount();
}
