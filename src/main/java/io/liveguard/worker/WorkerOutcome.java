package io.liveguard.worker;

/**
 * Counts for one poll of the heartbeat job queue.
 *
 * @param skipped jobs closed without a derived write because the server has no heartbeats
 */
public record WorkerOutcome(int claimed, int processed, int skipped, int failed, int deadLettered) {
    public static WorkerOutcome idle() {
        return new WorkerOutcome(0, 0, 0, 0, 0);
    }

    public boolean idleResult() {
        return claimed == 0;
    }
}
