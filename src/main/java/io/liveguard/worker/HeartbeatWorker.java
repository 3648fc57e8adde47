package io.liveguard.worker;

import io.liveguard.config.LiveGuardSettings;
import io.liveguard.engine.DerivedStateCalculator;
import io.liveguard.model.ClusterKey;
import io.liveguard.model.DerivedState;
import io.liveguard.model.Heartbeat;
import io.liveguard.model.Job;
import io.liveguard.observability.AuditLogger;
import io.liveguard.storage.ClusterDirectory;
import io.liveguard.storage.DerivedStateStore;
import io.liveguard.storage.HeartbeatStore;
import io.liveguard.storage.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single logical consumer of the heartbeat job queue. Jobs in a batch are processed one at a
 * time and a failing job never stops the rest of the batch.
 */
public final class HeartbeatWorker {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatWorker.class);
    static final String CLUSTER_NOT_FOUND = "Server or cluster not found";

    private final JobQueue jobs;
    private final HeartbeatStore heartbeats;
    private final ClusterDirectory clusters;
    private final DerivedStateStore derived;
    private final RankingRefresher ranking;
    private final AuditLogger audit;
    private final LiveGuardSettings settings;
    private final Clock clock;
    private final AtomicLong processedTotal = new AtomicLong();
    private final AtomicLong failedTotal = new AtomicLong();
    private final AtomicLong deadLetteredTotal = new AtomicLong();

    public HeartbeatWorker(
            JobQueue jobs,
            HeartbeatStore heartbeats,
            ClusterDirectory clusters,
            DerivedStateStore derived,
            RankingRefresher ranking,
            AuditLogger audit,
            LiveGuardSettings settings,
            Clock clock
    ) {
        this.jobs = jobs;
        this.heartbeats = heartbeats;
        this.clusters = clusters;
        this.derived = derived;
        this.ranking = ranking;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    public WorkerOutcome runOnce() {
        List<Job> claimed = jobs.claim(settings.jobBatchSize());
        if (claimed.isEmpty()) {
            return WorkerOutcome.idle();
        }
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        int deadLettered = 0;
        for (Job job : claimed) {
            switch (process(job)) {
                case PROCESSED -> processed++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                case DEAD_LETTERED -> deadLettered++;
            }
        }
        processedTotal.addAndGet(processed + skipped);
        failedTotal.addAndGet(failed);
        deadLetteredTotal.addAndGet(deadLettered);
        return new WorkerOutcome(claimed.size(), processed, skipped, failed, deadLettered);
    }

    /**
     * Polls until {@code running} turns false. A poll that completes no job sleeps
     * {@code jobPollIntervalMs}. Queue-level failures back off exponentially up to
     * {@code workerMaxBackoffMs}; the ranking pass runs every {@code rankingIntervalMs}.
     */
    public void runLoop(AtomicBoolean running) {
        long pollMs = settings.jobPollIntervalMs();
        long backoffMs = pollMs;
        Instant nextRanking = clock.instant();
        while (running.get()) {
            long sleepMs;
            try {
                WorkerOutcome outcome = runOnce();
                if (!outcome.idleResult()) {
                    log.info("Worker poll: claimed={} processed={} skipped={} failed={} deadLettered={}",
                            outcome.claimed(), outcome.processed(), outcome.skipped(),
                            outcome.failed(), outcome.deadLettered());
                }
                if (ranking != null && !clock.instant().isBefore(nextRanking)) {
                    ranking.refreshAll();
                    nextRanking = clock.instant().plusMillis(settings.rankingIntervalMs());
                }
                backoffMs = pollMs;
                // keep draining only while jobs get closed; failing jobs wait for the next poll
                sleepMs = outcome.processed() + outcome.skipped() + outcome.deadLettered() > 0 ? 0L : pollMs;
            } catch (RuntimeException e) {
                log.warn("Worker poll failed, retrying in {} ms", backoffMs, e);
                sleepMs = backoffMs;
                backoffMs = Math.min(settings.workerMaxBackoffMs(), backoffMs * 2);
            }
            if (sleepMs > 0 && !sleep(sleepMs)) {
                break;
            }
        }
        log.info("Worker loop stopped");
    }

    JobResult process(Job job) {
        String serverId = job.serverId();
        try {
            Optional<ClusterKey> cluster = clusters.clusterForServer(serverId);
            if (cluster.isEmpty()) {
                return fail(job, CLUSTER_NOT_FOUND);
            }
            List<Heartbeat> history = heartbeats.recent(serverId, settings.heartbeatHistoryLimit());
            Instant now = clock.instant();
            if (history.isEmpty()) {
                // nothing to derive from; keep whatever status the row already has
                jobs.markProcessed(job.jobId(), now);
                return JobResult.SKIPPED;
            }
            DerivedState state = DerivedStateCalculator.compute(
                    history,
                    settings.resolveGraceSeconds(cluster.get().graceWindowSeconds()),
                    settings.uptimeWindowHours(),
                    settings.anomalyDecayMinutes(),
                    derived.currentAnomalyState(serverId),
                    now
            );
            derived.writeDerived(serverId, state);
            jobs.markProcessed(job.jobId(), now);
            return JobResult.PROCESSED;
        } catch (RuntimeException e) {
            log.warn("Heartbeat job {} for server {} failed", job.jobId(), serverId, e);
            return fail(job, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private JobResult fail(Job job, String error) {
        try {
            jobs.markFailed(job.jobId(), error, job.attempts());
            if (!settings.retriesUnbounded() && job.attempts() >= settings.maxJobAttempts()) {
                jobs.markProcessed(job.jobId(), clock.instant());
                log.error("Heartbeat job {} for server {} dead-lettered after {} attempts: {}",
                        job.jobId(), job.serverId(), job.attempts(), error);
                if (audit != null) {
                    audit.log(AuditLogger.AuditEvent.of("worker.dead_letter", "worker", "heartbeat_job:" + job.jobId(),
                            "dead_lettered", job.serverId(), Map.of("attempts", job.attempts(), "error", error)));
                }
                return JobResult.DEAD_LETTERED;
            }
        } catch (RuntimeException e) {
            log.error("Failed to record failure of heartbeat job {}; it stays pending", job.jobId(), e);
        }
        return JobResult.FAILED;
    }

    private static boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long processedTotal() {
        return processedTotal.get();
    }

    public long failedTotal() {
        return failedTotal.get();
    }

    public long deadLetteredTotal() {
        return deadLetteredTotal.get();
    }

    enum JobResult {
        PROCESSED,
        SKIPPED,
        FAILED,
        DEAD_LETTERED
    }
}
