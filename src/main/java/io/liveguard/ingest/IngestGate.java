package io.liveguard.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.liveguard.config.LiveGuardSettings;
import io.liveguard.model.AgentStatus;
import io.liveguard.model.ClusterKey;
import io.liveguard.model.FastPathUpdate;
import io.liveguard.model.Heartbeat;
import io.liveguard.model.HeartbeatSubmission;
import io.liveguard.model.Rejection;
import io.liveguard.model.RejectionReason;
import io.liveguard.observability.IngestCounters;
import io.liveguard.security.ClusterKeyCache;
import io.liveguard.security.Ed25519Verifier;
import io.liveguard.security.HeartbeatCanonicalizer;
import io.liveguard.storage.EligibilityPolicy;
import io.liveguard.storage.FastPathWriter;
import io.liveguard.storage.HeartbeatIntegrityException;
import io.liveguard.storage.HeartbeatStore;
import io.liveguard.storage.JobQueue;
import io.liveguard.storage.RejectionRecorder;
import io.liveguard.util.Jsons;
import io.liveguard.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validates, authenticates and stores heartbeats.
 *
 * <p>Check order: structure, consent, key present, key version, signature, timestamp window,
 * then the atomic insert. A fresh heartbeat then gets the fast-path write and a job enqueue;
 * a replay gets neither.
 */
public final class IngestGate {
    private static final Logger log = LoggerFactory.getLogger(IngestGate.class);

    private final ClusterKeyCache keys;
    private final EligibilityPolicy eligibility;
    private final HeartbeatStore heartbeats;
    private final FastPathWriter fastPath;
    private final JobQueue jobs;
    private final RejectionRecorder rejections;
    private final LiveGuardSettings settings;
    private final Clock clock;
    private final IngestCounters counters = new IngestCounters();

    public IngestGate(
            ClusterKeyCache keys,
            EligibilityPolicy eligibility,
            HeartbeatStore heartbeats,
            FastPathWriter fastPath,
            JobQueue jobs,
            RejectionRecorder rejections,
            LiveGuardSettings settings,
            Clock clock
    ) {
        this.keys = keys;
        this.eligibility = eligibility;
        this.heartbeats = heartbeats;
        this.fastPath = fastPath;
        this.jobs = jobs;
        this.rejections = rejections;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Full ingest: resolves the server's cluster through the key cache, then {@link #admit}.
     */
    public AdmissionResult ingest(HeartbeatSubmission submission) {
        Optional<String> malformed = structuralProblem(submission);
        if (malformed.isPresent()) {
            return reject(submission, RejectionReason.MALFORMED_PAYLOAD, Map.of("problem", malformed.get()));
        }
        Optional<ClusterKey> cluster = keys.get(submission.serverId());
        if (cluster.isEmpty()) {
            return reject(submission, RejectionReason.SERVER_NOT_FOUND, Map.of());
        }
        return admit(submission, cluster.get());
    }

    /**
     * Records a body that could not even be parsed into a submission.
     */
    public AdmissionResult rejectUnparseable(String problem) {
        return reject(null, RejectionReason.MALFORMED_PAYLOAD, Map.of("problem", problem));
    }

    public AdmissionResult admit(HeartbeatSubmission submission, ClusterKey cluster) {
        Optional<String> malformed = structuralProblem(submission);
        if (malformed.isPresent()) {
            return reject(submission, RejectionReason.MALFORMED_PAYLOAD, Map.of("problem", malformed.get()));
        }
        String serverId = submission.serverId();
        if (!eligibility.allowed(serverId, EligibilityPolicy.HEARTBEAT, Map.of("cluster_id", cluster.clusterId()))) {
            return reject(submission, RejectionReason.CONSENT_DENIED, Map.of());
        }
        ClusterKey current = cluster;
        if (submission.keyVersion() > current.keyVersion()) {
            // the agent may already hold a rotated key the cache has not seen yet
            Optional<ClusterKey> refreshed = keys.refresh(serverId);
            if (refreshed.isEmpty()) {
                return reject(submission, RejectionReason.SERVER_NOT_FOUND, Map.of());
            }
            current = refreshed.get();
        }
        if (!current.hasPublicKey()) {
            return reject(submission, RejectionReason.MISSING_PUBLIC_KEY, Map.of("cluster_id", current.clusterId()));
        }
        if (submission.keyVersion() != current.keyVersion()) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("expected", current.keyVersion());
            meta.put("received", submission.keyVersion());
            return reject(submission, RejectionReason.KEY_VERSION_MISMATCH, meta);
        }
        byte[] message = HeartbeatCanonicalizer.canonicalBytes(submission);
        if (!Ed25519Verifier.verify(current.publicKey(), message, submission.signature())) {
            return reject(submission, RejectionReason.INVALID_SIGNATURE, Map.of("key_version", current.keyVersion()));
        }

        Instant now = clock.instant();
        Instant agentTimestamp = Timestamps.parse(submission.timestamp());
        if (settings.enforceTimestampWindow()) {
            int grace = settings.resolveGraceSeconds(current.graceWindowSeconds());
            if (Duration.between(agentTimestamp, now).toMillis() > grace * 1000L) {
                return reject(submission, RejectionReason.TIMESTAMP_STALE, Map.of("grace_seconds", grace));
            }
            if (Duration.between(now, agentTimestamp).toMillis() > settings.maxFutureSkewSeconds() * 1000L) {
                return reject(submission, RejectionReason.TIMESTAMP_FUTURE,
                        Map.of("max_skew_seconds", settings.maxFutureSkewSeconds()));
            }
        }

        Heartbeat heartbeat = new Heartbeat(
                serverId,
                submission.heartbeatId(),
                submission.keyVersion(),
                agentTimestamp,
                AgentStatus.fromWire(submission.status()),
                submission.mapName(),
                submission.playersCurrent(),
                submission.playersCapacity(),
                submission.agentVersion(),
                submission.signature(),
                debugPayload(submission),
                now
        );
        HeartbeatStore.InsertOutcome outcome;
        try {
            outcome = heartbeats.insert(heartbeat);
        } catch (HeartbeatIntegrityException e) {
            counters.recordIntegrityViolation();
            log.error("Heartbeat id {} reused across servers ({} vs {})",
                    e.heartbeatId(), e.serverId(), e.existingServerId());
            throw e;
        }
        if (outcome == HeartbeatStore.InsertOutcome.REPLAY) {
            log.debug("Replayed heartbeat {} for server {}", heartbeat.heartbeatId(), serverId);
            return counted(AdmissionResult.replay(serverId));
        }

        boolean processed = true;
        try {
            fastPath.writeFastPath(serverId, new FastPathUpdate(now, heartbeat.playersCurrent(), heartbeat.playersCapacity()));
        } catch (RuntimeException e) {
            processed = false;
            log.warn("Fast-path update failed for server {}; worker will catch up", serverId, e);
        }
        try {
            jobs.enqueue(serverId);
        } catch (RuntimeException e) {
            log.error("Failed to enqueue heartbeat job for server {}; derived state waits for the next heartbeat",
                    serverId, e);
        }
        return counted(AdmissionResult.accepted(serverId, processed));
    }

    public IngestCounters counters() {
        return counters;
    }

    static Optional<String> structuralProblem(HeartbeatSubmission s) {
        if (s == null) {
            return Optional.of("empty body");
        }
        if (isBlank(s.serverId())) {
            return Optional.of("server_id is required");
        }
        if (isBlank(s.heartbeatId())) {
            return Optional.of("heartbeat_id is required");
        }
        if (s.keyVersion() == null || s.keyVersion() < 1) {
            return Optional.of("key_version must be a positive integer");
        }
        if (Timestamps.parse(s.timestamp()) == null) {
            return Optional.of("timestamp must be RFC3339");
        }
        if (AgentStatus.fromWire(s.status()) == null) {
            return Optional.of("status must be online or offline");
        }
        if (isBlank(s.signature())) {
            return Optional.of("signature is required");
        }
        if (s.playersCurrent() != null && s.playersCurrent() < 0) {
            return Optional.of("players_current must not be negative");
        }
        if (s.playersCapacity() != null && s.playersCapacity() < 0) {
            return Optional.of("players_capacity must not be negative");
        }
        return Optional.empty();
    }

    private AdmissionResult reject(HeartbeatSubmission s, RejectionReason reason, Map<String, Object> metadata) {
        String serverId = s == null ? null : s.serverId();
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        if (s != null && s.heartbeatId() != null) {
            meta.put("heartbeat_id", s.heartbeatId());
        }
        if (s != null && !s.unknownFields().isEmpty()) {
            meta.put("unknown_fields", s.unknownFields());
        }
        log.info("Rejected heartbeat for server {}: {}", serverId, reason.code());
        try {
            rejections.record(new Rejection(serverId, reason, s == null ? null : s.agentVersion(), meta, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to record {} rejection for server {}", reason.code(), serverId, e);
        }
        return counted(AdmissionResult.rejected(serverId, reason));
    }

    private AdmissionResult counted(AdmissionResult result) {
        counters.record(result);
        return result;
    }

    private static String debugPayload(HeartbeatSubmission s) {
        if (s.payload() == null) {
            return null;
        }
        try {
            return Jsons.compact().writeValueAsString(s.payload());
        } catch (JsonProcessingException e) {
            log.warn("Dropping unserializable debug payload for heartbeat {}", s.heartbeatId(), e);
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
