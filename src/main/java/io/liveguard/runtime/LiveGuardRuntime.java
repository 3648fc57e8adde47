package io.liveguard.runtime;

import com.sun.net.httpserver.HttpServer;
import io.liveguard.config.LiveGuardConfig;
import io.liveguard.config.LiveGuardSettings;
import io.liveguard.ingest.AdmissionResult;
import io.liveguard.ingest.HeartbeatHttpHandler;
import io.liveguard.ingest.IngestGate;
import io.liveguard.model.HeartbeatSubmission;
import io.liveguard.model.Rejection;
import io.liveguard.model.ServerSnapshot;
import io.liveguard.observability.AuditLogger;
import io.liveguard.observability.IngestCounters;
import io.liveguard.observability.PrometheusFormatter;
import io.liveguard.security.ClusterKeyCache;
import io.liveguard.storage.Database;
import io.liveguard.storage.SqliteDerivedStateStore;
import io.liveguard.storage.SqliteHeartbeatStore;
import io.liveguard.storage.SqliteJobQueue;
import io.liveguard.storage.SqliteRejectionStore;
import io.liveguard.storage.SqliteServerDirectory;
import io.liveguard.worker.HeartbeatWorker;
import io.liveguard.worker.RankingRefresher;
import io.liveguard.worker.WorkerOutcome;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the SQLite adapters, key cache, ingest gate, worker and ranking pass for one data
 * root. Settings are read once here; restart to pick up changes.
 */
public final class LiveGuardRuntime {
    private final LiveGuardConfig config;
    private final LiveGuardSettings settings;
    private final Clock clock;
    private final Database database;
    private final SqliteServerDirectory directory;
    private final SqliteHeartbeatStore heartbeatStore;
    private final SqliteJobQueue jobQueue;
    private final SqliteDerivedStateStore derivedStore;
    private final SqliteRejectionStore rejectionStore;
    private final ClusterKeyCache keyCache;
    private final AuditLogger auditLogger;
    private final IngestGate gate;
    private final RankingRefresher ranking;
    private final HeartbeatWorker worker;

    public LiveGuardRuntime(LiveGuardConfig config) {
        this(config, Clock.systemUTC());
    }

    public LiveGuardRuntime(LiveGuardConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.settings = LiveGuardSettings.load(config.settingsFile());
        this.database = new Database(config);
        this.directory = new SqliteServerDirectory(database, clock);
        this.heartbeatStore = new SqliteHeartbeatStore(database);
        this.jobQueue = new SqliteJobQueue(database, clock, settings.jobClaimLeaseMs());
        this.derivedStore = new SqliteDerivedStateStore(database, clock);
        this.rejectionStore = new SqliteRejectionStore(database);
        this.keyCache = new ClusterKeyCache(directory, Duration.ofMillis(settings.keyCacheTtlMs()), clock);
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                loadOrCreateAuditSigningSecret(config.auditSigningKeyFile()),
                clock
        );
        this.gate = new IngestGate(
                keyCache,
                directory,
                heartbeatStore,
                derivedStore,
                jobQueue,
                this::recordRejection,
                settings,
                clock
        );
        this.ranking = new RankingRefresher(derivedStore);
        this.worker = new HeartbeatWorker(
                jobQueue,
                heartbeatStore,
                directory,
                derivedStore,
                ranking,
                auditLogger,
                settings,
                clock
        );
    }

    public void init() {
        database.init();
        auditLogger.log(AuditLogger.AuditEvent.of("runtime.init", "cli", "runtime/" + config.rootDir(), "ok",
                null, Map.of("settings_file_present", Files.exists(config.settingsFile()))));
    }

    public LiveGuardSettings settings() {
        return settings;
    }

    public void registerCluster(String clusterId, String name, String publicKey, Integer graceWindowSeconds) {
        directory.registerCluster(clusterId, name, publicKey, graceWindowSeconds);
        auditLogger.log(AuditLogger.AuditEvent.of("cluster.register", "cli", "cluster:" + clusterId, "ok", null,
                graceWindowSeconds == null ? Map.of() : Map.of("grace_window_seconds", graceWindowSeconds)));
    }

    public int rotateClusterKey(String clusterId, String newPublicKey) {
        int version = directory.rotateClusterKey(clusterId, newPublicKey);
        keyCache.clear();
        auditLogger.log(AuditLogger.AuditEvent.of("cluster.rotate_key", "cli", "cluster:" + clusterId, "ok", null,
                Map.of("key_version", version)));
        return version;
    }

    public void registerServer(String serverId, String clusterId, String name) {
        directory.registerServer(serverId, clusterId, name);
        keyCache.invalidate(serverId);
        auditLogger.log(AuditLogger.AuditEvent.of("server.register", "cli", "server:" + serverId, "ok", serverId,
                Map.of("cluster_id", clusterId)));
    }

    public boolean setConsent(String serverId, boolean granted) {
        boolean updated = directory.setConsent(serverId, granted);
        auditLogger.log(AuditLogger.AuditEvent.of("server.consent", "cli", "server:" + serverId,
                updated ? "ok" : "not_found", serverId, Map.of("granted", granted)));
        return updated;
    }

    public AdmissionResult ingest(HeartbeatSubmission submission) {
        return gate.ingest(submission);
    }

    public AdmissionResult rejectUnparseable(String problem) {
        return gate.rejectUnparseable(problem);
    }

    public WorkerOutcome runWorkerOnce() {
        return worker.runOnce();
    }

    public void runWorkerLoop(AtomicBoolean running) {
        worker.runLoop(running);
    }

    public RankingRefresher.RankingOutcome refreshRanking() {
        return ranking.refreshAll();
    }

    public Optional<ServerSnapshot> derived(String serverId) {
        return derivedStore.snapshot(serverId);
    }

    public List<ServerSnapshot> derivedAll() {
        return derivedStore.snapshots();
    }

    public Map<String, Integer> rejectionSummary(Instant since) {
        return rejectionStore.countsByReason(since);
    }

    public List<String> verifyAuditChain() {
        return auditLogger.verifyChain();
    }

    public StatsOutcome stats() {
        IngestCounters counters = gate.counters();
        return new StatsOutcome(
                heartbeatStore.count(),
                jobQueue.pendingCount(),
                counters.accepted(),
                counters.replayed(),
                counters.fastPathFailures(),
                counters.integrityViolations(),
                counters.rejectedByReason(),
                rejectionStore.countsByReason(clock.instant().minus(Duration.ofHours(24))),
                worker.processedTotal(),
                worker.failedTotal(),
                worker.deadLetteredTotal(),
                keyCache.size()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    /**
     * Starts {@code POST /v1/heartbeat} and {@code GET /metrics} on {@code port} (0 picks a free
     * port). The caller owns the returned server and stops it.
     */
    public HttpServer startHttpServer(int port) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/v1/heartbeat", new HeartbeatHttpHandler(gate));
        server.createContext("/metrics", exchange -> {
            byte[] bytes = metricsText().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.setExecutor(null);
        server.start();
        return server;
    }

    private void recordRejection(Rejection rejection) {
        rejectionStore.record(rejection);
        Map<String, Object> details = new LinkedHashMap<>(rejection.metadata());
        details.put("event_type", Rejection.EVENT_TYPE);
        details.put("agent_version", rejection.agentVersion());
        auditLogger.log(AuditLogger.AuditEvent.of("ingest.reject", "agent",
                rejection.serverId() == null ? "heartbeat" : "server:" + rejection.serverId(),
                rejection.reason().code(), rejection.serverId(), details));
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record StatsOutcome(
            long heartbeatsStored,
            int jobsPending,
            long ingestAccepted,
            long ingestReplayed,
            long fastPathFailures,
            long integrityViolations,
            Map<String, Long> rejectedByReason,
            Map<String, Integer> rejections24h,
            long workerProcessed,
            long workerFailed,
            long workerDeadLettered,
            int keyCacheEntries
    ) {
    }
}
