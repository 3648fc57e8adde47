package io.liveguard.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpServer;
import io.liveguard.config.LiveGuardConfig;
import io.liveguard.ingest.AdmissionResult;
import io.liveguard.model.HeartbeatSubmission;
import io.liveguard.model.ServerSnapshot;
import io.liveguard.runtime.LiveGuardRuntime;
import io.liveguard.security.HeartbeatSigner;
import io.liveguard.storage.HeartbeatIntegrityException;
import io.liveguard.util.Jsons;
import io.liveguard.worker.RankingRefresher;
import io.liveguard.worker.WorkerOutcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "liveguard",
        mixinStandardHelpOptions = true,
        description = "Signed heartbeat ingestion and derived liveness metrics",
        subcommands = {
                LiveGuardCommand.InitCommand.class,
                LiveGuardCommand.ClusterRegisterCommand.class,
                LiveGuardCommand.ClusterRotateKeyCommand.class,
                LiveGuardCommand.ServerRegisterCommand.class,
                LiveGuardCommand.ConsentCommand.class,
                LiveGuardCommand.KeygenCommand.class,
                LiveGuardCommand.SignCommand.class,
                LiveGuardCommand.IngestCommand.class,
                LiveGuardCommand.WorkerCommand.class,
                LiveGuardCommand.RankCommand.class,
                LiveGuardCommand.DerivedCommand.class,
                LiveGuardCommand.RejectionsCommand.class,
                LiveGuardCommand.MetricsCommand.class,
                LiveGuardCommand.AuditVerifyCommand.class,
                LiveGuardCommand.ServeCommand.class
        }
)
public final class LiveGuardCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = LiveGuardConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | cluster-register | cluster-rotate-key | server-register | consent | keygen | sign | ingest | worker | rank | derived | rejections | metrics | audit-verify | serve");
    }

    LiveGuardRuntime runtime() {
        LiveGuardRuntime runtime = new LiveGuardRuntime(LiveGuardConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Override
        public Integer call() {
            parent.runtime();
            System.out.println("Initialized LiveGuard at: " + LiveGuardConfig.fromRoot(parent.root).rootDir());
            return 0;
        }
    }

    @Command(name = "cluster-register", description = "Register a cluster and its Ed25519 public key")
    static final class ClusterRegisterCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--cluster-id"}, required = true, description = "Cluster id")
        String clusterId;

        @Option(names = {"--name"}, defaultValue = "", description = "Display name")
        String name;

        @Option(names = {"--public-key"}, description = "Base64 Ed25519 public key (raw or X.509)")
        String publicKey;

        @Option(names = {"--grace-seconds"}, description = "Grace window override in seconds")
        Integer graceSeconds;

        @Override
        public Integer call() {
            parent.runtime().registerCluster(clusterId, name, publicKey, graceSeconds);
            System.out.println(Jsons.toJson(Map.of("clusterId", clusterId, "keyVersion", 1)));
            return 0;
        }
    }

    @Command(name = "cluster-rotate-key", description = "Install a new cluster key and bump key_version")
    static final class ClusterRotateKeyCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--cluster-id"}, required = true, description = "Cluster id")
        String clusterId;

        @Option(names = {"--public-key"}, required = true, description = "New base64 Ed25519 public key")
        String publicKey;

        @Override
        public Integer call() {
            int version = parent.runtime().rotateClusterKey(clusterId, publicKey);
            System.out.println(Jsons.toJson(Map.of("clusterId", clusterId, "keyVersion", version)));
            return 0;
        }
    }

    @Command(name = "server-register", description = "Register a server under a cluster")
    static final class ServerRegisterCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--server-id"}, required = true, description = "Server id")
        String serverId;

        @Option(names = {"--cluster-id"}, required = true, description = "Owning cluster id")
        String clusterId;

        @Option(names = {"--name"}, defaultValue = "", description = "Display name")
        String name;

        @Override
        public Integer call() {
            parent.runtime().registerServer(serverId, clusterId, name);
            System.out.println(Jsons.toJson(Map.of("serverId", serverId, "clusterId", clusterId)));
            return 0;
        }
    }

    @Command(name = "consent", description = "Grant or withdraw heartbeat data consent for a server")
    static final class ConsentCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--server-id"}, required = true, description = "Server id")
        String serverId;

        @Option(names = {"--granted"}, required = true, arity = "1", description = "true|false")
        boolean granted;

        @Override
        public Integer call() {
            boolean updated = parent.runtime().setConsent(serverId, granted);
            System.out.println(Jsons.toJson(Map.of("serverId", serverId, "granted", granted, "updated", updated)));
            return updated ? 0 : 1;
        }
    }

    @Command(name = "keygen", description = "Generate an agent Ed25519 key pair")
    static final class KeygenCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(HeartbeatSigner.generate()));
            return 0;
        }
    }

    @Command(name = "sign", description = "Sign a heartbeat JSON file the way an agent does")
    static final class SignCommand implements Callable<Integer> {
        @Option(names = {"--file"}, required = true, description = "Heartbeat JSON without signature")
        String file;

        @Option(names = {"--private-key"}, required = true, description = "Base64 PKCS#8 Ed25519 private key")
        String privateKey;

        @Override
        public Integer call() throws Exception {
            JsonNode body = Jsons.mapper().readTree(Path.of(file).toFile());
            HeartbeatSubmission signed = HeartbeatSigner.fromPkcs8Base64(privateKey)
                    .sign(HeartbeatSubmission.fromJson(body));
            ObjectNode out = ((ObjectNode) body).deepCopy();
            out.put("signature", signed.signature());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "ingest", description = "Submit a signed heartbeat JSON file through the ingest gate")
    static final class IngestCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--file"}, required = true, description = "Signed heartbeat JSON")
        String file;

        @Override
        public Integer call() throws Exception {
            LiveGuardRuntime runtime = parent.runtime();
            JsonNode body = Jsons.mapper().readTree(Path.of(file).toFile());
            HeartbeatSubmission submission;
            try {
                submission = HeartbeatSubmission.fromJson(body);
            } catch (IllegalArgumentException e) {
                System.out.println(Jsons.toJson(runtime.rejectUnparseable(e.getMessage()).toReceipt()));
                return 1;
            }
            try {
                AdmissionResult result = runtime.ingest(submission);
                System.out.println(Jsons.toJson(result.toReceipt()));
                return result.accepted() ? 0 : 1;
            } catch (HeartbeatIntegrityException e) {
                System.out.println(Jsons.toJson(Map.of("error", "heartbeat_integrity_violation", "detail", e.getMessage())));
                return 2;
            }
        }
    }

    @Command(name = "worker", description = "Run the heartbeat worker loop or a single poll")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one poll cycle")
        boolean once;

        @Override
        public Integer call() {
            LiveGuardRuntime runtime = parent.runtime();
            if (once) {
                WorkerOutcome outcome = runtime.runWorkerOnce();
                System.out.println(Jsons.toJson(outcome));
                return 0;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            Thread loop = Thread.currentThread();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                loop.interrupt();
            }, "liveguard-shutdown-hook"));
            runtime.runWorkerLoop(running);
            return 0;
        }
    }

    @Command(name = "rank", description = "Recompute ranking scores from derived state")
    static final class RankCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Override
        public Integer call() {
            RankingRefresher.RankingOutcome outcome = parent.runtime().refreshRanking();
            System.out.println(Jsons.toJson(outcome));
            return outcome.failed() == 0 ? 0 : 1;
        }
    }

    @Command(name = "derived", description = "Show derived state for one server or all")
    static final class DerivedCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--server-id"}, description = "Server id; omit to list all")
        String serverId;

        @Override
        public Integer call() {
            LiveGuardRuntime runtime = parent.runtime();
            if (serverId == null || serverId.isBlank()) {
                List<ServerSnapshot> all = runtime.derivedAll();
                System.out.println(Jsons.toJson(all));
                return 0;
            }
            Optional<ServerSnapshot> snapshot = runtime.derived(serverId);
            if (snapshot.isEmpty()) {
                System.out.println(Jsons.toJson(Map.of("error", "not_found", "serverId", serverId)));
                return 1;
            }
            System.out.println(Jsons.toJson(snapshot.get()));
            return 0;
        }
    }

    @Command(name = "rejections", description = "Ingest rejection counts by reason")
    static final class RejectionsCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--since-hours"}, defaultValue = "24", description = "Look-back window in hours")
        long sinceHours;

        @Override
        public Integer call() {
            Instant since = Instant.now().minus(Duration.ofHours(Math.max(1L, sinceHours)));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("since", since.toString());
            out.put("byReason", parent.runtime().rejectionSummary(since));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Override
        public Integer call() {
            System.out.print(parent.runtime().metricsText());
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Override
        public Integer call() {
            List<String> problems = parent.runtime().verifyAuditChain();
            System.out.println(Jsons.toJson(Map.of("ok", problems.isEmpty(), "problems", problems)));
            return problems.isEmpty() ? 0 : 1;
        }
    }

    @Command(name = "serve", description = "Serve POST /v1/heartbeat and GET /metrics, with the worker in-process")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        LiveGuardCommand parent;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--worker"}, defaultValue = "true", arity = "1", description = "Run the worker loop in-process")
        boolean worker;

        @Override
        public Integer call() throws Exception {
            LiveGuardRuntime runtime = parent.runtime();
            HttpServer server = runtime.startHttpServer(port);
            AtomicBoolean running = new AtomicBoolean(true);
            Thread workerThread = null;
            if (worker) {
                workerThread = new Thread(() -> runtime.runWorkerLoop(running), "liveguard-worker");
                workerThread.start();
            }
            Thread finalWorker = workerThread;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                if (finalWorker != null) {
                    finalWorker.interrupt();
                }
                server.stop(1);
            }, "liveguard-shutdown-hook"));
            System.out.println("LiveGuard listening on http://127.0.0.1:" + server.getAddress().getPort() + "/v1/heartbeat");
            Thread.currentThread().join();
            return 0;
        }
    }
}
