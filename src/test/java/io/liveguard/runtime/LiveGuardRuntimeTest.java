package io.liveguard.runtime;

import io.liveguard.config.LiveGuardConfig;
import io.liveguard.ingest.AdmissionResult;
import io.liveguard.model.Confidence;
import io.liveguard.model.HeartbeatSubmission;
import io.liveguard.model.RejectionReason;
import io.liveguard.model.ServerSnapshot;
import io.liveguard.model.ServerStatus;
import io.liveguard.security.HeartbeatSigner;
import io.liveguard.testing.MutableClock;
import io.liveguard.testing.TestHeartbeats;
import io.liveguard.worker.WorkerOutcome;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;

import static io.liveguard.testing.TestHeartbeats.NOW;

final class LiveGuardRuntimeTest {
    @Test
    void heartbeatsFlowIntoDerivedStateAndRanking() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-runtime-flow-");
        try {
            MutableClock clock = new MutableClock(NOW);
            LiveGuardRuntime runtime = new LiveGuardRuntime(new LiveGuardConfig(root), clock);
            runtime.init();
            HeartbeatSigner.GeneratedKey key = HeartbeatSigner.generate();
            HeartbeatSigner signer = HeartbeatSigner.fromPkcs8Base64(key.privateKey());
            runtime.registerCluster("cl-1", "EU", key.publicKey(), null);
            runtime.registerServer("srv-1", "cl-1", "eu-1");

            HeartbeatSubmission last = null;
            for (int i = 0; i < 5; i++) {
                if (i > 0) {
                    clock.advance(Duration.ofMinutes(5));
                }
                last = signer.sign(TestHeartbeats.unsigned("srv-1", "hb-" + i, 1, clock.instant()));
                Assertions.assertTrue(runtime.ingest(last).accepted());
            }
            Assertions.assertTrue(runtime.ingest(last).replay());

            WorkerOutcome outcome = runtime.runWorkerOnce();
            Assertions.assertEquals(1, outcome.claimed());
            Assertions.assertEquals(1, outcome.processed());

            ServerSnapshot snapshot = runtime.derived("srv-1").orElseThrow();
            Assertions.assertEquals(ServerStatus.ONLINE, snapshot.effectiveStatus());
            Assertions.assertEquals(Confidence.GREEN, snapshot.confidence());
            Assertions.assertTrue(snapshot.uptimePercent() > 0.0);
            Assertions.assertEquals(clock.instant(), snapshot.lastHeartbeatAt());
            Assertions.assertEquals(clock.instant(), snapshot.lastSeenAt());
            Assertions.assertNull(snapshot.rankingScore());

            Assertions.assertEquals(1, runtime.refreshRanking().updated());
            Assertions.assertNotNull(runtime.derived("srv-1").orElseThrow().rankingScore());

            LiveGuardRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(5L, stats.heartbeatsStored());
            Assertions.assertEquals(0, stats.jobsPending());
            Assertions.assertEquals(5L, stats.ingestAccepted());
            Assertions.assertEquals(1L, stats.ingestReplayed());
            Assertions.assertTrue(runtime.metricsText().contains("liveguard_heartbeats_stored 5\n"));
            Assertions.assertTrue(runtime.verifyAuditChain().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectionsArePersistedAndAudited() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-runtime-reject-");
        try {
            MutableClock clock = new MutableClock(NOW);
            LiveGuardRuntime runtime = new LiveGuardRuntime(new LiveGuardConfig(root), clock);
            runtime.init();
            HeartbeatSigner.GeneratedKey key = HeartbeatSigner.generate();
            HeartbeatSigner signer = HeartbeatSigner.fromPkcs8Base64(key.privateKey());
            runtime.registerCluster("cl-1", "EU", key.publicKey(), null);
            runtime.registerServer("srv-1", "cl-1", "eu-1");

            HeartbeatSubmission forged = signer.sign(TestHeartbeats.unsigned("srv-1", "hb-1", 1, NOW)).withSignature(
                    HeartbeatSigner.fromPkcs8Base64(HeartbeatSigner.generate().privateKey())
                            .sign(TestHeartbeats.unsigned("srv-1", "hb-1", 1, NOW)).signature());
            Assertions.assertEquals(RejectionReason.INVALID_SIGNATURE, runtime.ingest(forged).reason());

            Assertions.assertTrue(runtime.setConsent("srv-1", false));
            AdmissionResult denied = runtime.ingest(signer.sign(TestHeartbeats.unsigned("srv-1", "hb-2", 1, NOW)));
            Assertions.assertEquals(RejectionReason.CONSENT_DENIED, denied.reason());

            Map<String, Integer> summary = runtime.rejectionSummary(NOW.minusSeconds(60));
            Assertions.assertEquals(1, summary.get("invalid_signature"));
            Assertions.assertEquals(1, summary.get("consent_denied"));
            Assertions.assertEquals(0L, runtime.stats().heartbeatsStored());

            String audit = Files.readString(new LiveGuardConfig(root).auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("\"action\":\"ingest.reject\""));
            Assertions.assertFalse(audit.contains(forged.signature()));
            Assertions.assertTrue(runtime.verifyAuditChain().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void keyRotationInvalidatesOldKeyVersion() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-runtime-rotate-");
        try {
            MutableClock clock = new MutableClock(NOW);
            LiveGuardRuntime runtime = new LiveGuardRuntime(new LiveGuardConfig(root), clock);
            runtime.init();
            HeartbeatSigner.GeneratedKey oldKey = HeartbeatSigner.generate();
            runtime.registerCluster("cl-1", "EU", oldKey.publicKey(), null);
            runtime.registerServer("srv-1", "cl-1", "eu-1");
            HeartbeatSigner oldSigner = HeartbeatSigner.fromPkcs8Base64(oldKey.privateKey());
            Assertions.assertTrue(runtime.ingest(oldSigner.sign(TestHeartbeats.unsigned("srv-1", "hb-1", 1, NOW))).accepted());

            HeartbeatSigner.GeneratedKey newKey = HeartbeatSigner.generate();
            Assertions.assertEquals(2, runtime.rotateClusterKey("cl-1", newKey.publicKey()));

            AdmissionResult stale = runtime.ingest(oldSigner.sign(TestHeartbeats.unsigned("srv-1", "hb-2", 1, NOW)));
            Assertions.assertEquals(RejectionReason.KEY_VERSION_MISMATCH, stale.reason());
            AdmissionResult fresh = runtime.ingest(HeartbeatSigner.fromPkcs8Base64(newKey.privateKey())
                    .sign(TestHeartbeats.unsigned("srv-1", "hb-3", 2, NOW)));
            Assertions.assertTrue(fresh.accepted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileIsReadAtStartup() throws Exception {
        Path root = Files.createTempDirectory("liveguard-test-runtime-settings-");
        try {
            LiveGuardConfig config = new LiveGuardConfig(root);
            Files.writeString(config.settingsFile(), "{\"maxJobAttempts\": 4, \"graceSecondsDefault\": 120}",
                    StandardCharsets.UTF_8);

            LiveGuardRuntime runtime = new LiveGuardRuntime(config, new MutableClock(NOW));

            Assertions.assertEquals(4, runtime.settings().maxJobAttempts());
            Assertions.assertEquals(120, runtime.settings().graceSecondsDefault());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
