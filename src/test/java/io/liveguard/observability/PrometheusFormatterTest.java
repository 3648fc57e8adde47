package io.liveguard.observability;

import io.liveguard.runtime.LiveGuardRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeMap;

final class PrometheusFormatterTest {
    @Test
    void rendersGaugesWithSingleHeaderPerMetric() {
        Map<String, Long> rejected = new TreeMap<>();
        rejected.put("invalid_signature", 4L);
        rejected.put("consent_denied", 1L);
        LiveGuardRuntime.StatsOutcome stats = new LiveGuardRuntime.StatsOutcome(
                120L, 3, 100L, 7L, 1L, 0L, rejected, Map.of("invalid_signature", 2), 90L, 2L, 1L, 5);

        String text = PrometheusFormatter.format(stats);

        Assertions.assertTrue(text.contains("liveguard_heartbeats_stored 120\n"));
        Assertions.assertTrue(text.contains("liveguard_ingest_total{result=\"accepted\"} 100\n"));
        Assertions.assertTrue(text.contains("liveguard_ingest_total{result=\"replay\"} 7\n"));
        Assertions.assertTrue(text.contains("liveguard_ingest_rejected_total{reason=\"invalid_signature\"} 4\n"));
        Assertions.assertTrue(text.contains("liveguard_ingest_rejections_24h{reason=\"invalid_signature\"} 2\n"));
        Assertions.assertTrue(text.contains("liveguard_worker_jobs_total{result=\"dead_lettered\"} 1\n"));
        Assertions.assertEquals(text.indexOf("# HELP liveguard_ingest_total "),
                text.lastIndexOf("# HELP liveguard_ingest_total "));
        Assertions.assertEquals(text.indexOf("# HELP liveguard_worker_jobs_total "),
                text.lastIndexOf("# HELP liveguard_worker_jobs_total "));
    }
}
