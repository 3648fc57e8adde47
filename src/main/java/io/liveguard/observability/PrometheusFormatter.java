package io.liveguard.observability;

import io.liveguard.runtime.LiveGuardRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(LiveGuardRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "liveguard_heartbeats_stored", "Heartbeats stored", null, null, stats.heartbeatsStored());
        appendGauge(sb, "liveguard_jobs_pending", "Pending heartbeat jobs", null, null, stats.jobsPending());
        appendGauge(sb, "liveguard_ingest_total", "Ingest outcomes since start", "result", "accepted", stats.ingestAccepted());
        appendGauge(sb, "liveguard_ingest_total", "Ingest outcomes since start", "result", "replay", stats.ingestReplayed());
        appendGauge(sb, "liveguard_ingest_fast_path_failures_total", "Accepted heartbeats whose fast-path write failed", null, null, stats.fastPathFailures());
        appendGauge(sb, "liveguard_ingest_integrity_violations_total", "Heartbeat ids reused across servers", null, null, stats.integrityViolations());
        appendMapGauge(sb, "liveguard_ingest_rejected_total", "Ingest rejections since start by reason", "reason", stats.rejectedByReason());
        appendMapGauge(sb, "liveguard_ingest_rejections_24h", "Persisted ingest rejections in the last 24h by reason", "reason", stats.rejections24h());
        appendGauge(sb, "liveguard_worker_jobs_total", "Worker job results since start", "result", "processed", stats.workerProcessed());
        appendGauge(sb, "liveguard_worker_jobs_total", "Worker job results since start", "result", "failed", stats.workerFailed());
        appendGauge(sb, "liveguard_worker_jobs_total", "Worker job results since start", "result", "dead_lettered", stats.workerDeadLettered());
        appendGauge(sb, "liveguard_key_cache_entries", "Cluster key cache entries", null, null, stats.keyCacheEntries());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, ? extends Number> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, ? extends Number> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue().longValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
