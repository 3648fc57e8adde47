package io.liveguard.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.liveguard.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code liveguard-settings.json}. Every field in the file is optional;
 * absent or non-positive values fall back to {@link #defaults()}.
 */
public record LiveGuardSettings(
        int graceSecondsDefault,
        int graceSecondsMin,
        int graceSecondsMax,
        int maxFutureSkewSeconds,
        boolean enforceTimestampWindow,
        long jobPollIntervalMs,
        int jobBatchSize,
        int heartbeatHistoryLimit,
        int uptimeWindowHours,
        int anomalyDecayMinutes,
        long jobClaimLeaseMs,
        int maxJobAttempts,
        long keyCacheTtlMs,
        long workerMaxBackoffMs,
        long rankingIntervalMs
) {
    public static final int DEFAULT_GRACE_SECONDS = 600;
    public static final int DEFAULT_GRACE_MIN_SECONDS = 60;
    public static final int DEFAULT_GRACE_MAX_SECONDS = 3600;
    public static final int DEFAULT_MAX_FUTURE_SKEW_SECONDS = 60;
    public static final long DEFAULT_JOB_POLL_INTERVAL_MS = 5_000L;
    public static final int DEFAULT_JOB_BATCH_SIZE = 50;
    public static final int DEFAULT_HISTORY_LIMIT = 500;
    public static final int DEFAULT_UPTIME_WINDOW_HOURS = 24;
    public static final int DEFAULT_ANOMALY_DECAY_MINUTES = 30;
    public static final long DEFAULT_KEY_CACHE_TTL_MS = 60_000L;
    public static final long DEFAULT_WORKER_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_RANKING_INTERVAL_MS = 60_000L;

    public static LiveGuardSettings defaults() {
        return new LiveGuardSettings(
                DEFAULT_GRACE_SECONDS,
                DEFAULT_GRACE_MIN_SECONDS,
                DEFAULT_GRACE_MAX_SECONDS,
                DEFAULT_MAX_FUTURE_SKEW_SECONDS,
                true,
                DEFAULT_JOB_POLL_INTERVAL_MS,
                DEFAULT_JOB_BATCH_SIZE,
                DEFAULT_HISTORY_LIMIT,
                DEFAULT_UPTIME_WINDOW_HOURS,
                DEFAULT_ANOMALY_DECAY_MINUTES,
                0L,
                0,
                DEFAULT_KEY_CACHE_TTL_MS,
                DEFAULT_WORKER_MAX_BACKOFF_MS,
                DEFAULT_RANKING_INTERVAL_MS
        );
    }

    public static LiveGuardSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static LiveGuardSettings fromFile(SettingsFile f, LiveGuardSettings d) {
        int graceMin = positiveOr(f.graceSecondsMin(), d.graceSecondsMin());
        int graceMax = Math.max(graceMin, positiveOr(f.graceSecondsMax(), d.graceSecondsMax()));
        return new LiveGuardSettings(
                positiveOr(f.graceSecondsDefault(), d.graceSecondsDefault()),
                graceMin,
                graceMax,
                nonNegativeOr(f.maxFutureSkewSeconds(), d.maxFutureSkewSeconds()),
                f.enforceTimestampWindow() == null ? d.enforceTimestampWindow() : f.enforceTimestampWindow(),
                positiveOr(f.jobPollIntervalMs(), d.jobPollIntervalMs()),
                positiveOr(f.jobBatchSize(), d.jobBatchSize()),
                positiveOr(f.heartbeatHistoryLimit(), d.heartbeatHistoryLimit()),
                positiveOr(f.uptimeWindowHours(), d.uptimeWindowHours()),
                positiveOr(f.anomalyDecayMinutes(), d.anomalyDecayMinutes()),
                nonNegativeOr(f.jobClaimLeaseMs(), d.jobClaimLeaseMs()),
                nonNegativeOr(f.maxJobAttempts(), d.maxJobAttempts()),
                positiveOr(f.keyCacheTtlMs(), d.keyCacheTtlMs()),
                positiveOr(f.workerMaxBackoffMs(), d.workerMaxBackoffMs()),
                positiveOr(f.rankingIntervalMs(), d.rankingIntervalMs())
        );
    }

    /**
     * Cluster override when present, otherwise the configured default, clamped to
     * {@code [graceSecondsMin, graceSecondsMax]}.
     */
    public int resolveGraceSeconds(Integer clusterOverride) {
        int grace = clusterOverride == null ? graceSecondsDefault : clusterOverride;
        grace = Math.max(graceSecondsMin, grace);
        return Math.min(graceSecondsMax, grace);
    }

    public boolean retriesUnbounded() {
        return maxJobAttempts <= 0;
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static long positiveOr(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    private static int nonNegativeOr(Integer value, int fallback) {
        return value == null || value < 0 ? fallback : value;
    }

    private static long nonNegativeOr(Long value, long fallback) {
        return value == null || value < 0L ? fallback : value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer graceSecondsDefault,
            Integer graceSecondsMin,
            Integer graceSecondsMax,
            Integer maxFutureSkewSeconds,
            Boolean enforceTimestampWindow,
            Long jobPollIntervalMs,
            Integer jobBatchSize,
            Integer heartbeatHistoryLimit,
            Integer uptimeWindowHours,
            Integer anomalyDecayMinutes,
            Long jobClaimLeaseMs,
            Integer maxJobAttempts,
            Long keyCacheTtlMs,
            Long workerMaxBackoffMs,
            Long rankingIntervalMs
    ) {
    }
}
