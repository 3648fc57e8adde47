package io.liveguard.testing;

import io.liveguard.config.LiveGuardSettings;

public final class TestSettings {
    private TestSettings() {
    }

    public static LiveGuardSettings defaults() {
        return LiveGuardSettings.defaults();
    }

    public static LiveGuardSettings withMaxJobAttempts(int maxJobAttempts) {
        LiveGuardSettings d = LiveGuardSettings.defaults();
        return new LiveGuardSettings(
                d.graceSecondsDefault(), d.graceSecondsMin(), d.graceSecondsMax(), d.maxFutureSkewSeconds(),
                d.enforceTimestampWindow(), d.jobPollIntervalMs(), d.jobBatchSize(), d.heartbeatHistoryLimit(),
                d.uptimeWindowHours(), d.anomalyDecayMinutes(), d.jobClaimLeaseMs(), maxJobAttempts,
                d.keyCacheTtlMs(), d.workerMaxBackoffMs(), d.rankingIntervalMs()
        );
    }

    public static LiveGuardSettings fastLoop() {
        LiveGuardSettings d = LiveGuardSettings.defaults();
        return new LiveGuardSettings(
                d.graceSecondsDefault(), d.graceSecondsMin(), d.graceSecondsMax(), d.maxFutureSkewSeconds(),
                d.enforceTimestampWindow(), 1L, d.jobBatchSize(), d.heartbeatHistoryLimit(),
                d.uptimeWindowHours(), d.anomalyDecayMinutes(), d.jobClaimLeaseMs(), d.maxJobAttempts(),
                d.keyCacheTtlMs(), 4L, d.rankingIntervalMs()
        );
    }

    public static LiveGuardSettings withoutTimestampWindow() {
        LiveGuardSettings d = LiveGuardSettings.defaults();
        return new LiveGuardSettings(
                d.graceSecondsDefault(), d.graceSecondsMin(), d.graceSecondsMax(), d.maxFutureSkewSeconds(),
                false, d.jobPollIntervalMs(), d.jobBatchSize(), d.heartbeatHistoryLimit(),
                d.uptimeWindowHours(), d.anomalyDecayMinutes(), d.jobClaimLeaseMs(), d.maxJobAttempts(),
                d.keyCacheTtlMs(), d.workerMaxBackoffMs(), d.rankingIntervalMs()
        );
    }
}
