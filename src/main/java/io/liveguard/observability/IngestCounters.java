package io.liveguard.observability;

import io.liveguard.ingest.AdmissionResult;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process ingest outcome counters exported on {@code /metrics}.
 */
public final class IngestCounters {
    private final LongAdder accepted = new LongAdder();
    private final LongAdder replayed = new LongAdder();
    private final LongAdder fastPathFailures = new LongAdder();
    private final LongAdder integrityViolations = new LongAdder();
    private final Map<String, LongAdder> rejectedByReason = new ConcurrentHashMap<>();

    public void record(AdmissionResult result) {
        if (!result.accepted()) {
            rejectedByReason.computeIfAbsent(result.reason().code(), k -> new LongAdder()).increment();
        } else if (result.replay()) {
            replayed.increment();
        } else {
            accepted.increment();
            if (!result.processed()) {
                fastPathFailures.increment();
            }
        }
    }

    public void recordIntegrityViolation() {
        integrityViolations.increment();
    }

    public long accepted() {
        return accepted.sum();
    }

    public long replayed() {
        return replayed.sum();
    }

    public long fastPathFailures() {
        return fastPathFailures.sum();
    }

    public long integrityViolations() {
        return integrityViolations.sum();
    }

    public Map<String, Long> rejectedByReason() {
        Map<String, Long> out = new TreeMap<>();
        rejectedByReason.forEach((reason, count) -> out.put(reason, count.sum()));
        return out;
    }
}
