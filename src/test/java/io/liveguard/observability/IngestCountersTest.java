package io.liveguard.observability;

import io.liveguard.ingest.AdmissionResult;
import io.liveguard.model.RejectionReason;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class IngestCountersTest {
    @Test
    void separatesOutcomes() {
        IngestCounters counters = new IngestCounters();
        counters.record(AdmissionResult.accepted("srv-1", true));
        counters.record(AdmissionResult.accepted("srv-1", false));
        counters.record(AdmissionResult.replay("srv-1"));
        counters.record(AdmissionResult.rejected("srv-1", RejectionReason.TIMESTAMP_STALE));
        counters.record(AdmissionResult.rejected("srv-2", RejectionReason.TIMESTAMP_STALE));
        counters.recordIntegrityViolation();

        Assertions.assertEquals(2L, counters.accepted());
        Assertions.assertEquals(1L, counters.replayed());
        Assertions.assertEquals(1L, counters.fastPathFailures());
        Assertions.assertEquals(1L, counters.integrityViolations());
        Assertions.assertEquals(Map.of("timestamp_stale", 2L), counters.rejectedByReason());
    }
}
