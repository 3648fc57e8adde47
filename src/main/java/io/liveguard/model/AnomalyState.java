package io.liveguard.model;

import java.time.Instant;

public record AnomalyState(boolean flagged, Instant lastDetectedAt) {
    private static final AnomalyState NONE = new AnomalyState(false, null);

    public static AnomalyState none() {
        return NONE;
    }
}
