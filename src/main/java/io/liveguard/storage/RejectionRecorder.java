package io.liveguard.storage;

import io.liveguard.model.Rejection;

@FunctionalInterface
public interface RejectionRecorder {
    void record(Rejection rejection);
}
