package io.liveguard.storage;

import io.liveguard.model.FastPathUpdate;

/**
 * The only derived-state write the ingest path is allowed to make.
 */
@FunctionalInterface
public interface FastPathWriter {
    void writeFastPath(String serverId, FastPathUpdate update);
}
