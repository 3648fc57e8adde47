package io.liveguard.storage;

import io.liveguard.model.ClusterKey;

import java.util.Optional;

/**
 * Read side of the administrative cluster/server collaborator.
 */
public interface ClusterDirectory {
    /**
     * Key material and grace override of the cluster {@code serverId} belongs to; empty when
     * the server or its cluster is unknown.
     */
    Optional<ClusterKey> clusterForServer(String serverId);
}
