package io.liveguard.model;

/**
 * Key material of the cluster a server belongs to. {@code graceWindowSeconds} is the raw
 * cluster override and may be null; resolve it through the settings before use.
 */
public record ClusterKey(
        String clusterId,
        String publicKey,
        int keyVersion,
        Integer graceWindowSeconds
) {
    public boolean hasPublicKey() {
        return publicKey != null && !publicKey.isBlank();
    }
}
