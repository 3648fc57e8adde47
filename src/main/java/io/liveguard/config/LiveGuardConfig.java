package io.liveguard.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LiveGuardConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "liveguard.db";
    public static final String SETTINGS_FILE_NAME = "liveguard-settings.json";

    private final Path rootDir;

    public LiveGuardConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LiveGuardConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new LiveGuardConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }
}
