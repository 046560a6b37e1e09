package io.querygate.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class QueryGateConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "querygate-settings.json";
    public static final long DEFAULT_CALL_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_IDEMPOTENCY_TTL_DAYS = 7;
    public static final double DEFAULT_PRICE_PER_TIB_USD = 5.0;

    private final Path rootDir;

    public QueryGateConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static QueryGateConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new QueryGateConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("querygate.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditLogFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-hmac.key");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
