package io.meshgraph.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MeshGraphConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_DB_FILE = "mqtt_messages.db";
    public static final int DEFAULT_WRITE_ATTEMPTS = 3;
    public static final long DEFAULT_WRITE_BACKOFF_MS = 50L;
    public static final int DEFAULT_RETENTION_DAYS = 7;
    public static final int DEFAULT_RETENTION_BATCH = 10_000;
    public static final long DEFAULT_METRICS_INTERVAL_MS = 30_000L;

    private final Path rootDir;
    private final Path artifactsDir;
    private final int writeAttempts;
    private final long writeBackoffMs;

    public MeshGraphConfig(Path rootDir, Path artifactsDir, int writeAttempts, long writeBackoffMs) {
        this.rootDir = rootDir;
        this.artifactsDir = artifactsDir;
        this.writeAttempts = Math.max(1, writeAttempts);
        this.writeBackoffMs = Math.max(0L, writeBackoffMs);
    }

    public static MeshGraphConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static MeshGraphConfig fromRoot(String root, String artifacts) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Path out = artifacts == null || artifacts.isBlank()
                ? base.resolve("artifacts")
                : Paths.get(artifacts).toAbsolutePath().normalize();
        return new MeshGraphConfig(base, out, DEFAULT_WRITE_ATTEMPTS, DEFAULT_WRITE_BACKOFF_MS);
    }

    public MeshGraphConfig withWriteRetry(int attempts, long backoffMs) {
        return new MeshGraphConfig(rootDir, artifactsDir, attempts, backoffMs);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DEFAULT_DB_FILE);
    }

    public Path artifactsDir() {
        return artifactsDir;
    }

    public Path metricsFile() {
        return rootDir.resolve("collector-metrics.prom");
    }


    public int writeAttempts() {
        return writeAttempts;
    }

    public long writeBackoffMs() {
        return writeBackoffMs;
    }
}
