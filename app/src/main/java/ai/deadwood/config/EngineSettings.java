package ai.deadwood.config;

import java.time.Duration;

/**
 * How the engine runs: pool size, timeouts and cache limits.
 *
 * @param taskTimeout zero disables the per-task deadline
 * @param commitCacheTtl lifetime of whole-run results cached by commit analysis
 */
public record EngineSettings(
        int workerCount,
        Duration errorCooldown,
        Duration taskTimeout,
        Duration shutdownTimeout,
        Duration cacheTtl,
        int cacheMaxEntries,
        Duration commitCacheTtl) {

    public EngineSettings {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        if (cacheMaxEntries < 1) {
            throw new IllegalArgumentException("cacheMaxEntries must be >= 1, got " + cacheMaxEntries);
        }
        if (taskTimeout.isNegative() || errorCooldown.isNegative()) {
            throw new IllegalArgumentException("Durations must not be negative");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
                Duration.ofSeconds(1),
                Duration.ZERO,
                Duration.ofSeconds(30),
                Duration.ofHours(1),
                10_000,
                Duration.ofHours(24));
    }

    public boolean hasTaskTimeout() {
        return !taskTimeout.isZero();
    }

    public EngineSettings withWorkerCount(int count) {
        return new EngineSettings(
                count, errorCooldown, taskTimeout, shutdownTimeout, cacheTtl, cacheMaxEntries, commitCacheTtl);
    }

    public EngineSettings withTaskTimeout(Duration timeout) {
        return new EngineSettings(
                workerCount, errorCooldown, timeout, shutdownTimeout, cacheTtl, cacheMaxEntries, commitCacheTtl);
    }

    public EngineSettings withErrorCooldown(Duration cooldown) {
        return new EngineSettings(
                workerCount, cooldown, taskTimeout, shutdownTimeout, cacheTtl, cacheMaxEntries, commitCacheTtl);
    }

    public EngineSettings withCache(Duration ttl, int maxEntries) {
        return new EngineSettings(
                workerCount, errorCooldown, taskTimeout, shutdownTimeout, ttl, maxEntries, commitCacheTtl);
    }
}
