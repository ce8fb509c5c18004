package ai.deadwood.pool;

public record PoolStats(
        int totalWorkers,
        int idleWorkers,
        int busyWorkers,
        int errorWorkers,
        int queuedTasks,
        long tasksCompleted,
        long tasksFailed) {}
