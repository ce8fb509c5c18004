package ai.deadwood.pool;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

public record WorkerSnapshot(
        int id,
        WorkerStatus status,
        @Nullable String currentTaskId,
        long tasksCompleted,
        long tasksFailed,
        Instant lastActivity) {}
