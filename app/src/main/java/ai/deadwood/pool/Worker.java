package ai.deadwood.pool;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/** Pool-internal worker bookkeeping. All fields are guarded by the pool's lock. */
final class Worker {
    final int id;
    WorkerStatus status = WorkerStatus.IDLE;
    @Nullable String currentTaskId;
    long tasksCompleted;
    long tasksFailed;
    Instant lastActivity = Instant.now();

    Worker(int id) {
        this.id = id;
    }

    WorkerSnapshot snapshot() {
        return new WorkerSnapshot(id, status, currentTaskId, tasksCompleted, tasksFailed, lastActivity);
    }
}
