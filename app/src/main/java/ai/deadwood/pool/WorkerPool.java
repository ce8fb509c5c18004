package ai.deadwood.pool;

import ai.deadwood.config.EngineSettings;
import ai.deadwood.exception.TaskTimeoutException;
import ai.deadwood.exception.WorkerPoolShutdownException;
import ai.deadwood.model.FileAnalysisResult;
import ai.deadwood.util.ExecutorServiceUtil;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Fixed set of workers, each backed by one daemon platform thread, running analysis tasks one at a time.
 *
 * <p>{@link #executeTask} never blocks: the task is queued FIFO and handed to the next idle worker. A worker whose task
 * fails goes to {@link WorkerStatus#ERROR} and takes no work until its cool-down expires; failed tasks are not retried.
 * With a task timeout configured, a task that has not finished by its deadline fails its future with
 * {@link TaskTimeoutException}; the worker itself stays busy until the task returns, since running code is never
 * interrupted.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(WorkerPool.class);

    private final Object lock = new Object();
    private final List<Worker> workers;
    private final ArrayDeque<Pending> queue = new ArrayDeque<>();
    private final Set<String> activeTaskIds = new HashSet<>();
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final Duration errorCooldown;
    private final Duration taskTimeout;
    private final Duration shutdownTimeout;
    private boolean shuttingDown;

    private static final class Pending {
        final AnalysisTask task;
        final CompletableFuture<FileAnalysisResult> future = new CompletableFuture<>();
        // set by whichever of completion and deadline gets there first
        final AtomicBoolean settled = new AtomicBoolean();
        @Nullable ScheduledFuture<?> deadline;

        Pending(AnalysisTask task) {
            this.task = task;
        }
    }

    public WorkerPool(int size, Duration errorCooldown, Duration taskTimeout, Duration shutdownTimeout) {
        if (size < 1) {
            throw new IllegalArgumentException("Worker pool needs at least one worker, got " + size);
        }
        var list = new ArrayList<Worker>(size);
        for (int i = 0; i < size; i++) {
            list.add(new Worker(i));
        }
        this.workers = List.copyOf(list);
        this.executor = ExecutorServiceUtil.newFixedThreadExecutor(size, "deadwood-worker-");
        this.scheduler = ExecutorServiceUtil.newScheduler("deadwood-pool-timer");
        this.errorCooldown = errorCooldown;
        this.taskTimeout = taskTimeout;
        this.shutdownTimeout = shutdownTimeout;
        logger.debug("Started worker pool with {} worker(s)", size);
    }

    public WorkerPool(EngineSettings settings) {
        this(settings.workerCount(), settings.errorCooldown(), settings.taskTimeout(), settings.shutdownTimeout());
    }

    /**
     * Queues a task. The returned future completes with the task's result, or exceptionally with whatever it threw,
     * {@link TaskTimeoutException}, or {@link WorkerPoolShutdownException}.
     *
     * @throws IllegalStateException if a task with the same id is already queued or running
     */
    public CompletableFuture<FileAnalysisResult> executeTask(AnalysisTask task) {
        var pending = new Pending(task);
        synchronized (lock) {
            if (shuttingDown) {
                return CompletableFuture.failedFuture(
                        new WorkerPoolShutdownException("Worker pool is shutting down"));
            }
            if (!activeTaskIds.add(task.taskId())) {
                throw new IllegalStateException("Task " + task.taskId() + " is already queued or running");
            }
            queue.addLast(pending);
            drainLocked();
        }
        return pending.future;
    }

    private void drainLocked() {
        while (!shuttingDown && !queue.isEmpty()) {
            var worker = idleWorkerLocked();
            if (worker == null) {
                return;
            }
            var pending = queue.pollFirst();
            worker.status = WorkerStatus.BUSY;
            worker.currentTaskId = pending.task.taskId();
            worker.lastActivity = Instant.now();
            if (!taskTimeout.isZero()) {
                pending.deadline = scheduler.schedule(
                        () -> onDeadline(worker, pending), taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            executor.execute(() -> run(worker, pending));
        }
    }

    private @Nullable Worker idleWorkerLocked() {
        for (var worker : workers) {
            if (worker.status == WorkerStatus.IDLE) {
                return worker;
            }
        }
        return null;
    }

    private void run(Worker worker, Pending pending) {
        var taskId = pending.task.taskId();
        logger.trace("Worker {} running {}", worker.id, taskId);
        @Nullable FileAnalysisResult result = null;
        @Nullable Throwable failure = null;
        try {
            result = pending.task.work().run();
        } catch (Throwable t) {
            failure = t;
            logger.debug("Task {} failed on worker {}: {}", taskId, worker.id, t.toString());
        }

        boolean first = pending.settled.compareAndSet(false, true);
        synchronized (lock) {
            activeTaskIds.remove(taskId);
            if (pending.deadline != null) {
                pending.deadline.cancel(false);
            }
            if (first) {
                if (failure == null) {
                    worker.tasksCompleted++;
                } else {
                    worker.tasksFailed++;
                }
            }
            worker.currentTaskId = null;
            worker.lastActivity = Instant.now();
            if (worker.status != WorkerStatus.TERMINATED) {
                if (failure != null || !first) {
                    worker.status = WorkerStatus.ERROR;
                    scheduleResetLocked(worker);
                } else {
                    worker.status = WorkerStatus.IDLE;
                }
            }
            lock.notifyAll();
            drainLocked();
        }

        if (first) {
            if (failure == null) {
                pending.future.complete(result);
            } else {
                pending.future.completeExceptionally(failure);
            }
        }
    }

    private void onDeadline(Worker worker, Pending pending) {
        if (!pending.settled.compareAndSet(false, true)) {
            return;
        }
        synchronized (lock) {
            worker.tasksFailed++;
        }
        logger.warn("Task {} exceeded {} ms on worker {}", pending.task.taskId(), taskTimeout.toMillis(), worker.id);
        pending.future.completeExceptionally(new TaskTimeoutException(pending.task.taskId(), taskTimeout));
    }

    private void scheduleResetLocked(Worker worker) {
        if (shuttingDown) {
            return;
        }
        scheduler.schedule(
                () -> {
                    synchronized (lock) {
                        if (worker.status == WorkerStatus.ERROR) {
                            worker.status = WorkerStatus.IDLE;
                            drainLocked();
                        }
                    }
                },
                errorCooldown.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    /**
     * Stops admission, waits up to {@code timeout} for busy workers, terminates all workers and rejects whatever is
     * still queued. Tasks still running past the timeout are left to finish on their own.
     *
     * @return true if no worker was busy when the pool terminated
     */
    public boolean shutdown(Duration timeout) {
        List<Pending> rejected;
        boolean drained;
        synchronized (lock) {
            if (!shuttingDown) {
                shuttingDown = true;
                logger.debug("Shutting down worker pool, {} task(s) queued", queue.size());
            }
            long deadline = System.nanoTime() + timeout.toNanos();
            while (busyCountLocked() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                try {
                    lock.wait(TimeUnit.NANOSECONDS.toMillis(remaining) + 1);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            drained = busyCountLocked() == 0;
            for (var worker : workers) {
                worker.status = WorkerStatus.TERMINATED;
            }
            rejected = new ArrayList<>(queue);
            queue.clear();
            rejected.forEach(p -> activeTaskIds.remove(p.task.taskId()));
        }

        for (var pending : rejected) {
            if (pending.settled.compareAndSet(false, true)) {
                pending.future.completeExceptionally(new WorkerPoolShutdownException("Worker pool shut down"));
            }
        }
        executor.shutdown();
        scheduler.shutdownNow();
        if (!drained) {
            logger.warn("Worker pool terminated with tasks still running after {} ms", timeout.toMillis());
        }
        return drained;
    }

    public boolean isShutdown() {
        synchronized (lock) {
            return shuttingDown;
        }
    }

    private int busyCountLocked() {
        int busy = 0;
        for (var worker : workers) {
            if (worker.status == WorkerStatus.BUSY) {
                busy++;
            }
        }
        return busy;
    }

    public PoolStats stats() {
        synchronized (lock) {
            int idle = 0, busy = 0, error = 0;
            long completed = 0, failed = 0;
            for (var worker : workers) {
                switch (worker.status) {
                    case IDLE -> idle++;
                    case BUSY -> busy++;
                    case ERROR -> error++;
                    case TERMINATED -> {}
                }
                completed += worker.tasksCompleted;
                failed += worker.tasksFailed;
            }
            return new PoolStats(workers.size(), idle, busy, error, queue.size(), completed, failed);
        }
    }

    public List<WorkerSnapshot> workers() {
        synchronized (lock) {
            return workers.stream().map(Worker::snapshot).toList();
        }
    }

    @Override
    public void close() {
        shutdown(shutdownTimeout);
    }
}
