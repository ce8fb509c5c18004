package ai.deadwood.pool;

public enum WorkerStatus {
    IDLE,
    BUSY,
    ERROR,
    TERMINATED
}
