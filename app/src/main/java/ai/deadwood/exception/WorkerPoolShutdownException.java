package ai.deadwood.exception;

public class WorkerPoolShutdownException extends RuntimeException {
    public WorkerPoolShutdownException(String message) {
        super(message);
    }
}
