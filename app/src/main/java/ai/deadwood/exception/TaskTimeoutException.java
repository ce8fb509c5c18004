package ai.deadwood.exception;

import java.time.Duration;

public class TaskTimeoutException extends RuntimeException {
    private final String taskId;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task %s did not finish within %d ms".formatted(taskId, timeout.toMillis()));
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
