package io.splitdrive.sql.exec;

/**
 * Failure raised by a task while producing output. The original error is the cause.
 */
public class ExecutorFailureException extends QueryHarnessException {

    private final String taskId;

    public ExecutorFailureException(String taskId, Throwable cause) {
        super("Task %s failed: %s".formatted(taskId, cause.getMessage()), cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
