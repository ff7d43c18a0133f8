package io.splitdrive.sql.exec.task;

public enum TaskState {
    RUNNING,
    FINISHED,
    CANCELED,
    FAILED;

    public boolean isDone() {
        return this != RUNNING;
    }
}
