package io.github.byzatic.minicron.schedulers;

/**
 * Lifecycle of a scheduled job.
 * <p>
 * {@code SCHEDULED -> SLEEPING -> RUNNING -> SLEEPING ...}; a task failure ends in {@link #FAILED},
 * an explicit stop ends in {@link #STOPPED}.
 */
public enum JobStatus {
    SCHEDULED,
    SLEEPING,
    RUNNING,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == FAILED || this == STOPPED;
    }

    public static String getStatusMessage(JobStatus status) {
        return switch (status) {
            case SCHEDULED -> "SCHEDULED: Job is registered but its loop has not started.";
            case SLEEPING -> "SLEEPING: Job is waiting for its next tick.";
            case RUNNING -> "RUNNING: Job task is executing.";
            case FAILED -> "FAILED: Job task threw and the job will not run again.";
            case STOPPED -> "STOPPED: Job was stopped and will not run again.";
        };
    }
}
