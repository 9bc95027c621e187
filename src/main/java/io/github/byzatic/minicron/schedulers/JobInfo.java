package io.github.byzatic.minicron.schedulers;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read-only snapshot of a job. Fields are sampled one by one and may be mutually stale.
 */
public final class JobInfo {
    public final UUID id;
    public final String cron;
    public final JobStatus status;
    public final LocalDateTime lastRunTime;
    public final LocalDateTime nextTick;
    public final String lastError;

    JobInfo(UUID id, String cron, JobStatus status, LocalDateTime lastRunTime, LocalDateTime nextTick, String lastError) {
        this.id = id;
        this.cron = cron;
        this.status = status;
        this.lastRunTime = lastRunTime;
        this.nextTick = nextTick;
        this.lastError = lastError;
    }

    @Override
    public String toString() {
        return "JobInfo{id=" + id + ", cron='" + cron + "', status=" + status +
                ", lastRunTime=" + lastRunTime + ", nextTick=" + nextTick +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
