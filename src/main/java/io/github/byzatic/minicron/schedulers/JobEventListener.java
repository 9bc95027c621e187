package io.github.byzatic.minicron.schedulers;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Job lifecycle callbacks, invoked on the job's own thread (except {@link #onStopped} for a job
 * that never started). Exceptions thrown here are logged and ignored.
 */
public interface JobEventListener {
    default void onSleep(UUID jobId, LocalDateTime nextTick) {
    }

    default void onStart(UUID jobId) {
    }

    default void onComplete(UUID jobId) {
    }

    default void onError(UUID jobId, Throwable error) {
    }

    default void onStopped(UUID jobId) {
    }
}
