package io.github.byzatic.minicron.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.minicron.cron.CronSpec;
import io.github.byzatic.minicron.cron.TickResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Scheduling loop of a single job, meant to own one thread for its whole life.
 * <p>
 * Each cycle resolves the next tick, sleeps until it, then runs the task. A task that throws moves the
 * job to {@link JobStatus#FAILED} and ends the loop; there is no retry. {@link #requestStop(String)}
 * ends the loop with {@link JobStatus#STOPPED}.
 * <p>
 * The runner thread is the only writer of the job state; readers get best-effort snapshots.
 */
@ThreadSafe
public final class JobRunner implements Runnable {
    private final static Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private final UUID id;
    private final CronSpec spec;
    private final CronTask task;
    private final Clock clock;
    private final Sleeper sleeper;
    private final List<JobEventListener> listeners;

    private final CancellationToken token = new CancellationToken();
    private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.SCHEDULED);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile LocalDateTime lastRunTime = null;
    private volatile LocalDateTime nextTick = null;
    private volatile String lastError = null;

    /**
     * @param listeners live view; listeners added later are notified too
     */
    public JobRunner(@NotNull UUID id, @NotNull CronSpec spec, @NotNull CronTask task, @NotNull Clock clock,
                     @NotNull Sleeper sleeper, @NotNull List<JobEventListener> listeners) {
        this.id = Objects.requireNonNull(id);
        this.spec = Objects.requireNonNull(spec);
        this.task = Objects.requireNonNull(task);
        this.clock = Objects.requireNonNull(clock);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.listeners = Objects.requireNonNull(listeners);
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            // already running elsewhere, or stopped before it got a thread
            logger.debug("Job {} not started: status {}", id, status.get());
            return;
        }
        try {
            loop();
        } finally {
            finished.countDown();
        }
    }

    private void loop() {
        logger.debug("Job {} ({}) loop started", id, spec);
        LocalDateTime lastFired = null;
        try {
            while (!token.isStopRequested() && !Thread.currentThread().isInterrupted()) {
                LocalDateTime now = TickResolver.truncate(LocalDateTime.now(clock));
                if (lastFired != null && now.isBefore(lastFired)) {
                    // woke before the tick, or the clock went back: never fire a tick twice
                    now = lastFired;
                }
                LocalDateTime next = TickResolver.nextTick(spec, now);
                Duration wait = TickResolver.sleepInterval(next, ZonedDateTime.now(clock));

                nextTick = next;
                status.set(JobStatus.SLEEPING);
                logger.debug("Job {} sleeping {} ms until {}", id, wait.toMillis(), next);
                fire(l -> l.onSleep(id, next));
                sleeper.sleep(wait);

                if (token.isStopRequested()) break;

                lastFired = next;
                status.set(JobStatus.RUNNING);
                fire(l -> l.onStart(id));
                try {
                    task.run(token);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Throwable ex) {
                    fail(ex);
                    return;
                }
                LocalDateTime ended = TickResolver.truncate(LocalDateTime.now(clock));
                lastRunTime = ended.isBefore(next) ? next : ended;
                logger.debug("Job {} completed run at {}", id, lastRunTime);
                fire(l -> l.onComplete(id));
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException ex) {
            // tick resolution or sleeper broke
            fail(ex);
            return;
        }
        markStopped();
    }

    private void fail(Throwable ex) {
        lastError = String.valueOf(ex);
        status.set(JobStatus.FAILED);
        logger.error("Job {} ({}) failed and will not be rescheduled", id, spec, ex);
        fire(l -> l.onError(id, ex));
    }

    private void markStopped() {
        status.set(JobStatus.STOPPED);
        logger.info("Job {} ({}) stopped: {}", id, spec, token.isStopRequested() ? token.reason() : "interrupted");
        fire(l -> l.onStopped(id));
    }

    /**
     * Asks the loop to end. A job that was never started becomes {@link JobStatus#STOPPED} right away;
     * a running one stops at its next check or on interrupt of its thread.
     */
    public void requestStop(@NotNull String reason) {
        if (!token.requestStop(reason)) return;
        try {
            task.onStopRequested();
        } catch (Throwable t) {
            logger.warn("Job {} onStopRequested hook failed", id, t);
        }
        if (started.compareAndSet(false, true)) {
            markStopped();
            finished.countDown();
        }
    }

    /**
     * Waits for the loop to end.
     *
     * @return {@code true} if the loop ended (or never started and was stopped) within {@code timeout}
     */
    public boolean awaitTermination(@NotNull Duration timeout) throws InterruptedException {
        return finished.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.warn("Listener failed for job {}, ignoring", id, t);
            }
        }
    }

    public @NotNull UUID getId() {
        return id;
    }

    public @NotNull CronSpec getSpec() {
        return spec;
    }

    public @NotNull JobStatus getStatus() {
        return status.get();
    }

    /**
     * Minute at which the last successful run returned: the clock is read again when the task returns
     * and truncated, and the result is never earlier than the tick that fired.
     *
     * @return {@code null} until a run completes without throwing
     */
    public @Nullable LocalDateTime getLastRunTime() {
        return lastRunTime;
    }

    public @Nullable LocalDateTime getNextTick() {
        return nextTick;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    public boolean isStarted() {
        return started.get();
    }

    public @NotNull JobInfo snapshot() {
        return new JobInfo(id, spec.getExpression(), status.get(), lastRunTime, nextTick, lastError);
    }
}
