package io.github.byzatic.minicron.schedulers;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.byzatic.minicron.base_exceptions.CronParseException;
import io.github.byzatic.minicron.cron.CronSpec;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CronRegistry
 * - Register tasks against 5-field cron expressions or aliases (parsed immediately, fail fast)
 * - One thread per job; jobs never block or affect each other
 * - A failing task stops only its own job (status FAILED, no retry)
 * - Real cancellation: stopAll() flags every job and interrupts its thread
 * - Event subscription (sleep/start/complete/error/stopped)
 *
 * <pre>{@code
 * try (CronRegistry registry = new CronRegistry.Builder().build()) {
 *     registry.register("@hourly", token -> report.send());
 *     registry.register("0 9 * * 0", token -> digest.mail(team));
 *     registry.startAll();
 *     ...
 * }
 * }</pre>
 */
public final class CronRegistry implements CronRegistryInterface {
    private final static Logger logger = LoggerFactory.getLogger(CronRegistry.class);

    private final ThreadPoolExecutor executor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final long defaultGraceMillis;
    private final List<JobEventListener> listeners;
    private final Map<UUID, JobRecord> jobs = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private CronRegistry(ThreadPoolExecutor executor, Clock clock, Sleeper sleeper, long defaultGraceMillis,
                         List<JobEventListener> listeners) {
        this.executor = executor;
        this.clock = clock;
        this.sleeper = sleeper;
        this.defaultGraceMillis = defaultGraceMillis;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    public static final class Builder {
        private ThreadPoolExecutor executor;
        private Clock clock = Clock.systemDefaultZone();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private long defaultGraceMillis = TimeUnit.SECONDS.toMillis(10);
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        /**
         * Pool the job threads come from. Each job keeps its thread until it stops, so the pool
         * needs room for every registered job.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * Time zone the cron fields are evaluated in. Shortcut for a system clock in that zone.
         */
        public Builder zone(ZoneId zone) {
            this.clock = Clock.system(Objects.requireNonNull(zone));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper);
            return this;
        }

        /**
         * How long {@link CronRegistry#stopAll()}, {@link CronRegistry#remove(UUID)} and
         * {@link CronRegistry#close()} wait for a job thread to finish.
         */
        public Builder defaultGrace(Duration grace) {
            this.defaultGraceMillis = Objects.requireNonNull(grace).toMillis();
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public CronRegistry build() {
            if (executor == null) {
                executor = new ThreadPoolExecutor(
                        0, Integer.MAX_VALUE,
                        60, TimeUnit.SECONDS,
                        new SynchronousQueue<>(),
                        new ThreadFactoryBuilder()
                                .setNameFormat("minicron-job-%d")
                                .setDaemon(false)
                                .setUncaughtExceptionHandler((th, ex) ->
                                        logger.error("Uncaught in {}", th.getName(), ex))
                                .build()
                );
            }
            return new CronRegistry(executor, clock, sleeper, defaultGraceMillis, listeners);
        }
    }

    @Override
    public void addListener(JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    @Override
    public void removeListener(JobEventListener l) {
        listeners.remove(l);
    }

    /**
     * Parse the expression and register the task. Starts the job right away if {@link #startAll()}
     * was already called.
     *
     * @throws CronParseException if the expression is invalid; nothing is registered then
     */
    @Override
    public @NotNull UUID register(@NotNull String cron, @NotNull CronTask task) throws CronParseException {
        Objects.requireNonNull(task);
        if (closed.get()) throw new IllegalStateException("Registry is closed");
        CronSpec spec = CronSpec.parse(cron);
        UUID id = UUID.randomUUID();
        JobRecord rec = new JobRecord(new JobRunner(id, spec, task, clock, sleeper, listeners));
        jobs.put(id, rec);
        logger.info("Registered job {} with schedule '{}' ({})", id, spec.getExpression(), spec);

        synchronized (this) {
            if (started.get()) submit(rec);
        }
        return id;
    }

    /**
     * Give every registered job its own thread. Jobs already started or stopped are left alone.
     */
    @Override
    public synchronized void startAll() {
        if (closed.get()) throw new IllegalStateException("Registry is closed");
        started.set(true);
        for (JobRecord rec : jobs.values()) {
            submit(rec);
        }
        logger.info("Started {} job(s)", jobs.size());
    }

    @Override
    public void stopAll() {
        stopAll(Duration.ofMillis(defaultGraceMillis));
    }

    /**
     * Stop every job: flag it, interrupt its thread, then wait up to {@code grace} per job.
     * Stopped jobs stay registered with status STOPPED (FAILED ones keep FAILED).
     */
    @Override
    public void stopAll(Duration grace) {
        List<JobRecord> snapshot;
        // same lock as register and startAll, so no job is submitted once this block is done
        synchronized (this) {
            started.set(false);
            snapshot = new ArrayList<>(jobs.values());
            for (JobRecord rec : snapshot) {
                requestStop(rec, "Stop requested");
            }
        }
        for (JobRecord rec : snapshot) {
            awaitStop(rec, grace);
        }
    }

    /**
     * Stop a job with the default grace period and forget it.
     */
    @Override
    public boolean remove(UUID jobId) {
        JobRecord rec = jobs.remove(jobId);
        if (rec == null) return false;
        requestStop(rec, "Removed");
        awaitStop(rec, Duration.ofMillis(defaultGraceMillis));
        return true;
    }

    @Override
    public Optional<JobInfo> query(UUID jobId) {
        JobRecord r = jobs.get(jobId);
        if (r == null) return Optional.empty();
        return Optional.of(r.runner.snapshot());
    }

    @Override
    public List<JobInfo> listJobs() {
        List<JobInfo> out = new ArrayList<>();
        for (JobRecord r : jobs.values()) {
            out.add(r.runner.snapshot());
        }
        return out;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        stopAll(Duration.ofMillis(defaultGraceMillis));
        executor.shutdown();
        try {
            if (!executor.awaitTermination(defaultGraceMillis, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private synchronized void submit(JobRecord rec) {
        if (rec.future != null || rec.runner.isStarted()) return;
        try {
            rec.future = executor.submit(rec.runner);
        } catch (RejectedExecutionException e) {
            logger.error("Executor rejected job {}", rec.runner.getId(), e);
            throw e;
        }
    }

    private void requestStop(JobRecord rec, String reason) {
        rec.runner.requestStop(reason);
        Future<?> f = rec.future;
        if (f != null && !f.isDone()) {
            f.cancel(true); // interrupt sleep or task
        }
    }

    private void awaitStop(JobRecord rec, Duration grace) {
        try {
            if (!rec.runner.awaitTermination(grace)) {
                logger.warn("Job {} did not stop within {} ms", rec.runner.getId(), grace.toMillis());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
