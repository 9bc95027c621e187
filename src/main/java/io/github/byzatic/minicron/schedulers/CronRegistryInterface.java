package io.github.byzatic.minicron.schedulers;

import io.github.byzatic.minicron.base_exceptions.CronParseException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CronRegistryInterface extends AutoCloseable {
    void addListener(JobEventListener l);

    void removeListener(JobEventListener l);

    UUID register(String cron, CronTask task) throws CronParseException;

    void startAll();

    void stopAll();

    void stopAll(Duration grace);

    boolean remove(UUID jobId);

    Optional<JobInfo> query(UUID jobId);

    List<JobInfo> listJobs();

    @Override
    void close();
}
