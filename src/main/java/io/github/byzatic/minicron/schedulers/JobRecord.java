package io.github.byzatic.minicron.schedulers;

import java.util.concurrent.Future;

final class JobRecord {
    final JobRunner runner;

    // set once the runner has been handed to the executor
    volatile Future<?> future = null;

    JobRecord(JobRunner runner) {
        this.runner = runner;
    }
}
