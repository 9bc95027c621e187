package io.github.byzatic.minicron.schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Suspends the calling job thread. Swappable so time-based behaviour can be tested without real waiting.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };

    /**
     * @throws InterruptedException if the job thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
