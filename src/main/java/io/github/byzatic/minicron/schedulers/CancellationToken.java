package io.github.byzatic.minicron.schedulers;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop flag, one per job. Once requested it stays requested.
 */
public final class CancellationToken {
    // null until a stop is requested
    private final AtomicReference<String> reason = new AtomicReference<>();

    public boolean isStopRequested() {
        return reason.get() != null;
    }

    public String reason() {
        String r = reason.get();
        return r == null ? "" : r;
    }

    /**
     * @return {@code false} if a stop had already been requested; the first reason is kept
     */
    boolean requestStop(String reason) {
        return this.reason.compareAndSet(null, reason == null ? "" : reason);
    }

    /**
     * Lets long tasks bail out: throws if a stop has been requested.
     */
    public void throwIfStopRequested() throws InterruptedException {
        if (isStopRequested()) throw new InterruptedException("Stop requested: " + reason());
    }
}
