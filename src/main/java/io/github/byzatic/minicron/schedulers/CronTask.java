package io.github.byzatic.minicron.schedulers;

/**
 * Work bound to a schedule. Arguments are bound by capturing them in the implementation.
 * <p>
 * Any exception thrown from {@link #run(CancellationToken)} fails the job permanently.
 */
@FunctionalInterface
public interface CronTask {
    void run(CancellationToken token) throws Exception;

    /**
     * Called from the stopping thread when the job is being stopped (optional).
     */
    default void onStopRequested() {
    }
}
