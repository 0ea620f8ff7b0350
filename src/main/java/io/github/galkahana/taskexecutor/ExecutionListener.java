package io.github.galkahana.taskexecutor;

import java.time.Duration;

/**
 * Lifecycle callbacks of an executor run. All methods default to no-ops, so implement only what you need.
 * <p>
 * Callbacks are observational: the executor ignores what they do, and a {@link RuntimeException} thrown
 * from one is logged and otherwise ignored. The per-task callbacks are invoked from worker threads
 * concurrently.
 *
 * @param <T> Item type
 */
public interface ExecutionListener<T> {

    /**
     * Called once when the run starts. Stream runs report a total of 0 since it is not known yet.
     */
    default void onBegin(CancellationToken token, int total) {}

    /**
     * Called before every attempt of a task.
     */
    default void onBefore(CancellationToken token, T item, int attempt) {}

    /**
     * Called after every attempt of a task, with its error (null on success) and wall time.
     */
    default void onAfter(CancellationToken token, T item, Throwable error, Duration elapsed) {}

    /**
     * Called when an attempt failed, including attempts that failed because of cancellation.
     */
    default void onError(CancellationToken token, T item, Throwable error, int attempt) {}

    /**
     * Called once with the final result. Not called for an empty batch.
     */
    default void onEnd(CancellationToken token, ExecutionResult result) {}
}
