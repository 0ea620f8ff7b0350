package io.github.galkahana.taskexecutor;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Decides what happens to a task whose handler threw.
 * <p>
 * Policies are called concurrently from every worker and must be thread-safe.
 *
 * @param <T> Item type
 */
@FunctionalInterface
public interface ErrorPolicy<T> {

    /**
     * @param error The error the handler threw
     * @param item The item being processed
     * @param attempt Zero-based attempt number of the failed execution
     * @return How to proceed with the task
     */
    ErrorAction decide(Throwable error, T item, int attempt);

    /**
     * Mark the task failed and move on. This is the default.
     */
    static <T> ErrorPolicy<T> alwaysContinue() {
        return (error, item, attempt) -> ErrorAction.CONTINUE;
    }

    /**
     * Retry every failure, up to the configured max retry count.
     */
    static <T> ErrorPolicy<T> alwaysRetry() {
        return (error, item, attempt) -> ErrorAction.RETRY;
    }

    /**
     * Retry failures caused by a timeout the handler ran into, a {@link java.util.concurrent.TimeoutException}
     * or a {@link DeadlineExceededException} of the handler's own anywhere in the cause chain, and continue
     * otherwise. Expiry of the executor's per-task timeout ends the task as cancelled and never reaches a policy.
     */
    static <T> ErrorPolicy<T> retryOnTimeout() {
        return (error, item, attempt) -> Failures.isTimeout(error) ? ErrorAction.RETRY : ErrorAction.CONTINUE;
    }

    /**
     * Abort the run on any failure.
     */
    static <T> ErrorPolicy<T> abortOnError() {
        return (error, item, attempt) -> ErrorAction.ABORT;
    }

    /**
     * Abort on the first failure seen by this policy instance, continue on every later one.
     * <p>
     * Workers run concurrently, so other tasks may already have failed (and been counted as failed) by the
     * time the abort cancels the run. Use a fresh instance per executor.
     */
    static <T> ErrorPolicy<T> abortOnFirstError() {
        AtomicBoolean first = new AtomicBoolean(true);
        return (error, item, attempt) -> first.compareAndSet(true, false) ? ErrorAction.ABORT : ErrorAction.CONTINUE;
    }

    /**
     * Retry when {@code shouldRetry} matches the error, continue otherwise.
     */
    static <T> ErrorPolicy<T> retryOnCondition(Predicate<Throwable> shouldRetry) {
        return (error, item, attempt) -> shouldRetry.test(error) ? ErrorAction.RETRY : ErrorAction.CONTINUE;
    }

    /**
     * Abort when {@code shouldAbort} matches the error, continue otherwise.
     */
    static <T> ErrorPolicy<T> abortOnCondition(Predicate<Throwable> shouldAbort) {
        return (error, item, attempt) -> shouldAbort.test(error) ? ErrorAction.ABORT : ErrorAction.CONTINUE;
    }

    /**
     * Evaluate {@code policies} in order and return the first decision that is not
     * {@link ErrorAction#CONTINUE}, or CONTINUE if all of them continue.
     */
    @SafeVarargs
    static <T> ErrorPolicy<T> combine(ErrorPolicy<T>... policies) {
        List<ErrorPolicy<T>> chain = List.of(policies);
        return (error, item, attempt) -> {
            for (ErrorPolicy<T> policy : chain) {
                ErrorAction action = policy.decide(error, item, attempt);
                if (action != ErrorAction.CONTINUE) {
                    return action;
                }
            }
            return ErrorAction.CONTINUE;
        };
    }
}
