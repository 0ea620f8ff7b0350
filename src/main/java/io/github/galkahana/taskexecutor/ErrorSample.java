package io.github.galkahana.taskexecutor;

import java.time.Instant;

/**
 * One recorded task failure.
 *
 * @param error The error the attempt ended with
 * @param taskId Id of the failed task
 * @param attempt Zero-based attempt that failed
 * @param timestamp When the failure was recorded
 */
public record ErrorSample(Throwable error, int taskId, int attempt, Instant timestamp) {
}
