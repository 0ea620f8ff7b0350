package io.github.galkahana.taskexecutor;

import java.time.Instant;

/**
 * The task whose failure aborted a run.
 *
 * @param taskId Id of the task that triggered the abort
 * @param attempt Zero-based attempt during which the abort was triggered
 * @param error The error (or wrapped panic) that triggered it
 * @param time When the abort was triggered
 */
public record AbortReason(int taskId, int attempt, Throwable error, Instant time) {
}
