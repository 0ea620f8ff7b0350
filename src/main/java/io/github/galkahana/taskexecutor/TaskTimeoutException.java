package io.github.galkahana.taskexecutor;

import java.time.Duration;

/**
 * A single task attempt ran past the configured per-task timeout.
 */
public class TaskTimeoutException extends DeadlineExceededException {

    private final Duration timeout;

    public TaskTimeoutException(Duration timeout, Throwable cause) {
        super("task timeout after " + Durations.format(timeout));
        this.timeout = timeout;
        if (cause != null) {
            initCause(cause);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }
}
