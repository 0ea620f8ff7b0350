package io.github.galkahana.taskexecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one executor run. Built once after all workers have stopped.
 * <p>
 * Task failures never surface as exceptions from {@link TaskExecutor#run}; check {@link #hasErrors()}
 * and {@link #aborted()} instead.
 *
 * @param total Items to process (for stream runs, the number of items actually taken from the input)
 * @param success Tasks that completed without error
 * @param failed Tasks that ended in error, after retries
 * @param retried Total number of retries across all tasks
 * @param cancelled Tasks stopped by cancellation, timeout or abort
 * @param aborted Whether a policy aborted the run
 * @param abortReason The task that triggered the abort, null unless aborted
 * @param startTime When the run started
 * @param endTime When the run finished
 * @param errorSamples The first recorded failures, in recording order
 * @param errorCount Failure count per error message, empty unless error aggregation is enabled
 */
public record ExecutionResult(int total, int success, int failed, int retried, int cancelled,
                              boolean aborted, AbortReason abortReason,
                              Instant startTime, Instant endTime,
                              List<ErrorSample> errorSamples, Map<String, Integer> errorCount) {

    public ExecutionResult {
        errorSamples = errorSamples == null ? List.of() : List.copyOf(errorSamples);
        errorCount = errorCount == null ? Map.of() : Map.copyOf(errorCount);
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * @return true if any task failed or the run was aborted
     */
    public boolean hasErrors() {
        return failed > 0 || aborted;
    }

    /**
     * @return Percentage (0-100) of successful tasks, 0 for an empty run
     */
    public double successRate() {
        if (total == 0) {
            return 0;
        }
        return (double) success / total * 100;
    }

    /**
     * @return true if every item reached a terminal state. An aborted run may leave items that were
     *         never dispatched.
     */
    public boolean isComplete() {
        return success + failed + cancelled == total;
    }
}
