package io.github.galkahana.taskexecutor;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Cause-chain checks shared by the executor and the built-in policies.
 */
final class Failures {

    private static final int MAX_CAUSE_DEPTH = 64;

    private Failures() {
    }

    static boolean causedBy(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    static boolean isCancellation(Throwable error) {
        return causedBy(error, CancellationException.class);
    }

    static boolean isTimeout(Throwable error) {
        return causedBy(error, DeadlineExceededException.class) || causedBy(error, TimeoutException.class);
    }

    /**
     * Aggregation key for an error: its message, or its class name when there is none.
     */
    static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }
}
