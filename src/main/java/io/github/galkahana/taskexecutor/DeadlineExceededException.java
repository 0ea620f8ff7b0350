package io.github.galkahana.taskexecutor;

import java.util.concurrent.CancellationException;

/**
 * Signals that a {@link CancellationToken} was cancelled because its deadline passed.
 */
public class DeadlineExceededException extends CancellationException {

    public DeadlineExceededException(String message) {
        super(message);
    }
}
