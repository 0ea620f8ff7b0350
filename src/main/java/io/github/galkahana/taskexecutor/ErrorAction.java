package io.github.galkahana.taskexecutor;

/**
 * What to do with a task whose handler failed.
 */
public enum ErrorAction {
    /** Mark the task failed and move on to the next item. */
    CONTINUE("Continue"),
    /** Run the task again, subject to the configured max retry count and backoff. */
    RETRY("Retry"),
    /** Mark the task failed and cancel the whole run. */
    ABORT("Abort");

    private final String label;

    ErrorAction(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
