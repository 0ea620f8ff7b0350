package io.github.galkahana.taskexecutor;

/**
 * What to do right after a handler panicked. Either way the wrapped panic then goes through the
 * {@link ErrorPolicy} like any other task error.
 */
public enum PanicAction {
    /** Keep the run going and let the error policy decide the task's fate. */
    CONTINUE,
    /** Record the abort reason and cancel the whole run. The task ends as failed. */
    ABORT
}
