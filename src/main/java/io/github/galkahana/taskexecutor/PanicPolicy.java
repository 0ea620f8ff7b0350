package io.github.galkahana.taskexecutor;

/**
 * Decides whether a handler panic, i.e. an {@link Error} escaping the handler, aborts the run.
 * The panic, wrapped in a {@link HandlerPanicException}, is afterwards handled as the attempt's error.
 *
 * @param <T> Item type
 */
@FunctionalInterface
public interface PanicPolicy<T> {

    /**
     * @param panic The throwable that escaped the handler
     * @param item The item being processed
     * @param attempt Zero-based attempt number
     */
    PanicAction decide(Throwable panic, T item, int attempt);

    /**
     * Abort the run on any panic. This is the default.
     */
    static <T> PanicPolicy<T> panicAsAbort() {
        return (panic, item, attempt) -> PanicAction.ABORT;
    }

    /**
     * Treat the panic as an ordinary task error and keep the run going.
     */
    static <T> PanicPolicy<T> panicAsContinue() {
        return (panic, item, attempt) -> PanicAction.CONTINUE;
    }
}
