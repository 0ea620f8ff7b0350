package io.github.galkahana.taskexecutor;

/**
 * Type definition for the per item processing function.
 * <p>
 * Any {@link Exception} thrown is a task error and goes through the error policy. Anything else
 * escaping the handler (an {@link Error}) is a panic: the panic policy may abort the run, and the wrapped
 * panic then goes through the error policy as well.
 * Handlers may run concurrently on several workers, so shared state they touch must be thread-safe.
 *
 * @param <T> Item type
 */
@FunctionalInterface
public interface Handler<T> {
    void handle(CancellationToken token, T item) throws Exception;
}
