package io.github.galkahana.taskexecutor;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Wraps an {@link Error} that escaped a handler. The original throwable is kept as the cause.
 */
public class HandlerPanicException extends RuntimeException {

    private final String panicStackTrace;

    public HandlerPanicException(Throwable panic) {
        super("panic: " + panic, panic);
        StringWriter trace = new StringWriter();
        panic.printStackTrace(new PrintWriter(trace));
        this.panicStackTrace = trace.toString();
    }

    /**
     * @return The panic value, i.e. the throwable the handler raised
     */
    public Throwable getPanic() {
        return getCause();
    }

    /**
     * @return Rendered stack trace of the panic at the point it was raised
     */
    public String getPanicStackTrace() {
        return panicStackTrace;
    }
}
