package io.github.galkahana.taskexecutor;

/**
 * Thrown when {@link TaskExecutor#run} or {@link TaskExecutor#runStream} is called on an executor
 * that already ran. Create a new executor for each batch.
 */
public class ExecutorReusedException extends IllegalStateException {

    public ExecutorReusedException() {
        super("executor already used; create a new one");
    }
}
