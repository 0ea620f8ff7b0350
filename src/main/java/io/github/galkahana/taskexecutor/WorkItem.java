package io.github.galkahana.taskexecutor;

/**
 * A single unit of work travelling from the feeder to a worker.
 *
 * @param id Sequential id assigned at enqueue time
 * @param payload The item to hand to the handler
 * @param attempt Zero-based attempt counter
 */
record WorkItem<T>(int id, T payload, int attempt) {

    static <T> WorkItem<T> first(int id, T payload) {
        return new WorkItem<>(id, payload, 0);
    }

    WorkItem<T> nextAttempt() {
        return new WorkItem<>(id, payload, attempt + 1);
    }
}
