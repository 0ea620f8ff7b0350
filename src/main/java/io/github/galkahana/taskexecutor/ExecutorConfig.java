package io.github.galkahana.taskexecutor;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for a {@link TaskExecutor}.
 * <p>
 * Only {@code concurrency} is required. Everything else falls back to a default in {@link #withDefaults()}:
 * no timeout, no retries, no backoff delay, {@link ErrorPolicy#alwaysContinue()},
 * {@link PanicPolicy#panicAsAbort()}, 100 error samples, no error aggregation and no listener.
 * <pre>{@code
 * ExecutorConfig<Order> config = ExecutorConfig.<Order>builder()
 *     .name("order-sync")
 *     .concurrency(8)
 *     .timeout(Duration.ofSeconds(5))
 *     .maxRetry(3)
 *     .backoff(Backoff.exponential(Duration.ofMillis(100), Duration.ofSeconds(2)))
 *     .errorPolicy(ErrorPolicy.retryOnTimeout())
 *     .errorAggregation(true)
 *     .build();
 * }</pre>
 *
 * @param <T> Item type
 */
@Value
@Builder(toBuilder = true)
public class ExecutorConfig<T> {

    public static final String DEFAULT_NAME = "executor";
    public static final int DEFAULT_MAX_ERROR_SAMPLES = 100;

    /** Identifies the executor in worker thread names and log lines. */
    String name;

    /** Number of concurrent workers, must be positive. */
    int concurrency;

    /** Per-attempt timeout. Null or zero means no timeout. */
    Duration timeout;

    /** Maximum number of retries per task. Zero means no retries. */
    int maxRetry;

    /** Delay before each retry. */
    Backoff backoff;

    ErrorPolicy<T> errorPolicy;

    PanicPolicy<T> panicPolicy;

    /** Cap on recorded error samples. Zero means the default of 100, a negative value disables sampling. */
    int maxErrorSamples;

    /** Count failures per error message into {@link ExecutionResult#errorCount()}. */
    boolean errorAggregation;

    ExecutionListener<T> listener;

    /**
     * @throws IllegalArgumentException If concurrency is not positive, or max retry or timeout is negative
     */
    public void validate() {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0, got " + concurrency);
        }
        if (maxRetry < 0) {
            throw new IllegalArgumentException("maxRetry must be >= 0, got " + maxRetry);
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0, got " + timeout);
        }
    }

    /**
     * @return A copy of this config with every unset field replaced by its default
     */
    public ExecutorConfig<T> withDefaults() {
        ExecutorConfigBuilder<T> builder = toBuilder();
        if (name == null || name.isBlank()) {
            builder.name(DEFAULT_NAME);
        }
        if (timeout == null) {
            builder.timeout(Duration.ZERO);
        }
        if (backoff == null) {
            builder.backoff(Backoff.none());
        }
        if (errorPolicy == null) {
            builder.errorPolicy(ErrorPolicy.alwaysContinue());
        }
        if (panicPolicy == null) {
            builder.panicPolicy(PanicPolicy.panicAsAbort());
        }
        if (maxErrorSamples == 0) {
            builder.maxErrorSamples(DEFAULT_MAX_ERROR_SAMPLES);
        }
        if (listener == null) {
            builder.listener(new ExecutionListener<>() {});
        }
        return builder.build();
    }

    public boolean hasTimeout() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
}
