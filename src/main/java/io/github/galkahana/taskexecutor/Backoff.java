package io.github.galkahana.taskexecutor;

import java.time.Duration;

import io.github.resilience4j.core.IntervalFunction;

/**
 * Delay to wait before a retry.
 * <p>
 * Implementations are pure functions of the attempt number, which is 1-based: the first retry asks for
 * {@code delay(1)}. Arithmetic saturates at {@link Long#MAX_VALUE} nanoseconds instead of overflowing.
 */
@FunctionalInterface
public interface Backoff {

    /** Fibonacci index past which fib(n) no longer fits a long. */
    int MAX_FIBONACCI_ATTEMPT = 92;

    /** Largest exponent used by {@link #exponential}; 2^62 still fits a long. */
    int MAX_EXPONENTIAL_ATTEMPT = 62;

    Duration delay(int attempt);

    /**
     * No delay between retries. Used when no backoff is configured.
     */
    static Backoff none() {
        return attempt -> Duration.ZERO;
    }

    /**
     * Always the same delay.
     */
    static Backoff constant(Duration delay) {
        return attempt -> delay;
    }

    /**
     * {@code base * attempt}.
     */
    static Backoff linear(Duration base) {
        long baseNanos = Durations.saturatedNanos(base);
        return attempt -> Duration.ofNanos(saturatedMultiply(baseNanos, attempt));
    }

    /**
     * {@code base * 2^(attempt - 1)}, capped at {@code max} when {@code max} is positive.
     * Attempts below 1 give no delay.
     */
    static Backoff exponential(Duration base, Duration max) {
        long baseNanos = Durations.saturatedNanos(base);
        long maxNanos = max == null ? 0 : Durations.saturatedNanos(max);
        return attempt -> {
            if (attempt <= 0) {
                return Duration.ZERO;
            }
            int exponent = Math.min(attempt, MAX_EXPONENTIAL_ATTEMPT) - 1;
            return cap(saturatedMultiply(baseNanos, 1L << exponent), maxNanos);
        };
    }

    /**
     * {@code base * fib(attempt)}, capped at {@code max} when {@code max} is positive.
     * Attempts below 1 give no delay.
     */
    static Backoff fibonacci(Duration base, Duration max) {
        long baseNanos = Durations.saturatedNanos(base);
        long maxNanos = max == null ? 0 : Durations.saturatedNanos(max);
        return attempt -> {
            if (attempt <= 0) {
                return Duration.ZERO;
            }
            long fib = fibonacci(Math.min(attempt, MAX_FIBONACCI_ATTEMPT));
            return cap(saturatedMultiply(baseNanos, fib), maxNanos);
        };
    }

    /**
     * Adapt a Resilience4j {@link IntervalFunction} (milliseconds per 1-based attempt), e.g.
     * {@code Backoff.fromIntervalFunction(IntervalFunction.ofExponentialRandomBackoff(100, 2.0, 0.5))}.
     * Attempts below 1 give no delay.
     */
    static Backoff fromIntervalFunction(IntervalFunction intervalFunction) {
        return attempt -> {
            if (attempt <= 0) {
                return Duration.ZERO;
            }
            Long millis = intervalFunction.apply(attempt);
            return millis == null || millis <= 0 ? Duration.ZERO : Duration.ofMillis(millis);
        };
    }

    private static Duration cap(long nanos, long maxNanos) {
        if (maxNanos > 0 && nanos > maxNanos) {
            return Duration.ofNanos(maxNanos);
        }
        return Duration.ofNanos(nanos);
    }

    private static long saturatedMultiply(long value, long factor) {
        try {
            return Math.multiplyExact(value, factor);
        } catch (ArithmeticException e) {
            return (value < 0) == (factor < 0) ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    private static long fibonacci(int n) {
        if (n <= 1) {
            return n;
        }
        long previous = 0;
        long current = 1;
        for (int i = 2; i <= n; i++) {
            long next = previous + current;
            previous = current;
            current = next;
        }
        return current;
    }
}
