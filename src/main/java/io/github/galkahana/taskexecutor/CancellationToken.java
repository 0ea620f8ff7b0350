package io.github.galkahana.taskexecutor;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative cancellation signal shared by everything that belongs to one run.
 * <p>
 * Tokens form a tree: cancelling a token cancels all of its descendants (with the same reason), while
 * cancelling a child never affects its parent. A token is cancelled at most once; the first reason wins.
 * Every blocking point in the executor (channel send/receive, retry backoff, handler invocation) watches
 * a token, and handlers are expected to do the same, either by polling {@link #isCancelled()}, by sleeping
 * through {@link #sleep(Duration)}, or by reacting to thread interruption.
 * <p>
 * Example:
 * <pre>{@code
 * CancellationToken token = CancellationToken.create().withTimeout(Duration.ofMinutes(5));
 * ExecutionResult result = executor.run(token, items, (t, item) -> {
 *     t.throwIfCancelled();
 *     client.send(item);
 * });
 * }</pre>
 */
@Slf4j
public final class CancellationToken {

    /**
     * Why a token was cancelled.
     */
    public enum Reason {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private static final ScheduledThreadPoolExecutor DEADLINES = createDeadlineScheduler();

    private final AtomicReference<Reason> reason = new AtomicReference<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private final Set<Registration> registrations = ConcurrentHashMap.newKeySet();

    private volatile Registration parentLink;
    private volatile ScheduledFuture<?> deadlineTimer;

    private CancellationToken() {
    }

    /**
     * Create a root token. It is only ever cancelled by an explicit {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Create a child token that is cancelled together with this one, and can also be cancelled on its own.
     * Cancelling the child releases its link to this token.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Registration link = onCancel(() -> child.cancel(reason.get()));
        child.parentLink = link;
        if (child.isCancelled()) {
            link.close();
        }
        return child;
    }

    /**
     * Create a child token that additionally cancels itself with {@link Reason#DEADLINE_EXCEEDED} once
     * {@code timeout} elapses. A zero or negative timeout yields an already expired token.
     */
    public CancellationToken withTimeout(Duration timeout) {
        CancellationToken child = child();
        long nanos = Durations.saturatedNanos(timeout);
        if (nanos <= 0) {
            child.cancel(Reason.DEADLINE_EXCEEDED);
            return child;
        }
        child.deadlineTimer = DEADLINES.schedule(() -> child.cancel(Reason.DEADLINE_EXCEEDED), nanos, TimeUnit.NANOSECONDS);
        if (child.isCancelled()) {
            child.deadlineTimer.cancel(false);
        }
        return child;
    }

    /**
     * Cancel this token and all of its descendants. No-op if already cancelled.
     */
    public void cancel() {
        cancel(Reason.CANCELLED);
    }

    private void cancel(Reason cancelReason) {
        if (cancelReason == null || !reason.compareAndSet(null, cancelReason)) {
            return;
        }
        done.countDown();

        ScheduledFuture<?> timer = deadlineTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        Registration link = parentLink;
        if (link != null) {
            link.close();
        }
        for (Registration registration : registrations) {
            registration.fire();
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * @return Why the token was cancelled, or null while it is still live
     */
    public Reason reason() {
        return reason.get();
    }

    /**
     * @return The exception describing the cancellation, or null while the token is still live.
     *         Deadline expiry is reported as a {@link DeadlineExceededException}.
     */
    public CancellationException error() {
        Reason current = reason.get();
        if (current == null) {
            return null;
        }
        return current == Reason.DEADLINE_EXCEEDED
                ? new DeadlineExceededException("deadline exceeded")
                : new CancellationException("operation cancelled");
    }

    /**
     * @throws CancellationException If the token has been cancelled
     */
    public void throwIfCancelled() {
        CancellationException error = error();
        if (error != null) {
            throw error;
        }
    }

    /**
     * Sleep for the given duration unless the token is cancelled first.
     *
     * @return true if the full duration elapsed, false if the token was (or already is) cancelled
     * @throws InterruptedException If the calling thread is interrupted while sleeping
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        long nanos = Durations.saturatedNanos(duration);
        if (nanos <= 0) {
            return !isCancelled();
        }
        return !done.await(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Block until the token is cancelled.
     */
    public void awaitCancellation() throws InterruptedException {
        done.await();
    }

    /**
     * Run {@code action} once when this token gets cancelled, or right away if it already is.
     * Close the returned registration to stop listening.
     */
    public Registration onCancel(Runnable action) {
        Registration registration = new Registration(action);
        registrations.add(registration);
        if (isCancelled()) {
            registration.fire();
        }
        return registration;
    }

    @Override
    public String toString() {
        Reason current = reason.get();
        return "CancellationToken[" + (current == null ? "live" : current) + "]";
    }

    /**
     * Handle for a cancellation callback. Fires at most once.
     */
    public final class Registration implements AutoCloseable {

        private final Runnable action;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Registration(Runnable action) {
            this.action = action;
        }

        private void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            registrations.remove(this);
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed", e);
            }
        }

        @Override
        public void close() {
            if (fired.compareAndSet(false, true)) {
                registrations.remove(this);
            }
        }
    }

    private static ScheduledThreadPoolExecutor createDeadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "cancellation-deadlines");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
