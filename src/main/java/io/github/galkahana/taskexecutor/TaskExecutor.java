package io.github.galkahana.taskexecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded-concurrency task executor with per-task timeout, retry with backoff, error and panic policies,
 * cooperative cancellation and aggregated run statistics.
 * <p>
 * A feeder thread pushes items, in order, onto a bounded work channel (twice the worker count) and a fixed
 * pool of workers pulls from it. Each worker owns an item end to end, retries included, so the attempts of
 * one item are strictly sequential while different items complete in any order.
 * <p>
 * Failures never escape a run: they are folded into the returned {@link ExecutionResult}. The only exceptions
 * thrown by {@link #run} and {@link #runStream} are setup errors such as {@link ExecutorReusedException}.
 * <p>
 * An executor runs at most once. Create a new one per batch:
 * <pre>{@code
 * TaskExecutor<String> executor = TaskExecutor.create(ExecutorConfig.<String>builder()
 *     .concurrency(4)
 *     .maxRetry(2)
 *     .errorPolicy(ErrorPolicy.alwaysRetry())
 *     .build());
 * ExecutionResult result = executor.run(urls, (token, url) -> client.ping(url));
 * if (result.hasErrors()) {
 *     log.warn("{} of {} pings failed", result.failed(), result.total());
 * }
 * }</pre>
 *
 * @param <T> Item type
 */
@Slf4j
public class TaskExecutor<T> {

    private static final int WORK_CHANNEL_BUFFER_MULTIPLIER = 2;

    private final ExecutorConfig<T> config;
    private final ExecutionListener<T> listener;
    private final ExecutionCounters counters = new ExecutionCounters();
    private final ErrorRecorder errors;
    private final AtomicReference<AbortReason> abortReason = new AtomicReference<>();
    private final AtomicBoolean used = new AtomicBoolean(false);

    private TaskExecutor(ExecutorConfig<T> config) {
        this.config = config;
        this.listener = config.getListener();
        this.errors = new ErrorRecorder(config.getMaxErrorSamples(), config.isErrorAggregation());
    }

    /**
     * Create an executor. The config is validated and defaulted here, so an invalid config never
     * yields an executor.
     *
     * @throws IllegalArgumentException If the config is invalid
     */
    public static <T> TaskExecutor<T> create(ExecutorConfig<T> config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        return new TaskExecutor<>(config.withDefaults());
    }

    public ExecutorConfig<T> getConfig() {
        return config;
    }

    /**
     * Process a batch of items with a fresh, never cancelled token.
     *
     * @see #run(CancellationToken, Collection, Handler)
     */
    public ExecutionResult run(Collection<T> items, Handler<T> handler) throws InterruptedException {
        return run(CancellationToken.create(), items, handler);
    }

    /**
     * Process a batch of items concurrently and block until every worker has stopped.
     * <p>
     * Items get sequential ids in iteration order. Cancelling {@code token} stops the run: items not yet
     * dispatched are dropped, buffered items are counted as cancelled and in-flight handlers see their
     * token cancelled and their thread interrupted.
     *
     * @param token Caller's cancellation token; the run derives its own child token from it
     * @param items Items to process
     * @param handler Per item processing function
     * @return The run statistics
     * @throws ExecutorReusedException If this executor already ran
     * @throws InterruptedException If the calling thread is interrupted while waiting; the run is cancelled
     */
    public ExecutionResult run(CancellationToken token, Collection<T> items, Handler<T> handler)
            throws InterruptedException {
        markUsed();
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(handler, "handler");

        Instant start = Instant.now();
        int total = items.size();
        CancellationToken runToken = token.child();
        try {
            notifyListener("onBegin", () -> listener.onBegin(runToken, total));

            if (total == 0) {
                return new ExecutionResult(0, 0, 0, 0, 0, false, null, start, Instant.now(), List.of(), Map.of());
            }

            log.info("Starting {} with {} workers over {} items", config.getName(), config.getConcurrency(), total);
            Channel<WorkItem<T>> work = newWorkChannel();
            runWorkers(runToken, work, () -> feed(runToken, items, work), handler);
            return assembleResult(runToken, total, start);
        } finally {
            runToken.cancel();
        }
    }

    /**
     * Process items from a caller-owned channel with a fresh, never cancelled token.
     *
     * @see #runStream(CancellationToken, Channel, Handler)
     */
    public ExecutionResult runStream(Channel<T> in, Handler<T> handler) throws InterruptedException {
        return runStream(CancellationToken.create(), in, handler);
    }

    /**
     * Process items taken from {@code in} until it is closed and drained, or the run is cancelled.
     * <p>
     * The caller owns {@code in} and must close it; the executor never does. Ids are assigned in the order
     * items are taken, and {@link ExecutionResult#total()} is the number of items taken.
     *
     * @throws ExecutorReusedException If this executor already ran
     * @throws InterruptedException If the calling thread is interrupted while waiting; the run is cancelled
     */
    public ExecutionResult runStream(CancellationToken token, Channel<T> in, Handler<T> handler)
            throws InterruptedException {
        markUsed();
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(handler, "handler");

        Instant start = Instant.now();
        CancellationToken runToken = token.child();
        try {
            notifyListener("onBegin", () -> listener.onBegin(runToken, 0));

            log.info("Starting {} with {} workers in stream mode", config.getName(), config.getConcurrency());
            Channel<WorkItem<T>> work = newWorkChannel();
            AtomicInteger taken = new AtomicInteger(0);
            runWorkers(runToken, work, () -> feedStream(runToken, in, work, taken), handler);
            return assembleResult(runToken, taken.get(), start);
        } finally {
            runToken.cancel();
        }
    }

    private void markUsed() {
        if (!used.compareAndSet(false, true)) {
            throw new ExecutorReusedException();
        }
    }

    private Channel<WorkItem<T>> newWorkChannel() {
        return new Channel<>(config.getConcurrency() * WORK_CHANNEL_BUFFER_MULTIPLIER);
    }

    private void runWorkers(CancellationToken runToken, Channel<WorkItem<T>> work, Runnable feeder, Handler<T> handler)
            throws InterruptedException {
        int numWorkers = config.getConcurrency();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(numWorkers, numWorkers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), workerThreads(config.getName()));
        Thread feederThread = new Thread(feeder, config.getName() + "-feeder");

        List<CompletableFuture<Void>> workers = new ArrayList<>(numWorkers);
        try {
            feederThread.start();
            for (int i = 0; i < numWorkers; i++) {
                CompletableFuture<Void> worker = CompletableFuture.runAsync(() -> workerLoop(runToken, work, handler), pool);
                worker.whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        runToken.cancel();
                    }
                });
                workers.add(worker);
            }

            CompletableFuture.allOf(workers.toArray(new CompletableFuture[0])).get();
            feederThread.join();
        } catch (ExecutionException e) {
            log.error("Worker of {} failed unexpectedly", config.getName(), e.getCause());
            feederThread.join();
            throw new IllegalStateException("Worker thread failed", e.getCause());
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for {} workers, cancelling run", config.getName());
            runToken.cancel();
            pool.shutdownNow();
            feederThread.interrupt();
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private void feed(CancellationToken runToken, Collection<T> items, Channel<WorkItem<T>> work) {
        log.debug("Feeder started");
        try (work) {
            int id = 0;
            for (T item : items) {
                if (!work.send(WorkItem.first(id, item), runToken)) {
                    log.debug("Feeder stopped by cancellation after {} of {} items", id, items.size());
                    return;
                }
                id++;
            }
            log.debug("Feeder enqueued all {} items", id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Feeder interrupted");
        }
    }

    private void feedStream(CancellationToken runToken, Channel<T> in, Channel<WorkItem<T>> work, AtomicInteger taken) {
        log.debug("Stream feeder started");
        try (work) {
            int id = 0;
            while (true) {
                Optional<T> next = in.receive(runToken);
                if (next.isEmpty()) {
                    log.debug("Stream feeder stopped after {} items (cancelled={})", id, runToken.isCancelled());
                    return;
                }
                taken.incrementAndGet();
                if (!work.send(WorkItem.first(id, next.get()), runToken)) {
                    log.debug("Stream feeder stopped by cancellation after {} items", id);
                    return;
                }
                id++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Stream feeder interrupted");
        }
    }

    private void workerLoop(CancellationToken runToken, Channel<WorkItem<T>> work, Handler<T> handler) {
        try {
            Optional<WorkItem<T>> next;
            while ((next = work.receive()).isPresent()) {
                runWithRetry(runToken, next.get(), handler);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted");
        }
    }

    private void runWithRetry(CancellationToken runToken, WorkItem<T> initial, Handler<T> handler)
            throws InterruptedException {
        WorkItem<T> item = initial;
        while (true) {
            if (runToken.isCancelled()) {
                log.debug("Task {} cancelled before attempt {}", item.id(), item.attempt());
                counters.cancelled.incrementAndGet();
                return;
            }

            WorkItem<T> current = item;
            notifyListener("onBefore", () -> listener.onBefore(runToken, current.payload(), current.attempt()));

            log.debug("Processing task {} (attempt {})", item.id(), item.attempt());
            long started = System.nanoTime();
            Attempt attempt = execute(runToken, item, handler);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            Throwable error = attempt.error();
            notifyListener("onAfter", () -> listener.onAfter(runToken, current.payload(), error, elapsed));

            if (error == null) {
                counters.success.incrementAndGet();
                return;
            }

            notifyListener("onError", () -> listener.onError(runToken, current.payload(), error, current.attempt()));

            // only cancellation of the executor's own tokens ends a task as cancelled
            if (attempt.tokenCancelled() && Failures.isCancellation(error)) {
                log.debug("Task {} cancelled on attempt {}: {}", item.id(), item.attempt(), error.getMessage());
                counters.cancelled.incrementAndGet();
                return;
            }

            errors.record(item, error);

            ErrorAction action = config.getErrorPolicy().decide(error, item.payload(), item.attempt());
            if (action == ErrorAction.RETRY) {
                if (item.attempt() >= config.getMaxRetry()) {
                    log.debug("Task {} failed after {} attempts", item.id(), item.attempt() + 1);
                    counters.failed.incrementAndGet();
                    return;
                }
                if (attempt.abortedRun()) {
                    log.debug("Task {} aborted the run, not retrying", item.id());
                    counters.failed.incrementAndGet();
                    return;
                }
                counters.retried.incrementAndGet();
                item = item.nextAttempt();

                Duration delay = config.getBackoff().delay(item.attempt());
                log.debug("Retrying task {} (attempt {}) in {}", item.id(), item.attempt(), Durations.format(delay));
                if (!sleepBeforeRetry(runToken, delay)) {
                    log.debug("Task {} cancelled during retry backoff", item.id());
                    counters.cancelled.incrementAndGet();
                    return;
                }
            } else if (action == ErrorAction.ABORT) {
                counters.failed.incrementAndGet();
                abort(item, error);
                runToken.cancel();
                return;
            } else {
                counters.failed.incrementAndGet();
                return;
            }
        }
    }

    private boolean sleepBeforeRetry(CancellationToken runToken, Duration delay) throws InterruptedException {
        try {
            return runToken.sleep(delay);
        } catch (InterruptedException e) {
            counters.cancelled.incrementAndGet();
            throw e;
        }
    }

    /**
     * Outcome of a single handler invocation.
     *
     * @param error The error the attempt ended with, null on success
     * @param tokenCancelled Whether the attempt token was already cancelled when the handler returned
     * @param abortedRun Whether the attempt panicked and the panic policy aborted the run
     */
    private record Attempt(Throwable error, boolean tokenCancelled, boolean abortedRun) {
        static final Attempt SUCCESS = new Attempt(null, false, false);
    }

    private Attempt execute(CancellationToken runToken, WorkItem<T> item, Handler<T> handler) {
        CancellationToken attemptToken = config.hasTimeout()
                ? runToken.withTimeout(config.getTimeout())
                : runToken.child();
        HandlerInterrupter interrupter = new HandlerInterrupter(Thread.currentThread());
        CancellationToken.Registration registration = attemptToken.onCancel(interrupter::interrupt);

        Exception error = null;
        Throwable panic = null;
        boolean tokenCancelled;
        try {
            handler.handle(attemptToken, item.payload());
        } catch (Exception e) {
            error = e;
        } catch (Throwable t) {
            panic = t;
        } finally {
            registration.close();
            if (interrupter.disarm()) {
                // clear the interrupt delivered on cancellation so it cannot leak into the next task
                Thread.interrupted();
            }
            tokenCancelled = attemptToken.isCancelled();
        }

        try {
            if (panic != null) {
                HandlerPanicException wrapped = new HandlerPanicException(panic);
                return new Attempt(wrapped, tokenCancelled, recoverPanic(runToken, item, wrapped));
            }
            if (error != null) {
                return new Attempt(translate(runToken, attemptToken, error), tokenCancelled, false);
            }
            return Attempt.SUCCESS;
        } finally {
            attemptToken.cancel();
        }
    }

    private Throwable translate(CancellationToken runToken, CancellationToken attemptToken, Exception error) {
        Throwable translated = error;
        if (attemptToken.isCancelled() && Failures.causedBy(error, InterruptedException.class)) {
            CancellationException cancellation = attemptToken.error();
            cancellation.initCause(error);
            translated = cancellation;
        }
        // a deadline inherited from the caller's token is not a task timeout
        if (config.hasTimeout() && runToken.reason() != CancellationToken.Reason.DEADLINE_EXCEEDED
                && Failures.causedBy(translated, DeadlineExceededException.class)) {
            translated = new TaskTimeoutException(config.getTimeout(), translated);
        }
        return translated;
    }

    /**
     * @return true if the panic policy aborted the run
     */
    private boolean recoverPanic(CancellationToken runToken, WorkItem<T> item, HandlerPanicException error) {
        Throwable panic = error.getPanic();
        PanicAction action = config.getPanicPolicy().decide(panic, item.payload(), item.attempt());
        log.warn("Task {} panicked on attempt {} ({}): {}", item.id(), item.attempt(), action, panic.toString());
        if (action != PanicAction.ABORT) {
            return false;
        }
        abort(item, error);
        runToken.cancel();
        return true;
    }

    private void abort(WorkItem<T> item, Throwable error) {
        AbortReason reason = new AbortReason(item.id(), item.attempt(), error, Instant.now());
        if (abortReason.compareAndSet(null, reason)) {
            log.warn("Aborting {}: task {} failed on attempt {}: {}",
                    config.getName(), item.id(), item.attempt(), error.getMessage());
        }
    }

    private ExecutionResult assembleResult(CancellationToken runToken, int total, Instant start) {
        AbortReason reason = abortReason.get();
        ExecutionResult result = new ExecutionResult(
                total,
                counters.success.get(),
                counters.failed.get(),
                counters.retried.get(),
                counters.cancelled.get(),
                reason != null,
                reason,
                start,
                Instant.now(),
                errors.samples(),
                errors.counts());

        log.info("{} finished in {}: total={}, success={}, failed={}, retried={}, cancelled={}, aborted={}",
                config.getName(), Durations.format(result.duration()), result.total(), result.success(),
                result.failed(), result.retried(), result.cancelled(), result.aborted());

        notifyListener("onEnd", () -> listener.onEnd(runToken, result));
        return result;
    }

    private void notifyListener(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Listener {} of {} failed", callback, config.getName(), e);
        }
    }

    private static ThreadFactory workerThreads(String name) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> new Thread(runnable, name + "-worker-" + counter.incrementAndGet());
    }

    /**
     * Interrupts the worker thread when the attempt token is cancelled, but only while the handler runs.
     */
    private static final class HandlerInterrupter {

        private final Thread worker;
        private boolean armed = true;
        private boolean fired = false;

        HandlerInterrupter(Thread worker) {
            this.worker = worker;
        }

        synchronized void interrupt() {
            if (armed) {
                fired = true;
                worker.interrupt();
            }
        }

        /**
         * @return true if the worker was interrupted while armed
         */
        synchronized boolean disarm() {
            armed = false;
            return fired;
        }
    }
}
