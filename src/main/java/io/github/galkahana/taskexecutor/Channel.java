package io.github.galkahana.taskexecutor;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, closeable FIFO handoff between producer and consumer threads, backed by a {@link BlockingQueue}.
 * <p>
 * Senders block while the channel is full, receivers block while it is empty and still open. Both
 * can be released early through a {@link CancellationToken}. Closing the channel lets receivers drain
 * what is already buffered and then see the end of input; sending on a closed channel is an error.
 * Close the channel from the producer once its last send has returned.
 * <p>
 * {@link TaskExecutor#runStream} consumes items from a channel owned by the caller, who is responsible
 * for closing it once no more items will be sent:
 * <pre>{@code
 * Channel<Order> orders = new Channel<>(64);
 * producerPool.submit(() -> {
 *     try (orders) {
 *         for (Order order : source) {
 *             orders.send(order);
 *         }
 *     }
 *     return null;
 * });
 * ExecutionResult result = executor.runStream(orders, handler);
 * }</pre>
 * A producer that already fills a {@link BlockingQueue} can hand it over with {@link #Channel(BlockingQueue)}
 * and close the channel when it is done.
 *
 * @param <E> Element type. Null elements are not allowed.
 */
public class Channel<E> implements AutoCloseable {

    /** Longest a blocked send or receive waits before checking the token and the closed flag again. */
    private static final long WAIT_SLICE_MILLIS = 10;

    private final BlockingQueue<E> queue;
    private final int capacity;

    private volatile boolean closed = false;

    /**
     * @param capacity Maximum number of buffered elements, must be positive
     */
    public Channel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
    }

    /**
     * Use an existing queue as the channel's buffer. Elements already in the queue are received first.
     *
     * @param queue The backing queue; its capacity bounds the channel
     */
    public Channel(BlockingQueue<E> queue) {
        this.queue = Objects.requireNonNull(queue, "queue");
        long total = (long) queue.size() + queue.remainingCapacity();
        this.capacity = (int) Math.min(total, Integer.MAX_VALUE);
    }

    /**
     * Send an element, blocking while the channel is full.
     *
     * @throws IllegalStateException If the channel is closed
     */
    public void send(E element) throws InterruptedException {
        send(element, CancellationToken.create());
    }

    /**
     * Send an element, blocking while the channel is full or until {@code token} is cancelled.
     *
     * @return true if the element was buffered, false if the token was cancelled first
     * @throws IllegalStateException If the channel is closed
     */
    public boolean send(E element, CancellationToken token) throws InterruptedException {
        Objects.requireNonNull(element, "element");
        while (true) {
            if (closed) {
                throw new IllegalStateException("send on closed channel");
            }
            if (token.isCancelled()) {
                return false;
            }
            if (queue.offer(element, WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
    }

    /**
     * Receive the next element, blocking while the channel is empty and open.
     *
     * @return The next element, or empty once the channel is closed and drained
     */
    public Optional<E> receive() throws InterruptedException {
        return receive(CancellationToken.create());
    }

    /**
     * Receive the next element, blocking while the channel is empty and open, or until {@code token}
     * is cancelled.
     *
     * @return The next element, or empty once the channel is closed and drained, or the token was cancelled
     */
    public Optional<E> receive(CancellationToken token) throws InterruptedException {
        while (true) {
            if (token.isCancelled()) {
                return Optional.empty();
            }
            // read before polling: an empty poll after close means everything sent was received
            boolean closedBeforePoll = closed;
            E element = queue.poll(WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS);
            if (element != null) {
                return Optional.of(element);
            }
            if (closedBeforePoll) {
                return Optional.empty();
            }
        }
    }

    /**
     * Close the channel. Buffered elements can still be received. Closing twice is a no-op.
     */
    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return Number of currently buffered elements
     */
    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
