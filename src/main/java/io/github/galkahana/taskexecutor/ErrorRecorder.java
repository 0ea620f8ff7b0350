package io.github.galkahana.taskexecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the first {@code maxSamples} failures of a run and, optionally, a count per error message.
 */
final class ErrorRecorder {

    private final int maxSamples;
    private final boolean aggregate;

    private final List<ErrorSample> samples = new ArrayList<>();
    private final ConcurrentHashMap<String, AtomicInteger> counts = new ConcurrentHashMap<>();

    ErrorRecorder(int maxSamples, boolean aggregate) {
        this.maxSamples = maxSamples;
        this.aggregate = aggregate;
    }

    void record(WorkItem<?> item, Throwable error) {
        if (aggregate) {
            counts.computeIfAbsent(Failures.messageOf(error), key -> new AtomicInteger(0)).incrementAndGet();
        }
        if (maxSamples > 0) {
            synchronized (samples) {
                if (samples.size() < maxSamples) {
                    samples.add(new ErrorSample(error, item.id(), item.attempt(), Instant.now()));
                }
            }
        }
    }

    List<ErrorSample> samples() {
        synchronized (samples) {
            return List.copyOf(samples);
        }
    }

    Map<String, Integer> counts() {
        Map<String, Integer> snapshot = new HashMap<>();
        counts.forEach((message, count) -> snapshot.put(message, count.get()));
        return snapshot;
    }
}
