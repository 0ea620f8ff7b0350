package io.github.galkahana.taskexecutor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run tallies, bumped by workers and read once when the result is assembled.
 */
final class ExecutionCounters {

    final AtomicInteger success = new AtomicInteger(0);
    final AtomicInteger failed = new AtomicInteger(0);
    final AtomicInteger retried = new AtomicInteger(0);
    final AtomicInteger cancelled = new AtomicInteger(0);
}
