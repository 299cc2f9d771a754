package com.routemq.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs store compaction on a fixed delay from a single daemon thread,
 * independent of request traffic.
 * <p>
 * A failed run is logged and retried at the next interval. {@link #close()} never
 * interrupts a run in progress; it waits for it to finish.
 */
public final class CompactionScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CompactionScheduler.class);

    private static final long CLOSE_WAIT_SECONDS = 60;

    private final Runnable compaction;
    private final Duration interval;
    private final AtomicLong completedRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> compactionTask;
    private volatile boolean closed;

    public CompactionScheduler(Runnable compaction, Duration interval) {
        this.compaction = Objects.requireNonNull(compaction, "compaction");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
    }

    /**
     * Start the schedule. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("CompactionScheduler has been closed");
        }
        if (compactionTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "storage-compaction");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        compactionTask = scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Storage compaction scheduled every {}", interval);
    }

    /**
     * Run one compaction now. Failures are logged, never thrown.
     */
    public void runOnce() {
        if (closed) {
            return;
        }
        long started = System.nanoTime();
        try {
            compaction.run();
            completedRuns.incrementAndGet();
            logger.info("Storage compaction finished in {} ms",
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        } catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            logger.error("Storage compaction failed, retrying in {}", interval, e);
        }
    }

    public long getCompletedRuns() {
        return completedRuns.get();
    }

    public long getFailedRuns() {
        return failedRuns.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (compactionTask != null) {
            compactionTask.cancel(false);
            compactionTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Storage compaction still running after {} seconds", CLOSE_WAIT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
