package com.quicklook.server.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of arriving frame paths with a debounce timer.
 *
 * Every notification re-arms one single-shot timer (cancel if pending, then
 * schedule). When it expires the whole queue is drained and handed to the
 * {@link BatchHandler} as one batch, so a burst of notifications costs one
 * processing pass and no path is lost. The timer never fires later than the
 * max wait after the oldest queued path arrived, so a steady stream still gets
 * processed. Ticks run on one dedicated thread.
 */
public class IngestionQueue {

    private static final Logger logger = LoggerFactory.getLogger(IngestionQueue.class);

    private final BatchHandler handler;
    private final long debounceMillis;
    private final long maxWaitMillis;
    private final ScheduledExecutorService scheduler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<String> queue = new ArrayDeque<>();
    private ScheduledFuture<?> pending;
    // latest moment the next tick may start, set when the first path of a batch arrives
    private long deadlineNanos;
    private boolean deadlineSet = false;
    private boolean stopped = false;

    private final AtomicLong tickCount = new AtomicLong();

    public IngestionQueue(BatchHandler handler, long debounceMillis) {
        this(handler, debounceMillis, 10 * debounceMillis);
    }

    public IngestionQueue(BatchHandler handler, long debounceMillis, long maxWaitMillis) {
        if (debounceMillis <= 0) {
            throw new IllegalArgumentException("Debounce interval must be positive");
        }
        if (maxWaitMillis < debounceMillis) {
            throw new IllegalArgumentException("Max wait " + maxWaitMillis
                    + " ms is shorter than the debounce interval " + debounceMillis + " ms");
        }
        this.handler = handler;
        this.debounceMillis = debounceMillis;
        this.maxWaitMillis = maxWaitMillis;
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "quicklook-tick");
            t.setDaemon(true);
            return t;
        });
        // re-arming cancels often; don't let cancelled timers pile up
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = executor;
    }

    public void notifyFile(String path) {
        lock.lock();
        try {
            if (stopped) {
                logger.warn("Ingestion stopped, ignoring {}", path);
                return;
            }
            queue.addLast(path);
            logger.debug("file notify: {}", path);
            rearm();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues several paths (e.g. a manual drop) with a single re-arm.
     */
    public void notifyFiles(Collection<String> paths) {
        lock.lock();
        try {
            if (stopped) {
                logger.warn("Ingestion stopped, ignoring {} paths", paths.size());
                return;
            }
            queue.addAll(paths);
            rearm();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void rearm() {
        if (queue.isEmpty()) {
            return;
        }
        long now = System.nanoTime();
        if (!deadlineSet) {
            deadlineNanos = now + TimeUnit.MILLISECONDS.toNanos(maxWaitMillis);
            deadlineSet = true;
        }
        long untilDeadline = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - now);
        long delay = Math.max(0, Math.min(debounceMillis, untilDeadline));
        if (pending != null) {
            pending.cancel(false);
        }
        pending = scheduler.schedule(this::tick, delay, TimeUnit.MILLISECONDS);
    }

    void tick() {
        List<String> batch;
        lock.lock();
        try {
            if (stopped) {
                return;
            }
            batch = new ArrayList<>(queue);
            queue.clear();
            deadlineSet = false;
        } finally {
            lock.unlock();
        }

        if (batch.isEmpty()) {
            return;
        }
        tickCount.incrementAndGet();
        logger.info("Processing {} queued paths", batch.size());
        try {
            handler.onBatch(batch);
        } catch (RuntimeException e) {
            logger.error("Batch processing failed for {} paths", batch.size(), e);
        }
    }

    /**
     * Runs an action on the tick thread, serialized with batch processing.
     */
    public Future<?> execute(Runnable action) {
        try {
            return scheduler.submit(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    logger.error("Tick action failed", e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Ingestion queue is stopped", e);
        }
    }

    /**
     * Cancels the pending timer and discards queued paths without processing
     * them.
     */
    public void stop() {
        int discarded;
        lock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            discarded = queue.size();
            queue.clear();
            deadlineSet = false;
        } finally {
            lock.unlock();
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Ingestion stopped, {} queued paths discarded", discarded);
    }

    public int pendingCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public long tickCount() {
        return tickCount.get();
    }

    public boolean isStopped() {
        lock.lock();
        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }
}
