package de.bsommerfeld.golinks.tracking;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.config.ClickConfig;
import de.bsommerfeld.golinks.core.domain.ClickEvent;
import de.bsommerfeld.golinks.db.ClickStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decouples click recording from the redirect path.
 *
 * <p>
 * Request threads hand events to {@link #offer(ClickEvent)}, which never
 * blocks: an event is either queued or dropped and counted. A single writer
 * thread drains the bounded queue and persists events one at a time in
 * enqueue order. A failed write is logged and counted; the writer keeps
 * running.
 *
 * <p>
 * {@link #shutdown()} stops intake, lets the writer finish every queued event
 * and waits at most the configured drain timeout before interrupting it. Once
 * shutdown has returned,
 * {@code accepted == recorded + failed + abandoned}, where {@code abandoned}
 * is zero unless the drain timed out.
 */
@Singleton
public class ClickPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ClickPipeline.class);

    private final ClickStore clickStore;
    private final ClickMetrics metrics;
    private final Duration drainTimeout;
    private final BlockingQueue<Runnable> queue;
    private final ThreadPoolExecutor writer;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong recorded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();

    @Inject
    public ClickPipeline(ClickStore clickStore, ClickMetrics metrics, ClickConfig config) {
        this(clickStore, metrics, config.getQueueCapacity(), Duration.ofSeconds(config.getDrainTimeoutSeconds()));
    }

    ClickPipeline(ClickStore clickStore, ClickMetrics metrics, int capacity, Duration drainTimeout) {
        if (capacity <= 0)
            throw new IllegalArgumentException("queue capacity must be positive: " + capacity);
        this.clickStore = clickStore;
        this.metrics = metrics;
        this.drainTimeout = drainTimeout;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, queue,
                new ThreadFactoryBuilder().setNameFormat("click-writer-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.AbortPolicy());
        metrics.bindQueue(queue);
    }

    /**
     * Starts the writer thread so that every accepted event passes through
     * the bounded queue.
     */
    public void start() {
        if (writer.prestartCoreThread())
            LOG.info("Click writer started (queue capacity {}).", queue.remainingCapacity() + queue.size());
    }

    /**
     * Queues an event without blocking.
     *
     * @return {@code false} if the event was dropped because the queue is full
     *         or shutdown has begun
     */
    public boolean offer(ClickEvent event) {
        if (writer.isShutdown()) {
            drop(DropReason.SHUTDOWN, event);
            return false;
        }
        try {
            accepted.incrementAndGet();
            writer.execute(() -> persist(event));
            return true;
        } catch (RejectedExecutionException e) {
            accepted.decrementAndGet();
            drop(writer.isShutdown() ? DropReason.SHUTDOWN : DropReason.QUEUE_FULL, event);
            return false;
        }
    }

    /**
     * Builds an event for a redirect, hashing the client address, and queues it.
     */
    public boolean record(String linkId, String userId, String remoteIp, String userAgent, String referrer) {
        return offer(ClickEvent.now(linkId, userId, IpHasher.hash(remoteIp), userAgent, referrer));
    }

    private void persist(ClickEvent event) {
        try {
            clickStore.recordClick(event);
            recorded.incrementAndGet();
            metrics.recordSuccess();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            metrics.recordError();
            LOG.warn("Failed to record click for link {}: {}", event.linkId(), e.getMessage());
        }
    }

    private void drop(DropReason reason, ClickEvent event) {
        dropped.incrementAndGet();
        metrics.recordDrop(reason);
        LOG.debug("Dropped click for link {} ({})", event.linkId(), reason.tag());
    }

    /**
     * Stops intake and drains the queue, waiting at most the drain timeout.
     * Must be called during application shutdown.
     */
    public void shutdown() {
        LOG.info("Shutting down click pipeline ({} queued)...", queue.size());
        writer.shutdown();
        try {
            if (!writer.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                abandon(writer.shutdownNow());
                LOG.warn("Click pipeline forced shutdown after {} s, {} event(s) abandoned.",
                        drainTimeout.toSeconds(), abandoned.get());
            }
        } catch (InterruptedException e) {
            abandon(writer.shutdownNow());
            Thread.currentThread().interrupt();
        }
        LOG.info("Click pipeline stopped: accepted={}, recorded={}, failed={}, dropped={}",
                accepted.get(), recorded.get(), failed.get(), dropped.get());
    }

    private void abandon(List<Runnable> pending) {
        for (int i = 0; i < pending.size(); i++) {
            abandoned.incrementAndGet();
            metrics.recordDrop(DropReason.SHUTDOWN);
        }
    }

    public boolean isShutdown() {
        return writer.isShutdown();
    }

    public int queueDepth() {
        return queue.size();
    }

    public long getAcceptedCount() {
        return accepted.get();
    }

    public long getRecordedCount() {
        return recorded.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getAbandonedCount() {
        return abandoned.get();
    }
}
