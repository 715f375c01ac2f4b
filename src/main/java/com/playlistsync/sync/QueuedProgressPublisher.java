package com.playlistsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decouples a possibly slow {@link SyncProgressListener} from the sync thread.
 * <p>
 * {@link #onProgress(List, int)} only enqueues the snapshot and returns. A single daemon thread
 * delivers snapshots to the delegate in order. When the bounded queue is full the oldest pending
 * snapshot is dropped: every snapshot carries the complete outcome list, so a consumer that falls
 * behind only misses intermediate states. {@link #close()} delivers what is still queued.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class QueuedProgressPublisher implements SyncProgressListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(QueuedProgressPublisher.class);

    private static final Event POISON = new Event(List.of(), -1);
    private static final long CLOSE_TIMEOUT_MS = 5_000;

    private record Event(List<SyncOutcome> outcomes, int currentIndex) {}

    private final SyncProgressListener delegate;
    private final BlockingQueue<Event> queue;
    private final Thread worker;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    public QueuedProgressPublisher(SyncProgressListener delegate, int capacity) {
        if (delegate == null) throw new IllegalArgumentException("delegate cannot be null");
        this.delegate = delegate;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity) + 1);
        this.worker = new Thread(this::drain, "sync-progress-publisher");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void onProgress(List<SyncOutcome> outcomes, int currentIndex) {
        if (closed) {
            logger.debug("Progress published after close; ignoring index {}", currentIndex);
            return;
        }
        Event event = new Event(outcomes, currentIndex);
        // one slot is reserved for the close marker
        while (queue.remainingCapacity() <= 1 || !queue.offer(event)) {
            if (queue.poll() != null) dropped.incrementAndGet();
        }
    }

    /**
     * @return number of snapshots discarded because the consumer fell behind
     */
    public long droppedCount() {
        return dropped.get();
    }

    private void drain() {
        while (true) {
            Event event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == POISON) return;
            try {
                delegate.onProgress(event.outcomes(), event.currentIndex());
            } catch (RuntimeException e) {
                logger.warn("Progress listener failed for index {}: {}", event.currentIndex(), e.getMessage(), e);
            }
        }
    }

    /**
     * Stops accepting snapshots and waits (bounded) for queued ones to be delivered.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        queue.offer(POISON);
        try {
            worker.join(CLOSE_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            logger.warn("Progress listener still busy after {} ms; abandoning remaining snapshots", CLOSE_TIMEOUT_MS);
            worker.interrupt();
        }
    }
}
