package com.instagrab.core.download;

import com.instagrab.common.model.MediaDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory download queue worked off by a single background thread through the
 * {@link DownloadManager}. Adding an item starts processing unless the queue is paused.
 * Finished entries stay listed; {@link #clear()} and {@link #remove(String)} only touch pending ones.
 */
public class DownloadQueue {
    private static final Logger logger = LoggerFactory.getLogger(DownloadQueue.class);

    public enum Event { ITEM_ADDED, ITEM_STARTED, ITEM_COMPLETED, ITEM_FAILED, QUEUE_COMPLETED, QUEUE_PAUSED }

    @FunctionalInterface
    public interface Listener {
        /**
         * @param item the affected entry, null for queue-level events
         */
        void onEvent(Event event, QueuedDownload item);
    }

    public record Stats(int total, int pending, int completed, int failed) {
    }

    private final DownloadManager manager;
    private final List<QueuedDownload> items = new ArrayList<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private Thread workerThread;

    public DownloadQueue(DownloadManager manager) {
        this.manager = manager;
    }

    public String add(MediaDescriptor descriptor, DownloadOptions options) {
        QueuedDownload item = new QueuedDownload(descriptor, options);
        synchronized (items) {
            items.add(item);
        }
        logger.info("➕ Queued {} ({})", descriptor.filename(), item.getId());
        emit(Event.ITEM_ADDED, item);
        if (!paused.get()) process();
        return item.getId();
    }

    public List<String> addBatch(List<MediaDescriptor> descriptors, DownloadOptions options) {
        List<String> ids = new ArrayList<>();
        for (MediaDescriptor d : descriptors) ids.add(add(d, options));
        return ids;
    }

    /**
     * Starts the worker if it is not running. Un-pauses the queue.
     */
    public void process() {
        paused.set(false);
        if (processing.getAndSet(true)) return;
        workerThread = new Thread(this::workerLoop, "DownloadQueueWorker");
        workerThread.setDaemon(true);
        workerThread.start();
    }

    /** Lets the current item finish, then stops. */
    public void pause() {
        paused.set(true);
        logger.info("⏸️ Queue paused");
    }

    public void resume() {
        if (paused.get()) {
            logger.info("▶️ Queue resumed");
            process();
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public boolean isProcessing() {
        return processing.get();
    }

    /** Removes all items that have not started. */
    public void clear() {
        int removed;
        synchronized (items) {
            int before = items.size();
            items.removeIf(i -> i.getStatus() == DownloadStatus.PENDING);
            removed = before - items.size();
        }
        logger.warn("Queue cleared, {} pending item(s) dropped", removed);
    }

    /**
     * @return true if the item was pending and has been removed
     */
    public boolean remove(String id) {
        synchronized (items) {
            return items.removeIf(i -> i.getId().equals(id) && i.getStatus() == DownloadStatus.PENDING);
        }
    }

    public List<QueuedDownload> getItems() {
        synchronized (items) {
            return List.copyOf(items);
        }
    }

    public Stats getStats() {
        int pending = 0;
        int completed = 0;
        int failed = 0;
        List<QueuedDownload> snapshot = getItems();
        for (QueuedDownload item : snapshot) {
            switch (item.getStatus()) {
                case PENDING, DOWNLOADING -> pending++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new Stats(snapshot.size(), pending, completed, failed);
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /** Waits for the worker to go idle. Used on shutdown and in tests. */
    public void awaitIdle(long timeoutMs) throws InterruptedException {
        Thread worker = workerThread;
        if (worker != null) worker.join(timeoutMs);
    }

    private void workerLoop() {
        try {
            while (!paused.get()) {
                QueuedDownload next = nextPending();
                if (next == null) break;
                run(next);
            }
        } finally {
            processing.set(false);
        }

        if (paused.get()) {
            emit(Event.QUEUE_PAUSED, null);
        } else if (nextPending() != null) {
            // An item was added between the last check and the flag reset
            process();
        } else {
            logger.info("🏁 Queue completed: {}", getStats());
            emit(Event.QUEUE_COMPLETED, null);
        }
    }

    private void run(QueuedDownload item) {
        item.setStatus(DownloadStatus.DOWNLOADING);
        emit(Event.ITEM_STARTED, item);

        DownloadResult result;
        try {
            result = manager.download(item.getDescriptor(), item.getOptions());
        } catch (RuntimeException e) {
            logger.error("❌ Unexpected error downloading {}", item.getDescriptor().filename(), e);
            item.finish(false, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            emit(Event.ITEM_FAILED, item);
            return;
        }
        item.finish(result.success(), result.error());
        emit(result.success() ? Event.ITEM_COMPLETED : Event.ITEM_FAILED, item);
    }

    private QueuedDownload nextPending() {
        synchronized (items) {
            for (QueuedDownload item : items) {
                if (item.getStatus() == DownloadStatus.PENDING) return item;
            }
            return null;
        }
    }

    private void emit(Event event, QueuedDownload item) {
        for (Listener listener : listeners) {
            try {
                listener.onEvent(event, item);
            } catch (RuntimeException e) {
                logger.error("Queue listener failed on {}", event, e);
            }
        }
    }
}
