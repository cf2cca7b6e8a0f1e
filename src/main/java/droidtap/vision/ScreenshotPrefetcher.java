package droidtap.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background loop that keeps the {@link ScreenshotCache} warm so the vision
 * tier rarely waits for a capture.
 *
 * <p>The loop is the only writer it adds; it talks to the resolver solely
 * through the cache slot.
 */
public class ScreenshotPrefetcher {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotPrefetcher.class);

    private final ScreenshotCache cache;
    private final long intervalMs;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService executor;

    public ScreenshotPrefetcher(ScreenshotCache cache, long intervalMs) {
        this.cache      = cache;
        this.intervalMs = intervalMs;
    }

    /** Starts the loop; a no-op when already running. */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "screenshot-prefetch");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Screenshot prefetch started (every {} ms)", intervalMs);
    }

    /** Stops the loop; a no-op when not running. */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) return;
        executor.shutdownNow();
        executor = null;
        log.info("Screenshot prefetch stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    void tick() {
        try {
            Screenshot shot = cache.refresh();
            log.trace("Prefetched screenshot at {}", shot.capturedAt());
        } catch (RuntimeException e) {
            // next tick retries; a stale slot only costs the resolver one capture
            log.debug("Prefetch capture failed: {}", e.getMessage());
        }
    }
}
