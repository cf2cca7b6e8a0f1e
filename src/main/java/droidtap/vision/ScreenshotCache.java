package droidtap.vision;

import droidtap.device.DeviceCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot cache of the latest device screenshot.
 *
 * <p>Reads within the TTL of the current capture return it without touching the
 * device. An expired or forced read captures a new screenshot and swaps it into
 * the slot as one reference write, so concurrent readers see either the old
 * capture or the new one, never a mix. Captures themselves are serialised so an
 * expired slot triggers one device round trip even with several readers waiting.
 */
public class ScreenshotCache {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotCache.class);

    private final DeviceCommands device;
    private final Duration ttl;
    private final Clock clock;

    private final AtomicReference<Screenshot> slot = new AtomicReference<>();
    private final Object captureLock = new Object();

    public ScreenshotCache(DeviceCommands device, Duration ttl) {
        this(device, ttl, Clock.systemUTC());
    }

    public ScreenshotCache(DeviceCommands device, Duration ttl, Clock clock) {
        this.device = device;
        this.ttl    = ttl;
        this.clock  = clock;
    }

    /**
     * Returns the cached capture if it is within the TTL, otherwise captures a new one.
     *
     * @throws droidtap.device.DeviceException if a capture was needed and failed
     */
    public Screenshot get() {
        Screenshot current = slot.get();
        if (isFresh(current)) {
            return current;
        }
        synchronized (captureLock) {
            current = slot.get();
            if (isFresh(current)) {
                return current;
            }
            return capture();
        }
    }

    /**
     * Captures unconditionally and replaces the slot.
     *
     * @throws droidtap.device.DeviceException if the capture failed; the slot keeps its old value
     */
    public Screenshot refresh() {
        synchronized (captureLock) {
            return capture();
        }
    }

    /** The current slot content, fresh or not, without any device call. */
    public Optional<Screenshot> peek() {
        return Optional.ofNullable(slot.get());
    }

    private boolean isFresh(Screenshot shot) {
        return shot != null && shot.isYoungerThan(ttl, clock.instant());
    }

    private Screenshot capture() {
        byte[] png = device.captureScreenshot();
        Screenshot shot = new Screenshot(png, clock.instant());
        slot.set(shot);
        log.debug("Captured screenshot ({} bytes)", png.length);
        return shot;
    }
}
