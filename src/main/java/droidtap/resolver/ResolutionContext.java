package droidtap.resolver;

import droidtap.device.DeviceCommands;
import droidtap.device.DeviceException;
import droidtap.model.Coordinates;
import droidtap.model.ResolvedTarget;
import droidtap.model.ScreenSize;
import droidtap.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Per-resolution state handed to every tier: the device to tap on and a record
 * of which tiers have run. One instance per {@code resolve} call.
 */
public class ResolutionContext {

    private static final Logger log = LoggerFactory.getLogger(ResolutionContext.class);

    private final DeviceCommands device;
    private final long settleMs;
    private final List<Tier> attempted = new ArrayList<>();

    /**
     * @param device   target device
     * @param settleMs pause after a tap so the UI can react before the caller continues
     */
    public ResolutionContext(DeviceCommands device, long settleMs) {
        this.device   = device;
        this.settleMs = settleMs;
    }

    /**
     * Taps the point and builds the resolved target.
     *
     * @throws DeviceException if the tap cannot be delivered
     */
    public ResolvedTarget tap(Coordinates point, Tier tier, String label) {
        device.tap(point);
        log.info("Tapped '{}' at {} via {}", label, point, tier);
        if (settleMs > 0) {
            try {
                Thread.sleep(settleMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return new ResolvedTarget(point, tier, label);
    }

    /** Device screen size, or empty when the device cannot report it. */
    public Optional<ScreenSize> screenSize() {
        try {
            return Optional.ofNullable(device.screenSize());
        } catch (DeviceException e) {
            log.debug("Screen size unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    void recordAttempt(Tier tier) {
        attempted.add(tier);
    }

    /** Tiers run so far, in order. */
    public List<Tier> attemptedTiers() {
        return Collections.unmodifiableList(attempted);
    }
}
