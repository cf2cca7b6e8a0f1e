package droidtap.vision;

import droidtap.model.ScreenSize;
import droidtap.model.VisionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-op {@link VisionService} used when {@code vision.enabled=false} (the default).
 * Reports itself unavailable so the resolver never reaches the vision tier.
 */
public class StubVisionService implements VisionService {

    private static final Logger log = LoggerFactory.getLogger(StubVisionService.class);

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public VisionResult findElement(String description) {
        log.debug("VisionService: stub, nothing found for '{}'", description);
        return VisionResult.notFound("Vision model not available");
    }

    @Override
    public void setScreenSize(ScreenSize size) {
    }

    @Override
    public void startBackgroundCapture() {
        log.debug("VisionService: stub, background capture not started");
    }

    @Override
    public void stopBackgroundCapture() {
    }
}
