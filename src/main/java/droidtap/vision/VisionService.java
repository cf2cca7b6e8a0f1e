package droidtap.vision;

import droidtap.model.ScreenSize;
import droidtap.model.VisionResult;

/**
 * Natural-language element localisation on the current screen.
 * {@link StubVisionService} stands in when no model is configured.
 */
public interface VisionService {

    /** Whether a model is reachable. Callers skip the vision tier entirely when false. */
    boolean isAvailable();

    /**
     * Locates the described element on the current screen.
     *
     * @return a result whose coordinates are {@code null} when nothing was found
     *         or the call failed; never {@code null} itself
     */
    VisionResult findElement(String description);

    /** Screen size hint used to bound and scale the model's coordinates. */
    void setScreenSize(ScreenSize size);

    /** Starts pre-capturing screenshots in the background. */
    void startBackgroundCapture();

    void stopBackgroundCapture();
}
