package droidtap.device;

import droidtap.model.Coordinates;
import droidtap.model.ScreenSize;

/**
 * Raw command channel to the controlled device.
 *
 * <p>Every method is a blocking round trip and throws {@link DeviceException}
 * when the transport fails.
 */
public interface DeviceCommands {

    /** Issues a single tap at the given pixel. */
    void tap(int x, int y);

    default void tap(Coordinates point) {
        tap(point.getX(), point.getY());
    }

    /** Captures the current screen as PNG bytes. */
    byte[] captureScreenshot();

    /** Runs a shell command on the device and returns its standard output. */
    String shell(String... args);

    /** Display size in pixels. */
    ScreenSize screenSize();
}
