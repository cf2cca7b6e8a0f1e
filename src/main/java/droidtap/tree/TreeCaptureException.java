package droidtap.tree;

import droidtap.device.DeviceException;

/**
 * The accessibility dump came back empty or could not be parsed.
 */
public class TreeCaptureException extends DeviceException {

    public TreeCaptureException(String msg) {
        super(msg);
    }

    public TreeCaptureException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
