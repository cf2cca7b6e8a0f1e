package droidtap.device;

/**
 * Unchecked exception for a failed round trip to the device: adb could not be
 * started, exited non-zero, or returned output that could not be understood.
 */
public class DeviceException extends RuntimeException {

    public DeviceException(String msg) {
        super(msg);
    }

    public DeviceException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
