package droidtap.vision;

import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * One complete screen capture. Never modified after construction; the cache
 * replaces the whole object on every new capture.
 *
 * @param png        PNG bytes as returned by the device
 * @param capturedAt when the capture completed
 */
public record Screenshot(byte[] png, Instant capturedAt) {

    public String base64() {
        return Base64.getEncoder().encodeToString(png);
    }

    public boolean isYoungerThan(Duration ttl, Instant now) {
        return Duration.between(capturedAt, now).compareTo(ttl) < 0;
    }
}
