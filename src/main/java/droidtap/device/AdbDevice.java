package droidtap.device;

import droidtap.model.ScreenSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link DeviceCommands} over adb: {@code input tap}, {@code screencap}, {@code wm size}.
 */
public class AdbDevice implements DeviceCommands {

    private static final Logger log = LoggerFactory.getLogger(AdbDevice.class);

    private static final Pattern PHYSICAL_SIZE = Pattern.compile("Physical size:\\s*(\\d+)x(\\d+)");
    private static final Pattern OVERRIDE_SIZE = Pattern.compile("Override size:\\s*(\\d+)x(\\d+)");

    /** PNG file signature; anything else from screencap is an error message. */
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};

    private final AdbClient adb;
    private volatile ScreenSize cachedScreenSize;

    public AdbDevice(AdbClient adb) {
        this.adb = adb;
    }

    @Override
    public void tap(int x, int y) {
        log.debug("tap ({}, {})", x, y);
        adb.run("shell", "input", "tap", String.valueOf(x), String.valueOf(y));
    }

    @Override
    public byte[] captureScreenshot() {
        byte[] png = adb.runBinary("exec-out", "screencap", "-p");
        if (png.length < PNG_MAGIC.length
                || !Arrays.equals(Arrays.copyOf(png, PNG_MAGIC.length), PNG_MAGIC)) {
            throw new DeviceException("screencap returned " + png.length + " bytes that are not a PNG");
        }
        return png;
    }

    @Override
    public String shell(String... args) {
        List<String> full = new ArrayList<>(args.length + 1);
        full.add("shell");
        full.addAll(Arrays.asList(args));
        return adb.run(full.toArray(new String[0]));
    }

    /**
     * Parses {@code wm size}. An override size, when set, wins over the physical size.
     * The result is cached for the lifetime of this object.
     */
    @Override
    public ScreenSize screenSize() {
        ScreenSize size = cachedScreenSize;
        if (size != null) return size;

        String out = shell("wm", "size");
        Matcher m = OVERRIDE_SIZE.matcher(out);
        if (!m.find()) {
            m = PHYSICAL_SIZE.matcher(out);
            if (!m.find()) {
                throw new DeviceException("Could not parse screen size from: " + out.trim());
            }
        }
        size = new ScreenSize(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        cachedScreenSize = size;
        log.debug("Screen size {}x{}", size.width(), size.height());
        return size;
    }

    /** Forgets the cached screen size, e.g. after a rotation. */
    public void invalidateScreenSize() {
        cachedScreenSize = null;
    }
}
