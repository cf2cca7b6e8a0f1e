package droidtap.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the {@code adb} binary as a child process.
 *
 * <p>Output is decoded as UTF-8 with malformed bytes replaced, so app names
 * and file paths with non-ASCII characters never break a call.
 */
public class AdbClient {

    private static final Logger log = LoggerFactory.getLogger(AdbClient.class);

    /** Daemon threads that drain adb stderr while stdout is read. */
    private static final ExecutorService STDERR_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "adb-stderr");
        t.setDaemon(true);
        return t;
    });

    private final String adbPath;
    private final String serial;

    /**
     * @param adbPath path to the adb executable, or just {@code adb} to use PATH
     * @param serial  device serial passed as {@code -s}; {@code null} or blank for the default device
     */
    public AdbClient(String adbPath, String serial) {
        this.adbPath = adbPath;
        this.serial  = (serial != null && !serial.isBlank()) ? serial.trim() : null;
    }

    /**
     * Runs adb with the given arguments and returns stdout as text.
     *
     * @throws DeviceException if adb cannot be started or exits non-zero
     */
    public String run(String... args) {
        return new String(runBinary(args), StandardCharsets.UTF_8);
    }

    /**
     * Runs adb and returns stdout untouched, for images and other binary payloads.
     *
     * @throws DeviceException if adb cannot be started or exits non-zero
     */
    public byte[] runBinary(String... args) {
        List<String> command = command(args);
        log.debug("adb {}", String.join(" ", args));

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new DeviceException("Could not start adb at '" + adbPath + "': " + e.getMessage(), e);
        }

        CompletableFuture<byte[]> stderr =
                CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), STDERR_READERS);
        try {
            byte[] stdout = process.getInputStream().readAllBytes();
            int exit = process.waitFor();
            if (exit != 0) {
                String err = new String(stderr.join(), StandardCharsets.UTF_8).trim();
                throw new DeviceException(String.format("adb %s failed (exit %d): %s",
                        String.join(" ", args), exit, err.isEmpty() ? "<no stderr>" : err));
            }
            return stdout;
        } catch (IOException e) {
            process.destroyForcibly();
            throw new DeviceException("Failed reading adb output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new DeviceException("Interrupted waiting for adb " + String.join(" ", args), e);
        }
    }

    /**
     * Lists attached devices in the {@code device} state.
     *
     * @throws DeviceException if none are attached
     */
    public List<String> ensureDevice() {
        List<String> devices = new ArrayList<>();
        String[] lines = run("devices").split("\\R");
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.endsWith("\tdevice")) {
                devices.add(line.substring(0, line.indexOf('\t')));
            }
        }
        if (devices.isEmpty()) {
            throw new DeviceException("No adb device connected (adb devices shows none)");
        }
        return devices;
    }

    private List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        command.add(adbPath);
        if (serial != null) {
            command.add("-s");
            command.add(serial);
        }
        command.addAll(Arrays.asList(args));
        return command;
    }

    private static byte[] drain(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            log.debug("Could not read adb stderr: {}", e.getMessage());
            return new byte[0];
        }
    }
}
