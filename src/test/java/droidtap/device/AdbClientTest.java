package droidtap.device;

import org.testng.SkipException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs {@link AdbClient} against {@code /bin/sh} standing in for the adb binary.
 */
public class AdbClientTest {

    private static final String SHELL = "/bin/sh";

    @BeforeMethod
    public void requireShell() {
        if (!new File(SHELL).canExecute()) {
            throw new SkipException("No " + SHELL + " on this machine");
        }
    }

    @Test
    public void run_success_returnsStdout() {
        AdbClient client = new AdbClient(SHELL, null);

        assertThat(client.run("-c", "echo hello").trim()).isEqualTo("hello");
    }

    @Test
    public void run_nonZeroExit_reportsStderrAndExitCode() {
        AdbClient client = new AdbClient(SHELL, null);

        assertThatThrownBy(() -> client.run("-c", "echo device offline >&2; exit 3"))
                .isInstanceOf(DeviceException.class)
                .hasMessageContaining("exit 3")
                .hasMessageContaining("device offline");
    }

    @Test
    public void run_stderrDrainedOffCommonPool() {
        AdbClient client = new AdbClient(SHELL, null);

        String threads = "";
        try {
            client.run("-c", "echo boom >&2; exit 1");
        } catch (DeviceException e) {
            threads = Thread.getAllStackTraces().keySet().stream()
                    .map(Thread::getName)
                    .filter(name -> name.startsWith("adb-stderr"))
                    .findAny()
                    .orElse("");
        }

        assertThat(threads).isEqualTo("adb-stderr");
    }

    @Test
    public void run_missingBinary_throwsDeviceException() {
        AdbClient client = new AdbClient("/nonexistent/adb", null);

        assertThatThrownBy(() -> client.run("devices"))
                .isInstanceOf(DeviceException.class)
                .hasMessageContaining("Could not start adb");
    }
}
