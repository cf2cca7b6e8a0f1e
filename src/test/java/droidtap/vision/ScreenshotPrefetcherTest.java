package droidtap.vision;

import droidtap.device.DeviceException;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ScreenshotPrefetcherTest {

    @Mock
    private ScreenshotCache cache;

    private AutoCloseable mocks;
    private ScreenshotPrefetcher prefetcher;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(cache.refresh()).thenReturn(new Screenshot(new byte[]{1}, Instant.now()));
        prefetcher = new ScreenshotPrefetcher(cache, 20);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        prefetcher.stop();
        mocks.close();
    }

    @Test(description = "start runs the refresh loop until stop")
    public void startStop_togglesLoop() {
        prefetcher.start();
        assertThat(prefetcher.isRunning()).isTrue();
        verify(cache, timeout(2000).atLeast(2)).refresh();

        prefetcher.stop();
        assertThat(prefetcher.isRunning()).isFalse();
    }

    @Test(description = "start and stop are idempotent")
    public void startTwice_stopTwice_noError() {
        prefetcher.start();
        prefetcher.start();
        prefetcher.stop();
        prefetcher.stop();

        assertThat(prefetcher.isRunning()).isFalse();
    }

    @Test(description = "A failed capture does not end the loop")
    public void tick_failure_keepsRunning() {
        when(cache.refresh()).thenThrow(new DeviceException("offline"))
                .thenReturn(new Screenshot(new byte[]{2}, Instant.now()));

        prefetcher.tick();
        prefetcher.start();

        verify(cache, timeout(2000).atLeast(2)).refresh();
        assertThat(prefetcher.isRunning()).isTrue();
    }
}
