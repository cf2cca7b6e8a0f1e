package droidtap.resolver;

import droidtap.device.DeviceCommands;
import droidtap.device.DeviceException;
import droidtap.model.Coordinates;
import droidtap.model.ResolvedTarget;
import droidtap.model.ScreenSize;
import droidtap.model.Tier;
import droidtap.model.VisionResult;
import droidtap.vision.VisionService;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class VisionMatcherTest {

    private static final Coordinates MIDDLE = new Coordinates(540, 1200);

    @Mock
    private VisionService vision;

    @Mock
    private DeviceCommands device;

    private AutoCloseable mocks;
    private VisionMatcher matcher;
    private ResolutionContext context;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        matcher = new VisionMatcher(vision, 0.4, 10);
        context = new ResolutionContext(device, 0);
        when(device.screenSize()).thenReturn(new ScreenSize(1080, 2400));
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test(description = "Confidence exactly at the gate is rejected")
    public void confidence040_rejected() {
        when(vision.findElement("the red car")).thenReturn(new VisionResult("car", MIDDLE, 0.4));

        assertThat(matcher.locate("the red car", context)).isEmpty();
        verify(device, never()).tap(any(Coordinates.class));
    }

    @Test(description = "Confidence just above the gate is accepted and tapped")
    public void confidence041_accepted() {
        when(vision.findElement("the red car")).thenReturn(new VisionResult("red car", MIDDLE, 0.41));

        Optional<ResolvedTarget> hit = matcher.locate("the red car", context);

        assertThat(hit).isPresent();
        assertThat(hit.get().tier()).isEqualTo(Tier.VISION);
        assertThat(hit.get().label()).isEqualTo("red car");
        verify(device).tap(MIDDLE);
    }

    @Test
    public void noCoordinates_rejectedWhateverTheConfidence() {
        when(vision.findElement("x")).thenReturn(new VisionResult("somewhere", null, 0.99));

        assertThat(matcher.locate("x", context)).isEmpty();
    }

    @Test(description = "A point hugging the screen edge is treated as a hallucination")
    public void edgeHugging_rejected() {
        when(vision.findElement("x")).thenReturn(new VisionResult("x", new Coordinates(1075, 1200), 0.9));

        assertThat(matcher.locate("x", context)).isEmpty();
    }

    @Test(description = "Without a known screen size the edge check is skipped")
    public void unknownScreenSize_edgeCheckSkipped() {
        when(device.screenSize()).thenThrow(new DeviceException("wm size failed"));
        when(vision.findElement("x")).thenReturn(new VisionResult("x", new Coordinates(2, 2), 0.9));

        assertThat(matcher.locate("x", context)).isPresent();
    }

    @Test(description = "The tier sends the query as the user wrote it")
    public void attempt_usesOriginalQuery() {
        NormalizedQuery q = new NormalizedQuery("The Red Car", "the red car", "red car", true, Optional.empty());
        when(vision.findElement("The Red Car")).thenReturn(new VisionResult("car", MIDDLE, 0.8));

        assertThat(matcher.attempt(q, context)).isPresent();
    }

    @Test
    public void isEnabled_followsServiceAvailability() {
        when(vision.isAvailable()).thenReturn(true);
        assertThat(matcher.isEnabled()).isTrue();

        when(vision.isAvailable()).thenReturn(false);
        assertThat(matcher.isEnabled()).isFalse();
    }
}
