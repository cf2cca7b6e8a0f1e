package droidtap.vision;

import droidtap.model.VisionResult;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class StubVisionServiceTest {

    @Test
    public void stub_isUnavailableAndFindsNothing() {
        StubVisionService stub = new StubVisionService();

        VisionResult result = stub.findElement("anything");

        assertThat(stub.isAvailable()).isFalse();
        assertThat(result.hasCoordinates()).isFalse();
        assertThat(result.confidence()).isZero();
    }
}
