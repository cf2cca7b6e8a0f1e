package droidtap.tree;

import droidtap.model.Bounds;
import droidtap.model.UIElement;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ListItemDetectorTest {

    private final ListItemDetector detector = new ListItemDetector();

    private static UIElement cell(String text, int left, int top, int width, int height) {
        return new UIElement(text, "", "", "android.view.ViewGroup", "app",
                Bounds.ofSize(left, top, width, height), true, false);
    }

    @Test(description = "Largest group of similar-sized cells is returned top to bottom")
    public void detect_returnsLargestGroupSorted() {
        List<UIElement> elements = List.of(
                cell("screen", 0, 0, 1080, 2400),   // container, too large
                cell("third", 0, 1300, 1000, 600),  // too wide
                cell("b", 40, 900, 800, 400),
                cell("a", 40, 300, 800, 400),
                cell("c", 40, 1500, 810, 410),      // same 50px bucket
                cell("chip1", 40, 100, 200, 120),
                cell("chip2", 260, 100, 200, 120),
                cell("dot", 0, 0, 20, 20));

        assertThat(detector.detect(elements)).extracting(UIElement::getText)
                .containsExactly("a", "b", "c");
    }

    @Test(description = "Grid cells on the same row are ordered left to right")
    public void detect_gridOrdersByTopThenLeft() {
        List<UIElement> elements = List.of(
                cell("row2-right", 550, 700, 480, 480),
                cell("row1-right", 550, 200, 480, 480),
                cell("row2-left", 50, 700, 480, 480),
                cell("row1-left", 50, 200, 480, 480));

        assertThat(detector.detect(elements)).extracting(UIElement::getText)
                .containsExactly("row1-left", "row1-right", "row2-left", "row2-right");
    }

    @Test(description = "A lone cell is not a list")
    public void detect_singleCandidate_returnsEmpty() {
        assertThat(detector.detect(List.of(cell("only", 40, 300, 800, 400)))).isEmpty();
    }

    @Test
    public void detect_emptyInput_returnsEmpty() {
        assertThat(detector.detect(List.of())).isEmpty();
    }
}
