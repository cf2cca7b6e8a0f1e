package droidtap.resolver;

import droidtap.device.DeviceCommands;
import droidtap.model.Bounds;
import droidtap.model.Coordinates;
import droidtap.model.ResolvedTarget;
import droidtap.model.Tier;
import droidtap.model.UIElement;
import droidtap.tree.AccessibilityTree;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class KnowledgeMapMatcherTest {

    @Mock
    private AccessibilityTree tree;

    @Mock
    private DeviceCommands device;

    private AutoCloseable mocks;
    private KnowledgeMapMatcher matcher;
    private QueryNormalizer normalizer;
    private ResolutionContext context;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        ResolverVocabulary vocab = ResolverVocabulary.load();
        matcher = new KnowledgeMapMatcher(tree, vocab);
        normalizer = new QueryNormalizer(vocab);
        context = new ResolutionContext(device, 0);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static UIElement el(String desc, String cls, boolean clickable, Bounds bounds) {
        return new UIElement("", desc, "", cls, "app", bounds, clickable, false);
    }

    @Test(description = "A known action taps the element whose description matches a synonym")
    public void attempt_knownKey_tapsMatchingDescription() {
        when(tree.captureTree()).thenReturn(List.of(
                el("Like", "android.widget.Button", true, new Bounds(0, 0, 100, 100)),
                el("Subscribe to Rick Astley", "android.widget.Button", true, new Bounds(800, 500, 1040, 600))));

        Optional<ResolvedTarget> hit = matcher.attempt(normalizer.normalize("click subscribe"), context);

        assertThat(hit).isPresent();
        assertThat(hit.get().tier()).isEqualTo(Tier.KNOWLEDGE_MAP);
        assertThat(hit.get().point()).isEqualTo(new Coordinates(920, 550));
        assertThat(hit.get().label()).isEqualTo("Subscribe to Rick Astley");
        verify(device).tap(new Coordinates(920, 550));
    }

    @Test(description = "Description contained in a synonym also matches")
    public void attempt_descriptionInsideSynonym_matches() {
        when(tree.captureTree()).thenReturn(List.of(
                el("Navigate", "android.widget.ImageButton", false, new Bounds(0, 0, 100, 100))));

        // "navigate" is contained in the "back" synonym "Navigate up"
        assertThat(matcher.attempt(normalizer.normalize("go back"), context)).isPresent();
    }

    @Test(description = "Non-clickable, non-button elements are never tapped")
    public void attempt_staticLabel_skipped() {
        when(tree.captureTree()).thenReturn(List.of(
                el("Share", "android.widget.TextView", false, new Bounds(0, 0, 100, 100))));

        assertThat(matcher.attempt(normalizer.normalize("share"), context)).isEmpty();
        verify(device, never()).tap(any(Coordinates.class));
    }

    @Test(description = "Elements without a description never match")
    public void attempt_emptyDescription_skipped() {
        when(tree.captureTree()).thenReturn(List.of(
                el("", "android.widget.Button", true, new Bounds(0, 0, 100, 100))));

        assertThat(matcher.attempt(normalizer.normalize("share"), context)).isEmpty();
    }

    @Test(description = "A query with no knowledge-map key never captures the tree")
    public void attempt_unknownQuery_noCapture() {
        assertThat(matcher.attempt(normalizer.normalize("never gonna give you up"), context)).isEmpty();
        verifyNoInteractions(tree);
    }

    @Test
    public void knownLabels_exactKeyWins() {
        assertThat(matcher.knownLabels("unsubscribe")).contains("Unsubscribe");
        assertThat(matcher.knownLabels("subscribe")).contains("Subscribe").doesNotContain("Unsubscribe");
    }

    @Test
    public void knownLabels_containmentEitherWay() {
        assertThat(matcher.knownLabels("open settings")).contains("Settings");
        assertThat(matcher.knownLabels("notif")).contains("Notifications");
    }

    @Test
    public void knownLabels_noKey_isNull() {
        assertThat(matcher.knownLabels("xyzzy")).isNull();
        assertThat(matcher.knownLabels("")).isNull();
    }
}
