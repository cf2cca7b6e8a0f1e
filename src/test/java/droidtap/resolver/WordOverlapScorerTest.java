package droidtap.resolver;

import droidtap.model.Bounds;
import droidtap.model.UIElement;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class WordOverlapScorerTest {

    private static final String NATO_20 = "alpha bravo charlie delta echo foxtrot golf hotel india juliett "
            + "kilo lima mike november oscar papa quebec romeo sierra tango";
    private static final String LETTERS_20 = "b c d e f g h i j k l m n o p q r s t u";

    private final WordOverlapScorer scorer = new WordOverlapScorer(0.5, 20, 0.1, 0.05);

    private static UIElement text(String text, boolean clickable) {
        return new UIElement(text, "", "", "android.widget.TextView", "app",
                new Bounds(0, 0, 100, 100), clickable, false);
    }

    private double score(String query, UIElement e) {
        return scorer.score(WordOverlapScorer.words(query), e);
    }

    // ── Acceptance floor ──────────────────────────────────────────────────

    @Test(description = "Exactly half the query words and no bonus is accepted")
    public void floor_exactlyHalf_accepted() {
        double s = score("alpha zulu", text("alpha", false));

        assertThat(s).isEqualTo(0.5);
        assertThat(scorer.accepts(s)).isTrue();
    }

    @Test(description = "0.45 overlap on short text gets no bonus and is rejected")
    public void floor_045_noBonus_rejected() {
        double s = score(LETTERS_20, text("b c d e f g h i j", false));

        assertThat(s).isCloseTo(0.45, within(1e-9));
        assertThat(scorer.accepts(s)).isFalse();
    }

    @Test(description = "0.45 overlap plus the long-text bonus reaches 0.55 and is accepted")
    public void floor_045_withLongTextBonus_accepted() {
        double s = score(NATO_20, text("alpha bravo charlie delta echo foxtrot golf hotel india", false));

        assertThat(s).isCloseTo(0.55, within(1e-9));
        assertThat(scorer.accepts(s)).isTrue();
    }

    @Test(description = "0.4 overlap plus the long-text bonus still reaches the floor")
    public void floor_040_withLongTextBonus_accepted() {
        double s = score("alpha bravo charlie delta echo", text("alpha bravo and a much longer caption", false));

        assertThat(s).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.accepts(s)).isTrue();
    }

    // ── Bonuses ───────────────────────────────────────────────────────────

    @Test
    public void clickableBonus_added() {
        assertThat(score("alpha zulu", text("alpha", true))).isCloseTo(0.55, within(1e-9));
    }

    @Test
    public void longTextBonus_countsTextAndDescriptionTogether() {
        UIElement e = new UIElement("alpha bravo", "charlie delta echo", "", "android.view.View", "app",
                new Bounds(0, 0, 10, 10), false, false);

        // 11 + 18 chars combined > 20
        assertThat(score("alpha", e)).isCloseTo(1.1, within(1e-9));
    }

    // ── Shape ─────────────────────────────────────────────────────────────

    @Test(description = "Adding a query word the element contains never lowers its score")
    public void monotonic_addingPresentWord() {
        UIElement e = text("alpha bravo", false);

        assertThat(score("alpha zulu bravo", e)).isGreaterThanOrEqualTo(score("alpha zulu", e));
    }

    @Test
    public void noOverlap_scoresZeroAndIsNeverBest() {
        UIElement e = text("a completely different caption here", true);

        assertThat(score("alpha", e)).isZero();
        assertThat(scorer.best("alpha", List.of(e))).isEmpty();
    }

    @Test
    public void best_picksHighestScore() {
        UIElement weak = text("alpha", false);
        UIElement strong = text("alpha bravo", false);

        Optional<WordOverlapScorer.Scored> best = scorer.best("alpha bravo", List.of(weak, strong));

        assertThat(best).isPresent();
        assertThat(best.get().element()).isSameAs(strong);
        assertThat(best.get().score()).isEqualTo(1.0);
    }

    @Test
    public void best_tie_firstElementWins() {
        UIElement first = text("alpha", false);
        UIElement second = text("alpha", false);

        assertThat(scorer.best("alpha", List.of(first, second)).get().element()).isSameAs(first);
    }

    @Test
    public void best_queryIsCaseInsensitive() {
        assertThat(scorer.best("ALPHA", List.of(text("Alpha", false)))).isPresent();
    }
}
