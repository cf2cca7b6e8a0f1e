package droidtap.resolver;

import droidtap.model.ResolvedTarget;
import droidtap.model.Tier;
import droidtap.model.UIElement;
import droidtap.tree.AccessibilityTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tier 1: search the live accessibility tree.
 *
 * <ol>
 *   <li>query is a substring of an element's text</li>
 *   <li>query is a substring of an element's content-description</li>
 *   <li>best word-overlap score, if it clears the floor</li>
 * </ol>
 * The first pass with a hit wins. Pass 3 handles partial or reordered phrasings
 * of long on-screen text, such as a spoken fragment of a headline.
 */
public class AccessibilityTreeMatcher implements TierMatcher {

    private static final Logger log = LoggerFactory.getLogger(AccessibilityTreeMatcher.class);

    private final AccessibilityTree tree;
    private final WordOverlapScorer scorer;

    public AccessibilityTreeMatcher(AccessibilityTree tree, WordOverlapScorer scorer) {
        this.tree   = tree;
        this.scorer = scorer;
    }

    @Override
    public Tier tier() {
        return Tier.ACCESSIBILITY_TREE;
    }

    @Override
    public Optional<ResolvedTarget> attempt(NormalizedQuery query, ResolutionContext context) {
        String q = query.searchText().toLowerCase(Locale.ROOT).trim();
        if (q.isEmpty()) return Optional.empty();

        List<UIElement> elements = tree.captureTree();
        log.debug("Checking {} elements for '{}'", elements.size(), q);

        for (UIElement e : elements) {
            if (!e.getText().isEmpty() && e.getText().toLowerCase(Locale.ROOT).contains(q)) {
                return Optional.of(context.tap(e.center(), tier(), e.getText()));
            }
        }
        for (UIElement e : elements) {
            if (!e.getContentDesc().isEmpty() && e.getContentDesc().toLowerCase(Locale.ROOT).contains(q)) {
                return Optional.of(context.tap(e.center(), tier(), e.getContentDesc()));
            }
        }

        Optional<WordOverlapScorer.Scored> best = scorer.best(q, elements);
        if (best.isPresent() && scorer.accepts(best.get().score())) {
            UIElement e = best.get().element();
            String label = String.format("%s (%.0f%% match)", e.label(), best.get().score() * 100);
            return Optional.of(context.tap(e.center(), tier(), label));
        }
        best.ifPresent(b -> log.debug("Best overlap {} for '{}' is below the floor", b.score(), q));
        return Optional.empty();
    }
}
