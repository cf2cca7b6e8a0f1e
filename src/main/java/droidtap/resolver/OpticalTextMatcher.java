package droidtap.resolver;

import droidtap.model.OcrMatch;
import droidtap.model.ResolvedTarget;
import droidtap.model.ScoredOcrMatch;
import droidtap.model.Tier;
import droidtap.ocr.TextRecognizer;
import droidtap.vision.Screenshot;
import droidtap.vision.ScreenshotCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Tier 2: find the query in OCR output of the cached screenshot. Catches text
 * drawn on canvases, web views and images that never reaches the
 * accessibility tree.
 */
public class OpticalTextMatcher implements TierMatcher {

    private static final Logger log = LoggerFactory.getLogger(OpticalTextMatcher.class);

    private final TextRecognizer recognizer;
    private final ScreenshotCache cache;
    private final double fuzzyThreshold;

    public OpticalTextMatcher(TextRecognizer recognizer, ScreenshotCache cache, double fuzzyThreshold) {
        this.recognizer     = recognizer;
        this.cache          = cache;
        this.fuzzyThreshold = fuzzyThreshold;
    }

    @Override
    public Tier tier() {
        return Tier.OPTICAL_TEXT;
    }

    @Override
    public boolean isEnabled() {
        return recognizer.isAvailable();
    }

    @Override
    public Optional<ResolvedTarget> attempt(NormalizedQuery query, ResolutionContext context) {
        String q = query.searchText();
        Screenshot shot = cache.get();

        List<OcrMatch> exact = recognizer.findText(shot.png(), q);
        if (!exact.isEmpty()) {
            OcrMatch m = exact.get(0);
            return Optional.of(context.tap(m.center(), tier(), m.text()));
        }

        List<ScoredOcrMatch> fuzzy = recognizer.findTextFuzzy(shot.png(), q, fuzzyThreshold);
        if (!fuzzy.isEmpty()) {
            ScoredOcrMatch best = fuzzy.get(0);
            log.debug("OCR fuzzy hit '{}' for '{}' (similarity {})", best.match().text(), q, best.score());
            return Optional.of(context.tap(best.match().center(), tier(), best.match().text() + " (fuzzy)"));
        }
        return Optional.empty();
    }
}
