package droidtap.resolver;

import droidtap.model.ResolvedTarget;
import droidtap.model.ScreenSize;
import droidtap.model.Tier;
import droidtap.model.VisionResult;
import droidtap.vision.VisionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Tier 3: ask the vision model. Slowest and least deterministic, so it runs
 * last, and its answer is only used when it carries coordinates, its confidence
 * is strictly above the gate, and the point is not hugging a screen edge (a
 * common hallucination).
 */
public class VisionMatcher implements TierMatcher {

    private static final Logger log = LoggerFactory.getLogger(VisionMatcher.class);

    private final VisionService vision;
    private final double minConfidence;
    private final int edgeMarginPx;

    public VisionMatcher(VisionService vision, double minConfidence, int edgeMarginPx) {
        this.vision        = vision;
        this.minConfidence = minConfidence;
        this.edgeMarginPx  = edgeMarginPx;
    }

    @Override
    public Tier tier() {
        return Tier.VISION;
    }

    @Override
    public boolean isEnabled() {
        return vision.isAvailable();
    }

    @Override
    public Optional<ResolvedTarget> attempt(NormalizedQuery query, ResolutionContext context) {
        return locate(query.original(), context);
    }

    /**
     * Asks the model for an arbitrary description and taps it if the answer passes the gate.
     */
    public Optional<ResolvedTarget> locate(String description, ResolutionContext context) {
        VisionResult result = vision.findElement(description);
        if (!accepts(result, context.screenSize())) {
            log.debug("Vision answer for '{}' rejected: {} at {} (confidence {})",
                    description, result.description(), result.coordinates(), result.confidence());
            return Optional.empty();
        }
        return Optional.of(context.tap(result.coordinates(), tier(), result.description()));
    }

    boolean accepts(VisionResult result, Optional<ScreenSize> screen) {
        if (!result.hasCoordinates() || result.confidence() <= minConfidence) {
            return false;
        }
        return screen.map(s -> s.isInside(result.coordinates(), edgeMarginPx)).orElse(true);
    }
}
