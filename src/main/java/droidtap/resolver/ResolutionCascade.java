package droidtap.resolver;

import droidtap.device.DeviceCommands;
import droidtap.model.ResolvedTarget;
import droidtap.model.UIElement;
import droidtap.tree.AccessibilityTree;
import droidtap.tree.ScreenSummary;
import droidtap.vision.VisionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point: turns a natural-language query into a tap on the device.
 *
 * <p>Order of operations for one query:
 * <ol>
 *   <li>normalise</li>
 *   <li>ordinal queries go to the {@link OrdinalItemFinder} and stop there</li>
 *   <li>vision-only queries ("the red car") go straight to the vision tier</li>
 *   <li>otherwise the tiers run in the order given, cheapest first, and the
 *       first one that taps wins</li>
 * </ol>
 * Each tier runs at most once. A tier that throws counts as a miss, so one
 * flaky collaborator never aborts the whole resolution.
 */
public class ResolutionCascade {

    private static final Logger log = LoggerFactory.getLogger(ResolutionCascade.class);

    private final DeviceCommands device;
    private final AccessibilityTree tree;
    private final QueryNormalizer normalizer;
    private final List<TierMatcher> tiers;
    private final VisionMatcher visionMatcher;
    private final OrdinalItemFinder ordinalFinder;
    private final VisionService visionService;
    private final long settleMs;

    /**
     * @param tiers         text tiers followed by the vision tier, in cost order
     * @param visionMatcher the vision tier, also used for vision-only queries
     * @param settleMs      pause after each tap
     */
    public ResolutionCascade(DeviceCommands device,
                             AccessibilityTree tree,
                             QueryNormalizer normalizer,
                             List<TierMatcher> tiers,
                             VisionMatcher visionMatcher,
                             OrdinalItemFinder ordinalFinder,
                             VisionService visionService,
                             long settleMs) {
        this.device        = device;
        this.tree          = tree;
        this.normalizer    = normalizer;
        this.tiers         = List.copyOf(tiers);
        this.visionMatcher = visionMatcher;
        this.ordinalFinder = ordinalFinder;
        this.visionService = visionService;
        this.settleMs      = settleMs;
    }

    /**
     * Resolves the query and taps the element it names.
     * Never throws for an element that cannot be found; the result says why.
     */
    public ResolutionResult resolve(String rawQuery) {
        NormalizedQuery query = normalizer.normalize(rawQuery);
        if (query.original().isEmpty()) {
            return ResolutionResult.failure("", "Empty query", List.of());
        }
        ResolutionContext context = new ResolutionContext(device, settleMs);

        ResolutionResult result;
        if (query.ordinal().isPresent()) {
            log.debug("Ordinal query '{}': {}", query.original(), query.ordinal().get());
            result = ordinalFinder.find(query, query.ordinal().get(), context);
        } else if (query.requiresVision()) {
            log.debug("'{}' names a visual concept, routing to vision only", query.original());
            result = visionOnly(query, context);
        } else {
            result = runTiers(query, context);
        }

        if (result.resolved()) {
            log.info("Resolved '{}' via {} -> {}", result.query(), result.target().tier(), result.target().point());
        } else {
            log.info("Could not resolve '{}': {} (tried {})",
                    result.query(), result.failureReason(), result.attemptedTiers());
        }
        return result;
    }

    /** Upstream surface: just whether a tap happened. */
    public boolean resolveAndTap(String rawQuery) {
        return resolve(rawQuery).resolved();
    }

    /**
     * Text of every element with more than one character, from a fresh capture.
     * Empty when the tree cannot be captured.
     */
    public List<String> listVisibleText() {
        List<String> texts = new ArrayList<>();
        try {
            for (UIElement e : tree.captureTree()) {
                if (e.getText().length() > 1) texts.add(e.getText());
            }
        } catch (RuntimeException e) {
            log.warn("Could not capture the screen for text listing: {}", e.getMessage());
        }
        return texts;
    }

    /** Short human-readable description of the current screen. */
    public String describeScreen() {
        try {
            return ScreenSummary.describe(tree.captureTree());
        } catch (RuntimeException e) {
            log.warn("Could not capture the screen for a summary: {}", e.getMessage());
            return ScreenSummary.describe(List.of());
        }
    }

    public void startBackgroundCapture() {
        visionService.startBackgroundCapture();
    }

    public void stopBackgroundCapture() {
        visionService.stopBackgroundCapture();
    }

    // ── Paths ─────────────────────────────────────────────────────────────

    private ResolutionResult visionOnly(NormalizedQuery query, ResolutionContext context) {
        if (!visionMatcher.isEnabled()) {
            return ResolutionResult.failure(query.original(),
                    "Query needs the vision model, which is not available", context.attemptedTiers());
        }
        Optional<ResolvedTarget> hit = attemptTier(visionMatcher, query, context);
        return hit.map(t -> ResolutionResult.success(query.original(), t, context.attemptedTiers()))
                .orElseGet(() -> ResolutionResult.failure(query.original(),
                        "Vision model could not locate it", context.attemptedTiers()));
    }

    private ResolutionResult runTiers(NormalizedQuery query, ResolutionContext context) {
        for (TierMatcher tier : tiers) {
            if (!tier.isEnabled()) {
                log.debug("Skipping {}: collaborator unavailable", tier.tier());
                continue;
            }
            Optional<ResolvedTarget> hit = attemptTier(tier, query, context);
            if (hit.isPresent()) {
                return ResolutionResult.success(query.original(), hit.get(), context.attemptedTiers());
            }
        }
        return ResolutionResult.failure(query.original(), "No tier found a match", context.attemptedTiers());
    }

    private Optional<ResolvedTarget> attemptTier(TierMatcher tier, NormalizedQuery query, ResolutionContext context) {
        context.recordAttempt(tier.tier());
        log.debug("Trying {} for '{}'", tier.tier(), query.original());
        try {
            return tier.attempt(query, context);
        } catch (RuntimeException e) {
            log.warn("{} failed for '{}': {}", tier.tier(), query.original(), e.getMessage());
            return Optional.empty();
        }
    }
}
