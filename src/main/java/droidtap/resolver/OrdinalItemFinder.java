package droidtap.resolver;

import droidtap.model.ResolvedTarget;
import droidtap.model.Tier;
import droidtap.model.UIElement;
import droidtap.tree.AccessibilityTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Resolves "the Nth item" queries. Ordinal queries need an ordered collection
 * rather than a single best match, so they bypass the tiered cascade: the
 * detected list is indexed directly, and the vision model is asked for the item
 * only when the list does not have it.
 */
public class OrdinalItemFinder {

    private static final Logger log = LoggerFactory.getLogger(OrdinalItemFinder.class);

    private final AccessibilityTree tree;
    private final VisionMatcher visionMatcher;
    private final ResolverVocabulary vocabulary;

    public OrdinalItemFinder(AccessibilityTree tree, VisionMatcher visionMatcher, ResolverVocabulary vocabulary) {
        this.tree          = tree;
        this.visionMatcher = visionMatcher;
        this.vocabulary    = vocabulary;
    }

    public ResolutionResult find(NormalizedQuery query, OrdinalQuery ordinal, ResolutionContext context) {
        context.recordAttempt(Tier.ORDINAL_LIST);
        try {
            Optional<ResolvedTarget> fromList = fromList(ordinal, context);
            if (fromList.isPresent()) {
                return ResolutionResult.success(query.original(), fromList.get(), context.attemptedTiers());
            }
        } catch (RuntimeException e) {
            log.warn("List detection failed for '{}': {}", query.original(), e.getMessage());
        }

        if (visionMatcher.isEnabled()) {
            context.recordAttempt(Tier.VISION);
            String phrase = phrase(ordinal);
            try {
                Optional<ResolvedTarget> fromVision = visionMatcher.locate(phrase, context);
                if (fromVision.isPresent()) {
                    return ResolutionResult.success(query.original(), fromVision.get(), context.attemptedTiers());
                }
            } catch (RuntimeException e) {
                log.warn("Vision lookup of '{}' failed for '{}': {}", phrase, query.original(), e.getMessage());
            }
        }

        String reason = String.format("No #%d '%s' found", ordinal.position(), ordinal.itemType());
        return ResolutionResult.failure(query.original(), reason, context.attemptedTiers());
    }

    /** Natural-language form handed to the vision model: "the second video". */
    String phrase(OrdinalQuery ordinal) {
        return "the " + vocabulary.ordinalWord(ordinal.position()) + " " + ordinal.itemType();
    }

    private Optional<ResolvedTarget> fromList(OrdinalQuery ordinal, ResolutionContext context) {
        List<UIElement> items = tree.detectListItems(ordinal.itemType());
        OptionalInt index = ordinal.indexIn(items.size());
        if (index.isEmpty()) {
            log.debug("Position {} is outside the {} detected '{}' items",
                    ordinal.position(), items.size(), ordinal.itemType());
            return Optional.empty();
        }
        UIElement item = items.get(index.getAsInt());
        return Optional.of(context.tap(item.center(), Tier.ORDINAL_LIST, item.label()));
    }
}
