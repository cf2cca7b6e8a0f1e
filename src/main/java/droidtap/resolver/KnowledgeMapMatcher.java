package droidtap.resolver;

import droidtap.model.ResolvedTarget;
import droidtap.model.Tier;
import droidtap.model.UIElement;
import droidtap.tree.AccessibilityTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tier 0: canonical actions ("subscribe", "back", "share") whose accessibility
 * labels are known in advance. A hit on the knowledge map costs one tree capture
 * and a linear scan of content-descriptions.
 */
public class KnowledgeMapMatcher implements TierMatcher {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeMapMatcher.class);

    private final AccessibilityTree tree;
    private final ResolverVocabulary vocabulary;

    public KnowledgeMapMatcher(AccessibilityTree tree, ResolverVocabulary vocabulary) {
        this.tree       = tree;
        this.vocabulary = vocabulary;
    }

    @Override
    public Tier tier() {
        return Tier.KNOWLEDGE_MAP;
    }

    @Override
    public Optional<ResolvedTarget> attempt(NormalizedQuery query, ResolutionContext context) {
        List<String> labels = knownLabels(query.searchText());
        if (labels == null) {
            return Optional.empty();
        }
        log.debug("Knowledge map labels for '{}': {}", query.searchText(), labels);

        for (UIElement element : tree.captureTree()) {
            String desc = element.getContentDesc().toLowerCase(Locale.ROOT);
            if (desc.isEmpty()) continue;
            if (!element.isClickable() && !element.isButtonClass()) continue;
            for (String label : labels) {
                String known = label.toLowerCase(Locale.ROOT);
                if (known.contains(desc) || desc.contains(known)) {
                    return Optional.of(context.tap(element.center(), tier(), element.getContentDesc()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Exact key first, then the first key (in map order) that contains or is
     * contained by the query: "open settings" finds "settings".
     *
     * @return the key's labels, or {@code null} when no key applies
     */
    List<String> knownLabels(String searchText) {
        if (searchText == null || searchText.isBlank()) return null;
        Map<String, List<String>> map = vocabulary.getKnowledgeMap();
        List<String> exact = map.get(searchText);
        if (exact != null) return exact;
        for (Map.Entry<String, List<String>> e : map.entrySet()) {
            if (searchText.contains(e.getKey()) || e.getKey().contains(searchText)) {
                return e.getValue();
            }
        }
        return null;
    }
}
