package droidtap.resolver;

import droidtap.model.UIElement;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Scores elements by the fraction of query words found in their text and
 * content-description, plus small bonuses for long text (content rather than
 * toolbar chrome) and clickability. The bonuses count toward the acceptance
 * floor.
 */
public class WordOverlapScorer {

    /** Floating-point slack so 0.4 + 0.1 still reaches a 0.5 floor. */
    private static final double EPSILON = 1e-9;

    private final double floor;
    private final int longTextChars;
    private final double longTextBonus;
    private final double clickableBonus;

    public WordOverlapScorer(double floor, int longTextChars, double longTextBonus, double clickableBonus) {
        this.floor          = floor;
        this.longTextChars  = longTextChars;
        this.longTextBonus  = longTextBonus;
        this.clickableBonus = clickableBonus;
    }

    /** An element with its score. */
    public record Scored(UIElement element, double score) {}

    /**
     * @return the element's score, or 0 when it shares no word with the query
     */
    public double score(Set<String> queryWords, UIElement element) {
        if (queryWords.isEmpty()) return 0;
        String text = element.getText().toLowerCase(Locale.ROOT);
        String desc = element.getContentDesc().toLowerCase(Locale.ROOT);
        String combined = (text + " " + desc).trim();
        if (combined.isEmpty()) return 0;

        Set<String> elementWords = words(combined);
        long overlap = queryWords.stream().filter(elementWords::contains).count();
        if (overlap == 0) return 0;

        double score = (double) overlap / queryWords.size();
        if (text.length() + desc.length() > longTextChars) score += longTextBonus;
        if (element.isClickable()) score += clickableBonus;
        return score;
    }

    /**
     * Highest-scoring element; on a tie the earlier element wins.
     */
    public Optional<Scored> best(String query, List<UIElement> elements) {
        Set<String> queryWords = words(query.toLowerCase(Locale.ROOT));
        Scored best = null;
        for (UIElement e : elements) {
            double s = score(queryWords, e);
            if (s > 0 && (best == null || s > best.score())) {
                best = new Scored(e, s);
            }
        }
        return Optional.ofNullable(best);
    }

    public boolean accepts(double score) {
        return score >= floor - EPSILON;
    }

    static Set<String> words(String s) {
        String t = s.trim();
        return t.isEmpty() ? Set.of() : new HashSet<>(Arrays.asList(t.split("\\s+")));
    }
}
