package droidtap.resolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a raw request ("tap the subscribe button", "the second video",
 * "the red car") into a {@link NormalizedQuery}.
 */
public class QueryNormalizer {

    private final ResolverVocabulary vocabulary;

    public QueryNormalizer(ResolverVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public NormalizedQuery normalize(String raw) {
        String original = raw != null ? raw.trim() : "";
        String working = original.toLowerCase(Locale.ROOT);
        return new NormalizedQuery(
                original,
                working,
                cleanSearchText(working),
                requiresVision(working),
                detectOrdinal(working));
    }

    /**
     * Recognises {@code [verb] [on] [the] <ordinal> <item type>}, e.g.
     * "the second video", "tap the last post", "3rd result".
     */
    Optional<OrdinalQuery> detectOrdinal(String working) {
        String[] tokens = tokens(working);
        int i = 0;
        if (i < tokens.length && vocabulary.getActionVerbs().contains(tokens[i])) i++;
        if (i < tokens.length && tokens[i].equals("on")) i++;
        if (i < tokens.length && tokens[i].equals("the")) i++;

        // an ordinal word alone names no item type
        if (i + 1 >= tokens.length) return Optional.empty();
        Integer position = vocabulary.getOrdinals().get(tokens[i]);
        if (position == null) return Optional.empty();

        String itemType = String.join(" ", Arrays.copyOfRange(tokens, i + 1, tokens.length));
        return Optional.of(new OrdinalQuery(position, itemType));
    }

    /**
     * True when any visual-only term appears as a whole word (or, for phrases,
     * as a whole phrase). Colours and generic object nouns have no text in the
     * accessibility tree or on screen, so only the vision tier can answer.
     */
    boolean requiresVision(String working) {
        String[] words = working.split("[^\\p{L}\\p{N}]+");
        Set<String> wordSet = new HashSet<>(Arrays.asList(words));
        String padded = " " + String.join(" ", words) + " ";
        for (String term : vocabulary.getVisionLexicon()) {
            boolean hit = term.indexOf(' ') >= 0
                    ? padded.contains(" " + term + " ")
                    : wordSet.contains(term);
            if (hit) return true;
        }
        return false;
    }

    /**
     * Drops stop words ("click", "the", "button", ...). When that leaves nothing,
     * only action verbs are dropped; when even that leaves nothing, the query is
     * returned as is.
     */
    String cleanSearchText(String working) {
        String[] tokens = tokens(working);
        List<String> kept = new ArrayList<>();
        for (String t : tokens) {
            if (!vocabulary.getStopWords().contains(t)) kept.add(t);
        }
        if (kept.isEmpty()) {
            for (String t : tokens) {
                if (!vocabulary.getActionVerbs().contains(t)) kept.add(t);
            }
        }
        return kept.isEmpty() ? working : String.join(" ", kept);
    }

    private static String[] tokens(String s) {
        String t = s.trim();
        return t.isEmpty() ? new String[0] : t.split("\\s+");
    }
}
