package droidtap.resolver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fixed word lists the resolver works from: the knowledge map of canonical
 * actions to accessibility labels, stop words, action verbs, the purely visual
 * lexicon, and the ordinal vocabulary.
 *
 * <p>Built once at startup from {@code resolver-vocabulary.json} and shared
 * read-only by the normalizer and the matchers. Knowledge-map key order is
 * preserved; it decides which key wins a containment lookup.
 */
public final class ResolverVocabulary {

    public static final String RESOURCE = "/resolver-vocabulary.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, List<String>> knowledgeMap;
    private final Set<String> stopWords;
    private final Set<String> actionVerbs;
    private final Set<String> visionLexicon;
    private final Map<String, Integer> ordinals;

    @JsonCreator
    public ResolverVocabulary(
            @JsonProperty("knowledgeMap") Map<String, List<String>> knowledgeMap,
            @JsonProperty("stopWords") List<String> stopWords,
            @JsonProperty("actionVerbs") List<String> actionVerbs,
            @JsonProperty("visionLexicon") List<String> visionLexicon,
            @JsonProperty("ordinals") Map<String, Integer> ordinals) {
        Map<String, List<String>> km = new LinkedHashMap<>();
        if (knowledgeMap != null) {
            knowledgeMap.forEach((k, v) -> km.put(k.toLowerCase(Locale.ROOT), List.copyOf(v)));
        }
        this.knowledgeMap  = Collections.unmodifiableMap(km);
        this.stopWords     = lowerSet(stopWords);
        this.actionVerbs   = lowerSet(actionVerbs);
        this.visionLexicon = lowerSet(visionLexicon);
        this.ordinals      = Collections.unmodifiableMap(
                new LinkedHashMap<>(ordinals != null ? ordinals : Map.of()));
    }

    /**
     * Loads the vocabulary bundled on the classpath.
     *
     * @throws IllegalStateException if the resource is missing
     * @throws UncheckedIOException  if it cannot be parsed
     */
    public static ResolverVocabulary load() {
        try (InputStream is = ResolverVocabulary.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Classpath resource not found: " + RESOURCE);
            }
            return fromJson(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    public static ResolverVocabulary fromJson(InputStream json) throws IOException {
        return MAPPER.readValue(json, ResolverVocabulary.class);
    }

    public Map<String, List<String>> getKnowledgeMap() { return knowledgeMap; }
    public Set<String> getStopWords()                  { return stopWords; }
    public Set<String> getActionVerbs()                { return actionVerbs; }
    public Set<String> getVisionLexicon()              { return visionLexicon; }
    public Map<String, Integer> getOrdinals()          { return ordinals; }

    /**
     * Spelled-out ordinal for a position: the first alphabetic vocabulary word
     * mapped to it ("second", "last"), or {@code <n>th} when there is none.
     */
    public String ordinalWord(int position) {
        for (Map.Entry<String, Integer> e : ordinals.entrySet()) {
            if (e.getValue() == position && e.getKey().chars().allMatch(Character::isLetter)) {
                return e.getKey();
            }
        }
        return position + "th";
    }

    private static Set<String> lowerSet(List<String> words) {
        if (words == null) return Set.of();
        return words.stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(java.util.stream.Collectors.toUnmodifiableSet());
    }
}
