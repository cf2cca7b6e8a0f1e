package droidtap.resolver;

import java.util.Optional;

/**
 * A query after normalisation.
 *
 * @param original       trimmed input as the user wrote it, used for vision prompts and diagnostics
 * @param working        lower-cased {@code original}
 * @param searchText     {@code working} without stop words, for the text-based tiers
 * @param requiresVision the query names something only a vision model can see
 * @param ordinal        present when the query asks for the Nth item of a list
 */
public record NormalizedQuery(String original,
                              String working,
                              String searchText,
                              boolean requiresVision,
                              Optional<OrdinalQuery> ordinal) {
}
