package droidtap.model;

/**
 * Fuzzy OCR hit together with its similarity to the query.
 */
public record ScoredOcrMatch(double score, OcrMatch match) {
}
