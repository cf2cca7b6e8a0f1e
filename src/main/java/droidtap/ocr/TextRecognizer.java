package droidtap.ocr;

import droidtap.model.OcrMatch;
import droidtap.model.ScoredOcrMatch;

import java.util.List;

/**
 * Optical text search over a screenshot.
 *
 * <p>Implementations never throw for engine faults; a failed pass yields an
 * empty list.
 */
public interface TextRecognizer {

    /** Whether the engine is installed and usable. Callers skip OCR entirely when false. */
    boolean isAvailable();

    /**
     * Case-insensitive substring search, best engine confidence first.
     *
     * @param image PNG bytes
     */
    List<OcrMatch> findText(byte[] image, String query);

    /**
     * Similarity search, most similar first. Only matches scoring at least
     * {@code threshold} are returned.
     *
     * @param image PNG bytes
     */
    List<ScoredOcrMatch> findTextFuzzy(byte[] image, String query, double threshold);
}
