package droidtap.model;

/**
 * A run of text recognised in a screenshot.
 *
 * @param text       recognised text
 * @param confidence engine confidence in {@code [0.0, 1.0]}
 * @param bounds     box around the text in image pixels
 */
public record OcrMatch(String text, double confidence, Bounds bounds) {

    public Coordinates center() {
        return bounds.center();
    }
}
