package droidtap.model;

/**
 * Answer from the vision model for one localisation request.
 *
 * @param description what the model says it found (or why it found nothing)
 * @param coordinates estimated tap point, {@code null} when nothing was found
 * @param confidence  model confidence in {@code [0.0, 1.0]}
 */
public record VisionResult(String description, Coordinates coordinates, double confidence) {

    public static VisionResult notFound(String description) {
        return new VisionResult(description, null, 0.0);
    }

    public boolean hasCoordinates() {
        return coordinates != null;
    }
}
