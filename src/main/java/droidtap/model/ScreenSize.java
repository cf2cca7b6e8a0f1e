package droidtap.model;

/**
 * Physical (or overridden) display size reported by the device.
 */
public record ScreenSize(int width, int height) {

    /** True when the point lies at least {@code margin} pixels inside every edge. */
    public boolean isInside(Coordinates point, int margin) {
        return point.getX() >= margin && point.getX() <= width - margin
                && point.getY() >= margin && point.getY() <= height - margin;
    }
}
