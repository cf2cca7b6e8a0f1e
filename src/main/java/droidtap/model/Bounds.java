package droidtap.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Element rectangle in device pixel space, edges inclusive of {@code left}/{@code top}.
 */
public final class Bounds {

    /** uiautomator format: {@code [left,top][right,bottom]}. */
    private static final Pattern UIAUTOMATOR_BOUNDS =
            Pattern.compile("\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");

    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

    @JsonProperty("left")
    private final int left;

    @JsonProperty("top")
    private final int top;

    @JsonProperty("right")
    private final int right;

    @JsonProperty("bottom")
    private final int bottom;

    public Bounds(int left, int top, int right, int bottom) {
        this.left   = left;
        this.top    = top;
        this.right  = right;
        this.bottom = bottom;
    }

    /** Builds bounds from a top-left corner plus size, as OCR engines report them. */
    public static Bounds ofSize(int left, int top, int width, int height) {
        return new Bounds(left, top, left + width, top + height);
    }

    /**
     * Parses a uiautomator {@code bounds} attribute.
     *
     * @return the parsed bounds, or {@link #EMPTY} when the value is missing or malformed
     */
    public static Bounds parse(String raw) {
        if (raw == null) return EMPTY;
        Matcher m = UIAUTOMATOR_BOUNDS.matcher(raw.trim());
        if (!m.matches()) return EMPTY;
        return new Bounds(
                Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)));
    }

    public int getLeft()   { return left; }
    public int getTop()    { return top; }
    public int getRight()  { return right; }
    public int getBottom() { return bottom; }

    @JsonIgnore
    public int width()  { return right - left; }

    @JsonIgnore
    public int height() { return bottom - top; }

    /** Tap point: integer midpoint of the rectangle. */
    @JsonIgnore
    public Coordinates center() {
        return new Coordinates((left + right) / 2, (top + bottom) / 2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bounds other)) return false;
        return left == other.left && top == other.top
                && right == other.right && bottom == other.bottom;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, right, bottom);
    }

    @Override
    public String toString() {
        return String.format("[%d,%d][%d,%d]", left, top, right, bottom);
    }
}
