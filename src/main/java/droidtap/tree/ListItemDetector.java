package droidtap.tree;

import droidtap.model.UIElement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the repeating cells of a feed or grid by grouping elements of the same
 * approximate size. The largest such group is taken to be the list.
 */
public class ListItemDetector {

    static final int MIN_SIDE    = 100;
    static final int MAX_WIDTH   = 900;
    static final int MAX_HEIGHT  = 1500;
    static final int SIZE_BUCKET = 50;

    private final int minItems;

    public ListItemDetector() {
        this(2);
    }

    public ListItemDetector(int minItems) {
        this.minItems = minItems;
    }

    /**
     * @return the largest same-size group sorted by (top, left), or an empty
     *         list when no group reaches {@code minItems}
     */
    public List<UIElement> detect(List<UIElement> elements) {
        Map<Long, List<UIElement>> groups = new LinkedHashMap<>();
        for (UIElement e : elements) {
            int w = e.getBounds().width();
            int h = e.getBounds().height();
            // tiny decorations and full-screen containers are never list cells
            if (w < MIN_SIDE || h < MIN_SIDE) continue;
            if (w > MAX_WIDTH || h > MAX_HEIGHT) continue;

            long key = ((long) bucket(w) << 32) | bucket(h);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(e);
        }

        List<UIElement> largest = List.of();
        for (List<UIElement> group : groups.values()) {
            if (group.size() > largest.size()) {
                largest = group;
            }
        }
        if (largest.size() < minItems) {
            return List.of();
        }

        List<UIElement> sorted = new ArrayList<>(largest);
        sorted.sort(Comparator.<UIElement>comparingInt(e -> e.getBounds().getTop())
                .thenComparingInt(e -> e.getBounds().getLeft()));
        return sorted;
    }

    private static int bucket(int px) {
        return Math.round(px / (float) SIZE_BUCKET) * SIZE_BUCKET;
    }
}
