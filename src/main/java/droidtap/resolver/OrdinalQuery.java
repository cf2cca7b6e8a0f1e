package droidtap.resolver;

import java.util.OptionalInt;

/**
 * "The Nth item of type T". Position is 1-based; {@link #LAST} counts from the end.
 */
public record OrdinalQuery(int position, String itemType) {

    public static final int LAST = -1;

    /**
     * Maps the position onto a list of the given size.
     * Positive positions are 1-based from the head, negative ones count back from
     * the tail. Anything outside the list is empty.
     */
    public OptionalInt indexIn(int size) {
        int index = position > 0 ? position - 1 : size + position;
        if (position == 0 || index < 0 || index >= size) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(index);
    }
}
