package droidtap.model;

/**
 * Outcome of a successful resolution: where the tap went, which tier found it,
 * and what was matched.
 */
public record ResolvedTarget(Coordinates point, Tier tier, String label) {

    @Override
    public String toString() {
        return String.format("%s at %s via %s", label, point, tier);
    }
}
