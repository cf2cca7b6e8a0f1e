package droidtap.resolver;

import droidtap.model.ResolvedTarget;
import droidtap.model.Tier;

import java.util.Optional;

/**
 * One resolution strategy. A matcher either taps and returns the target it
 * found, or returns empty; it never reports a match below its own acceptance
 * threshold.
 */
public interface TierMatcher {

    Tier tier();

    /** False when the collaborator this tier needs is missing; the tier is then skipped. */
    default boolean isEnabled() {
        return true;
    }

    /**
     * @throws RuntimeException on collaborator faults; the cascade downgrades these to a miss
     */
    Optional<ResolvedTarget> attempt(NormalizedQuery query, ResolutionContext context);
}
