package droidtap.resolver;

import droidtap.model.ResolvedTarget;
import droidtap.model.Tier;

import java.util.List;

/**
 * Outcome of one {@link ResolutionCascade#resolve} call.
 *
 * @param resolved       {@code true} when a tier found and tapped the element
 * @param query          the query as given
 * @param target         what was tapped, or {@code null} on failure
 * @param failureReason  why nothing was tapped, or {@code null} on success
 * @param attemptedTiers tiers that ran, in order
 */
public record ResolutionResult(boolean resolved,
                               String query,
                               ResolvedTarget target,
                               String failureReason,
                               List<Tier> attemptedTiers) {

    public static ResolutionResult success(String query, ResolvedTarget target, List<Tier> attempted) {
        return new ResolutionResult(true, query, target, null, List.copyOf(attempted));
    }

    public static ResolutionResult failure(String query, String reason, List<Tier> attempted) {
        return new ResolutionResult(false, query, null, reason, List.copyOf(attempted));
    }
}
