package guraa.sitephoto.visual;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.model.Assignment;
import guraa.sitephoto.model.MatchCandidate;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Interface for resolving ranked match candidates into before/after pairs.
 * Implementations must be deterministic: identical input gives an identical assignment.
 */
public interface PairSelector {

    /**
     * Resolve candidates into an assignment.
     *
     * @param rankings Ranked candidates per before photo id
     * @param beforeIds Every before photo of the group, including ones without candidates
     * @param afterIds Every after photo of the group
     * @param settings Score floor and sharing rules
     * @return The assignment; photos that were not paired are listed as unmatched
     */
    Assignment select(Map<String, List<MatchCandidate>> rankings,
                      Collection<String> beforeIds,
                      Collection<String> afterIds,
                      MatchingSettings settings);

    /**
     * A candidate may be committed only with at least one confirmed match and a score at or above the floor.
     */
    static boolean isEligible(MatchCandidate candidate, MatchingSettings settings) {
        return candidate.getMatchCount() > 0 && candidate.getScore() >= settings.getMinScore();
    }
}
