package guraa.sitephoto.visual;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.model.Assignment;
import guraa.sitephoto.model.MatchCandidate;
import guraa.sitephoto.model.PhotoPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Greedy pairing: repeatedly commit the highest scoring remaining pair whose photos are both free.
 * Ties are broken by before id, then after id. Not globally optimal.
 */
@Slf4j
@Component
public class GreedyPairSelector implements PairSelector {

    static final Comparator<MatchCandidate> GLOBAL_ORDER = Comparator
            .comparingDouble(MatchCandidate::getScore).reversed()
            .thenComparing(MatchCandidate::getBeforeId)
            .thenComparing(MatchCandidate::getAfterId);

    @Override
    public Assignment select(Map<String, List<MatchCandidate>> rankings,
                             Collection<String> beforeIds,
                             Collection<String> afterIds,
                             MatchingSettings settings) {
        Set<String> befores = new HashSet<>(beforeIds);
        Set<String> afters = new HashSet<>(afterIds);

        List<MatchCandidate> all = rankings.values().stream()
                .flatMap(List::stream)
                .filter(candidate -> befores.contains(candidate.getBeforeId()))
                .filter(candidate -> afters.contains(candidate.getAfterId()))
                .filter(candidate -> PairSelector.isEligible(candidate, settings))
                .sorted(GLOBAL_ORDER)
                .collect(Collectors.toList());

        Set<String> assignedBefore = new HashSet<>();
        Set<String> assignedAfter = new HashSet<>();
        List<PhotoPair> pairs = new ArrayList<>();

        for (MatchCandidate candidate : all) {
            if (assignedBefore.contains(candidate.getBeforeId())) {
                continue;
            }
            if (!settings.isAllowSharedAfter() && assignedAfter.contains(candidate.getAfterId())) {
                continue;
            }
            assignedBefore.add(candidate.getBeforeId());
            assignedAfter.add(candidate.getAfterId());
            pairs.add(new PhotoPair(candidate.getBeforeId(), candidate.getAfterId(),
                    candidate.getScore(), candidate.getMatchCount()));
        }

        pairs.sort(Comparator.comparing(PhotoPair::getBeforeId));
        log.debug("Greedy pairing committed {} of {} eligible candidates", pairs.size(), all.size());
        return new Assignment(pairs, remaining(befores, assignedBefore), remaining(afters, assignedAfter));
    }

    static List<String> remaining(Set<String> all, Set<String> assigned) {
        TreeSet<String> left = new TreeSet<>(all);
        left.removeAll(assigned);
        return new ArrayList<>(left);
    }
}
