package guraa.sitephoto.model;

import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Final pairing for one (site, task) group.
 * Pairs are ordered by before id, unmatched lists are sorted by id.
 */
@Value
public class Assignment {

    List<PhotoPair> pairs;

    List<String> unmatchedBefore;

    List<String> unmatchedAfter;

    public Assignment(List<PhotoPair> pairs, List<String> unmatchedBefore, List<String> unmatchedAfter) {
        this.pairs = List.copyOf(pairs);
        this.unmatchedBefore = List.copyOf(unmatchedBefore);
        this.unmatchedAfter = List.copyOf(unmatchedAfter);
    }

    /**
     * An assignment with nothing paired, used when a build does not finish.
     */
    public static Assignment unpaired(Collection<String> beforeIds, Collection<String> afterIds) {
        return new Assignment(List.of(),
                beforeIds.stream().sorted().collect(Collectors.toList()),
                afterIds.stream().sorted().collect(Collectors.toList()));
    }

    public Optional<String> afterFor(String beforeId) {
        return pairs.stream()
                .filter(pair -> pair.getBeforeId().equals(beforeId))
                .map(PhotoPair::getAfterId)
                .findFirst();
    }

    public int getPairCount() {
        return pairs.size();
    }
}
