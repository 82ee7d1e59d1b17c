package guraa.sitephoto.visual;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.config.PairingMode;
import guraa.sitephoto.model.Assignment;
import guraa.sitephoto.model.MatchCandidate;
import guraa.sitephoto.model.PhotoPair;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static guraa.sitephoto.visual.GreedyPairSelectorTest.candidate;
import static org.junit.jupiter.api.Assertions.*;

class OptimalPairSelectorTest {

    private final OptimalPairSelector selector = new OptimalPairSelector();
    private final MatchingSettings settings = MatchingSettings.defaults().toBuilder()
            .pairingMode(PairingMode.OPTIMAL)
            .build();

    @Test
    void shouldMaximiseTotalScoreWhereGreedyDoesNot() {
        // Given: greedy would take (b1, a1) = 0.9 and leave (b2, a2) = 0.1
        Map<String, List<MatchCandidate>> rankings = new TreeMap<>();
        rankings.put("b1", List.of(candidate("b1", "a1", 0.9), candidate("b1", "a2", 0.8)));
        rankings.put("b2", List.of(candidate("b2", "a1", 0.7), candidate("b2", "a2", 0.1)));

        // When
        Assignment assignment = selector.select(rankings, List.of("b1", "b2"), List.of("a1", "a2"), settings);

        // Then
        assertEquals(Optional.of("a2"), assignment.afterFor("b1"));
        assertEquals(Optional.of("a1"), assignment.afterFor("b2"));
        double total = assignment.getPairs().stream().mapToDouble(PhotoPair::getScore).sum();
        assertEquals(1.5, total, 1e-9);
    }

    @Test
    void shouldHandleMoreBeforesThanAfters() {
        Map<String, List<MatchCandidate>> rankings = new TreeMap<>();
        rankings.put("b1", List.of(candidate("b1", "a1", 0.4)));
        rankings.put("b2", List.of(candidate("b2", "a1", 0.6)));
        rankings.put("b3", List.of());

        Assignment assignment = selector.select(rankings, List.of("b1", "b2", "b3"), List.of("a1"), settings);

        assertEquals(1, assignment.getPairCount());
        assertEquals(Optional.of("a1"), assignment.afterFor("b2"));
        assertEquals(List.of("b1", "b3"), assignment.getUnmatchedBefore());
        assertTrue(assignment.getUnmatchedAfter().isEmpty());
    }

    @Test
    void shouldRespectScoreFloor() {
        Map<String, List<MatchCandidate>> rankings = new TreeMap<>();
        rankings.put("b1", List.of(candidate("b1", "a1", 0.2)));

        Assignment assignment = selector.select(rankings, List.of("b1"), List.of("a1", "a2"),
                settings.toBuilder().minScore(0.5).build());

        assertEquals(0, assignment.getPairCount());
        assertEquals(List.of("a1", "a2"), assignment.getUnmatchedAfter());
    }

    @Test
    void shouldGiveEachBeforeItsBestWhenSharingIsAllowed() {
        Map<String, List<MatchCandidate>> rankings = new TreeMap<>();
        rankings.put("b1", List.of(candidate("b1", "a1", 0.9), candidate("b1", "a2", 0.3)));
        rankings.put("b2", List.of(candidate("b2", "a1", 0.8)));

        Assignment assignment = selector.select(rankings, List.of("b1", "b2"), List.of("a1", "a2"),
                settings.toBuilder().allowSharedAfter(true).build());

        assertEquals(Optional.of("a1"), assignment.afterFor("b1"));
        assertEquals(Optional.of("a1"), assignment.afterFor("b2"));
        assertEquals(List.of("a2"), assignment.getUnmatchedAfter());
    }

    @Test
    void shouldSolveSquareAssignmentProblem() {
        // Given
        double[][] cost = {
                {4, 1, 3},
                {2, 0, 5},
                {3, 2, 2}
        };

        // When
        int[] assignment = new OptimalPairSelector.HungarianAlgorithm(cost).execute();

        // Then: rows 0, 1, 2 take columns 1, 0, 2 for a total cost of 5
        assertArrayEquals(new int[]{1, 0, 2}, assignment);
    }

    @Test
    void shouldReturnEmptyAssignmentForEmptyGroup() {
        Assignment assignment = selector.select(Map.of(), List.of(), List.of(), settings);

        assertEquals(0, assignment.getPairCount());
        assertTrue(assignment.getUnmatchedBefore().isEmpty());
    }
}
