package guraa.sitephoto.visual;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.model.Assignment;
import guraa.sitephoto.model.MatchCandidate;
import guraa.sitephoto.model.PhotoPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pairing that maximises the total score over all committed pairs, using the Hungarian algorithm.
 * Slower than the greedy selector; only eligible candidates can be paired.
 */
@Slf4j
@Component
public class OptimalPairSelector implements PairSelector {

    @Override
    public Assignment select(Map<String, List<MatchCandidate>> rankings,
                             Collection<String> beforeIds,
                             Collection<String> afterIds,
                             MatchingSettings settings) {
        List<String> befores = new ArrayList<>(new TreeSet<>(beforeIds));
        List<String> afters = new ArrayList<>(new TreeSet<>(afterIds));
        Map<String, Integer> afterIndex = new HashMap<>();
        for (int j = 0; j < afters.size(); j++) {
            afterIndex.put(afters.get(j), j);
        }

        MatchCandidate[][] eligible = new MatchCandidate[befores.size()][afters.size()];
        for (int i = 0; i < befores.size(); i++) {
            for (MatchCandidate candidate : rankings.getOrDefault(befores.get(i), List.of())) {
                Integer j = afterIndex.get(candidate.getAfterId());
                if (j != null && PairSelector.isEligible(candidate, settings)) {
                    eligible[i][j] = candidate;
                }
            }
        }

        List<PhotoPair> pairs = settings.isAllowSharedAfter()
                ? bestPerBefore(eligible)
                : hungarianPairs(eligible, befores.size(), afters.size());

        Set<String> assignedBefore = new HashSet<>();
        Set<String> assignedAfter = new HashSet<>();
        for (PhotoPair pair : pairs) {
            assignedBefore.add(pair.getBeforeId());
            assignedAfter.add(pair.getAfterId());
        }
        pairs.sort(Comparator.comparing(PhotoPair::getBeforeId));
        log.debug("Optimal pairing committed {} pairs", pairs.size());
        return new Assignment(pairs,
                GreedyPairSelector.remaining(new HashSet<>(befores), assignedBefore),
                GreedyPairSelector.remaining(new HashSet<>(afters), assignedAfter));
    }

    private List<PhotoPair> bestPerBefore(MatchCandidate[][] eligible) {
        List<PhotoPair> pairs = new ArrayList<>();
        for (MatchCandidate[] row : eligible) {
            MatchCandidate best = null;
            for (MatchCandidate candidate : row) {
                if (candidate != null && (best == null || candidate.getScore() > best.getScore())) {
                    best = candidate;
                }
            }
            if (best != null) {
                pairs.add(toPair(best));
            }
        }
        return pairs;
    }

    private List<PhotoPair> hungarianPairs(MatchCandidate[][] eligible, int rows, int cols) {
        List<PhotoPair> pairs = new ArrayList<>();
        int n = Math.max(rows, cols);
        if (n == 0) {
            return pairs;
        }

        // Square cost matrix; ineligible and padding cells cost nothing so they never beat a real pair.
        double[][] cost = new double[n][n];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                cost[i][j] = eligible[i][j] == null ? 0.0 : -eligible[i][j].getScore();
            }
        }

        int[] assignment = new HungarianAlgorithm(cost).execute();
        for (int i = 0; i < rows; i++) {
            int j = assignment[i];
            if (j >= 0 && j < cols && eligible[i][j] != null) {
                pairs.add(toPair(eligible[i][j]));
            }
        }
        return pairs;
    }

    private static PhotoPair toPair(MatchCandidate candidate) {
        return new PhotoPair(candidate.getBeforeId(), candidate.getAfterId(),
                candidate.getScore(), candidate.getMatchCount());
    }

    /**
     * Minimum-cost assignment on a square matrix (potentials formulation, O(n^3)).
     */
    static final class HungarianAlgorithm {
        private final double[][] costMatrix;
        private final int size;

        HungarianAlgorithm(double[][] costMatrix) {
            this.costMatrix = costMatrix;
            this.size = costMatrix.length;
        }

        /**
         * @return For each row, the column assigned to it
         */
        int[] execute() {
            double[] rowPotential = new double[size + 1];
            double[] colPotential = new double[size + 1];
            int[] rowOfColumn = new int[size + 1];
            int[] way = new int[size + 1];

            for (int row = 1; row <= size; row++) {
                rowOfColumn[0] = row;
                int col0 = 0;
                double[] minSlack = new double[size + 1];
                boolean[] used = new boolean[size + 1];
                Arrays.fill(minSlack, Double.POSITIVE_INFINITY);

                do {
                    used[col0] = true;
                    int row0 = rowOfColumn[col0];
                    double delta = Double.POSITIVE_INFINITY;
                    int col1 = 0;
                    for (int col = 1; col <= size; col++) {
                        if (used[col]) {
                            continue;
                        }
                        double slack = costMatrix[row0 - 1][col - 1] - rowPotential[row0] - colPotential[col];
                        if (slack < minSlack[col]) {
                            minSlack[col] = slack;
                            way[col] = col0;
                        }
                        if (minSlack[col] < delta) {
                            delta = minSlack[col];
                            col1 = col;
                        }
                    }
                    for (int col = 0; col <= size; col++) {
                        if (used[col]) {
                            rowPotential[rowOfColumn[col]] += delta;
                            colPotential[col] -= delta;
                        } else {
                            minSlack[col] -= delta;
                        }
                    }
                    col0 = col1;
                } while (rowOfColumn[col0] != 0);

                do {
                    int col1 = way[col0];
                    rowOfColumn[col0] = rowOfColumn[col1];
                    col0 = col1;
                } while (col0 != 0);
            }

            int[] columnOfRow = new int[size];
            Arrays.fill(columnOfRow, -1);
            for (int col = 1; col <= size; col++) {
                if (rowOfColumn[col] != 0) {
                    columnOfRow[rowOfColumn[col] - 1] = col - 1;
                }
            }
            return columnOfRow;
        }
    }
}
