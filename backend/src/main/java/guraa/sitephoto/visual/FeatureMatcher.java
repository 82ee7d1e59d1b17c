package guraa.sitephoto.visual;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.model.FeatureSet;
import guraa.sitephoto.model.MatchCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores candidate "after" photos against one "before" photo by counting descriptors
 * that survive the nearest/second-nearest ratio test under Hamming distance.
 * Stateless, so calls for different before photos can run in parallel.
 */
@Component
public class FeatureMatcher {

    private static final Comparator<Scored> RANKING = Comparator
            .comparingDouble((Scored s) -> s.score).reversed()
            .thenComparing(s -> s.afterId);

    /**
     * Rank candidates for a before photo.
     *
     * @param before Features of the before photo
     * @param candidates Features of the after photos of the same group
     * @param settings Ratio threshold and result cap
     * @return At most {@code topK} candidates, best first, ties broken by after id
     */
    public List<MatchCandidate> rank(FeatureSet before, List<FeatureSet> candidates, MatchingSettings settings) {
        List<Scored> scored = new ArrayList<>(candidates.size());
        for (FeatureSet after : candidates) {
            int count = countConfirmedMatches(before, after, settings.getRatio());
            scored.add(new Scored(after.getPhotoId(), count, normalize(count, before.size(), after.size())));
        }
        scored.sort(RANKING);

        int limit = Math.min(settings.getTopK(), scored.size());
        List<MatchCandidate> ranked = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Scored s = scored.get(i);
            ranked.add(new MatchCandidate(before.getPhotoId(), s.afterId, s.matchCount, s.score, i + 1));
        }
        return ranked;
    }

    /**
     * Count before descriptors whose nearest after descriptor is clearly closer than the second nearest.
     * Needs at least two after descriptors; with fewer nothing can be confirmed.
     */
    public int countConfirmedMatches(FeatureSet before, FeatureSet after, double ratio) {
        if (before.isEmpty() || after.size() < 2) {
            return 0;
        }
        int confirmed = 0;
        for (int i = 0; i < before.size(); i++) {
            long[] query = before.descriptor(i);
            int nearest = Integer.MAX_VALUE;
            int second = Integer.MAX_VALUE;
            for (int j = 0; j < after.size(); j++) {
                int distance = hamming(query, after.descriptor(j));
                if (distance < nearest) {
                    second = nearest;
                    nearest = distance;
                } else if (distance < second) {
                    second = distance;
                }
            }
            if (nearest < ratio * second) {
                confirmed++;
            }
        }
        return confirmed;
    }

    /**
     * Confirmed matches over the smaller descriptor set, clamped to [0, 1].
     */
    public static double normalize(int matchCount, int beforeSize, int afterSize) {
        int smaller = Math.min(beforeSize, afterSize);
        if (smaller <= 0 || matchCount <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) matchCount / smaller);
    }

    static int hamming(long[] a, long[] b) {
        int distance = 0;
        for (int w = 0; w < a.length; w++) {
            distance += Long.bitCount(a[w] ^ b[w]);
        }
        return distance;
    }

    private static final class Scored {
        final String afterId;
        final int matchCount;
        final double score;

        Scored(String afterId, int matchCount, double score) {
            this.afterId = afterId;
            this.matchCount = matchCount;
            this.score = score;
        }
    }
}
