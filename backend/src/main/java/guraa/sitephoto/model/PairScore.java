package guraa.sitephoto.model;

import lombok.Value;

/**
 * Similarity of one explicitly chosen before/after pair.
 */
@Value
public class PairScore {
    String beforeId;
    String afterId;
    int beforeFeatures;
    int afterFeatures;
    int matchCount;
    double score;
}
