package guraa.sitephoto.model;

import lombok.Value;

/**
 * A scored candidate "after" photo for one "before" photo.
 */
@Value
public class MatchCandidate {

    String beforeId;

    String afterId;

    /**
     * Descriptors of the before photo that passed the ratio test against this candidate.
     */
    int matchCount;

    /**
     * Match count divided by the smaller descriptor set size, in [0, 1].
     */
    double score;

    /**
     * 1-based position among the before photo's candidates.
     */
    int rank;
}
