package guraa.sitephoto.model;

import lombok.Value;

/**
 * A committed before/after pairing.
 */
@Value
public class PhotoPair {
    String beforeId;
    String afterId;
    double score;
    int matchCount;
}
