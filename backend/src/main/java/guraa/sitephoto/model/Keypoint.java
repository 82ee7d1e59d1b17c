package guraa.sitephoto.model;

import lombok.Value;

/**
 * A detected local feature in processing-resolution coordinates.
 */
@Value
public class Keypoint {
    float x;
    float y;
    float size;
    float angle;
    float response;
}
