package guraa.sitephoto.model;

import lombok.Value;

/**
 * A photo that could not take part in matching, and why.
 */
@Value
public class PhotoFailure {
    String photoId;
    FailureKind kind;
    String message;
}
