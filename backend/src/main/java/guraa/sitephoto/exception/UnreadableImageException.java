package guraa.sitephoto.exception;

import java.io.IOException;

/**
 * Thrown when a stored photo cannot be decoded into pixels.
 * The photo is excluded from matching for the current report run.
 */
public class UnreadableImageException extends IOException {

    private final String photoId;

    public UnreadableImageException(String photoId, String message) {
        super("Unreadable image " + photoId + ": " + message);
        this.photoId = photoId;
    }

    public UnreadableImageException(String photoId, String message, Throwable cause) {
        super("Unreadable image " + photoId + ": " + message, cause);
        this.photoId = photoId;
    }

    public String getPhotoId() {
        return photoId;
    }
}
