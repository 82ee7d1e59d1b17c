package guraa.sitephoto.exception;

import java.io.IOException;

/**
 * Thrown when a photo could not be written into the store.
 * No partial file is left behind, so the placement can be retried.
 */
public class StorageFailureException extends IOException {

    private final String photoName;

    public StorageFailureException(String photoName, String message, Throwable cause) {
        super("Failed to store photo " + photoName + ": " + message, cause);
        this.photoName = photoName;
    }

    public String getPhotoName() {
        return photoName;
    }
}
