package guraa.sitephoto.exception;

public class PhotoNotFoundException extends RuntimeException {

    public PhotoNotFoundException(String photoId) {
        super("Photo not found: " + photoId);
    }
}
