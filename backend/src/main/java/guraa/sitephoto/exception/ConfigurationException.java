package guraa.sitephoto.exception;

/**
 * Thrown when the application configuration is invalid.
 * Raised while configuration beans are built, so the application refuses to start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
