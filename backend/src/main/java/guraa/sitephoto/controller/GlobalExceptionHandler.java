package guraa.sitephoto.controller;

import guraa.sitephoto.exception.ConfigurationException;
import guraa.sitephoto.exception.PhotoNotFoundException;
import guraa.sitephoto.exception.ReportNotFoundException;
import guraa.sitephoto.exception.StorageFailureException;
import guraa.sitephoto.exception.UnreadableImageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle file upload size exceeded exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleMaxSizeException(MaxUploadSizeExceededException e) {
        logger.error("File size exceeded the maximum limit", e);
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "Photo exceeds the maximum upload size");
    }

    /**
     * Handle a photo that could not be written; the photo is named so the sender can retry it
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<Map<String, String>> handleStorageFailure(StorageFailureException e) {
        logger.error("Storage failure for photo {}", e.getPhotoName(), e);
        Map<String, String> response = new HashMap<>();
        response.put("error", "Could not store photo: " + e.getMessage());
        response.put("photo", e.getPhotoName());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(UnreadableImageException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableImage(UnreadableImageException e) {
        logger.warn("Unreadable image {}: {}", e.getPhotoId(), e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler({ReportNotFoundException.class, PhotoNotFoundException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(RuntimeException e) {
        logger.debug("Not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * Handle malformed requests
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        logger.warn("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, String>> handleRejected(TaskRejectedException e) {
        logger.warn("Report queue is full: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Too many report builds queued, try again later");
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException e) {
        logger.error("Configuration error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration error: " + e.getMessage());
    }

    /**
     * Handle IO exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        logger.error("IO Exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error processing photo: " + e.getMessage());
    }

    /**
     * Handle all other exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        logger.error("Unexpected exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", message);
        return ResponseEntity.status(status).body(response);
    }
}
